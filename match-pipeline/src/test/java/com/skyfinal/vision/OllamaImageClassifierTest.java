package com.skyfinal.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Ollama adapter against a local HTTP endpoint.
 */
@DisplayName("Ollama Image Classifier Tests")
class OllamaImageClassifierTest {

    private static final String PATH = "/api/generate";
    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0x10, 0x4A};

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpServer server;
    private volatile int status;
    private volatile String responseBody;
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private OllamaImageClassifier classifier;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext(PATH, exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                receivedBody.set(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();

        classifier = new OllamaImageClassifier(HttpClient.newHttpClient(),
                URI.create("http://127.0.0.1:" + server.getAddress().getPort() + PATH),
                "llava:7b", Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(int status, String body) {
        this.status = status;
        this.responseBody = body;
    }

    // ==========================================
    // Test: Request
    // ==========================================

    @Test
    @DisplayName("Should post the frame with a deterministic, non-streaming request")
    void testRequestBody() throws Exception {
        respond(200, "{\"model\":\"llava:7b\",\"response\":\"NO_EVENT\",\"done\":true}");

        classifier.classify(JPEG);

        JsonNode request = objectMapper.readTree(receivedBody.get());
        assertEquals("llava:7b", request.path("model").asText());
        assertEquals(OllamaImageClassifier.PROMPT, request.path("prompt").asText());
        assertEquals(1, request.path("images").size());
        assertEquals(Base64.getEncoder().encodeToString(JPEG), request.path("images").get(0).asText());
        assertTrue(request.path("stream").isBoolean());
        assertFalse(request.path("stream").asBoolean());
        assertEquals(0.0, request.path("options").path("temperature").asDouble());
        assertEquals(10, request.path("options").path("num_predict").asInt());
        System.out.println("✓ Request: " + request.path("options"));
    }

    @Test
    @DisplayName("Should list every classifiable label in the prompt")
    void testPromptLabels() {
        for (VisualLabel label : VisualLabel.CLASSIFIABLE) {
            assertTrue(OllamaImageClassifier.PROMPT.contains("- " + label.name()), label.name());
        }
        assertFalse(OllamaImageClassifier.PROMPT.contains(VisualLabel.ERROR.name()));
    }

    // ==========================================
    // Test: Response
    // ==========================================

    @Test
    @DisplayName("Should return the raw model answer")
    void testResponseParsed() throws Exception {
        respond(200, "{\"model\":\"llava:7b\",\"response\":\" kill \",\"done\":true}");

        String raw = classifier.classify(JPEG);

        assertEquals(" kill ", raw);
        assertEquals(VisualLabel.KILL, VisualLabel.parse(raw));
    }

    @Test
    @DisplayName("Should fall back to NO_EVENT when the answer has no response field")
    void testMissingResponseField() throws Exception {
        respond(200, "{\"done\":true}");

        assertEquals(VisualLabel.NO_EVENT.name(), classifier.classify(JPEG));
    }

    @Test
    @DisplayName("Should fail on a non-2xx answer")
    void testServerError() {
        respond(500, "{\"error\":\"model not loaded\"}");

        IOException e = assertThrows(IOException.class, () -> classifier.classify(JPEG));
        assertEquals("Classifier answered HTTP 500", e.getMessage());
        System.out.println("✓ " + e.getMessage());
    }
}
