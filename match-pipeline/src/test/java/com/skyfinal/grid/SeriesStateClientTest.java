package com.skyfinal.grid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfinal.state.Snapshot;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the GraphQL client against a local HTTP endpoint:
 * - Request shape and authentication header
 * - Non-200 answers and GraphQL errors reported as no data
 * - Successful responses mapped into snapshots
 */
@DisplayName("Series State Client Tests")
class SeriesStateClientTest {

    private static final String PATH = "/central-data/graphql";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpServer server;
    private volatile int status;
    private volatile String responseBody;
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final AtomicReference<String> receivedApiKey = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext(PATH, exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                receivedBody.set(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            receivedApiKey.set(exchange.getRequestHeaders().getFirst("x-api-key"));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(int status, String body) {
        this.status = status;
        this.responseBody = body;
    }

    private SeriesStateClient client(URI endpoint) {
        return new SeriesStateClient(HttpClient.newHttpClient(),
                new SeriesStateMapper("inventory", Clock.fixed(NOW, ZoneOffset.UTC)),
                endpoint, "test-key", Duration.ofSeconds(2),
                SeriesStateClient.buildQuery("GamePlayerStateValorant", "inventory"));
    }

    private SeriesStateClient client() {
        return client(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + PATH));
    }

    private static String fixture() throws IOException {
        try (InputStream in = SeriesStateClientTest.class.getResourceAsStream("/series-state.json")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // ==========================================
    // Test: Query
    // ==========================================

    @Test
    @DisplayName("Should build a query for the configured player type and inventory field")
    void testBuildQuery() {
        String query = SeriesStateClient.buildQuery("GamePlayerStateValorant", "inventory");

        assertTrue(query.startsWith("query MidRoundState($seriesId: ID!)"));
        assertTrue(query.contains("... on " + SeriesStateMapper.TEAM_TYPE));
        assertTrue(query.contains("... on GamePlayerStateValorant"));
        assertTrue(query.contains("inventory {"));
    }

    @Test
    @DisplayName("Should send the api key and the named operation with the series id")
    void testRequestShape() throws Exception {
        respond(200, fixture());

        client().fetchSnapshot("2629390");

        assertEquals("test-key", receivedApiKey.get());
        JsonNode request = objectMapper.readTree(receivedBody.get());
        assertEquals("MidRoundState", request.path("operationName").asText());
        assertEquals("2629390", request.path("variables").path("seriesId").asText());
        assertTrue(request.path("query").asText().contains("seriesState(id: $seriesId)"));
        System.out.println("✓ Request carried key and variables");
    }

    // ==========================================
    // Test: Responses
    // ==========================================

    @Test
    @DisplayName("Should map a successful response into a snapshot")
    void testSuccessfulResponse() throws Exception {
        respond(200, fixture());

        Snapshot snapshot = client().fetchSnapshot("2629390").orElseThrow();

        assertEquals("2629390", snapshot.getSeriesId());
        assertEquals("game-2", snapshot.getGameId());
        assertEquals(3, snapshot.getPlayerCount());
        assertEquals(NOW, snapshot.getTimestamp());
        System.out.println("✓ Fetched " + snapshot);
    }

    @Test
    @DisplayName("Should report no data on a non-200 answer")
    void testNon200Answer() {
        respond(500, "{\"message\":\"upstream unavailable\"}");

        assertTrue(client().fetchSnapshot("2629390").isEmpty());
        StateFetchException e = assertThrows(StateFetchException.class,
                () -> client().fetchSeriesState("2629390"));
        assertTrue(e.getMessage().startsWith("HTTP 500"));
    }

    @Test
    @DisplayName("Should report no data when the response carries GraphQL errors")
    void testGraphQlErrors() {
        respond(200, "{\"data\":null,\"errors\":[{\"message\":\"Series not found\"}]}");

        assertTrue(client().fetchSnapshot("2629390").isEmpty());
        StateFetchException e = assertThrows(StateFetchException.class,
                () -> client().fetchSeriesState("2629390"));
        assertTrue(e.getMessage().contains("Series not found"));
    }

    @Test
    @DisplayName("Should report no data when the series has no state")
    void testMissingSeriesState() {
        respond(200, "{\"data\":{\"seriesState\":null}}");

        Optional<Snapshot> snapshot = client().fetchSnapshot("2629390");

        assertTrue(snapshot.isEmpty());
    }

    @Test
    @DisplayName("Should report no data when the service is unreachable")
    void testUnreachableService() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        assertTrue(client(URI.create("http://127.0.0.1:" + port + PATH)).fetchSnapshot("2629390").isEmpty());
    }
}
