package com.skyfinal.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.stream.Collectors;

/**
 * Classifies frames with a vision-language model served by Ollama's
 * {@code /api/generate} endpoint.
 *
 * Requests run at temperature 0 with a tiny token budget: the model is only
 * asked to name one label. The per-request timeout bounds how long the
 * classification thread can block.
 */
public class OllamaImageClassifier implements ImageClassifier {

    static final String PROMPT = "You are a visual referee for a professional VALORANT match.\n\n"
            + "Classify exactly ONE label:\n"
            + VisualLabel.CLASSIFIABLE.stream().map(l -> "- " + l.name()).collect(Collectors.joining("\n"))
            + "\n\nOnly output the label.";

    private static final int MAX_TOKENS = 10;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String model;
    private final Duration timeout;

    public OllamaImageClassifier(URI endpoint, String model, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), endpoint, model, timeout);
    }

    OllamaImageClassifier(HttpClient httpClient, URI endpoint, String model, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public String classify(byte[] jpeg) throws IOException, InterruptedException {
        ObjectNode options = objectMapper.createObjectNode();
        options.put("temperature", 0.0);
        options.put("num_predict", MAX_TOKENS);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        payload.put("prompt", PROMPT);
        payload.putArray("images").add(Base64.getEncoder().encodeToString(jpeg));
        payload.put("stream", false);
        payload.set("options", options);

        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload),
                        StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Classifier answered HTTP " + response.statusCode());
        }

        JsonNode body = objectMapper.readTree(response.body());
        return body.path("response").asText(VisualLabel.NO_EVENT.name());
    }
}
