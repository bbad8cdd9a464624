package com.skyfinal.grid;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyfinal.config.PipelineConfig;
import com.skyfinal.state.Snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Fetches live series state from the GRID series-state GraphQL endpoint.
 *
 * The query shape is fixed at construction from the configured player type
 * and inventory field; discovering those through schema introspection is
 * left to whoever supplies the configuration.
 *
 * Failures never escape {@link #fetchSnapshot(String)}: transport errors,
 * non-200 answers and GraphQL errors are logged and reported as "no data".
 */
public class SeriesStateClient implements StateFetcher {

    private static final Logger logger = LoggerFactory.getLogger(SeriesStateClient.class);
    private static final String OPERATION_NAME = "MidRoundState";
    private static final int MAX_LOGGED_BODY = 500;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SeriesStateMapper mapper;
    private final URI endpoint;
    private final String apiKey;
    private final Duration requestTimeout;
    private final String query;

    public SeriesStateClient(PipelineConfig config) {
        this(HttpClient.newBuilder().connectTimeout(config.getGridRequestTimeout()).build(),
                new SeriesStateMapper(config.getInventoryField()),
                config.getGridEndpoint(),
                config.getApiKey(),
                config.getGridRequestTimeout(),
                buildQuery(config.getPlayerType(), config.getInventoryField()));
    }

    SeriesStateClient(HttpClient httpClient, SeriesStateMapper mapper, URI endpoint,
                      String apiKey, Duration requestTimeout, String query) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.mapper = mapper;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.query = query;
    }

    @Override
    public Optional<Snapshot> fetchSnapshot(String seriesId) {
        try {
            JsonNode seriesState = fetchSeriesState(seriesId);
            return mapper.toSnapshot(seriesState, seriesId);
        } catch (StateFetchException | IOException e) {
            logger.warn("Series-state request failed for {}: {}", seriesId, e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /**
     * Issues one GraphQL request and returns the {@code data.seriesState} node,
     * which is null when the service has no state for the series.
     */
    JsonNode fetchSeriesState(String seriesId) throws IOException, InterruptedException {
        ObjectNode variables = objectMapper.createObjectNode();
        variables.put("seriesId", seriesId);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("query", query);
        payload.put("operationName", OPERATION_NAME);
        payload.set("variables", variables);

        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("x-api-key", apiKey)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(serialize(payload), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new StateFetchException("HTTP " + response.statusCode() + ": " + abbreviate(response.body()));
        }

        JsonNode body = objectMapper.readTree(response.body());
        JsonNode errors = body.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            throw new StateFetchException("GraphQL errors: " + abbreviate(errors.toString()));
        }

        JsonNode seriesState = body.path("data").path("seriesState");
        return seriesState.isMissingNode() || seriesState.isNull() ? null : seriesState;
    }

    private String serialize(ObjectNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StateFetchException("Failed to encode request", e);
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_LOGGED_BODY ? text : text.substring(0, MAX_LOGGED_BODY) + "...";
    }

    /**
     * Builds the series-state query for the given player type and inventory field.
     */
    public static String buildQuery(String playerType, String inventoryField) {
        return """
                query MidRoundState($seriesId: ID!) {
                  seriesState(id: $seriesId) {
                    id
                    games {
                      id
                      teams {
                        __typename
                        ... on %s {
                          id
                          name
                          side
                          players {
                            __typename
                            ... on %s {
                              id
                              name
                              alive
                              participationStatus
                              currentHealth
                              maxHealth
                              currentArmor
                              position { x y }
                              character { name }
                              %s {
                                items { id name quantity equipped stashed }
                              }
                            }
                          }
                        }
                      }
                    }
                  }
                }
                """.formatted(SeriesStateMapper.TEAM_TYPE, playerType, inventoryField);
    }
}
