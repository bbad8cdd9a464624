package com.skyfinal.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfinal.history.HistoryEntry;
import com.skyfinal.monitor.EventSurface;
import com.skyfinal.protocol.MessageSerializer;
import com.skyfinal.session.SessionManager;
import com.skyfinal.tactical.TacticalEvent;
import com.skyfinal.tactical.TacticalEventType;
import com.skyfinal.vision.VisualEvent;
import com.skyfinal.vision.VisualLabel;

import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the event stream:
 * - Request/reply over WebSocket
 * - Pushed events reach every subscriber
 * - Malformed requests are answered with ERROR
 */
@DisplayName("Event Server Tests")
class EventServerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static EventServer server;
    private static SessionManager sessionManager;
    private static StubSurface surface;
    private static EventBroadcaster broadcaster;
    private static String wsUrl;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<WebSocketClient> clients = new ArrayList<>();

    @BeforeAll
    static void startServer() throws Exception {
        sessionManager = new SessionManager();
        surface = new StubSurface();
        MessageSerializer serializer = new MessageSerializer();
        broadcaster = new EventBroadcaster(sessionManager, serializer, "2629390");

        server = new EventServer(0, sessionManager, surface, serializer, "2629390");
        server.start();
        wsUrl = "ws://localhost:" + server.getBoundPort() + EventServer.WEBSOCKET_PATH;
    }

    @AfterAll
    static void stopServer() {
        if (server != null) {
            server.shutdown();
        }
    }

    @AfterEach
    void closeClients() {
        clients.forEach(WebSocketClient::close);
    }

    private static TacticalEvent firstDeath() {
        return new TacticalEvent(TacticalEventType.FIRST_DEATH, NOW, "First death of the round: B (Sentinels)",
                Map.of("player", "B", "team", "Sentinels"));
    }

    /**
     * Read side with fixed content; drainEvents empties it like the real log.
     */
    private static class StubSurface implements EventSurface {
        final List<TacticalEvent> events = new ArrayList<>();

        @Override
        public synchronized List<TacticalEvent> getLatestEvents() {
            return List.copyOf(events);
        }

        @Override
        public List<String> getTacticalConclusions() {
            return List.of("Entry engagement lost by Sentinels at R7C2.");
        }

        @Override
        public List<VisualEvent> getLatestVisualEvents() {
            return List.of(VisualEvent.of(VisualLabel.KILL, NOW));
        }

        @Override
        public synchronized List<TacticalEvent> drainEvents() {
            List<TacticalEvent> drained = List.copyOf(events);
            events.clear();
            return drained;
        }

        @Override
        public List<HistoryEntry> getPersistedHistory() {
            return List.of(
                    new HistoryEntry("2629390", "g1", NOW.toString(), Map.of()),
                    new HistoryEntry("2629390", "g2", NOW.toString(), Map.of()));
        }

        @Override
        public String describeRoundStatus() {
            return "Round Status: 9 players alive. Game ID: g2.";
        }
    }

    /**
     * A connected test client and the messages it has received so far.
     */
    private static class Subscriber {
        final WebSocketClient client;
        final BlockingQueue<String> received;

        Subscriber(WebSocketClient client, BlockingQueue<String> received) {
            this.client = client;
            this.received = received;
        }
    }

    private Subscriber connect() throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        CountDownLatch connectLatch = new CountDownLatch(1);

        WebSocketClient client = new WebSocketClient(new URI(wsUrl)) {
            @Override
            public void onOpen(ServerHandshake handshake) {
                connectLatch.countDown();
            }

            @Override
            public void onMessage(String message) {
                received.add(message);
            }

            @Override
            public void onClose(int code, String reason, boolean remote) {}

            @Override
            public void onError(Exception ex) {
                ex.printStackTrace();
            }
        };
        clients.add(client);
        client.connect();

        assertTrue(connectLatch.await(5, TimeUnit.SECONDS), "Should connect within timeout");
        return new Subscriber(client, received);
    }

    private JsonNode request(Subscriber subscriber, String json) throws Exception {
        subscriber.client.send(json);
        return next(subscriber);
    }

    private JsonNode next(Subscriber subscriber) throws Exception {
        String message = subscriber.received.poll(5, TimeUnit.SECONDS);
        assertNotNull(message, "Should receive a message");
        return objectMapper.readTree(message);
    }

    // ==========================================
    // Test: Requests
    // ==========================================

    @Test
    @DisplayName("Should answer GET_CONCLUSIONS with the latest conclusions")
    void testGetConclusions() throws Exception {
        Subscriber subscriber = connect();

        JsonNode reply = request(subscriber, "{\"type\": \"GET_CONCLUSIONS\"}");

        assertEquals("CONCLUSIONS", reply.get("type").asText());
        assertEquals("2629390", reply.get("seriesId").asText());
        assertEquals("Entry engagement lost by Sentinels at R7C2.",
                reply.get("payload").get("conclusions").get(0).asText());
        System.out.println("✓ Received: " + reply);
    }

    @Test
    @DisplayName("Should answer GET_EVENTS and drain on CLEAR_EVENTS")
    void testEventsAndClear() throws Exception {
        surface.events.add(firstDeath());
        Subscriber subscriber = connect();

        JsonNode events = request(subscriber, "{\"type\": \"GET_EVENTS\"}");
        assertEquals("EVENTS", events.get("type").asText());
        assertEquals("FIRST_DEATH", events.get("payload").get("events").get(0).get("type").asText());
        assertEquals("KILL", events.get("payload").get("visual").get(0).get("label").asText());

        JsonNode drained = request(subscriber, "{\"type\": \"CLEAR_EVENTS\"}");
        assertEquals(1, drained.get("payload").get("events").size());

        JsonNode after = request(subscriber, "{\"type\": \"GET_EVENTS\"}");
        assertEquals(0, after.get("payload").get("events").size());
    }

    @Test
    @DisplayName("Should answer GET_HISTORY, honouring a limit")
    void testGetHistory() throws Exception {
        Subscriber subscriber = connect();

        JsonNode all = request(subscriber, "{\"type\": \"GET_HISTORY\"}");
        assertEquals(2, all.get("payload").get("entries").size());
        assertEquals("g1", all.get("payload").get("entries").get(0).get("game_id").asText());

        JsonNode limited = request(subscriber, "{\"type\": \"GET_HISTORY\", \"payload\": {\"limit\": 1}}");
        assertEquals(1, limited.get("payload").get("entries").size());
        assertEquals("g2", limited.get("payload").get("entries").get(0).get("game_id").asText());
    }

    @Test
    @DisplayName("Should answer GET_STATUS with the round status")
    void testGetStatus() throws Exception {
        Subscriber subscriber = connect();

        JsonNode reply = request(subscriber, "{\"type\": \"GET_STATUS\"}");

        assertEquals("STATUS", reply.get("type").asText());
        assertEquals("Round Status: 9 players alive. Game ID: g2.", reply.get("payload").get("status").asText());
    }

    @Test
    @DisplayName("Should answer malformed and push-only messages with ERROR")
    void testErrors() throws Exception {
        Subscriber subscriber = connect();

        assertEquals("ERROR", request(subscriber, "not json").get("type").asText());
        assertEquals("ERROR", request(subscriber, "{\"type\": \"TACTICAL_EVENT\"}").get("type").asText());
        assertEquals("ERROR", request(subscriber, "{\"payload\": {}}").get("type").asText());
    }

    // ==========================================
    // Test: Pushed Events
    // ==========================================

    @Test
    @DisplayName("Should push events to every connected subscriber")
    void testBroadcast() throws Exception {
        List<Subscriber> subscribers = List.of(connect(), connect());
        for (Subscriber subscriber : subscribers) {
            // A reply proves the server has registered the subscriber
            assertEquals("STATUS", request(subscriber, "{\"type\": \"GET_STATUS\"}").get("type").asText());
        }

        broadcaster.onTacticalEvent(firstDeath());
        broadcaster.onConclusion("Entry engagement lost by Sentinels at R7C2.");
        broadcaster.onVisualEvent(VisualEvent.error("timed out", NOW));

        for (Subscriber subscriber : subscribers) {
            JsonNode event = next(subscriber);
            JsonNode conclusion = next(subscriber);
            JsonNode visual = next(subscriber);

            assertEquals("TACTICAL_EVENT", event.get("type").asText());
            assertEquals("Sentinels", event.get("payload").get("metadata").get("team").asText());
            assertEquals("CONCLUSION", conclusion.get("type").asText());
            assertEquals(event.get("sequence").asLong() + 1, conclusion.get("sequence").asLong());
            assertEquals("VISUAL_EVENT", visual.get("type").asText());
            assertEquals("ERROR", visual.get("payload").get("label").asText());
            assertEquals("timed out", visual.get("payload").get("error").asText());
        }
        System.out.println("✓ Broadcast reached " + sessionManager.getSessionCount() + " subscribers");
    }
}
