package com.skyfinal.grid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfinal.state.ArmorBucket;
import com.skyfinal.state.HealthBucket;
import com.skyfinal.state.PlayerState;
import com.skyfinal.state.Snapshot;

import org.junit.jupiter.api.*;

import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for normalizing series-state responses:
 * - Game selection
 * - Team filtering and player fields
 * - Weapon extraction
 */
@DisplayName("Series State Mapper Tests")
class SeriesStateMapperTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SeriesStateMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new SeriesStateMapper("inventory", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JsonNode fixture() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/series-state.json")) {
            return objectMapper.readTree(in).path("data").path("seriesState");
        }
    }

    // ==========================================
    // Test: Snapshot Mapping
    // ==========================================

    @Test
    @DisplayName("Should snapshot the latest game that has players")
    void testLatestGameWithPlayers() throws Exception {
        Snapshot snapshot = mapper.toSnapshot(fixture(), "fallback").orElseThrow();

        assertEquals("2629390", snapshot.getSeriesId());
        assertEquals("game-2", snapshot.getGameId());
        assertEquals(NOW, snapshot.getTimestamp());
        assertEquals(3, snapshot.getPlayerCount());
        assertEquals(2, snapshot.getAliveCount());
        System.out.println("✓ Mapped " + snapshot);
    }

    @Test
    @DisplayName("Should skip teams of other game types")
    void testOtherTeamTypesIgnored() throws Exception {
        Snapshot snapshot = mapper.toSnapshot(fixture(), "fallback").orElseThrow();

        assertNull(snapshot.getPlayer("x1"));
    }

    @Test
    @DisplayName("Should map team, health, armor, agent and position")
    void testPlayerFields() throws Exception {
        Snapshot snapshot = mapper.toSnapshot(fixture(), "fallback").orElseThrow();

        PlayerState derke = snapshot.getPlayer("p1");
        assertEquals("Derke", derke.getPlayerName());
        assertEquals("Fnatic", derke.getTeamName());
        assertEquals("attacker", derke.getSide());
        assertEquals("Raze", derke.getAgent());
        assertTrue(derke.isAlive());
        assertEquals(HealthBucket.FULL, derke.getHealthBucket());
        assertEquals(ArmorBucket.HEAVY, derke.getArmorBucket());
        assertEquals("R8C1", derke.getPosition().getRegion());
        assertEquals("NW", derke.getPosition().getQuadrant());

        PlayerState tenz = snapshot.getPlayer("p3");
        assertEquals(HealthBucket.CRITICAL, tenz.getHealthBucket(), "Numeric strings are accepted");
        assertEquals(ArmorBucket.LIGHT, tenz.getArmorBucket());
        assertFalse(tenz.getPosition().isKnown());
    }

    @Test
    @DisplayName("Should fall back to the player name when the id is missing")
    void testIdFallback() throws Exception {
        Snapshot snapshot = mapper.toSnapshot(fixture(), "fallback").orElseThrow();

        PlayerState chronicle = snapshot.getPlayer("Chronicle");
        assertNotNull(chronicle);
        assertFalse(chronicle.isAlive());
        assertEquals(HealthBucket.CRITICAL, chronicle.getHealthBucket());
    }

    @Test
    @DisplayName("Should return empty when no game has players")
    void testNoPlayers() throws Exception {
        JsonNode state = objectMapper.readTree("""
                { "id": "1", "games": [ { "id": "g", "teams": [] } ] }
                """);

        assertTrue(mapper.toSnapshot(state, "1").isEmpty());
        assertTrue(mapper.toSnapshot(null, "1").isEmpty());
    }

    @Test
    @DisplayName("Should use the requested series id when the response has none")
    void testSeriesIdFallback() throws Exception {
        JsonNode state = objectMapper.readTree("""
                { "games": [ { "id": "g", "teams": [ { "name": "A", "players": [ { "id": "p", "alive": true } ] } ] } ] }
                """);

        Optional<Snapshot> snapshot = mapper.toSnapshot(state, "requested");

        assertEquals("requested", snapshot.orElseThrow().getSeriesId());
    }

    // ==========================================
    // Test: Weapon Extraction
    // ==========================================

    @Test
    @DisplayName("Should prefer the equipped item over unequipped ones")
    void testEquippedWeapon() throws Exception {
        Snapshot snapshot = mapper.toSnapshot(fixture(), "fallback").orElseThrow();

        assertEquals("Vandal", snapshot.getPlayer("p1").getWeapon());
        assertEquals("Operator", snapshot.getPlayer("p3").getWeapon());
    }

    @Test
    @DisplayName("Should fall back to the first named item when nothing is equipped")
    void testFirstNamedItem() throws Exception {
        JsonNode inventory = objectMapper.readTree("""
                { "items": [ { "name": "  " }, { "name": " Ghost ", "equipped": 0 }, { "name": "Sheriff" } ] }
                """);

        assertEquals("Ghost", mapper.extractWeapon(inventory));
    }

    @Test
    @DisplayName("Should rank equipped items by count, quantity and name")
    void testRanking() throws Exception {
        JsonNode inventory = objectMapper.readTree("""
                { "items": [
                    { "name": "Spectre", "equipped": 1, "quantity": 1 },
                    { "name": "Phantom", "equipped": 1, "quantity": 2 },
                    { "name": "Bulldog", "equipped": 1, "quantity": 2 }
                ] }
                """);

        assertEquals("Phantom", mapper.extractWeapon(inventory));
        assertNull(mapper.extractWeapon(objectMapper.readTree("{}")));
    }
}
