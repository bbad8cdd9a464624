package com.skyfinal.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.skyfinal.state.PlayerState;
import com.skyfinal.state.Snapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simplified projection of a {@link Snapshot} as written to the history file.
 *
 * JSON format:
 * {
 *     "series_id": "2629390",
 *     "game_id": "g-1",
 *     "timestamp": "2026-01-01T12:00:00Z",
 *     "players": { "p1": { "alive": true, "hp_bucket": "full", "weapon": "Vandal" } }
 * }
 */
public class HistoryEntry {

    @JsonProperty("series_id")
    private String seriesId;

    @JsonProperty("game_id")
    private String gameId;

    private String timestamp;

    private Map<String, PlayerRecord> players = new LinkedHashMap<>();

    // Default constructor for Jackson
    public HistoryEntry() {
    }

    public HistoryEntry(String seriesId, String gameId, String timestamp, Map<String, PlayerRecord> players) {
        this.seriesId = seriesId;
        this.gameId = gameId;
        this.timestamp = timestamp;
        this.players = new LinkedHashMap<>(players);
    }

    public static HistoryEntry of(Snapshot snapshot) {
        Map<String, PlayerRecord> players = new LinkedHashMap<>();
        for (PlayerState p : snapshot.getPlayers().values()) {
            players.put(p.getPlayerId(),
                    new PlayerRecord(p.isAlive(), p.getHealthBucket().getLabel(), p.getWeapon()));
        }
        return new HistoryEntry(snapshot.getSeriesId(), snapshot.getGameId(),
                snapshot.getTimestamp().toString(), players);
    }

    public String getSeriesId() {
        return seriesId;
    }

    public void setSeriesId(String seriesId) {
        this.seriesId = seriesId;
    }

    public String getGameId() {
        return gameId;
    }

    public void setGameId(String gameId) {
        this.gameId = gameId;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public Map<String, PlayerRecord> getPlayers() {
        return players;
    }

    public void setPlayers(Map<String, PlayerRecord> players) {
        this.players = players;
    }

    /**
     * Per-player fields kept in the history file.
     */
    public static class PlayerRecord {

        private boolean alive;

        @JsonProperty("hp_bucket")
        private String hpBucket;

        private String weapon;

        public PlayerRecord() {
        }

        public PlayerRecord(boolean alive, String hpBucket, String weapon) {
            this.alive = alive;
            this.hpBucket = hpBucket;
            this.weapon = weapon;
        }

        public boolean isAlive() {
            return alive;
        }

        public void setAlive(boolean alive) {
            this.alive = alive;
        }

        public String getHpBucket() {
            return hpBucket;
        }

        public void setHpBucket(String hpBucket) {
            this.hpBucket = hpBucket;
        }

        public String getWeapon() {
            return weapon;
        }

        public void setWeapon(String weapon) {
            this.weapon = weapon;
        }
    }

    @Override
    public String toString() {
        return "HistoryEntry{" +
                "seriesId='" + seriesId + '\'' +
                ", gameId='" + gameId + '\'' +
                ", timestamp='" + timestamp + '\'' +
                ", players=" + players.size() +
                '}';
    }
}
