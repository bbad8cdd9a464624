package com.skyfinal.state;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A point-in-time view of one game instance.
 *
 * Immutable once constructed. The player map keeps the order the feed
 * reported players in, which is the order {@link SnapshotDiffer} emits
 * changes in.
 */
public class Snapshot {

    private final String seriesId;
    private final String gameId;
    private final Instant timestamp;
    private final Map<String, PlayerState> players;

    public Snapshot(String seriesId, String gameId, Instant timestamp, Collection<PlayerState> players) {
        this.seriesId = seriesId;
        this.gameId = gameId;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");

        Map<String, PlayerState> byId = new LinkedHashMap<>();
        for (PlayerState player : players) {
            byId.put(player.getPlayerId(), player);
        }
        this.players = Collections.unmodifiableMap(byId);
    }

    public Snapshot(String seriesId, String gameId, Collection<PlayerState> players) {
        this(seriesId, gameId, Instant.now(), players);
    }

    public String getSeriesId() {
        return seriesId;
    }

    public String getGameId() {
        return gameId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, PlayerState> getPlayers() {
        return players;
    }

    public PlayerState getPlayer(String playerId) {
        return players.get(playerId);
    }

    public int getPlayerCount() {
        return players.size();
    }

    public long getAliveCount() {
        return players.values().stream()
                .filter(PlayerState::isAlive)
                .count();
    }

    /**
     * An empty snapshot is treated as a failed poll and never stored.
     */
    public boolean isEmpty() {
        return players.isEmpty();
    }

    @Override
    public String toString() {
        return "Snapshot{" +
                "seriesId='" + seriesId + '\'' +
                ", gameId='" + gameId + '\'' +
                ", timestamp=" + timestamp +
                ", players=" + players.size() +
                '}';
    }
}
