package com.skyfinal.grid;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyfinal.state.ArmorBucket;
import com.skyfinal.state.HealthBucket;
import com.skyfinal.state.MapBounds;
import com.skyfinal.state.PlayerState;
import com.skyfinal.state.Position;
import com.skyfinal.state.Snapshot;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Normalizes a {@code seriesState} GraphQL object into a {@link Snapshot}.
 *
 * The snapshot describes the latest game of the series that reports any
 * players. Only Valorant team states are read; other team types are skipped.
 * Region labels are computed against the bounds of all positioned players in
 * that game.
 */
public class SeriesStateMapper {

    static final String TEAM_TYPE = "GameTeamStateValorant";

    private static final Comparator<InventoryItem> BEST_EQUIPPED =
            Comparator.comparingInt((InventoryItem i) -> i.equipped)
                    .thenComparingInt(i -> i.quantity)
                    .thenComparing(i -> i.name);

    private final String inventoryField;
    private final Clock clock;

    public SeriesStateMapper(String inventoryField, Clock clock) {
        this.inventoryField = inventoryField;
        this.clock = clock;
    }

    public SeriesStateMapper(String inventoryField) {
        this(inventoryField, Clock.systemUTC());
    }

    /**
     * @param seriesState the {@code data.seriesState} node, may be null or missing
     * @param seriesId    fallback series id when the node carries none
     */
    public Optional<Snapshot> toSnapshot(JsonNode seriesState, String seriesId) {
        if (seriesState == null || seriesState.isNull() || seriesState.isMissingNode()) {
            return Optional.empty();
        }
        String resolvedSeriesId = text(seriesState, "id");
        if (resolvedSeriesId == null) {
            resolvedSeriesId = seriesId;
        }

        List<JsonNode> games = new ArrayList<>();
        seriesState.path("games").forEach(games::add);

        for (int i = games.size() - 1; i >= 0; i--) {
            JsonNode game = games.get(i);
            List<PlayerState> players = mapPlayers(game);
            if (!players.isEmpty()) {
                return Optional.of(new Snapshot(resolvedSeriesId, text(game, "id"), clock.instant(), players));
            }
        }
        return Optional.empty();
    }

    private List<PlayerState> mapPlayers(JsonNode game) {
        List<JsonNode> teams = new ArrayList<>();
        for (JsonNode team : game.path("teams")) {
            String typeName = text(team, "__typename");
            if (typeName == null || TEAM_TYPE.equals(typeName)) {
                teams.add(team);
            }
        }

        MapBounds bounds = computeBounds(teams).orElse(null);

        List<PlayerState> players = new ArrayList<>();
        for (JsonNode team : teams) {
            String teamName = text(team, "name");
            String side = text(team, "side");

            for (JsonNode p : team.path("players")) {
                String name = text(p, "name");
                String id = text(p, "id");
                if (id == null) {
                    id = name;
                }
                if (id == null) {
                    continue;
                }

                JsonNode pos = p.path("position");
                Double x = number(pos, "x");
                Double y = number(pos, "y");

                players.add(PlayerState.builder()
                        .playerId(id)
                        .playerName(name)
                        .teamName(teamName)
                        .side(side)
                        .agent(text(p.path("character"), "name"))
                        .alive(p.path("alive").asBoolean(false))
                        .healthBucket(HealthBucket.of(number(p, "currentHealth"), number(p, "maxHealth")))
                        .armorBucket(ArmorBucket.of(number(p, "currentArmor")))
                        .weapon(extractWeapon(p.path(inventoryField)))
                        .position(Position.locate(x, y, bounds))
                        .build());
            }
        }
        return players;
    }

    private Optional<MapBounds> computeBounds(List<JsonNode> teams) {
        List<double[]> points = new ArrayList<>();
        for (JsonNode team : teams) {
            for (JsonNode p : team.path("players")) {
                JsonNode pos = p.path("position");
                Double x = number(pos, "x");
                Double y = number(pos, "y");
                if (x != null && y != null) {
                    points.add(new double[]{x, y});
                }
            }
        }
        return MapBounds.of(points);
    }

    /**
     * Picks the current weapon from an inventory node ({@code {items: [...]}}).
     * The best equipped item wins, ranked by equipped count, then quantity,
     * then name. With nothing equipped, the first named item is used.
     */
    String extractWeapon(JsonNode inventory) {
        JsonNode items = inventory.path("items");
        if (!items.isArray() || items.size() == 0) {
            return null;
        }

        InventoryItem best = null;
        String fallback = null;
        for (JsonNode item : items) {
            String name = text(item, "name");
            if (name == null || name.isBlank()) {
                continue;
            }
            name = name.trim();
            if (fallback == null) {
                fallback = name;
            }

            InventoryItem candidate = new InventoryItem(item.path("equipped").asInt(0),
                    item.path("quantity").asInt(0), name);
            if (candidate.equipped > 0 && (best == null || BEST_EQUIPPED.compare(candidate, best) > 0)) {
                best = candidate;
            }
        }
        return best != null ? best.name : fallback;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            double d = value.asDouble();
            return Double.isNaN(d) ? null : d;
        }
        if (value.isTextual()) {
            try {
                String s = value.asText().trim();
                return s.isEmpty() ? null : Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static final class InventoryItem {
        final int equipped;
        final int quantity;
        final String name;

        InventoryItem(int equipped, int quantity, String name) {
            this.equipped = equipped;
            this.quantity = quantity;
            this.name = name;
        }
    }
}
