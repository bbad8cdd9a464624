package com.skyfinal.state;

import java.util.Objects;

/**
 * Represents one player's condition within a {@link Snapshot}.
 *
 * Immutable: a player that changes between polls shows up as a new
 * PlayerState in the next snapshot, never as a mutation of this one.
 */
public class PlayerState {

    private final String playerId;
    private final String playerName;
    private final String teamName;
    private final String side;
    private final String agent;
    private final boolean alive;
    private final HealthBucket healthBucket;
    private final ArmorBucket armorBucket;
    private final String weapon;
    private final Position position;

    private PlayerState(Builder builder) {
        this.playerId = Objects.requireNonNull(builder.playerId, "playerId");
        this.playerName = builder.playerName;
        this.teamName = builder.teamName;
        this.side = builder.side;
        this.agent = builder.agent;
        this.alive = builder.alive;
        this.healthBucket = builder.healthBucket;
        this.armorBucket = builder.armorBucket;
        this.weapon = builder.weapon;
        this.position = builder.position;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getPlayerName() {
        return playerName;
    }

    public String getTeamName() {
        return teamName;
    }

    /**
     * Attacker or defender, as reported by the state feed.
     */
    public String getSide() {
        return side;
    }

    public String getAgent() {
        return agent;
    }

    public boolean isAlive() {
        return alive;
    }

    public HealthBucket getHealthBucket() {
        return healthBucket;
    }

    public ArmorBucket getArmorBucket() {
        return armorBucket;
    }

    /**
     * Current weapon name, or null when the feed reported none.
     */
    public String getWeapon() {
        return weapon;
    }

    public Position getPosition() {
        return position;
    }

    /**
     * Returns a copy with the alive flag replaced.
     */
    public PlayerState withAlive(boolean newAlive) {
        return toBuilder().alive(newAlive).build();
    }

    /**
     * Returns a copy carrying a different weapon.
     */
    public PlayerState withWeapon(String newWeapon) {
        return toBuilder().weapon(newWeapon).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .playerId(playerId)
                .playerName(playerName)
                .teamName(teamName)
                .side(side)
                .agent(agent)
                .alive(alive)
                .healthBucket(healthBucket)
                .armorBucket(armorBucket)
                .weapon(weapon)
                .position(position);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String playerId;
        private String playerName;
        private String teamName;
        private String side;
        private String agent;
        private boolean alive = true;
        private HealthBucket healthBucket = HealthBucket.UNKNOWN;
        private ArmorBucket armorBucket = ArmorBucket.UNKNOWN;
        private String weapon;
        private Position position = Position.unknown();

        public Builder playerId(String playerId) {
            this.playerId = playerId;
            return this;
        }

        public Builder playerName(String playerName) {
            this.playerName = playerName;
            return this;
        }

        public Builder teamName(String teamName) {
            this.teamName = teamName;
            return this;
        }

        public Builder side(String side) {
            this.side = side;
            return this;
        }

        public Builder agent(String agent) {
            this.agent = agent;
            return this;
        }

        public Builder alive(boolean alive) {
            this.alive = alive;
            return this;
        }

        public Builder healthBucket(HealthBucket healthBucket) {
            this.healthBucket = healthBucket;
            return this;
        }

        public Builder armorBucket(ArmorBucket armorBucket) {
            this.armorBucket = armorBucket;
            return this;
        }

        public Builder weapon(String weapon) {
            this.weapon = weapon;
            return this;
        }

        public Builder position(Position position) {
            this.position = position != null ? position : Position.unknown();
            return this;
        }

        public PlayerState build() {
            return new PlayerState(this);
        }
    }

    @Override
    public String toString() {
        return "PlayerState{" +
                "playerId='" + playerId + '\'' +
                ", playerName='" + playerName + '\'' +
                ", team='" + teamName + '\'' +
                ", alive=" + alive +
                ", weapon='" + weapon + '\'' +
                '}';
    }
}
