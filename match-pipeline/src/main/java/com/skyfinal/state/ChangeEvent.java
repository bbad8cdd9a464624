package com.skyfinal.state;

import java.util.Objects;

/**
 * A typed delta between two snapshots for one player.
 *
 * Only {@link ChangeType#WEAPON_CHANGE} carries weapon names; for deaths both
 * are null. Instances come from the static factories so the variant and its
 * fields always agree.
 */
public class ChangeEvent {

    private final ChangeType type;
    private final PlayerState player;
    private final String oldWeapon;
    private final String newWeapon;

    private ChangeEvent(ChangeType type, PlayerState player, String oldWeapon, String newWeapon) {
        this.type = Objects.requireNonNull(type, "type");
        this.player = Objects.requireNonNull(player, "player");
        this.oldWeapon = oldWeapon;
        this.newWeapon = newWeapon;
    }

    public static ChangeEvent playerDied(PlayerState player) {
        return new ChangeEvent(ChangeType.PLAYER_DIED, player, null, null);
    }

    public static ChangeEvent weaponChange(PlayerState player, String oldWeapon, String newWeapon) {
        return new ChangeEvent(ChangeType.WEAPON_CHANGE, player, oldWeapon, newWeapon);
    }

    public ChangeType getType() {
        return type;
    }

    /**
     * The player's state in the newer snapshot.
     */
    public PlayerState getPlayer() {
        return player;
    }

    public String getOldWeapon() {
        return oldWeapon;
    }

    public String getNewWeapon() {
        return newWeapon;
    }

    @Override
    public String toString() {
        return "ChangeEvent{" +
                "type=" + type +
                ", player='" + player.getPlayerId() + '\'' +
                (type == ChangeType.WEAPON_CHANGE ? ", " + oldWeapon + " -> " + newWeapon : "") +
                '}';
    }
}
