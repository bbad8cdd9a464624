package com.skyfinal.state;

/**
 * Kinds of per-player change detected between two consecutive snapshots.
 */
public enum ChangeType {
    PLAYER_DIED,
    WEAPON_CHANGE
}
