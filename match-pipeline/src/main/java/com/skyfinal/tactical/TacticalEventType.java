package com.skyfinal.tactical;

/**
 * Tags for tactical events written to the event log.
 */
public enum TacticalEventType {
    /** First player to die in the current round. */
    FIRST_DEATH
}
