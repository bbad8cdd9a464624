package com.skyfinal.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Calculates what changed between two consecutive snapshots.
 *
 * Only players present in both snapshots are compared; joins and leaves are
 * not modelled. The first snapshot of a session has nothing to compare
 * against and yields no changes, which keeps startup from producing a burst
 * of spurious events.
 */
public class SnapshotDiffer {

    /**
     * Returns the changes from {@code previous} to {@code current}, in the
     * current snapshot's player order.
     *
     * @param previous the last accepted snapshot, or null on the first poll
     * @param current  the snapshot just fetched
     */
    public List<ChangeEvent> diff(Snapshot previous, Snapshot current) {
        if (previous == null) {
            return Collections.emptyList();
        }

        List<ChangeEvent> changes = new ArrayList<>();
        for (Map.Entry<String, PlayerState> entry : current.getPlayers().entrySet()) {
            PlayerState oldState = previous.getPlayer(entry.getKey());
            if (oldState == null) {
                continue;
            }
            PlayerState newState = entry.getValue();

            if (oldState.isAlive() && !newState.isAlive()) {
                changes.add(ChangeEvent.playerDied(newState));
            }

            String newWeapon = newState.getWeapon();
            if (newWeapon != null && !newWeapon.isEmpty()
                    && !Objects.equals(oldState.getWeapon(), newWeapon)) {
                changes.add(ChangeEvent.weaponChange(newState, oldState.getWeapon(), newWeapon));
            }
        }
        return changes;
    }
}
