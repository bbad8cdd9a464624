package com.skyfinal.monitor;

import com.skyfinal.history.HistoryEntry;
import com.skyfinal.tactical.TacticalEvent;
import com.skyfinal.vision.VisualEvent;

import java.util.List;

/**
 * Read side of the pipeline as seen by the advisory layer.
 */
public interface EventSurface {

    /** Most recent tactical events, oldest first. */
    List<TacticalEvent> getLatestEvents();

    /** Most recent tactical conclusions, oldest first. */
    List<String> getTacticalConclusions();

    /** Most recent surfaced visual events, oldest first. */
    List<VisualEvent> getLatestVisualEvents();

    /**
     * Returns the whole tactical event log and empties it. This is the
     * consumer's side of the hand-off; the pipeline never expires events.
     */
    List<TacticalEvent> drainEvents();

    /** The persisted snapshot projection, surviving restarts. */
    List<HistoryEntry> getPersistedHistory();

    /** One-line summary of the current round. */
    String describeRoundStatus();
}
