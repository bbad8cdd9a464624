package com.skyfinal.sink;

import com.skyfinal.tactical.TacticalEvent;
import com.skyfinal.vision.VisualEvent;

/**
 * Boundary where events from both channels become visible to the advisory
 * layer. Implementations are called from the pipeline threads and must not
 * block.
 */
public interface EventSink {

    EventSink NONE = new EventSink() {
    };

    default void onTacticalEvent(TacticalEvent event) {
    }

    default void onConclusion(String conclusion) {
    }

    default void onVisualEvent(VisualEvent event) {
    }
}
