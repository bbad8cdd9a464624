package com.skyfinal.grid;

import com.skyfinal.state.Snapshot;

import java.util.Optional;

/**
 * Source of live game state. One call per poll tick.
 *
 * Implementations hide the remote query and schema details. An empty result
 * means "no data this tick"; implementations may also throw, and the poller
 * treats both the same way.
 */
@FunctionalInterface
public interface StateFetcher {

    Optional<Snapshot> fetchSnapshot(String seriesId);
}
