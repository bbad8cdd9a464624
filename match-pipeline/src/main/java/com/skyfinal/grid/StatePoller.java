package com.skyfinal.grid;

import com.skyfinal.history.HistoryStore;
import com.skyfinal.lifecycle.StopSignal;
import com.skyfinal.state.ChangeEvent;
import com.skyfinal.state.Snapshot;
import com.skyfinal.state.SnapshotDiffer;
import com.skyfinal.tactical.TacticalEventDetector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Drives the structured-state channel on a fixed interval.
 *
 * Each tick fetches once, then runs diff, detect and persist strictly in
 * that order before accepting the snapshot as the new baseline. A tick with
 * no data leaves the baseline alone. A tick that throws is logged and the
 * loop retries after a short backoff; no single tick can stop polling.
 *
 * Threading Model:
 * - run() occupies one dedicated thread until the stop signal fires
 * - That thread is the only writer of the baseline and the history
 * - Ticks never overlap, so snapshots are processed in poll order
 */
public class StatePoller implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(StatePoller.class);

    private final String seriesId;
    private final StateFetcher fetcher;
    private final SnapshotDiffer differ;
    private final TacticalEventDetector detector;
    private final HistoryStore history;
    private final Duration pollInterval;
    private final Duration errorBackoff;
    private final StopSignal stopSignal;

    // Written by the polling thread only; volatile for status readers
    private volatile Snapshot previous;

    public StatePoller(String seriesId, StateFetcher fetcher, SnapshotDiffer differ,
                       TacticalEventDetector detector, HistoryStore history,
                       Duration pollInterval, Duration errorBackoff, StopSignal stopSignal) {
        if (seriesId == null || seriesId.isBlank()) {
            throw new IllegalArgumentException("The series id must be provided");
        }
        this.seriesId = seriesId;
        this.fetcher = fetcher;
        this.differ = differ;
        this.detector = detector;
        this.history = history;
        this.pollInterval = pollInterval;
        this.errorBackoff = errorBackoff;
        this.stopSignal = stopSignal;
    }

    @Override
    public void run() {
        logger.info("State polling started for series {} every {}", seriesId, pollInterval);

        while (!stopSignal.isStopped()) {
            Duration pause = pollInterval;
            try {
                pollOnce();
            } catch (RuntimeException e) {
                logger.error("Error in polling tick for series {}", seriesId, e);
                pause = errorBackoff;
            }
            if (stopSignal.awaitStop(pause)) {
                break;
            }
        }

        logger.info("State polling stopped for series {}", seriesId);
    }

    /**
     * Runs a single tick.
     *
     * @return true if a snapshot was accepted as the new baseline
     */
    public boolean pollOnce() {
        Optional<Snapshot> fetched = fetcher.fetchSnapshot(seriesId);
        if (fetched.isEmpty() || fetched.get().isEmpty()) {
            logger.debug("No data for series {} this tick", seriesId);
            return false;
        }
        Snapshot current = fetched.get();

        List<ChangeEvent> changes = differ.diff(previous, current);
        for (ChangeEvent change : changes) {
            detector.processChange(change, current);
        }
        history.append(current);
        previous = current;

        logger.debug("Accepted {} with {} change(s)", current, changes.size());
        return true;
    }

    /**
     * The last accepted snapshot, or null before the first successful poll.
     */
    public Snapshot getLastSnapshot() {
        return previous;
    }

    public String getSeriesId() {
        return seriesId;
    }
}
