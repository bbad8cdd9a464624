package com.skyfinal.monitor;

import com.skyfinal.config.PipelineConfig;
import com.skyfinal.grid.StateFetcher;
import com.skyfinal.grid.StatePoller;
import com.skyfinal.history.HistoryEntry;
import com.skyfinal.history.HistoryStore;
import com.skyfinal.lifecycle.StopSignal;
import com.skyfinal.sink.EventSink;
import com.skyfinal.state.PlayerState;
import com.skyfinal.state.Snapshot;
import com.skyfinal.state.SnapshotDiffer;
import com.skyfinal.tactical.TacticalEvent;
import com.skyfinal.tactical.TacticalEventDetector;
import com.skyfinal.vision.FrameClassifier;
import com.skyfinal.vision.FrameComposer;
import com.skyfinal.vision.FrameProducer;
import com.skyfinal.vision.ImageClassifier;
import com.skyfinal.vision.JpegEncoder;
import com.skyfinal.vision.LatestFrameSlot;
import com.skyfinal.vision.ScreenCapturer;
import com.skyfinal.vision.VisualEvent;

import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires and runs both sensor channels for one series.
 *
 * Threading Model:
 * - One thread polls the state feed (diff, detect, persist)
 * - One thread captures frames into the latest-frame slot
 * - One thread classifies frames from that slot
 * - The three share nothing but the slot and a single stop signal
 *
 * The visual channel runs only when it is enabled in the configuration and
 * both a screen capturer and an image classifier were supplied.
 */
public class MatchMonitor implements EventSurface {

    private static final Logger logger = LoggerFactory.getLogger(MatchMonitor.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final PipelineConfig config;
    private final StopSignal stopSignal = new StopSignal();
    private final AtomicBoolean started = new AtomicBoolean();

    private final TacticalEventDetector detector;
    private final HistoryStore history;
    private final StatePoller poller;

    private final LatestFrameSlot frameSlot;
    private final FrameProducer frameProducer;
    private final FrameClassifier frameClassifier;

    private final Deque<VisualEvent> recentVisualEvents = new ArrayDeque<>();
    private final List<ExecutorService> executors = new ArrayList<>();

    public MatchMonitor(PipelineConfig config, StateFetcher fetcher,
                        ScreenCapturer capturer, ImageClassifier classifier,
                        EventSink downstream, Clock clock) {
        this.config = config;
        EventSink sink = new RecordingSink(downstream);

        this.detector = new TacticalEventDetector(config.getPremiumWeapons(), config.getVisibleCount(), sink, clock);
        this.history = new HistoryStore(config.getHistoryWindowSize(), config.getHistoryFile());
        this.poller = new StatePoller(config.getSeriesId(), fetcher, new SnapshotDiffer(), detector, history,
                config.getPollInterval(), config.getPollErrorBackoff(), stopSignal);

        if (config.isVisionEnabled() && capturer != null && classifier != null) {
            FrameComposer composer = new FrameComposer(config.getKillfeedRegion(), config.getRoundEndRegion(),
                    config.getScaleFactor());
            this.frameSlot = new LatestFrameSlot();
            this.frameProducer = new FrameProducer(capturer, composer,
                    config.getKillfeedRegion(), config.getRoundEndRegion(), frameSlot,
                    config.getCaptureDelay(), config.getCaptureErrorPause(), stopSignal, clock);
            this.frameClassifier = new FrameClassifier(frameSlot, composer, new JpegEncoder(config.getJpegQuality()),
                    classifier, sink, config.getClassificationPeriod(), config.getEventCooldown(),
                    config.getFrameWait(), stopSignal, clock);
        } else {
            this.frameSlot = null;
            this.frameProducer = null;
            this.frameClassifier = null;
        }
    }

    public MatchMonitor(PipelineConfig config, StateFetcher fetcher, EventSink downstream) {
        this(config, fetcher, null, null, downstream, Clock.systemUTC());
    }

    /**
     * Starts the loops. Calling it again has no effect.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        logger.info("Starting match monitor: {}", config);

        submit("state-poller", poller);
        if (isVisionActive()) {
            submit("frame-producer", frameProducer);
            submit("frame-classifier", frameClassifier);
        } else {
            logger.info("Visual channel disabled");
        }
    }

    private void submit(String name, Runnable loop) {
        ExecutorService executor = Executors.newSingleThreadExecutor(new DefaultThreadFactory(name, true));
        executors.add(executor);
        executor.submit(loop);
    }

    /**
     * Signals every loop to stop and waits for in-flight calls to finish.
     */
    public void stop() {
        stopSignal.stop();
        for (ExecutorService executor : executors) {
            executor.shutdown();
        }
        for (ExecutorService executor : executors) {
            try {
                if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("A pipeline loop did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        logger.info("Match monitor stopped");
    }

    public boolean isVisionActive() {
        return frameClassifier != null;
    }

    @Override
    public List<TacticalEvent> getLatestEvents() {
        return detector.getLatestEvents();
    }

    @Override
    public List<String> getTacticalConclusions() {
        return detector.getTacticalConclusions();
    }

    @Override
    public List<VisualEvent> getLatestVisualEvents() {
        synchronized (recentVisualEvents) {
            return Collections.unmodifiableList(new ArrayList<>(recentVisualEvents));
        }
    }

    @Override
    public List<TacticalEvent> drainEvents() {
        return detector.drainEvents();
    }

    public void clearEventLog() {
        detector.clearEventLog();
    }

    @Override
    public List<HistoryEntry> getPersistedHistory() {
        return history.readPersisted();
    }

    /**
     * Up to {@code limit} of the most recent in-memory snapshots, oldest first.
     */
    public List<Snapshot> getSnapshotHistory(int limit) {
        return history.getSnapshots(limit);
    }

    public Snapshot getLastSnapshot() {
        return poller.getLastSnapshot();
    }

    @Override
    public String describeRoundStatus() {
        Snapshot snapshot = poller.getLastSnapshot();
        if (snapshot == null) {
            return "No live GRID data available for round status.";
        }
        return "Round Status: " + snapshot.getAliveCount() + " players alive. Game ID: "
                + snapshot.getGameId() + ".";
    }

    /**
     * Summary of the latest snapshot with one example player.
     */
    public String describeSnapshot() {
        Snapshot snapshot = poller.getLastSnapshot();
        if (snapshot == null) {
            return "No live GRID data available for stats.";
        }

        StringBuilder summary = new StringBuilder()
                .append("GRID Snapshot (Game: ").append(snapshot.getGameId()).append("): ")
                .append(snapshot.getAliveCount()).append('/').append(snapshot.getPlayerCount())
                .append(" players alive.");

        snapshot.getPlayers().values().stream()
                .filter(PlayerState::isAlive)
                .findFirst()
                .ifPresent(p -> summary.append(" Example: ").append(p.getPlayerName())
                        .append(" is at ").append(p.getPosition().getRegion())
                        .append(" with ").append(p.getWeapon()).append('.'));
        return summary.toString();
    }

    /**
     * Classifies a screenshot, or the latest buffered frame when null,
     * without going through the debounce.
     *
     * @throws IllegalStateException if the visual channel is not active
     */
    public VisualEvent analyzeScreen(BufferedImage screenshot) {
        if (!isVisionActive()) {
            throw new IllegalStateException("Visual channel is disabled");
        }
        return frameClassifier.analyze(screenshot);
    }

    StatePoller getPoller() {
        return poller;
    }

    LatestFrameSlot getFrameSlot() {
        return frameSlot;
    }

    /**
     * Keeps the last few visual events for readers, then forwards everything.
     */
    private class RecordingSink implements EventSink {

        private final EventSink downstream;

        RecordingSink(EventSink downstream) {
            this.downstream = downstream;
        }

        @Override
        public void onTacticalEvent(TacticalEvent event) {
            downstream.onTacticalEvent(event);
        }

        @Override
        public void onConclusion(String conclusion) {
            downstream.onConclusion(conclusion);
        }

        @Override
        public void onVisualEvent(VisualEvent event) {
            synchronized (recentVisualEvents) {
                recentVisualEvents.addLast(event);
                while (recentVisualEvents.size() > config.getVisibleCount()) {
                    recentVisualEvents.removeFirst();
                }
            }
            downstream.onVisualEvent(event);
        }
    }
}
