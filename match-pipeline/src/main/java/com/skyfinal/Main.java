package com.skyfinal;

import com.skyfinal.config.ConfigLoader;
import com.skyfinal.config.PipelineConfig;
import com.skyfinal.grid.SeriesStateClient;
import com.skyfinal.monitor.MatchMonitor;
import com.skyfinal.protocol.MessageSerializer;
import com.skyfinal.server.EventBroadcaster;
import com.skyfinal.server.EventServer;
import com.skyfinal.session.SessionManager;
import com.skyfinal.sink.EventSink;
import com.skyfinal.vision.ImageClassifier;
import com.skyfinal.vision.OllamaImageClassifier;
import com.skyfinal.vision.RobotScreenCapturer;
import com.skyfinal.vision.ScreenCapturer;

import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AWTException;
import java.awt.HeadlessException;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point for the live match event pipeline.
 *
 * Polls the series state feed and, where a display is available, watches the
 * screen for kill-feed and round-end cues. Events are pushed to subscribers
 * of the WebSocket event stream.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        PipelineConfig config;
        try {
            config = PipelineConfig.fromConfig(ConfigLoader.load());
        } catch (ConfigException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        logger.info("===========================================");
        logger.info("  Match Event Pipeline");
        logger.info("  Series {}", config.getSeriesId());
        logger.info("===========================================");

        SessionManager sessionManager = new SessionManager();
        MessageSerializer serializer = new MessageSerializer();
        EventSink sink = config.isServerEnabled()
                ? new EventBroadcaster(sessionManager, serializer, config.getSeriesId())
                : EventSink.NONE;

        ScreenCapturer capturer = null;
        ImageClassifier classifier = null;
        if (config.isVisionEnabled()) {
            capturer = createCapturer();
            classifier = new OllamaImageClassifier(config.getClassifierEndpoint(), config.getClassifierModel(),
                    config.getClassifierTimeout());
        }

        MatchMonitor monitor = new MatchMonitor(config, new SeriesStateClient(config),
                capturer, classifier, sink, Clock.systemUTC());

        EventServer server = config.isServerEnabled()
                ? new EventServer(config.getServerPort(), sessionManager, monitor, serializer, config.getSeriesId())
                : null;

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping pipeline...");
            monitor.stop();
            if (server != null) {
                server.shutdown();
            }
            stopped.countDown();
        }));

        try {
            if (server != null) {
                server.start();
            }
            monitor.start();
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Failed to start pipeline", e);
            System.exit(1);
        }
    }

    private static ScreenCapturer createCapturer() {
        try {
            return new RobotScreenCapturer();
        } catch (AWTException | HeadlessException e) {
            logger.warn("Screen capture unavailable ({}), visual channel disabled", e.getMessage());
            return null;
        }
    }
}
