package com.skyfinal.config;

import com.skyfinal.vision.CaptureRegion;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable settings for the whole pipeline, injected into every component
 * at construction.
 *
 * Built from a Typesafe {@link Config} in production and with the
 * {@link Builder} in tests. Defaults mirror {@code reference.conf}. The series
 * id has no default: a pipeline without one refuses to start.
 */
public class PipelineConfig {

    private static final String ROOT = "pipeline";

    private final String seriesId;
    private final String apiKey;
    private final URI gridEndpoint;
    private final String playerType;
    private final String inventoryField;
    private final Duration gridRequestTimeout;

    private final Duration pollInterval;
    private final Duration pollErrorBackoff;

    private final int historyWindowSize;
    private final Path historyFile;

    private final Set<String> premiumWeapons;
    private final int visibleCount;

    private final boolean visionEnabled;
    private final double classificationHz;
    private final Duration eventCooldown;
    private final Duration captureDelay;
    private final Duration captureErrorPause;
    private final Duration frameWait;
    private final double scaleFactor;
    private final float jpegQuality;
    private final CaptureRegion killfeedRegion;
    private final CaptureRegion roundEndRegion;
    private final URI classifierEndpoint;
    private final String classifierModel;
    private final Duration classifierTimeout;

    private final boolean serverEnabled;
    private final int serverPort;

    private PipelineConfig(Builder b) {
        if (b.seriesId == null || b.seriesId.isBlank()) {
            throw new IllegalArgumentException("A series id must be provided");
        }
        if (b.historyWindowSize <= 0) {
            throw new IllegalArgumentException("History window size must be positive, got " + b.historyWindowSize);
        }
        if (b.classificationHz <= 0) {
            throw new IllegalArgumentException("Classification frequency must be positive, got " + b.classificationHz);
        }
        if (b.visibleCount < 0) {
            throw new IllegalArgumentException("Visible count must not be negative, got " + b.visibleCount);
        }
        if (b.scaleFactor <= 0 || b.scaleFactor > 1) {
            throw new IllegalArgumentException("Scale factor must be in (0, 1], got " + b.scaleFactor);
        }
        this.seriesId = b.seriesId.trim();
        this.apiKey = b.apiKey;
        this.gridEndpoint = b.gridEndpoint;
        this.playerType = b.playerType;
        this.inventoryField = b.inventoryField;
        this.gridRequestTimeout = b.gridRequestTimeout;
        this.pollInterval = b.pollInterval;
        this.pollErrorBackoff = b.pollErrorBackoff;
        this.historyWindowSize = b.historyWindowSize;
        this.historyFile = b.historyFile;
        this.premiumWeapons = Collections.unmodifiableSet(new LinkedHashSet<>(b.premiumWeapons));
        this.visibleCount = b.visibleCount;
        this.visionEnabled = b.visionEnabled;
        this.classificationHz = b.classificationHz;
        this.eventCooldown = b.eventCooldown;
        this.captureDelay = b.captureDelay;
        this.captureErrorPause = b.captureErrorPause;
        this.frameWait = b.frameWait;
        this.scaleFactor = b.scaleFactor;
        this.jpegQuality = b.jpegQuality;
        this.killfeedRegion = b.killfeedRegion;
        this.roundEndRegion = b.roundEndRegion;
        this.classifierEndpoint = b.classifierEndpoint;
        this.classifierModel = b.classifierModel;
        this.classifierTimeout = b.classifierTimeout;
        this.serverEnabled = b.serverEnabled;
        this.serverPort = b.serverPort;
    }

    /**
     * Reads the {@code pipeline} block of a resolved config.
     *
     * @throws ConfigException.Missing if the series id is absent
     * @throws ConfigException.BadValue if a value is present but unusable
     */
    public static PipelineConfig fromConfig(Config root) {
        Config c = root.getConfig(ROOT);

        String seriesId = c.getString("grid.series-id");
        if (seriesId.isBlank()) {
            throw new ConfigException.BadValue(ROOT + ".grid.series-id", "must not be blank");
        }

        try {
            return builder()
                    .seriesId(seriesId)
                    .apiKey(c.getString("grid.api-key"))
                    .gridEndpoint(URI.create(c.getString("grid.endpoint")))
                    .playerType(c.getString("grid.player-type"))
                    .inventoryField(c.getString("grid.inventory-field"))
                    .gridRequestTimeout(c.getDuration("grid.request-timeout"))
                    .pollInterval(c.getDuration("poll.interval"))
                    .pollErrorBackoff(c.getDuration("poll.error-backoff"))
                    .historyWindowSize(c.getInt("history.window-size"))
                    .historyFile(Paths.get(c.getString("history.file")))
                    .premiumWeapons(new LinkedHashSet<>(c.getStringList("tactical.premium-weapons")))
                    .visibleCount(c.getInt("tactical.visible-count"))
                    .visionEnabled(c.getBoolean("vision.enabled"))
                    .classificationHz(c.getDouble("vision.classification-hz"))
                    .eventCooldown(c.getDuration("vision.event-cooldown"))
                    .captureDelay(c.getDuration("vision.capture-delay"))
                    .captureErrorPause(c.getDuration("vision.error-pause"))
                    .frameWait(c.getDuration("vision.frame-wait"))
                    .scaleFactor(c.getDouble("vision.scale-factor"))
                    .jpegQuality((float) c.getDouble("vision.jpeg-quality"))
                    .killfeedRegion(region("killfeed", c.getConfig("vision.killfeed-region")))
                    .roundEndRegion(region("round-end", c.getConfig("vision.round-end-region")))
                    .classifierEndpoint(URI.create(c.getString("vision.classifier.endpoint")))
                    .classifierModel(c.getString("vision.classifier.model"))
                    .classifierTimeout(c.getDuration("vision.classifier.timeout"))
                    .serverEnabled(c.getBoolean("server.enabled"))
                    .serverPort(c.getInt("server.port"))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(ROOT, e.getMessage(), e);
        }
    }

    private static CaptureRegion region(String name, Config c) {
        return new CaptureRegion(name, c.getInt("top"), c.getInt("left"), c.getInt("width"), c.getInt("height"));
    }

    public String getSeriesId() {
        return seriesId;
    }

    public String getApiKey() {
        return apiKey;
    }

    public URI getGridEndpoint() {
        return gridEndpoint;
    }

    public String getPlayerType() {
        return playerType;
    }

    public String getInventoryField() {
        return inventoryField;
    }

    public Duration getGridRequestTimeout() {
        return gridRequestTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getPollErrorBackoff() {
        return pollErrorBackoff;
    }

    public int getHistoryWindowSize() {
        return historyWindowSize;
    }

    public Path getHistoryFile() {
        return historyFile;
    }

    public Set<String> getPremiumWeapons() {
        return premiumWeapons;
    }

    /**
     * How many events and conclusions consumers see at once.
     */
    public int getVisibleCount() {
        return visibleCount;
    }

    public boolean isVisionEnabled() {
        return visionEnabled;
    }

    public double getClassificationHz() {
        return classificationHz;
    }

    public Duration getClassificationPeriod() {
        return Duration.ofNanos((long) (1_000_000_000L / classificationHz));
    }

    public Duration getEventCooldown() {
        return eventCooldown;
    }

    public Duration getCaptureDelay() {
        return captureDelay;
    }

    public Duration getCaptureErrorPause() {
        return captureErrorPause;
    }

    public Duration getFrameWait() {
        return frameWait;
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    public float getJpegQuality() {
        return jpegQuality;
    }

    public CaptureRegion getKillfeedRegion() {
        return killfeedRegion;
    }

    public CaptureRegion getRoundEndRegion() {
        return roundEndRegion;
    }

    public URI getClassifierEndpoint() {
        return classifierEndpoint;
    }

    public String getClassifierModel() {
        return classifierModel;
    }

    public Duration getClassifierTimeout() {
        return classifierTimeout;
    }

    public boolean isServerEnabled() {
        return serverEnabled;
    }

    public int getServerPort() {
        return serverPort;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String seriesId;
        private String apiKey = "";
        private URI gridEndpoint = URI.create("https://api-op.grid.gg/live-data-feed/series-state/graphql");
        private String playerType = "GamePlayerStateValorant";
        private String inventoryField = "inventory";
        private Duration gridRequestTimeout = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration pollErrorBackoff = Duration.ofSeconds(1);
        private int historyWindowSize = 50;
        private Path historyFile = Paths.get("DATA", "history.json");
        private Set<String> premiumWeapons = new LinkedHashSet<>(Set.of("Vandal", "Phantom", "Operator"));
        private int visibleCount = 5;
        private boolean visionEnabled = true;
        private double classificationHz = 2.0;
        private Duration eventCooldown = Duration.ofSeconds(2);
        private Duration captureDelay = Duration.ofMillis(10);
        private Duration captureErrorPause = Duration.ofSeconds(1);
        private Duration frameWait = Duration.ofSeconds(2);
        private double scaleFactor = 0.5;
        private float jpegQuality = 0.8f;
        private CaptureRegion killfeedRegion = new CaptureRegion("killfeed", 40, 1240, 640, 260);
        private CaptureRegion roundEndRegion = new CaptureRegion("round-end", 260, 350, 1220, 340);
        private URI classifierEndpoint = URI.create("http://localhost:11434/api/generate");
        private String classifierModel = "qwen3-vl:2b";
        private Duration classifierTimeout = Duration.ofSeconds(5);
        private boolean serverEnabled = true;
        private int serverPort = 8090;

        public Builder seriesId(String seriesId) {
            this.seriesId = seriesId;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder gridEndpoint(URI gridEndpoint) {
            this.gridEndpoint = gridEndpoint;
            return this;
        }

        public Builder playerType(String playerType) {
            this.playerType = playerType;
            return this;
        }

        public Builder inventoryField(String inventoryField) {
            this.inventoryField = inventoryField;
            return this;
        }

        public Builder gridRequestTimeout(Duration gridRequestTimeout) {
            this.gridRequestTimeout = gridRequestTimeout;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder pollErrorBackoff(Duration pollErrorBackoff) {
            this.pollErrorBackoff = pollErrorBackoff;
            return this;
        }

        public Builder historyWindowSize(int historyWindowSize) {
            this.historyWindowSize = historyWindowSize;
            return this;
        }

        public Builder historyFile(Path historyFile) {
            this.historyFile = historyFile;
            return this;
        }

        public Builder premiumWeapons(Set<String> premiumWeapons) {
            this.premiumWeapons = premiumWeapons;
            return this;
        }

        public Builder visibleCount(int visibleCount) {
            this.visibleCount = visibleCount;
            return this;
        }

        public Builder visionEnabled(boolean visionEnabled) {
            this.visionEnabled = visionEnabled;
            return this;
        }

        public Builder classificationHz(double classificationHz) {
            this.classificationHz = classificationHz;
            return this;
        }

        public Builder eventCooldown(Duration eventCooldown) {
            this.eventCooldown = eventCooldown;
            return this;
        }

        public Builder captureDelay(Duration captureDelay) {
            this.captureDelay = captureDelay;
            return this;
        }

        public Builder captureErrorPause(Duration captureErrorPause) {
            this.captureErrorPause = captureErrorPause;
            return this;
        }

        public Builder frameWait(Duration frameWait) {
            this.frameWait = frameWait;
            return this;
        }

        public Builder scaleFactor(double scaleFactor) {
            this.scaleFactor = scaleFactor;
            return this;
        }

        public Builder jpegQuality(float jpegQuality) {
            this.jpegQuality = jpegQuality;
            return this;
        }

        public Builder killfeedRegion(CaptureRegion killfeedRegion) {
            this.killfeedRegion = killfeedRegion;
            return this;
        }

        public Builder roundEndRegion(CaptureRegion roundEndRegion) {
            this.roundEndRegion = roundEndRegion;
            return this;
        }

        public Builder classifierEndpoint(URI classifierEndpoint) {
            this.classifierEndpoint = classifierEndpoint;
            return this;
        }

        public Builder classifierModel(String classifierModel) {
            this.classifierModel = classifierModel;
            return this;
        }

        public Builder classifierTimeout(Duration classifierTimeout) {
            this.classifierTimeout = classifierTimeout;
            return this;
        }

        public Builder serverEnabled(boolean serverEnabled) {
            this.serverEnabled = serverEnabled;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "seriesId='" + seriesId + '\'' +
                ", pollInterval=" + pollInterval +
                ", historyWindowSize=" + historyWindowSize +
                ", historyFile=" + historyFile +
                ", visionEnabled=" + visionEnabled +
                ", classificationHz=" + classificationHz +
                ", eventCooldown=" + eventCooldown +
                ", serverPort=" + (serverEnabled ? serverPort : "disabled") +
                '}';
    }
}
