package com.packetsentinel.core.config;

import com.packetsentinel.core.model.FeatureLayout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable tuning parameters of the detection engine.
 *
 * <p>
 * Values are resolved from environment variables with the defaults listed
 * below. Every pipeline owns its own instance; nothing here is static
 * state.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>{@code MIN_ANOMALY_SAMPLES}</td><td>100</td></tr>
 * <tr><td>{@code ANOMALY_THRESHOLD}</td><td>0.5</td></tr>
 * <tr><td>{@code CLASSIFICATION_THRESHOLD}</td><td>0.7</td></tr>
 * <tr><td>{@code LOGIN_WINDOW_SECONDS}</td><td>3600</td></tr>
 * <tr><td>{@code CONNECTION_IDLE_TIMEOUT_SECONDS}</td><td>300</td></tr>
 * <tr><td>{@code ACCESS_WINDOW_SECONDS}</td><td>300</td></tr>
 * <tr><td>{@code ALERT_DEDUP_WINDOW_SECONDS}</td><td>300</td></tr>
 * <tr><td>{@code STATS_FLUSH_INTERVAL_SECONDS}</td><td>60</td></tr>
 * <tr><td>{@code QUEUE_CAPACITY}</td><td>10000</td></tr>
 * <tr><td>{@code WORKER_COUNT}</td><td>available processors</td></tr>
 * <tr><td>{@code ANOMALY_RETRAIN_INTERVAL_SECONDS}</td><td>3600</td></tr>
 * <tr><td>{@code ANOMALY_SAMPLE_CAPACITY}</td><td>10000</td></tr>
 * <tr><td>{@code DETECTOR_TIMEOUT_MILLIS}</td><td>20 (&le; 0 waits forever)</td></tr>
 * <tr><td>{@code HISTORY_WINDOW_SECONDS}</td><td>60</td></tr>
 * <tr><td>{@code HISTORY_MAX_PACKETS}</td><td>1000 (port samples per source)</td></tr>
 * <tr><td>{@code TRACKER_SWEEP_INTERVAL_SECONDS}</td><td>60</td></tr>
 * <tr><td>{@code PERSISTENCE_MAX_ATTEMPTS}</td><td>3</td></tr>
 * <tr><td>{@code FEATURE_LAYOUT}</td><td>live</td></tr>
 * <tr><td>{@code MODEL_RELOAD_INTERVAL_SECONDS}</td><td>0 (disabled)</td></tr>
 * </table>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, {@link #defaults()} or the
 * {@link Builder} for tests. The builder collects every invalid value and
 * reports them together at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionSettings {

    // ---------------------------------------------------------------
    // Detection thresholds
    // ---------------------------------------------------------------
    private final int minAnomalySamples;
    private final double anomalyThreshold;
    private final double classificationThreshold;
    private final int anomalySampleCapacity;
    private final FeatureLayout featureLayout;

    // ---------------------------------------------------------------
    // Windows
    // ---------------------------------------------------------------
    private final Duration loginWindow;
    private final Duration connectionIdleTimeout;
    private final Duration accessWindow;
    private final Duration alertDedupWindow;
    private final Duration historyWindow;
    private final int historyMaxPackets;

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------
    private final int queueCapacity;
    private final int workerCount;
    private final Duration detectorTimeout;
    private final int persistenceMaxAttempts;

    // ---------------------------------------------------------------
    // Timers
    // ---------------------------------------------------------------
    private final Duration statsFlushInterval;
    private final Duration anomalyRetrainInterval;
    private final Duration trackerSweepInterval;
    private final Duration modelReloadInterval;

    private DetectionSettings(Builder b) {
        this.minAnomalySamples = b.minAnomalySamples;
        this.anomalyThreshold = b.anomalyThreshold;
        this.classificationThreshold = b.classificationThreshold;
        this.anomalySampleCapacity = b.anomalySampleCapacity;
        this.featureLayout = b.featureLayout;
        this.loginWindow = Duration.ofSeconds(b.loginWindowSeconds);
        this.connectionIdleTimeout = Duration.ofSeconds(b.connectionIdleTimeoutSeconds);
        this.accessWindow = Duration.ofSeconds(b.accessWindowSeconds);
        this.alertDedupWindow = Duration.ofSeconds(b.alertDedupWindowSeconds);
        this.historyWindow = Duration.ofSeconds(b.historyWindowSeconds);
        this.historyMaxPackets = b.historyMaxPackets;
        this.queueCapacity = b.queueCapacity;
        this.workerCount = b.workerCount;
        this.detectorTimeout = Duration.ofMillis(b.detectorTimeoutMillis);
        this.persistenceMaxAttempts = b.persistenceMaxAttempts;
        this.statsFlushInterval = Duration.ofSeconds(b.statsFlushIntervalSeconds);
        this.anomalyRetrainInterval = Duration.ofSeconds(b.anomalyRetrainIntervalSeconds);
        this.trackerSweepInterval = Duration.ofSeconds(b.trackerSweepIntervalSeconds);
        this.modelReloadInterval = Duration.ofSeconds(b.modelReloadIntervalSeconds);
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * @return settings with every default applied
     */
    public static DetectionSettings defaults() {
        return new Builder().build();
    }

    /**
     * Build settings from environment variables.
     *
     * @return fully populated settings
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     *                                  or a value is out of range
     * @throws IllegalArgumentException if {@code FEATURE_LAYOUT} is unknown
     */
    public static DetectionSettings fromEnvironment() {
        try {
            return new Builder()
                    .minAnomalySamples(parseIntEnv("MIN_ANOMALY_SAMPLES", "100"))
                    .anomalyThreshold(parseDoubleEnv("ANOMALY_THRESHOLD", "0.5"))
                    .classificationThreshold(parseDoubleEnv("CLASSIFICATION_THRESHOLD", "0.7"))
                    .loginWindowSeconds(parseLongEnv("LOGIN_WINDOW_SECONDS", "3600"))
                    .connectionIdleTimeoutSeconds(parseLongEnv("CONNECTION_IDLE_TIMEOUT_SECONDS", "300"))
                    .accessWindowSeconds(parseLongEnv("ACCESS_WINDOW_SECONDS", "300"))
                    .alertDedupWindowSeconds(parseLongEnv("ALERT_DEDUP_WINDOW_SECONDS", "300"))
                    .statsFlushIntervalSeconds(parseLongEnv("STATS_FLUSH_INTERVAL_SECONDS", "60"))
                    .queueCapacity(parseIntEnv("QUEUE_CAPACITY", "10000"))
                    .workerCount(parseIntEnv("WORKER_COUNT",
                            String.valueOf(Runtime.getRuntime().availableProcessors())))
                    .anomalyRetrainIntervalSeconds(parseLongEnv("ANOMALY_RETRAIN_INTERVAL_SECONDS", "3600"))
                    .anomalySampleCapacity(parseIntEnv("ANOMALY_SAMPLE_CAPACITY", "10000"))
                    .detectorTimeoutMillis(parseLongEnv("DETECTOR_TIMEOUT_MILLIS", "20"))
                    .historyWindowSeconds(parseLongEnv("HISTORY_WINDOW_SECONDS", "60"))
                    .historyMaxPackets(parseIntEnv("HISTORY_MAX_PACKETS", "1000"))
                    .trackerSweepIntervalSeconds(parseLongEnv("TRACKER_SWEEP_INTERVAL_SECONDS", "60"))
                    .persistenceMaxAttempts(parseIntEnv("PERSISTENCE_MAX_ATTEMPTS", "3"))
                    .featureLayout(FeatureLayout.fromName(env("FEATURE_LAYOUT", "live")))
                    .modelReloadIntervalSeconds(parseLongEnv("MODEL_RELOAD_INTERVAL_SECONDS", "0"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getMinAnomalySamples() {
        return minAnomalySamples;
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public double getClassificationThreshold() {
        return classificationThreshold;
    }

    public int getAnomalySampleCapacity() {
        return anomalySampleCapacity;
    }

    public FeatureLayout getFeatureLayout() {
        return featureLayout;
    }

    public Duration getLoginWindow() {
        return loginWindow;
    }

    public Duration getConnectionIdleTimeout() {
        return connectionIdleTimeout;
    }

    public Duration getAccessWindow() {
        return accessWindow;
    }

    public Duration getAlertDedupWindow() {
        return alertDedupWindow;
    }

    public Duration getHistoryWindow() {
        return historyWindow;
    }

    /**
     * @return destination ports remembered per source for port-scan
     *         queries; packet and byte totals are not capped by it
     */
    public int getHistoryMaxPackets() {
        return historyMaxPackets;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * @return per-detector wait; zero or negative means wait indefinitely
     */
    public Duration getDetectorTimeout() {
        return detectorTimeout;
    }

    public int getPersistenceMaxAttempts() {
        return persistenceMaxAttempts;
    }

    public Duration getStatsFlushInterval() {
        return statsFlushInterval;
    }

    public Duration getAnomalyRetrainInterval() {
        return anomalyRetrainInterval;
    }

    public Duration getTrackerSweepInterval() {
        return trackerSweepInterval;
    }

    /**
     * @return model reload period; zero disables the reload timer
     */
    public Duration getModelReloadInterval() {
        return modelReloadInterval;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionSettings}, pre-filled with the
     * defaults.
     */
    public static class Builder {
        private int minAnomalySamples = 100;
        private double anomalyThreshold = 0.5;
        private double classificationThreshold = 0.7;
        private int anomalySampleCapacity = 10_000;
        private FeatureLayout featureLayout = FeatureLayout.LIVE;
        private long loginWindowSeconds = 3600;
        private long connectionIdleTimeoutSeconds = 300;
        private long accessWindowSeconds = 300;
        private long alertDedupWindowSeconds = 300;
        private long historyWindowSeconds = 60;
        private int historyMaxPackets = 1000;
        private int queueCapacity = 10_000;
        private int workerCount = Runtime.getRuntime().availableProcessors();
        private long detectorTimeoutMillis = 20;
        private int persistenceMaxAttempts = 3;
        private long statsFlushIntervalSeconds = 60;
        private long anomalyRetrainIntervalSeconds = 3600;
        private long trackerSweepIntervalSeconds = 60;
        private long modelReloadIntervalSeconds = 0;

        public Builder minAnomalySamples(int v) {
            this.minAnomalySamples = v;
            return this;
        }

        public Builder anomalyThreshold(double v) {
            this.anomalyThreshold = v;
            return this;
        }

        public Builder classificationThreshold(double v) {
            this.classificationThreshold = v;
            return this;
        }

        public Builder anomalySampleCapacity(int v) {
            this.anomalySampleCapacity = v;
            return this;
        }

        public Builder featureLayout(FeatureLayout v) {
            this.featureLayout = v;
            return this;
        }

        public Builder loginWindowSeconds(long v) {
            this.loginWindowSeconds = v;
            return this;
        }

        public Builder connectionIdleTimeoutSeconds(long v) {
            this.connectionIdleTimeoutSeconds = v;
            return this;
        }

        public Builder accessWindowSeconds(long v) {
            this.accessWindowSeconds = v;
            return this;
        }

        public Builder alertDedupWindowSeconds(long v) {
            this.alertDedupWindowSeconds = v;
            return this;
        }

        public Builder historyWindowSeconds(long v) {
            this.historyWindowSeconds = v;
            return this;
        }

        public Builder historyMaxPackets(int v) {
            this.historyMaxPackets = v;
            return this;
        }

        public Builder queueCapacity(int v) {
            this.queueCapacity = v;
            return this;
        }

        public Builder workerCount(int v) {
            this.workerCount = v;
            return this;
        }

        public Builder detectorTimeoutMillis(long v) {
            this.detectorTimeoutMillis = v;
            return this;
        }

        public Builder persistenceMaxAttempts(int v) {
            this.persistenceMaxAttempts = v;
            return this;
        }

        public Builder statsFlushIntervalSeconds(long v) {
            this.statsFlushIntervalSeconds = v;
            return this;
        }

        public Builder anomalyRetrainIntervalSeconds(long v) {
            this.anomalyRetrainIntervalSeconds = v;
            return this;
        }

        public Builder trackerSweepIntervalSeconds(long v) {
            this.trackerSweepIntervalSeconds = v;
            return this;
        }

        public Builder modelReloadIntervalSeconds(long v) {
            this.modelReloadIntervalSeconds = v;
            return this;
        }

        /**
         * Build and validate the settings.
         *
         * @return validated settings
         * @throws IllegalStateException if one or more values are invalid
         */
        public DetectionSettings build() {
            Objects.requireNonNull(featureLayout, "featureLayout must not be null");
            List<String> errors = new ArrayList<>();

            if (minAnomalySamples < 2) {
                errors.add("minAnomalySamples must be >= 2, got: " + minAnomalySamples);
            }
            if (anomalySampleCapacity < minAnomalySamples) {
                errors.add("anomalySampleCapacity must be >= minAnomalySamples, got: "
                        + anomalySampleCapacity);
            }
            requireUnitInterval(anomalyThreshold, "anomalyThreshold", errors);
            requireUnitInterval(classificationThreshold, "classificationThreshold", errors);
            requirePositive(loginWindowSeconds, "loginWindowSeconds", errors);
            requirePositive(connectionIdleTimeoutSeconds, "connectionIdleTimeoutSeconds", errors);
            requirePositive(accessWindowSeconds, "accessWindowSeconds", errors);
            requirePositive(alertDedupWindowSeconds, "alertDedupWindowSeconds", errors);
            requirePositive(historyWindowSeconds, "historyWindowSeconds", errors);
            requirePositive(historyMaxPackets, "historyMaxPackets", errors);
            requirePositive(queueCapacity, "queueCapacity", errors);
            requirePositive(workerCount, "workerCount", errors);
            requirePositive(persistenceMaxAttempts, "persistenceMaxAttempts", errors);
            requirePositive(statsFlushIntervalSeconds, "statsFlushIntervalSeconds", errors);
            requirePositive(anomalyRetrainIntervalSeconds, "anomalyRetrainIntervalSeconds", errors);
            requirePositive(trackerSweepIntervalSeconds, "trackerSweepIntervalSeconds", errors);
            if (modelReloadIntervalSeconds < 0) {
                errors.add("modelReloadIntervalSeconds must be >= 0, got: " + modelReloadIntervalSeconds);
            }

            if (!errors.isEmpty()) {
                throw new IllegalStateException(
                        "Detection settings validation failed:\n  - " + String.join("\n  - ", errors));
            }
            return new DetectionSettings(this);
        }

        private static void requirePositive(long value, String name, List<String> errors) {
            if (value < 1) {
                errors.add(name + " must be >= 1, got: " + value);
            }
        }

        private static void requireUnitInterval(double value, String name, List<String> errors) {
            if (!(value >= 0.0 && value <= 1.0)) {
                errors.add(name + " must be in [0, 1], got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    private static double parseDoubleEnv(String name, String defaultValue) {
        return Double.parseDouble(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "minAnomalySamples=" + minAnomalySamples +
                ", anomalyThreshold=" + anomalyThreshold +
                ", classificationThreshold=" + classificationThreshold +
                ", featureLayout=" + featureLayout +
                ", queueCapacity=" + queueCapacity +
                ", workerCount=" + workerCount +
                ", detectorTimeout=" + detectorTimeout +
                ", alertDedupWindow=" + alertDedupWindow +
                ", statsFlushInterval=" + statsFlushInterval +
                '}';
    }
}
