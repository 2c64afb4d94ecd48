package com.order.consolidation.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for the order consolidation engine.
 * Configures matching thresholds, continuation and timing windows, and session timeouts.
 * Every component takes the same immutable instance at construction.
 */
public class EngineOptions {

    private static final double DEFAULT_HIGH_CONFIDENCE_THRESHOLD = 0.85;
    private static final double DEFAULT_MEDIUM_CONFIDENCE_THRESHOLD = 0.60;
    private static final double DEFAULT_TRAINING_SIMILARITY_THRESHOLD = 0.70;
    private static final Duration DEFAULT_CONTINUATION_WINDOW = Duration.ofMinutes(10);
    private static final Duration DEFAULT_RAPID_THRESHOLD = Duration.ofSeconds(30);
    private static final Duration DEFAULT_NORMAL_THRESHOLD = Duration.ofMinutes(3);
    private static final Duration DEFAULT_SLOW_THRESHOLD = Duration.ofMinutes(8);
    private static final Duration DEFAULT_FREQUENCY_WINDOW = Duration.ofMinutes(10);
    private static final double DEFAULT_FREQUENCY_BOOST_THRESHOLD = 0.5;
    private static final Duration DEFAULT_HISTORY_LOOKBACK = Duration.ofHours(1);
    private static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofMinutes(30);
    private static final Duration DEFAULT_EXTENSION_TIMEOUT = Duration.ofMinutes(5);
    private static final double DEFAULT_SESSION_START_THRESHOLD = 0.5;
    private static final double DEFAULT_SESSION_CLOSE_THRESHOLD = 0.6;
    private static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final double highConfidenceThreshold;
    private final double mediumConfidenceThreshold;
    private final double trainingSimilarityThreshold;
    private final Duration continuationWindow;
    private final Duration rapidThreshold;
    private final Duration normalThreshold;
    private final Duration slowThreshold;
    private final Duration frequencyWindow;
    private final double frequencyBoostThreshold;
    private final Duration historyLookback;
    private final Duration sessionTimeout;
    private final Duration extensionTimeout;
    private final double sessionStartThreshold;
    private final double sessionCloseThreshold;
    private final Duration sweepInterval;

    private EngineOptions(Builder builder) {
        this.highConfidenceThreshold = builder.highConfidenceThreshold;
        this.mediumConfidenceThreshold = builder.mediumConfidenceThreshold;
        this.trainingSimilarityThreshold = builder.trainingSimilarityThreshold;
        this.continuationWindow = builder.continuationWindow;
        this.rapidThreshold = builder.rapidThreshold;
        this.normalThreshold = builder.normalThreshold;
        this.slowThreshold = builder.slowThreshold;
        this.frequencyWindow = builder.frequencyWindow;
        this.frequencyBoostThreshold = builder.frequencyBoostThreshold;
        this.historyLookback = builder.historyLookback;
        this.sessionTimeout = builder.sessionTimeout;
        this.extensionTimeout = builder.extensionTimeout;
        this.sessionStartThreshold = builder.sessionStartThreshold;
        this.sessionCloseThreshold = builder.sessionCloseThreshold;
        this.sweepInterval = builder.sweepInterval;
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public double getMediumConfidenceThreshold() {
        return mediumConfidenceThreshold;
    }

    public double getTrainingSimilarityThreshold() {
        return trainingSimilarityThreshold;
    }

    public Duration getContinuationWindow() {
        return continuationWindow;
    }

    public Duration getRapidThreshold() {
        return rapidThreshold;
    }

    public Duration getNormalThreshold() {
        return normalThreshold;
    }

    public Duration getSlowThreshold() {
        return slowThreshold;
    }

    public Duration getFrequencyWindow() {
        return frequencyWindow;
    }

    public double getFrequencyBoostThreshold() {
        return frequencyBoostThreshold;
    }

    public Duration getHistoryLookback() {
        return historyLookback;
    }

    public Duration getSessionTimeout() {
        return sessionTimeout;
    }

    public Duration getExtensionTimeout() {
        return extensionTimeout;
    }

    public double getSessionStartThreshold() {
        return sessionStartThreshold;
    }

    public double getSessionCloseThreshold() {
        return sessionCloseThreshold;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    /**
     * Creates default options.
     */
    public static EngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double highConfidenceThreshold = DEFAULT_HIGH_CONFIDENCE_THRESHOLD;
        private double mediumConfidenceThreshold = DEFAULT_MEDIUM_CONFIDENCE_THRESHOLD;
        private double trainingSimilarityThreshold = DEFAULT_TRAINING_SIMILARITY_THRESHOLD;
        private Duration continuationWindow = DEFAULT_CONTINUATION_WINDOW;
        private Duration rapidThreshold = DEFAULT_RAPID_THRESHOLD;
        private Duration normalThreshold = DEFAULT_NORMAL_THRESHOLD;
        private Duration slowThreshold = DEFAULT_SLOW_THRESHOLD;
        private Duration frequencyWindow = DEFAULT_FREQUENCY_WINDOW;
        private double frequencyBoostThreshold = DEFAULT_FREQUENCY_BOOST_THRESHOLD;
        private Duration historyLookback = DEFAULT_HISTORY_LOOKBACK;
        private Duration sessionTimeout = DEFAULT_SESSION_TIMEOUT;
        private Duration extensionTimeout = DEFAULT_EXTENSION_TIMEOUT;
        private double sessionStartThreshold = DEFAULT_SESSION_START_THRESHOLD;
        private double sessionCloseThreshold = DEFAULT_SESSION_CLOSE_THRESHOLD;
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;

        public Builder highConfidenceThreshold(double highConfidenceThreshold) {
            validateThreshold(highConfidenceThreshold, "highConfidenceThreshold");
            this.highConfidenceThreshold = highConfidenceThreshold;
            return this;
        }

        public Builder mediumConfidenceThreshold(double mediumConfidenceThreshold) {
            validateThreshold(mediumConfidenceThreshold, "mediumConfidenceThreshold");
            this.mediumConfidenceThreshold = mediumConfidenceThreshold;
            return this;
        }

        public Builder trainingSimilarityThreshold(double trainingSimilarityThreshold) {
            validateThreshold(trainingSimilarityThreshold, "trainingSimilarityThreshold");
            this.trainingSimilarityThreshold = trainingSimilarityThreshold;
            return this;
        }

        public Builder continuationWindow(Duration continuationWindow) {
            this.continuationWindow = validatePositive(continuationWindow, "continuationWindow");
            return this;
        }

        public Builder rapidThreshold(Duration rapidThreshold) {
            this.rapidThreshold = validatePositive(rapidThreshold, "rapidThreshold");
            return this;
        }

        public Builder normalThreshold(Duration normalThreshold) {
            this.normalThreshold = validatePositive(normalThreshold, "normalThreshold");
            return this;
        }

        public Builder slowThreshold(Duration slowThreshold) {
            this.slowThreshold = validatePositive(slowThreshold, "slowThreshold");
            return this;
        }

        public Builder frequencyWindow(Duration frequencyWindow) {
            this.frequencyWindow = validatePositive(frequencyWindow, "frequencyWindow");
            return this;
        }

        public Builder frequencyBoostThreshold(double frequencyBoostThreshold) {
            if (frequencyBoostThreshold < 0.0) {
                throw new IllegalArgumentException("frequencyBoostThreshold must be >= 0");
            }
            this.frequencyBoostThreshold = frequencyBoostThreshold;
            return this;
        }

        public Builder historyLookback(Duration historyLookback) {
            this.historyLookback = validatePositive(historyLookback, "historyLookback");
            return this;
        }

        public Builder sessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = validatePositive(sessionTimeout, "sessionTimeout");
            return this;
        }

        public Builder extensionTimeout(Duration extensionTimeout) {
            this.extensionTimeout = validatePositive(extensionTimeout, "extensionTimeout");
            return this;
        }

        public Builder sessionStartThreshold(double sessionStartThreshold) {
            validateThreshold(sessionStartThreshold, "sessionStartThreshold");
            this.sessionStartThreshold = sessionStartThreshold;
            return this;
        }

        public Builder sessionCloseThreshold(double sessionCloseThreshold) {
            validateThreshold(sessionCloseThreshold, "sessionCloseThreshold");
            this.sessionCloseThreshold = sessionCloseThreshold;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = validatePositive(sweepInterval, "sweepInterval");
            return this;
        }

        public EngineOptions build() {
            if (highConfidenceThreshold < mediumConfidenceThreshold) {
                throw new IllegalArgumentException(
                        "highConfidenceThreshold must be >= mediumConfidenceThreshold");
            }
            if (rapidThreshold.compareTo(normalThreshold) > 0
                    || normalThreshold.compareTo(slowThreshold) > 0) {
                throw new IllegalArgumentException(
                        "timing thresholds must satisfy rapid <= normal <= slow");
            }
            return new EngineOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private Duration validatePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " is required");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
