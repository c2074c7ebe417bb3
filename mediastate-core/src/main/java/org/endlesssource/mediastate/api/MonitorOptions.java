package org.endlesssource.mediastate.api;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration options for {@link MediaStateMonitor} implementations.
 */
public final class MonitorOptions {
    public static final Duration DEFAULT_SESSIONS_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SERVER_STATS_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RECORDINGS_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_LIBRARY_INTERVAL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(15);
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_LIST_SIZE = 5;
    public static final String DEFAULT_KEY_PREFIX = "emby";

    private final Map<Category, Duration> intervals;
    private final Duration pollTimeout;
    private final int failureThreshold;
    private final int listSize;
    private final String keyPrefix;
    private final Set<Feature> enabledFeatures;

    private MonitorOptions(Map<Category, Duration> intervals,
                           Duration pollTimeout,
                           int failureThreshold,
                           int listSize,
                           String keyPrefix,
                           Set<Feature> enabledFeatures) {
        EnumMap<Category, Duration> copy = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            copy.put(category, requirePositive(category.id() + " interval", intervals.get(category)));
        }
        this.intervals = Collections.unmodifiableMap(copy);
        this.pollTimeout = requirePositive("pollTimeout", pollTimeout);
        this.failureThreshold = requirePositive("failureThreshold", failureThreshold);
        this.listSize = requirePositive("listSize", listSize);
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix must not be null");
        Objects.requireNonNull(enabledFeatures, "enabledFeatures must not be null");
        this.enabledFeatures = Collections.unmodifiableSet(enabledFeatures.isEmpty()
                ? EnumSet.noneOf(Feature.class)
                : EnumSet.copyOf(enabledFeatures));
    }

    public static MonitorOptions defaults() {
        Map<Category, Duration> intervals = new EnumMap<>(Category.class);
        intervals.put(Category.SESSIONS, DEFAULT_SESSIONS_INTERVAL);
        intervals.put(Category.SERVER_STATS, DEFAULT_SERVER_STATS_INTERVAL);
        intervals.put(Category.RECORDINGS, DEFAULT_RECORDINGS_INTERVAL);
        intervals.put(Category.LIBRARY, DEFAULT_LIBRARY_INTERVAL);
        return new MonitorOptions(intervals, DEFAULT_POLL_TIMEOUT, DEFAULT_FAILURE_THRESHOLD, DEFAULT_LIST_SIZE,
                DEFAULT_KEY_PREFIX, EnumSet.allOf(Feature.class));
    }

    public Duration getInterval(Category category) {
        return intervals.get(Objects.requireNonNull(category, "category must not be null"));
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public int getListSize() {
        return listSize;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public Set<Feature> getEnabledFeatures() {
        return enabledFeatures;
    }

    public boolean isEnabled(Feature feature) {
        return enabledFeatures.contains(feature);
    }

    /**
     * Sessions always poll; other categories poll while at least one of their features is enabled.
     */
    public boolean isActive(Category category) {
        if (category == Category.SESSIONS) {
            return true;
        }
        return enabledFeatures.stream().anyMatch(feature -> feature.category() == category);
    }

    public MonitorOptions withInterval(Category category, Duration interval) {
        Objects.requireNonNull(category, "category must not be null");
        Map<Category, Duration> copy = new EnumMap<>(intervals);
        copy.put(category, interval);
        return new MonitorOptions(copy, pollTimeout, failureThreshold, listSize, keyPrefix, enabledFeatures);
    }

    public MonitorOptions withPollTimeout(Duration timeout) {
        return new MonitorOptions(intervals, timeout, failureThreshold, listSize, keyPrefix, enabledFeatures);
    }

    public MonitorOptions withFailureThreshold(int threshold) {
        return new MonitorOptions(intervals, pollTimeout, threshold, listSize, keyPrefix, enabledFeatures);
    }

    public MonitorOptions withListSize(int size) {
        return new MonitorOptions(intervals, pollTimeout, failureThreshold, size, keyPrefix, enabledFeatures);
    }

    public MonitorOptions withKeyPrefix(String prefix) {
        return new MonitorOptions(intervals, pollTimeout, failureThreshold, listSize, prefix, enabledFeatures);
    }

    public MonitorOptions withFeature(Feature feature, boolean enabled) {
        Objects.requireNonNull(feature, "feature must not be null");
        Set<Feature> copy = EnumSet.noneOf(Feature.class);
        copy.addAll(enabledFeatures);
        if (enabled) {
            copy.add(feature);
        } else {
            copy.remove(feature);
        }
        return new MonitorOptions(intervals, pollTimeout, failureThreshold, listSize, keyPrefix, copy);
    }

    public MonitorOptions withEnabledFeatures(Set<Feature> features) {
        return new MonitorOptions(intervals, pollTimeout, failureThreshold, listSize, keyPrefix, features);
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
