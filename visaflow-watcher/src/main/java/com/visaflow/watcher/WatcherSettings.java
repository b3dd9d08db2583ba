package com.visaflow.watcher;

import java.time.Duration;

/**
 * Settings shared by every folder watcher of a process.
 *
 * @param defaultPollInterval  interval used when a watcher config does not set one
 * @param maxConsecutiveErrors failed polls in a row after which a watcher stops itself
 * @param pollThreads          threads running poll cycles; watchers poll independently of each other
 */
public record WatcherSettings(
    Duration defaultPollInterval,
    int maxConsecutiveErrors,
    int pollThreads
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_CONSECUTIVE_ERRORS = 10;
    public static final int DEFAULT_POLL_THREADS = 4;

    public WatcherSettings {
        if (defaultPollInterval == null || defaultPollInterval.isNegative() || defaultPollInterval.isZero()) {
            throw new IllegalArgumentException("defaultPollInterval must be positive");
        }
        if (maxConsecutiveErrors < 1) {
            throw new IllegalArgumentException("maxConsecutiveErrors must be >= 1");
        }
        if (pollThreads < 1) {
            throw new IllegalArgumentException("pollThreads must be >= 1");
        }
    }

    public static WatcherSettings defaults() {
        return new WatcherSettings(DEFAULT_POLL_INTERVAL, DEFAULT_MAX_CONSECUTIVE_ERRORS, DEFAULT_POLL_THREADS);
    }

    public WatcherSettings withMaxConsecutiveErrors(int maxConsecutiveErrors) {
        return new WatcherSettings(defaultPollInterval, maxConsecutiveErrors, pollThreads);
    }

    public WatcherSettings withDefaultPollInterval(Duration defaultPollInterval) {
        return new WatcherSettings(defaultPollInterval, maxConsecutiveErrors, pollThreads);
    }
}
