package com.visaflow.watcher;

import java.time.Instant;

/**
 * Snapshot of a running watcher.
 */
public record WatcherInfo(
    String watcherId,
    String folderId,
    String workflowDefinitionId,
    Instant startedAt,
    Instant lastPollAt,
    int errorCount,
    int knownFileCount
) {}
