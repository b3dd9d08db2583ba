package com.visaflow.watcher;

import com.visaflow.core.model.FolderItem;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * What one watcher polls and which workflow it starts.
 *
 * @param folderId             folder to poll
 * @param workflowDefinitionId definition started for each new file
 * @param pollInterval         delay between polls, or null for the process default
 * @param fileExtensions       accepted extensions without the dot; empty accepts every file
 */
public record WatcherConfig(
    String folderId,
    String workflowDefinitionId,
    Duration pollInterval,
    List<String> fileExtensions
) {
    public WatcherConfig {
        if (folderId == null || folderId.isBlank()) {
            throw new IllegalArgumentException("folderId is required");
        }
        if (workflowDefinitionId == null || workflowDefinitionId.isBlank()) {
            throw new IllegalArgumentException("workflowDefinitionId is required");
        }
        if (pollInterval != null && (pollInterval.isNegative() || pollInterval.isZero())) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        fileExtensions = fileExtensions == null ? List.of() : fileExtensions.stream()
            .map(WatcherConfig::normalizeExtension)
            .filter(e -> !e.isEmpty())
            .toList();
    }

    public static WatcherConfig of(String folderId, String workflowDefinitionId) {
        return new WatcherConfig(folderId, workflowDefinitionId, null, List.of());
    }

    public WatcherConfig withPollInterval(Duration pollInterval) {
        return new WatcherConfig(folderId, workflowDefinitionId, pollInterval, fileExtensions);
    }

    public WatcherConfig withFileExtensions(List<String> fileExtensions) {
        return new WatcherConfig(folderId, workflowDefinitionId, pollInterval, fileExtensions);
    }

    public Duration pollIntervalOr(Duration defaultInterval) {
        return pollInterval != null ? pollInterval : defaultInterval;
    }

    /**
     * Whether a folder entry is a file this watcher reacts to.
     */
    public boolean accepts(FolderItem item) {
        if (!item.isFile()) {
            return false;
        }
        return fileExtensions.isEmpty() || fileExtensions.contains(normalizeExtension(item.extension()));
    }

    private static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }
}
