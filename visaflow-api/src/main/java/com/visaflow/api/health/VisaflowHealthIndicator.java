package com.visaflow.api.health;

import com.visaflow.watcher.FolderWatcher;
import com.visaflow.watcher.WatcherInfo;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Custom health indicator for the validation service.
 * Reports:
 * - Number of running folder watchers
 * - Watchers whose last polls failed, with their error counts
 *
 * Failing watchers stop by themselves, so they are reported as details and never turn the service DOWN.
 */
@Component
public class VisaflowHealthIndicator implements HealthIndicator {

    private final FolderWatcher folderWatcher;

    public VisaflowHealthIndicator(FolderWatcher folderWatcher) {
        this.folderWatcher = folderWatcher;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            List<WatcherInfo> watchers = folderWatcher.getActiveWatchers();
            details.put("activeWatchers", watchers.size());

            Map<String, Integer> failing = new LinkedHashMap<>();
            for (WatcherInfo watcher : watchers) {
                if (watcher.errorCount() > 0) {
                    failing.put(watcher.watcherId(), watcher.errorCount());
                }
            }
            details.put("failingWatchers", failing);

            return Health.up()
                .withDetails(details)
                .build();

        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
