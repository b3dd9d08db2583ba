package com.visaflow.api.lifecycle;

import com.visaflow.api.config.VisaflowProperties;
import com.visaflow.watcher.FolderWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts folder watchers once the service is ready and stops them on shutdown.
 */
@Component
public class WatcherLifecycleHandler {

    private static final Logger log = LoggerFactory.getLogger(WatcherLifecycleHandler.class);

    private final FolderWatcher folderWatcher;
    private final VisaflowProperties properties;

    public WatcherLifecycleHandler(FolderWatcher folderWatcher, VisaflowProperties properties) {
        this.folderWatcher = folderWatcher;
        this.properties = properties;
    }

    /**
     * Watch the source folder of every active auto-start definition, if enabled.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.watcher().autoStart()) {
            log.info("Watcher auto-start disabled");
            return;
        }
        try {
            List<String> started = folderWatcher.startForActiveWorkflows();
            log.info("Auto-started {} watcher(s)", started.size());
        } catch (RuntimeException e) {
            log.error("Could not auto-start watchers: {}", e.getMessage(), e);
        }
    }

    /**
     * Stop polling before the context closes its beans.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        int running = folderWatcher.getActiveWatchers().size();
        log.info("Stopping {} watcher(s) for shutdown", running);
        folderWatcher.stopAll();
    }
}
