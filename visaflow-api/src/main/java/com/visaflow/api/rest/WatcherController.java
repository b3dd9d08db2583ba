package com.visaflow.api.rest;

import com.visaflow.core.exception.NotFoundException;
import com.visaflow.watcher.FolderWatcher;
import com.visaflow.watcher.WatcherConfig;
import com.visaflow.watcher.WatcherInfo;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * REST API for folder watchers.
 */
@RestController
@RequestMapping("/api/v1/watchers")
public class WatcherController {

    private final FolderWatcher folderWatcher;

    public WatcherController(FolderWatcher folderWatcher) {
        this.folderWatcher = folderWatcher;
    }

    /**
     * Start watching a folder.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> startWatcher(@RequestBody StartWatcherRequest request) {
        WatcherConfig config = new WatcherConfig(
            request.folderId(),
            request.workflowDefinitionId(),
            request.pollInterval(),
            request.fileExtensions());

        String watcherId = folderWatcher.start(config);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(Map.of("watcherId", watcherId));
    }

    /**
     * Start a watcher for every active definition that auto-starts on upload.
     */
    @PostMapping("/active-workflows")
    public ResponseEntity<Map<String, Object>> startForActiveWorkflows() {
        List<String> started = folderWatcher.startForActiveWorkflows();
        return ResponseEntity.ok(Map.of("started", started));
    }

    @GetMapping
    public ResponseEntity<List<WatcherInfo>> listWatchers() {
        return ResponseEntity.ok(folderWatcher.getActiveWatchers());
    }

    /**
     * Poll a watcher's folder now instead of waiting for its next tick.
     */
    @PostMapping("/{watcherId}/poll")
    public ResponseEntity<Map<String, Object>> pollNow(@PathVariable String watcherId) {
        boolean polled = folderWatcher.pollOnce(watcherId);
        return ResponseEntity.ok(Map.of(
            "watcherId", watcherId,
            "polled", polled
        ));
    }

    @DeleteMapping("/{watcherId}")
    public ResponseEntity<Void> stopWatcher(@PathVariable String watcherId) {
        if (!folderWatcher.stop(watcherId)) {
            throw new NotFoundException("FolderWatcher", watcherId);
        }
        return ResponseEntity.noContent().build();
    }

    // ========== DTOs ==========

    public record StartWatcherRequest(
        String folderId,
        String workflowDefinitionId,
        Duration pollInterval,
        List<String> fileExtensions
    ) {}
}
