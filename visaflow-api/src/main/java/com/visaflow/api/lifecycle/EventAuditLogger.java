package com.visaflow.api.lifecycle;

import com.visaflow.core.event.EventBus;
import com.visaflow.engine.event.EngineEvent;
import com.visaflow.engine.event.EngineEventType;
import com.visaflow.watcher.WatcherEvent;
import com.visaflow.watcher.WatcherEventType;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs engine and watcher events as they are published.
 */
@Component
public class EventAuditLogger {

    private static final Logger log = LoggerFactory.getLogger(EventAuditLogger.class);

    private final EventBus.Subscription engineSubscription;
    private final EventBus.Subscription watcherSubscription;

    public EventAuditLogger(EventBus<EngineEvent> engineEventBus, EventBus<WatcherEvent> watcherEventBus) {
        this.engineSubscription = engineEventBus.subscribe(this::onEngineEvent);
        this.watcherSubscription = watcherEventBus.subscribe(this::onWatcherEvent);
    }

    void onEngineEvent(EngineEvent event) {
        if (event.type() == EngineEventType.ERROR) {
            log.warn("Engine {} on instance {}: {}", event.type(), event.instanceId(), event.data());
        } else {
            log.debug("Engine {} on instance {}: {}", event.type(), event.instanceId(), event.data());
        }
    }

    void onWatcherEvent(WatcherEvent event) {
        if (event.type() == WatcherEventType.ERROR) {
            log.warn("Watcher {} {}: {}", event.watcherId(), event.type(), event.data());
        } else if (event.type() == WatcherEventType.STOPPED) {
            log.info("Watcher {} stopped: {}", event.watcherId(), event.data());
        } else {
            log.debug("Watcher {} {}: {}", event.watcherId(), event.type(), event.data());
        }
    }

    @PreDestroy
    public void close() {
        engineSubscription.close();
        watcherSubscription.close();
    }
}
