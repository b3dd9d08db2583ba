package com.visaflow.watcher;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something a folder watcher did.
 */
public record WatcherEvent(
    WatcherEventType type,
    String watcherId,
    Map<String, Object> data,
    Instant timestamp
) {
    public WatcherEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    static WatcherEvent of(WatcherEventType type, String watcherId, Instant timestamp, Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new WatcherEvent(type, watcherId, data, timestamp);
    }
}
