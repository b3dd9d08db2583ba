package com.visaflow.engine.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification of something the engine did to an instance.
 * Published only once the transition sequence that produced it has been committed,
 * except {@link EngineEventType#ERROR}.
 */
public record EngineEvent(
    EngineEventType type,
    String instanceId,
    Map<String, Object> data,
    Instant timestamp
) {
    public EngineEvent {
        // Values may be null (an unlabeled node), so no Map.copyOf here
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static EngineEvent of(EngineEventType type, String instanceId, Instant timestamp, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new EngineEvent(type, instanceId, data, timestamp);
    }
}
