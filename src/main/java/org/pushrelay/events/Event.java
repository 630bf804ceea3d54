package org.pushrelay.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An upstream event. The payload is the JSON object received on the inbox endpoint
 * and is what field templates are rendered against.
 */
public record Event(String id, Map<String, Object> payload, Instant receivedAt) {

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(receivedAt, "receivedAt");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
