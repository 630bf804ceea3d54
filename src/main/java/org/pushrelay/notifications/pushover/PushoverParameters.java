package org.pushrelay.notifications.pushover;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns rendered field values into the request parameters posted to Pushover.
 */
public final class PushoverParameters {

    private PushoverParameters() {}

    /**
     * @param rendered rendered value per field; missing entries count as blank
     * @return the parameter set, or empty when a required field rendered blank
     *         and the event must be skipped
     */
    public static Optional<Map<String, String>> build(Map<PushoverField, String> rendered) {
        Map<String, String> params = new LinkedHashMap<>();

        for (PushoverField field : PushoverField.requiredFields()) {
            String value = presence(rendered.get(field));
            if (value == null) {
                return Optional.empty();
            }
            params.put(field.key(), value);
        }

        for (PushoverField field : PushoverField.optionalFields()) {
            String value = presence(rendered.get(field));
            if (value == null) continue;

            if (field.flag()) {
                params.put(field.key(), toFlag(value));
            } else {
                params.put(field.key(), truncate(value, field.maxLength()));
            }
        }

        return Optional.of(Collections.unmodifiableMap(params));
    }

    static String truncate(String value, int maxLength) {
        if (maxLength <= 0 || value.length() <= maxLength) return value;
        return value.substring(0, maxLength);
    }

    static String toFlag(String value) {
        return "true".equals(value) || "1".equals(value) ? "1" : "0";
    }

    /** Blank values are treated as absent. */
    static String presence(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
