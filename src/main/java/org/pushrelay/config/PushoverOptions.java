package org.pushrelay.config;

import org.pushrelay.notifications.pushover.PushoverField;
import org.pushrelay.notifications.pushover.PushoverSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.pushrelay.config.utils.KeyProvider.ENV_PUSHOVER_TOKEN;
import static org.pushrelay.config.utils.KeyProvider.ENV_PUSHOVER_USER;

/**
 * Validated view of the {@code <pushover>} config section with defaults applied.
 */
public record PushoverOptions(URI apiUrl,
                              String token,
                              String user,
                              int expectedReceivePeriodInDays,
                              Duration connectionTimeout,
                              Duration requestTimeout,
                              long pollIntervalSeconds,
                              int batchSize,
                              Map<PushoverField, String> templates) {

    private static final Logger logger = LoggerFactory.getLogger(PushoverOptions.class);

    public static final String REQUIRED_OPTIONS_MESSAGE =
            "token, user, and expected_receive_period_in_days are all required.";

    static final int DEFAULT_CONNECTION_TIMEOUT_MS = 10_000;
    static final int DEFAULT_REQUEST_TIMEOUT_MS = 30_000;
    static final int DEFAULT_POLL_INTERVAL_SECONDS = 5;
    static final int DEFAULT_BATCH_SIZE = 50;

    public PushoverOptions {
        templates = Collections.unmodifiableMap(new EnumMap<>(templates));
    }

    public static PushoverOptions from(XmlConfiguration.Pushover section, UnaryOperator<String> environment) {
        String token = firstNonBlank(environment.apply(ENV_PUSHOVER_TOKEN), section.token);
        String user = firstNonBlank(environment.apply(ENV_PUSHOVER_USER), section.user);
        Integer period = parsePositive(section.expectedReceivePeriodInDays);

        if (token == null || user == null || period == null) {
            throw new IllegalStateException(REQUIRED_OPTIONS_MESSAGE);
        }

        URI apiUrl = URI.create(firstNonBlank(section.apiUrl, PushoverSender.API_URL));

        Map<PushoverField, String> templates = new EnumMap<>(PushoverField.class);
        for (PushoverField field : PushoverField.values()) {
            templates.put(field, field.defaultTemplate());
        }
        templates.put(PushoverField.TOKEN, token);
        templates.put(PushoverField.USER, user);

        if (section.templates != null) {
            for (XmlConfiguration.Pushover.Field f : section.templates.fields) {
                PushoverField field = PushoverField.fromKey(f.name).orElse(null);
                if (field == null) {
                    logger.warn("Ignoring template for unknown Pushover field '{}'", f.name);
                    continue;
                }
                if (field == PushoverField.TOKEN || field == PushoverField.USER) {
                    logger.warn("Ignoring template for '{}': set <{}> or {} instead", field.key(), field.key(),
                            field == PushoverField.TOKEN ? ENV_PUSHOVER_TOKEN : ENV_PUSHOVER_USER);
                    continue;
                }
                templates.put(field, f.template == null ? "" : f.template);
            }
        }

        return new PushoverOptions(
                apiUrl,
                token,
                user,
                period,
                Duration.ofMillis(orDefault(section.connectionTimeout, DEFAULT_CONNECTION_TIMEOUT_MS)),
                Duration.ofMillis(orDefault(section.requestTimeout, DEFAULT_REQUEST_TIMEOUT_MS)),
                orDefault(section.pollIntervalSeconds, DEFAULT_POLL_INTERVAL_SECONDS),
                orDefault(section.batchSize, DEFAULT_BATCH_SIZE),
                templates
        );
    }

    public String template(PushoverField field) {
        return templates.getOrDefault(field, "");
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) return first.trim();
        if (second != null && !second.isBlank()) return second.trim();
        return null;
    }

    private static Integer parsePositive(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            logger.error("expectedReceivePeriodInDays is not a number: '{}'", value);
            return null;
        }
    }

    private static int orDefault(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    @Override
    public String toString() {
        return "PushoverOptions{apiUrl=" + apiUrl
                + ", user=" + user
                + ", expectedReceivePeriodInDays=" + expectedReceivePeriodInDays
                + ", pollIntervalSeconds=" + pollIntervalSeconds
                + ", batchSize=" + batchSize + "}";
    }
}
