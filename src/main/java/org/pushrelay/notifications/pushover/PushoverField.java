package org.pushrelay.notifications.pushover;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The fields a Pushover message is rendered from.
 *
 * Field       Role      Rule
 * ----------  --------  ----------------------------------------
 * token       required
 * user        required
 * message     required
 * url         optional  cut to 512 chars
 * url_title   optional  cut to 100 chars
 * html        optional  "true"/"1" -> "1", anything else -> "0"
 * image_url   optional  not sent; resolved into an attachment
 */
public enum PushoverField {
    TOKEN("token", true, 0, "", false),
    USER("user", true, 0, "", false),
    MESSAGE("message", true, 0, "{{message}}", false),
    DEVICE("device", false, 0, "{{device}}", false),
    TITLE("title", false, 0, "{{title}}", false),
    URL("url", false, 512, "{{url}}", false),
    URL_TITLE("url_title", false, 100, "{{url_title}}", false),
    PRIORITY("priority", false, 0, "{{priority}}", false),
    TIMESTAMP("timestamp", false, 0, "{{timestamp}}", false),
    SOUND("sound", false, 0, "{{sound}}", false),
    RETRY("retry", false, 0, "{{retry}}", false),
    EXPIRE("expire", false, 0, "{{expire}}", false),
    HTML("html", false, 0, "false", true),
    IMAGE_URL("image_url", false, 0, "{{image_url}}", false);

    private final String key;
    private final boolean required;
    private final int maxLength;
    private final String defaultTemplate;
    private final boolean flag;

    PushoverField(String key, boolean required, int maxLength, String defaultTemplate, boolean flag) {
        this.key = key;
        this.required = required;
        this.maxLength = maxLength;
        this.defaultTemplate = defaultTemplate;
        this.flag = flag;
    }

    /** Name used on the wire and in config templates. */
    public String key() { return key; }

    public boolean required() { return required; }

    /** Maximum length in chars, or 0 when the value is sent as rendered. */
    public int maxLength() { return maxLength; }

    public String defaultTemplate() { return defaultTemplate; }

    public boolean flag() { return flag; }

    /** Whether the rendered value is posted as a request parameter. */
    public boolean transmitted() { return this != IMAGE_URL; }

    public static Optional<PushoverField> fromKey(String key) {
        if (key == null) return Optional.empty();
        String normalized = key.trim().toLowerCase();
        return Arrays.stream(values()).filter(f -> f.key.equals(normalized)).findFirst();
    }

    public static List<PushoverField> requiredFields() {
        return Arrays.stream(values()).filter(PushoverField::required).collect(Collectors.toList());
    }

    public static List<PushoverField> optionalFields() {
        return Arrays.stream(values())
                .filter(f -> !f.required && f.transmitted())
                .collect(Collectors.toList());
    }
}
