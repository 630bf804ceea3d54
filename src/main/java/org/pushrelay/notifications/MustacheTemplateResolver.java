package org.pushrelay.notifications;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.MustacheFactory;
import org.pushrelay.events.Event;
import org.pushrelay.notifications.pushover.PushoverField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.EnumMap;
import java.util.Map;

/**
 * Field templates compiled once with mustache.java and rendered against each event payload.
 * Values are written raw: Pushover messages are plain text unless {@code html} is set,
 * and the sender of an HTML message is expected to supply the markup.
 */
public class MustacheTemplateResolver implements TemplateResolver {

    private static final Logger logger = LoggerFactory.getLogger(MustacheTemplateResolver.class);

    private final Map<PushoverField, Mustache> compiled = new EnumMap<>(PushoverField.class);

    public MustacheTemplateResolver(Map<PushoverField, String> templates) {
        MustacheFactory mf = new RawMustacheFactory();
        for (Map.Entry<PushoverField, String> entry : templates.entrySet()) {
            String template = entry.getValue() == null ? "" : entry.getValue();
            compiled.put(entry.getKey(), mf.compile(new StringReader(template), entry.getKey().key()));
        }
        logger.info("[MustacheTemplateResolver] Compiled {} field templates", compiled.size());
    }

    @Override
    public String resolve(Event event, PushoverField field) {
        Mustache mustache = compiled.get(field);
        if (mustache == null) return "";

        StringWriter writer = new StringWriter();
        try {
            mustache.execute(writer, event.payload()).flush();
        } catch (IOException e) {
            throw new MustacheException("Failed to render template for field " + field.key(), e);
        }
        return writer.toString();
    }

    private static final class RawMustacheFactory extends DefaultMustacheFactory {
        @Override
        public void encode(String value, Writer writer) {
            try {
                writer.write(value);
            } catch (IOException e) {
                throw new MustacheException("Failed to write value", e);
            }
        }
    }
}
