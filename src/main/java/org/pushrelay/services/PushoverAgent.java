package org.pushrelay.services;

import org.pushrelay.config.utils.LogContext;
import org.pushrelay.events.Event;
import org.pushrelay.notifications.NotificationSender;
import org.pushrelay.notifications.TemplateResolver;
import org.pushrelay.notifications.pushover.Attachment;
import org.pushrelay.notifications.pushover.AttachmentFetcher;
import org.pushrelay.notifications.pushover.PushoverField;
import org.pushrelay.notifications.pushover.PushoverParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Receives batches of events and sends one Pushover notification per event.
 * Events are handled in order, one at a time; a failing event is logged and
 * recorded, and the rest of the batch still goes out.
 */
public class PushoverAgent {

    private static final Logger logger = LoggerFactory.getLogger(PushoverAgent.class);

    private final TemplateResolver templates;
    private final AttachmentFetcher attachments;
    private final NotificationSender sender;
    private final AgentStatus status;
    private final int expectedReceivePeriodInDays;

    public PushoverAgent(TemplateResolver templates,
                         AttachmentFetcher attachments,
                         NotificationSender sender,
                         AgentStatus status,
                         int expectedReceivePeriodInDays) {
        this.templates = templates;
        this.attachments = attachments;
        this.sender = sender;
        this.status = status;
        this.expectedReceivePeriodInDays = expectedReceivePeriodInDays;
    }

    /**
     * @return number of events for which a request was sent
     */
    public int receive(List<Event> events) {
        int sent = 0;
        for (Event event : events) {
            LogContext.start("PushoverAgent", event.id());
            try {
                status.recordReceive();
                if (deliver(event)) sent++;
            } catch (Exception e) {
                String cause = Objects.toString(e.getMessage(), e.getClass().getSimpleName());
                logger.error("Failed to deliver event {}: {}", event.id(), cause, e);
                status.recordError("Event " + event.id() + ": " + cause);
            } finally {
                LogContext.clear();
            }
        }
        return sent;
    }

    private boolean deliver(Event event) throws Exception {
        Map<PushoverField, String> rendered = render(event);

        Optional<Map<String, String>> params = PushoverParameters.build(rendered);
        if (params.isEmpty()) {
            logger.debug("Event {} skipped: token, user or message rendered blank", event.id());
            return false;
        }

        Attachment attachment = attachments.fetch(rendered.get(PushoverField.IMAGE_URL)).orElse(null);
        sender.send(params.get(), attachment);
        return true;
    }

    Map<PushoverField, String> render(Event event) {
        Map<PushoverField, String> rendered = new EnumMap<>(PushoverField.class);
        for (PushoverField field : PushoverField.values()) {
            rendered.put(field, templates.resolve(event, field));
        }
        return rendered;
    }

    public boolean isWorking() {
        return status.isWorking(expectedReceivePeriodInDays);
    }

    public AgentStatus status() {
        return status;
    }
}
