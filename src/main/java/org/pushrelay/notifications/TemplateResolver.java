package org.pushrelay.notifications;

import org.pushrelay.events.Event;
import org.pushrelay.notifications.pushover.PushoverField;

/**
 * Renders the configured template of one Pushover field against an event.
 * Must not have side effects; returns an empty string when nothing renders.
 */
@FunctionalInterface
public interface TemplateResolver {

    String resolve(Event event, PushoverField field);
}
