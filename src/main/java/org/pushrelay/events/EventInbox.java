package org.pushrelay.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory queue between the HTTP intake and the delivery task.
 * Nothing is persisted; events still queued at shutdown are dropped.
 */
public class EventInbox {

    private static final Logger logger = LoggerFactory.getLogger(EventInbox.class);

    private final Queue<Event> queue = new ConcurrentLinkedQueue<>();
    private final Clock clock;

    public EventInbox() { this(Clock.systemUTC()); }

    public EventInbox(Clock clock) {
        this.clock = clock;
    }

    public Event offer(Map<String, Object> payload) {
        Event event = new Event(UUID.randomUUID().toString(), payload, clock.instant());
        queue.add(event);
        logger.debug("Event {} queued ({} pending)", event.id(), queue.size());
        return event;
    }

    /**
     * Removes and returns up to {@code max} events in arrival order.
     */
    public List<Event> drain(int max) {
        List<Event> batch = new ArrayList<>(Math.min(max, 64));
        Event next;
        while (batch.size() < max && (next = queue.poll()) != null) {
            batch.add(next);
        }
        return batch;
    }

    public int size() {
        return queue.size();
    }
}
