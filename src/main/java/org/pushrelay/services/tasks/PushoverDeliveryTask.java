package org.pushrelay.services.tasks;

import org.pushrelay.events.Event;
import org.pushrelay.events.EventInbox;
import org.pushrelay.services.PushoverAgent;
import org.pushrelay.services.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Drains the inbox and hands each batch to the {@link PushoverAgent}.
 */
public class PushoverDeliveryTask implements ScheduledTask {

    private static final Logger logger = LoggerFactory.getLogger(PushoverDeliveryTask.class);

    private final EventInbox inbox;
    private final PushoverAgent agent;
    private final long intervalSeconds;
    private final int batchSize;

    public PushoverDeliveryTask(EventInbox inbox, PushoverAgent agent, long intervalSeconds, int batchSize) {
        this.inbox = inbox;
        this.agent = agent;
        this.intervalSeconds = intervalSeconds;
        this.batchSize = batchSize;
    }

    @Override
    public String name() { return "[ PushoverDeliveryTask ]"; }

    @Override
    public long intervalSeconds() { return Math.max(intervalSeconds, 1); }

    /** The inbox is empty at startup, so the first drain waits one poll interval. */
    @Override
    public long initialDelaySeconds() { return intervalSeconds(); }

    @Override
    public void execute() {
        List<Event> batch = inbox.drain(batchSize);
        if (batch.isEmpty()) return;

        int sent = agent.receive(batch);
        logger.info("Processed {} events, {} notifications sent, {} still queued", batch.size(), sent, inbox.size());
    }
}
