package org.pushrelay.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.pushrelay.events.EventInbox;
import org.pushrelay.utils.HttpRequestUtil;
import org.pushrelay.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * POST /events
 * Body: one JSON object, or an array of objects. Each object becomes one event.
 */
public class ReceiveEventsHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(ReceiveEventsHandler.class);

    private final EventInbox inbox;

    public ReceiveEventsHandler(EventInbox inbox) {
        this.inbox = inbox;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }
        exchange.startBlocking();

        List<Map<String, Object>> payloads = HttpRequestUtil.parseJsonObjects(exchange);
        if (payloads == null) return;

        payloads.forEach(inbox::offer);
        logger.info("Accepted {} events ({} queued)", payloads.size(), inbox.size());

        ResponseUtil.sendCreated(exchange, "Events accepted", Map.of("accepted", payloads.size()));
    }
}
