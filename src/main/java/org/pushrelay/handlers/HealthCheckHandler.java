package org.pushrelay.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.pushrelay.events.EventInbox;
import org.pushrelay.services.AgentStatus;
import org.pushrelay.services.PushoverAgent;
import org.pushrelay.utils.ResponseUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handler for health check endpoint.
 * Returns  -  basic app info,
 *          -  whether the agent is working,
 *          -  last receipt / last error.
 */
public class HealthCheckHandler implements HttpHandler {

    private static final Instant START_TIME = Instant.now();

    private final PushoverAgent agent;
    private final EventInbox inbox;
    private final String environment;

    public HealthCheckHandler(PushoverAgent agent, EventInbox inbox, String environment) {
        this.agent = agent;
        this.inbox = inbox;
        this.environment = environment;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        AgentStatus status = agent.status();
        AgentStatus.LastError lastError = status.lastError();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", "PushRelay");
        response.put("version", "1.0.0");
        response.put("environment", environment);
        response.put("uptime_seconds", Duration.between(START_TIME, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now().toString());
        response.put("working", agent.isWorking());
        response.put("last_receive_at", status.lastReceiveAt());
        response.put("last_error_at", lastError == null ? null : lastError.at());
        response.put("last_error_message", lastError == null ? null : lastError.message());
        response.put("inbox_size", inbox.size());

        ResponseUtil.sendSuccess(exchange, "Health check completed", response);
    }
}
