package org.pushrelay.rest;

import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.pushrelay.events.EventInbox;
import org.pushrelay.handlers.HealthCheckHandler;
import org.pushrelay.handlers.ReceiveEventsHandler;
import org.pushrelay.rest.base.Dispatcher;
import org.pushrelay.rest.base.ErrorHandlers;
import org.pushrelay.services.PushoverAgent;

public class Routes {

    private Routes() {}

    public static RoutingHandler events(EventInbox inbox) {
        return Handlers.routing()
                .post("", new Dispatcher(new ReceiveEventsHandler(inbox)))
                .setInvalidMethodHandler(ErrorHandlers.methodNotAllowed())
                .setFallbackHandler(ErrorHandlers.notFound());
    }

    public static RoutingHandler health(PushoverAgent agent, EventInbox inbox, String environment) {
        return Handlers.routing()
                .get("/health", new HealthCheckHandler(agent, inbox, environment))
                .setInvalidMethodHandler(ErrorHandlers.methodNotAllowed())
                .setFallbackHandler(ErrorHandlers.notFound());
    }
}
