package org.pushrelay.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

/**
 * Moves request handling from the IO thread to a worker thread.
 * Handlers behind it may block (reading request bodies, JSON parsing).
 */
public class Dispatcher implements HttpHandler {
    private final HttpHandler handler;

    public Dispatcher(HttpHandler handler) {
        this.handler = handler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        exchange.dispatch(this.handler);
    }
}
