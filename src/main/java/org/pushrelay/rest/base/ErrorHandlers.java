package org.pushrelay.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.util.StatusCodes;
import org.pushrelay.utils.ResponseUtil;

/**
 * JSON error responses for requests no route accepts.
 */
public final class ErrorHandlers {

    private ErrorHandlers() {}

    /** Unknown route: 404 naming the URI. */
    public static HttpHandler notFound() {
        return exchange -> ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND,
                "URI " + exchange.getRequestURI() + " not found on server");
    }

    /** Known route, wrong verb: 405 naming the method. */
    public static HttpHandler methodNotAllowed() {
        return exchange -> ResponseUtil.sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED,
                "Method " + exchange.getRequestMethod() + " not allowed");
    }
}
