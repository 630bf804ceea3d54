package org.pushrelay.rest;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.handlers.PathHandler;
import org.pushrelay.config.XmlConfiguration;
import org.pushrelay.events.EventInbox;
import org.pushrelay.rest.base.ErrorHandlers;
import org.pushrelay.services.PushoverAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private RestApiServer() {}

    /**
     * Starts Undertow with the event intake and health routes under {@code server.basePath}.
     *
     * @return the running server; the caller stops it on shutdown
     */
    public static Undertow startUndertow(XmlConfiguration.Server cfg, EventInbox inbox, PushoverAgent agent, String environment) {
        if (cfg == null) {
            logger.error("Invalid configuration: missing server configuration.");
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        String basePath = cfg.basePath == null ? "" : cfg.basePath;

        PathHandler pathHandler = Handlers.path(ErrorHandlers.notFound())
                .addPrefixPath(basePath + "/events", Routes.events(inbox))
                .addPrefixPath(basePath + "/system", Routes.health(agent, inbox, environment));

        Undertow.Builder builder = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .addHttpListener(cfg.port, cfg.host)
                .setHandler(pathHandler);
        if (cfg.ioThreads > 0) builder.setIoThreads(cfg.ioThreads);
        if (cfg.workerThreads > 0) builder.setWorkerThreads(cfg.workerThreads);

        Undertow server = builder.build();
        server.start();
        logger.info("""

                        PUSHRELAY EVENT INTAKE
                        --------------------------------------
                        Undertow server started successfully!
                        Host   : http://{}:{}{}
                        """,
                cfg.host, cfg.port, basePath);
        return server;
    }
}
