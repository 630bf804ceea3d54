package org.pushrelay;

import io.undertow.Undertow;
import org.pushrelay.config.ConfigLoader;
import org.pushrelay.config.PushoverOptions;
import org.pushrelay.config.XmlConfiguration;
import org.pushrelay.config.utils.KeyProvider;
import org.pushrelay.config.utils.LogContext;
import org.pushrelay.events.EventInbox;
import org.pushrelay.notifications.MustacheTemplateResolver;
import org.pushrelay.notifications.pushover.AttachmentFetcher;
import org.pushrelay.notifications.pushover.HttpImageDownloader;
import org.pushrelay.notifications.pushover.PushoverSender;
import org.pushrelay.rest.RestApiServer;
import org.pushrelay.services.AgentStatus;
import org.pushrelay.services.PushoverAgent;
import org.pushrelay.services.TaskScheduler;
import org.pushrelay.services.tasks.PushoverDeliveryTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Entry point
 * Load Configuration from Xml
 * Wire the Pushover agent
 * Start the event intake and the delivery task
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        LogContext.start("Main");

        try {
            String environment = KeyProvider.getEnvironment();
            logger.info("[------------ Starting PushRelay ({}) ------------]", environment);

            String configPath = (args.length > 0) ? args[0] : "config.xml";
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            if (cfg.logging != null) {
                KeyProvider.applyLogLevel(cfg.logging.level);
            }
            PushoverOptions options = ConfigLoader.pushoverOptions(cfg);
            logger.debug("Configuration loaded from {}: {}", configPath, options);

            EventInbox inbox = new EventInbox();
            PushoverSender sender = new PushoverSender(options.apiUrl(), options.connectionTimeout(), options.requestTimeout());
            PushoverAgent agent = new PushoverAgent(
                    new MustacheTemplateResolver(options.templates()),
                    new AttachmentFetcher(new HttpImageDownloader(options.connectionTimeout(), options.requestTimeout())),
                    sender,
                    new AgentStatus(Clock.systemUTC()),
                    options.expectedReceivePeriodInDays());

            TaskScheduler scheduler = new TaskScheduler();
            scheduler.register(new PushoverDeliveryTask(inbox, agent, options.pollIntervalSeconds(), options.batchSize()));

            logger.info("[------------ Starting Undertow server ------------]");
            Undertow server = RestApiServer.startUndertow(cfg.server, inbox, agent, environment);
            scheduler.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                server.stop();
                scheduler.stop();
                try {
                    sender.close();
                } catch (IOException e) {
                    logger.warn("Failed closing Pushover HTTP client: {}", e.getMessage());
                }
                if (inbox.size() > 0) {
                    logger.warn("{} queued events dropped on shutdown", inbox.size());
                }
                logger.info("[------------ PushRelay shutdown complete ------------]");
            }));

        } catch (Exception e) {
            logger.error("[------------ System startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }
}
