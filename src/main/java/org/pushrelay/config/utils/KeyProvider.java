package org.pushrelay.config.utils;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * KeyProvider = secret and environment lookup for PushRelay.
 * Responsibilities:
 *   1. Load environment (.env + system ENV)
 *   2. Initialize correct Logback (dev/prod)
 *   3. Provide Pushover credentials overriding the XML config
 * Priority for secret resolution:
 *     1. System environment variable
 *     2. .env file
 */
public class KeyProvider {

    private static final Logger logger = LoggerFactory.getLogger(KeyProvider.class);

    public static final String ENV_PUSHOVER_TOKEN = "PUSHOVER_TOKEN";
    public static final String ENV_PUSHOVER_USER  = "PUSHOVER_USER";
    private static final String ENV_ENVIRONMENT   = "APP_ENV";

    private static volatile boolean initialized = false;
    private static String activeEnv = "PRODUCTION";
    private static Dotenv dotenv;

    private KeyProvider() {}

    private static synchronized void init() {
        if (initialized) return;

        try {
            dotenv = Dotenv.configure()
                    .ignoreIfMalformed()
                    .ignoreIfMissing()
                    .load();

            String env = System.getenv(ENV_ENVIRONMENT);
            if (env == null || env.isBlank()) {
                env = dotenv.get(ENV_ENVIRONMENT, "PRODUCTION");
            }
            activeEnv = env.toUpperCase();
            System.setProperty(ENV_ENVIRONMENT, activeEnv);

            loadLogback(isDev() ? "logback-dev.xml" : "logback.xml");

            initialized = true;
            logger.info("KeyProvider initialized, environment: {}", activeEnv);

        } catch (Exception e) {
            throw new IllegalStateException("Failed initializing environment", e);
        }
    }

    /**
     * Looks up {@code keyName} in the system environment, then in {@code .env}.
     *
     * @return the trimmed value, or {@code null} when neither source defines it
     */
    public static String find(String keyName) {
        if (!initialized) init();

        String value = System.getenv(keyName);
        if ((value == null || value.isBlank()) && dotenv != null) {
            value = dotenv.get(keyName);
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        logger.debug("Secret '{}' loaded from environment ({} chars)", keyName, value.length());
        return value.trim();
    }

    public static boolean isDev() { return "DEVELOPMENT".equalsIgnoreCase(activeEnv); }
    public static String getEnvironment() { if (!initialized) init(); return activeEnv; }

    /**
     * Overrides the root level set by the Logback file with {@code <logging><level>} from config.
     *
     * @return false when the level is blank or not a Logback level; the root level is then unchanged
     */
    public static boolean applyLogLevel(String level) {
        if (level == null || level.isBlank()) return false;

        Level parsed = Level.toLevel(level.trim(), null);
        if (parsed == null) {
            logger.warn("Ignoring unknown log level '{}'", level);
            return false;
        }
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(parsed);
        logger.info("Root log level set to {}", parsed);
        return true;
    }

    private static void loadLogback(String fileName) {
        try (InputStream in = KeyProvider.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                logger.warn("Logback file {} not found on classpath, keeping default configuration", fileName);
                return;
            }
            LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
            ctx.reset();

            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(ctx);
            configurator.doConfigure(in);

            StatusPrinter.printInCaseOfErrorsOrWarnings(ctx);
        } catch (Exception e) {
            logger.error("Failed loading logback configuration {}: {}", fileName, e.getMessage());
        }
    }
}
