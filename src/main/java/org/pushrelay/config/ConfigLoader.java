package org.pushrelay.config;

import org.pushrelay.config.utils.KeyProvider;
import org.pushrelay.config.utils.XmlUtil;
import org.w3c.dom.Document;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.UnaryOperator;


public class ConfigLoader {

    private ConfigLoader() {}

    /**
     * Loads the XML config file and returns a fully-typed XmlConfiguration object.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        Path path = Path.of(xmlPath);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Config file not found: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return loadConfig(in);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file! " + e.getMessage(), e);
        }
    }

    public static XmlConfiguration loadConfig(InputStream in) {
        try {
            Document doc = XmlUtil.parse(in);
            return XmlUtil.unmarshal(doc, XmlConfiguration.class);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file! " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the pushover section against the process environment.
     */
    public static PushoverOptions pushoverOptions(XmlConfiguration cfg) {
        return pushoverOptions(cfg, KeyProvider::find);
    }

    public static PushoverOptions pushoverOptions(XmlConfiguration cfg, UnaryOperator<String> environment) {
        if (cfg == null || cfg.pushover == null) {
            throw new IllegalStateException("Invalid configuration: missing pushover section.");
        }
        return PushoverOptions.from(cfg.pushover, environment);
    }
}
