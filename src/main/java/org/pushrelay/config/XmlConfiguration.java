package org.pushrelay.config;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlRootElement;
import jakarta.xml.bind.annotation.XmlValue;

import java.util.ArrayList;
import java.util.List;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server;
    public Logging logging;
    public Pushover pushover;

    // --- Undertow Server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host;
        public int port;
        public int ioThreads;
        public int workerThreads;
        public String basePath;
    }

    // --- Logging ---
    @XmlRootElement(name = "logging")
    public static class Logging {
        /** Root logger level, e.g. INFO or DEBUG. Overrides the Logback file. */
        public String level;
    }

    // --- Pushover agent ---
    @XmlRootElement(name = "pushover")
    public static class Pushover {
        public String apiUrl;
        public String token;
        public String user;
        public String expectedReceivePeriodInDays;
        public int connectionTimeout;
        public int requestTimeout;
        public int pollIntervalSeconds;
        public int batchSize;
        public Templates templates;

        @XmlRootElement(name = "templates")
        public static class Templates {
            @XmlElement(name = "field")
            public List<Field> fields = new ArrayList<>();
        }

        /**
         * One Mustache template per Pushover field, e.g.
         * {@code <field name="title">{{service}} is down</field>}.
         */
        public static class Field {
            @XmlAttribute(name = "name")
            public String name;

            @XmlValue
            public String template;
        }
    }
}
