package org.pushrelay.notifications.pushover;

import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.mime.MultipartEntityBuilder;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;
import org.jetbrains.annotations.Nullable;
import org.pushrelay.notifications.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Posts one message to the Pushover messages API.
 * Without an attachment the parameters go out as the query of a plain POST; with one,
 * the same query is sent alongside a multipart body holding the image.
 */
public class PushoverSender implements NotificationSender, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(PushoverSender.class);

    public static final String API_URL = "https://api.pushover.net/1/messages.json";

    private final URI apiUrl;
    private final CloseableHttpClient httpClient;

    public PushoverSender(URI apiUrl, Duration connectTimeout, Duration requestTimeout) {
        this.apiUrl = apiUrl;

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
                .setSocketTimeout(Timeout.ofMilliseconds(requestTimeout.toMillis()))
                .build();
        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(requestTimeout.toMillis()))
                .build();

        this.httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .setDefaultRequestConfig(requestConfig)
                .build();

        logger.info("[PushoverSender initialized, endpoint={}]", apiUrl);
    }

    @Override
    public int send(Map<String, String> params, @Nullable Attachment attachment) throws IOException {
        try {
            HttpPost post;
            if (attachment != null) {
                Map<String, String> query = new LinkedHashMap<>(params);
                query.put("message", sanitizeMessage(params.get("message")));

                post = new HttpPost(buildUri(query));
                post.setEntity(MultipartEntityBuilder.create()
                        .addBinaryBody("attachment", attachment.content(), detectContentType(attachment), attachment.fileName())
                        .build());
                logger.info("Sending request with attachment {}", attachment);
            } else {
                post = new HttpPost(buildUri(params));
                logger.info("Sending request without attachment");
            }
            logger.debug("Query parameters: {}", redact(params));

            PushoverResponse response = httpClient.execute(post, r -> new PushoverResponse(
                    r.getCode(),
                    r.getEntity() == null ? "" : EntityUtils.toString(r.getEntity(), StandardCharsets.UTF_8)));

            if (response.isSuccess()) {
                logger.info("Response status: {}", response.status());
            } else {
                logger.warn("Response status: {}", response.status());
            }
            logger.info("Response body: {}", response.body());
            logger.info("Sent the following notification: \"{}\"", redact(params));
            return response.status();
        } finally {
            if (attachment != null) {
                attachment.close();
            }
        }
    }

    /**
     * The multipart encoder escapes '%' inconsistently, so the literal is spelled out
     * before the query is built.
     */
    static String sanitizeMessage(String message) {
        return message.replace("%", " percent");
    }

    static Map<String, String> redact(Map<String, String> params) {
        Map<String, String> copy = new LinkedHashMap<>(params);
        copy.remove(PushoverField.TOKEN.key());
        return copy;
    }

    private URI buildUri(Map<String, String> query) throws IOException {
        List<NameValuePair> pairs = new ArrayList<>(query.size());
        query.forEach((k, v) -> pairs.add(new BasicNameValuePair(k, v)));
        try {
            return new URIBuilder(apiUrl).addParameters(pairs).build();
        } catch (URISyntaxException e) {
            throw new IOException("Invalid Pushover endpoint " + apiUrl + ": " + e.getMessage(), e);
        }
    }

    private static ContentType detectContentType(Attachment attachment) {
        String type = attachment.contentType();
        if (type == null || type.isBlank()) {
            return ContentType.DEFAULT_BINARY;
        }
        return ContentType.create(type.toLowerCase(Locale.ROOT));
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    record PushoverResponse(int status, String body) {
        boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
