package org.pushrelay.notifications.pushover;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Downloads images with the JDK {@link HttpClient}. The response stream stays open
 * inside the returned {@link Attachment} until the attachment is closed.
 */
public class HttpImageDownloader implements ImageDownloader {

    private static final Logger logger = LoggerFactory.getLogger(HttpImageDownloader.class);

    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpImageDownloader(Duration connectTimeout, Duration requestTimeout) {
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Attachment download(String url, int maxBytes) throws IOException {
        URI uri = toUri(url);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<InputStream> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while downloading " + url);
        }

        InputStream body = response.body();
        try {
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new IOException("HTTP " + status);
            }
            byte[] content = body.readNBytes(maxBytes + 1);
            String contentType = response.headers().firstValue("Content-Type").map(HttpImageDownloader::mediaType).orElse("");

            logger.debug("Downloaded {} bytes ({}) from {}", content.length, contentType, url);
            return new Attachment(url, fileName(uri), contentType, content, body);
        } catch (IOException | RuntimeException e) {
            body.close();
            throw e;
        }
    }

    private static URI toUri(String url) throws IOException {
        try {
            URI uri = URI.create(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IOException("not an absolute http(s) URL");
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    /** "image/png; charset=binary" -> "image/png" */
    static String mediaType(String header) {
        int semicolon = header.indexOf(';');
        return (semicolon >= 0 ? header.substring(0, semicolon) : header).trim();
    }

    @NotNull
    static String fileName(URI uri) {
        String path = uri.getPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) return "attachment";
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
