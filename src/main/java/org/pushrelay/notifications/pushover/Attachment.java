package org.pushrelay.notifications.pushover;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;

/**
 * A downloaded image bound to a single dispatch call.
 * Owned by whoever fetched it until handed to {@link PushoverSender}, which closes it.
 */
public final class Attachment implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(Attachment.class);

    private final String sourceUrl;
    private final String fileName;
    private final String contentType;
    private final byte[] content;
    private final Closeable handle;
    private boolean closed;

    public Attachment(String sourceUrl, String fileName, String contentType, byte[] content, Closeable handle) {
        this.sourceUrl = sourceUrl;
        this.fileName = fileName;
        this.contentType = contentType;
        this.content = content;
        this.handle = handle;
    }

    public String sourceUrl() { return sourceUrl; }

    public String fileName() { return fileName; }

    /** Content type reported by the image host, parameters stripped. May be empty. */
    public String contentType() { return contentType; }

    public long size() { return content.length; }

    public byte[] content() {
        if (closed) throw new IllegalStateException("Attachment from '" + sourceUrl + "' already closed");
        return content;
    }

    public boolean isClosed() { return closed; }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (handle == null) return;
        try {
            handle.close();
        } catch (IOException e) {
            logger.warn("Failed to release download handle for '{}': {}", sourceUrl, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "Attachment{" + fileName + ", " + contentType + ", " + content.length + " bytes}";
    }
}
