package org.pushrelay.notifications.pushover;

import java.io.IOException;

/**
 * Opens an image URL. Implementations read at most {@code maxBytes + 1} bytes so the
 * caller can tell an oversized body from one that fits exactly.
 */
@FunctionalInterface
public interface ImageDownloader {

    Attachment download(String url, int maxBytes) throws IOException;
}
