package org.pushrelay.notifications.pushover;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves a rendered {@code image_url} into an attachment. Never throws: every
 * failure is logged and the notification goes out without an image.
 */
public class AttachmentFetcher {

    private static final Logger logger = LoggerFactory.getLogger(AttachmentFetcher.class);

    /** 2.5 MB, Pushover's attachment limit. */
    public static final int MAX_ATTACHMENT_BYTES = 2_621_440;

    private static final Pattern SUPPORTED_TYPES = Pattern.compile("^image/(jpeg|png|gif)$", Pattern.CASE_INSENSITIVE);

    private final ImageDownloader downloader;

    public AttachmentFetcher(ImageDownloader downloader) {
        this.downloader = downloader;
    }

    public Optional<Attachment> fetch(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            return Optional.empty();
        }

        Attachment attachment;
        try {
            attachment = downloader.download(imageUrl, MAX_ATTACHMENT_BYTES);
        } catch (Exception e) {
            logger.info("Failed to download image from '{}': {}", imageUrl,
                    Objects.toString(e.getMessage(), e.getClass().getSimpleName()));
            return Optional.empty();
        }

        if (attachment.size() > MAX_ATTACHMENT_BYTES) {
            logger.info("Image size exceeds 2.5 MB limit for '{}'. Skipping attachment.", imageUrl);
            attachment.close();
            return Optional.empty();
        }

        String contentType = attachment.contentType() == null ? "" : attachment.contentType();
        if (!SUPPORTED_TYPES.matcher(contentType).matches()) {
            logger.info("Unsupported image type '{}' for '{}'. Skipping attachment.", contentType, imageUrl);
            attachment.close();
            return Optional.empty();
        }

        return Optional.of(attachment);
    }
}
