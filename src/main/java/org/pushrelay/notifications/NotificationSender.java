package org.pushrelay.notifications;

import org.jetbrains.annotations.Nullable;
import org.pushrelay.notifications.pushover.Attachment;

import java.io.IOException;
import java.util.Map;

public interface NotificationSender {
    /**
     * @param params     request parameters; token, user and message are always present
     * @param attachment image to upload, or null. Implementations close it before returning,
     *                   whether the request succeeded or not.
     * @return HTTP status code returned by the notification API
     * @throws IOException when the request could not be sent or the response not read
     */
    int send(Map<String, String> params, @Nullable Attachment attachment) throws IOException;
}
