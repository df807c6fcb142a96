package io.prayernotify.push;

import io.prayernotify.prayer.NotificationPayload;

/**
 * Delivers one push message to one device.
 */
public interface PushGateway {

    /**
     * @return the provider's message id
     * @throws PushDeliveryException when the provider rejects or cannot be reached
     */
    String send(NotificationPayload payload);
}
