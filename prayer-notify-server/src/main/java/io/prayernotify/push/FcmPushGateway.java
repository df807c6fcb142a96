package io.prayernotify.push;

import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.Message;
import com.google.firebase.messaging.Notification;
import io.prayernotify.prayer.NotificationPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

public class FcmPushGateway implements PushGateway {
    private static final Logger log = LoggerFactory.getLogger(FcmPushGateway.class);

    private final FirebaseMessaging firebaseMessaging;

    public FcmPushGateway(FirebaseMessaging firebaseMessaging) {
        this.firebaseMessaging = Objects.requireNonNull(firebaseMessaging, "firebaseMessaging must not be null");
    }

    @Override
    public String send(NotificationPayload payload) {
        Map<String, String> data = payload.routingData() != null ? payload.routingData() : Map.of();
        Message message = Message.builder()
                .setToken(payload.pushAddress())
                .setNotification(Notification.builder()
                        .setTitle(payload.title())
                        .setBody(payload.body())
                        .build())
                .putAllData(data)
                .build();

        String tokenPreview = tokenPreview(payload.pushAddress());
        try {
            String id = firebaseMessaging.send(message);
            log.info("FCM sent messageId={} token={} title='{}' dataKeys={}", id, tokenPreview, payload.title(), data.keySet());
            return id;
        } catch (FirebaseMessagingException e) {
            log.error("FCM send failed token={} code={} msg={}", tokenPreview, e.getMessagingErrorCode(), e.getMessage());
            throw new PushDeliveryException("FCM send failed: " + e.getMessage(), e);
        }
    }

    public static String tokenPreview(String token) {
        if (token == null) {
            return null;
        }
        return token.length() > 8 ? token.substring(0, 8) + "…" : token;
    }
}
