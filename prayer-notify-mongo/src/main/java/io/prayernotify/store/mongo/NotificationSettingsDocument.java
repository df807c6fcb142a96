package io.prayernotify.store.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per subscriber and venue prayer alert choices. Other fields of the stored document are ignored.
 */
@Document(collection = "notification_settings")
public class NotificationSettingsDocument {

    @Id
    private String id;

    private String subscriberId;
    private String venueId;
    private Map<String, Flags> prayerNotifications = new LinkedHashMap<>();

    public NotificationSettingsDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    public void setSubscriberId(String subscriberId) {
        this.subscriberId = subscriberId;
    }

    public String getVenueId() {
        return venueId;
    }

    public void setVenueId(String venueId) {
        this.venueId = venueId;
    }

    public Map<String, Flags> getPrayerNotifications() {
        return prayerNotifications;
    }

    public void setPrayerNotifications(Map<String, Flags> prayerNotifications) {
        this.prayerNotifications = prayerNotifications;
    }

    public static class Flags {
        private Boolean start;
        private Boolean jamaat;

        public Flags() {
        }

        public Flags(Boolean start, Boolean jamaat) {
            this.start = start;
            this.jamaat = jamaat;
        }

        public Boolean getStart() {
            return start;
        }

        public void setStart(Boolean start) {
            this.start = start;
        }

        public Boolean getJamaat() {
            return jamaat;
        }

        public void setJamaat(Boolean jamaat) {
            this.jamaat = jamaat;
        }
    }
}
