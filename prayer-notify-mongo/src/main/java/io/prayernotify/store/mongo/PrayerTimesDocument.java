package io.prayernotify.store.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One venue's timetable for one day. {@code date} is the civil date as {@code yyyy-MM-dd}.
 */
@Document(collection = "prayer_times")
public class PrayerTimesDocument {

    @Id
    private String id;

    private String venueId;
    private String date;
    private Map<String, Slot> prayers = new LinkedHashMap<>();

    public PrayerTimesDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getVenueId() {
        return venueId;
    }

    public void setVenueId(String venueId) {
        this.venueId = venueId;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public Map<String, Slot> getPrayers() {
        return prayers;
    }

    public void setPrayers(Map<String, Slot> prayers) {
        this.prayers = prayers;
    }

    public static class Slot {
        private Instant start;
        private Instant jamaat;

        public Slot() {
        }

        public Slot(Instant start, Instant jamaat) {
            this.start = start;
            this.jamaat = jamaat;
        }

        public Instant getStart() {
            return start;
        }

        public void setStart(Instant start) {
            this.start = start;
        }

        public Instant getJamaat() {
            return jamaat;
        }

        public void setJamaat(Instant jamaat) {
            this.jamaat = jamaat;
        }
    }
}
