package io.prayernotify.config;

import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Prayer scheduling settings.
 */
@ConfigurationProperties(prefix = "prayer")
public class PrayerNotifyProperties {
    /**
     * Civil zone that decides "today" and renders times in notification bodies.
     */
    private String zone = "Europe/London";
    private String dailySweep = "AT 00:30";
    private boolean dailySweepEnabled = true;
    /**
     * Absolute url queued notification tasks POST to when they fire.
     */
    private String dispatchUrl = "http://localhost:8080/notifications/prayer";
    private String defaultVenueName = "Your Mosque";
    private boolean manualTriggerEnabled = true;

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public String getDailySweep() {
        return dailySweep;
    }

    public void setDailySweep(String dailySweep) {
        this.dailySweep = dailySweep;
    }

    public boolean isDailySweepEnabled() {
        return dailySweepEnabled;
    }

    public void setDailySweepEnabled(boolean dailySweepEnabled) {
        this.dailySweepEnabled = dailySweepEnabled;
    }

    public String getDispatchUrl() {
        return dispatchUrl;
    }

    public void setDispatchUrl(String dispatchUrl) {
        this.dispatchUrl = dispatchUrl;
    }

    public String getDefaultVenueName() {
        return defaultVenueName;
    }

    public void setDefaultVenueName(String defaultVenueName) {
        this.defaultVenueName = defaultVenueName;
    }

    public boolean isManualTriggerEnabled() {
        return manualTriggerEnabled;
    }

    public void setManualTriggerEnabled(boolean manualTriggerEnabled) {
        this.manualTriggerEnabled = manualTriggerEnabled;
    }
}
