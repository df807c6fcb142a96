package io.prayernotify.prayer;

public record PrayerAlertSetting(boolean alertAtPrimary, boolean alertAtSecondary) {

    public static final PrayerAlertSetting NONE = new PrayerAlertSetting(false, false);

    public boolean enabled(AlertKind kind) {
        return switch (kind) {
            case PRIMARY -> alertAtPrimary;
            case SECONDARY -> alertAtSecondary;
        };
    }
}
