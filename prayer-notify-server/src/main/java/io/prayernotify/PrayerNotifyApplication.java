package io.prayernotify;

import org.springframework.boot.SpringApplication;
import io.prayernotify.config.PrayerNotifyProperties;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// the web layer reads prayer.* even when the queue auto-configuration backs off
@SpringBootApplication
@EnableConfigurationProperties(PrayerNotifyProperties.class)
public class PrayerNotifyApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrayerNotifyApplication.class, args);
    }
}
