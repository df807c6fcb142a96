package io.prayernotify.push;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.messaging.FirebaseMessaging;
import io.prayernotify.auth.FirebaseIdentityVerifier;
import io.prayernotify.auth.IdentityVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileInputStream;
import java.io.IOException;

@Configuration
public class FirebaseConfig {

    private static final Logger log = LoggerFactory.getLogger(FirebaseConfig.class);

    @Bean
    public FirebaseApp firebaseApp(@Value("${fcm.service-account-path:}") String serviceAccountPath) throws IOException {
        if (!FirebaseApp.getApps().isEmpty()) {
            return FirebaseApp.getInstance();
        }

        if (serviceAccountPath == null || serviceAccountPath.isBlank()) {
            log.warn("No FCM service account path configured, using application default credentials");
            return FirebaseApp.initializeApp();
        }

        try (FileInputStream serviceAccount = new FileInputStream(serviceAccountPath)) {
            log.info("Loading Firebase service account from {}", serviceAccountPath);
            FirebaseOptions options = FirebaseOptions.builder()
                    .setCredentials(GoogleCredentials.fromStream(serviceAccount))
                    .build();
            return FirebaseApp.initializeApp(options);
        }
    }

    @Bean
    public FirebaseMessaging firebaseMessaging(FirebaseApp app) {
        return FirebaseMessaging.getInstance(app);
    }

    @Bean
    public FirebaseAuth firebaseAuth(FirebaseApp app) {
        return FirebaseAuth.getInstance(app);
    }

    @Bean
    public PushGateway pushGateway(FirebaseMessaging firebaseMessaging) {
        return new FcmPushGateway(firebaseMessaging);
    }

    @Bean
    public IdentityVerifier identityVerifier(FirebaseAuth firebaseAuth) {
        return new FirebaseIdentityVerifier(firebaseAuth);
    }
}
