package io.prayernotify.auth;

import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.auth.FirebaseAuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Verifies Firebase ID tokens issued to signed-in app users.
 */
public class FirebaseIdentityVerifier implements IdentityVerifier {
    private static final Logger log = LoggerFactory.getLogger(FirebaseIdentityVerifier.class);

    private final FirebaseAuth firebaseAuth;

    public FirebaseIdentityVerifier(FirebaseAuth firebaseAuth) {
        this.firebaseAuth = Objects.requireNonNull(firebaseAuth, "firebaseAuth must not be null");
    }

    @Override
    public Optional<String> verify(String idToken) {
        if (idToken == null || idToken.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(firebaseAuth.verifyIdToken(idToken).getUid());
        } catch (FirebaseAuthException e) {
            log.debug("ID token rejected code={} msg={}", e.getAuthErrorCode(), e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.debug("ID token malformed msg={}", e.getMessage());
            return Optional.empty();
        }
    }
}
