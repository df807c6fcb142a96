package io.prayernotify.auth;

import java.util.Optional;

/**
 * Resolves a client-supplied identity token to the signed-in subscriber id.
 */
public interface IdentityVerifier {

    /**
     * @return the subscriber id, or empty when the token is missing, malformed, expired or revoked
     */
    Optional<String> verify(String idToken);
}
