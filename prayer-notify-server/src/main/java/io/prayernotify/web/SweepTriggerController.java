package io.prayernotify.web;

import io.prayernotify.auth.IdentityVerifier;
import io.prayernotify.config.PrayerNotifyProperties;
import io.prayernotify.prayer.SweepOrchestrator;
import io.prayernotify.prayer.SweepSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * On-demand sweep triggers: the signed-in re-sync and the operator's manual global run.
 * Both answer 503 while the queue is switched off ({@code prayer.queue.enabled=false}).
 */
@RestController
@RequestMapping("/prayer-notifications")
public class SweepTriggerController {
    private static final Logger log = LoggerFactory.getLogger(SweepTriggerController.class);

    static final String MANUAL_TRIGGERED = "Manual prayer notification scheduler triggered.";
    static final String SCHEDULING_DISABLED = "Prayer notification scheduling is disabled.";

    private static final String BEARER_PREFIX = "Bearer ";

    private final ObjectProvider<SweepOrchestrator> orchestrator;
    private final IdentityVerifier identityVerifier;
    private final PrayerNotifyProperties props;

    public SweepTriggerController(ObjectProvider<SweepOrchestrator> orchestrator,
                                  IdentityVerifier identityVerifier,
                                  PrayerNotifyProperties props) {
        this.orchestrator = orchestrator;
        this.identityVerifier = identityVerifier;
        this.props = props;
    }

    /**
     * Schedules today's alerts for the caller only. The subscriber id comes from the verified ID
     * token, never from the body.
     */
    @PostMapping("/schedule-today")
    public ResponseEntity<?> scheduleToday(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                           @RequestBody(required = false) ScheduleTodayRequest request) {
        Optional<String> subscriberId = identityVerifier.verify(bearerToken(authorization));
        if (subscriberId.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("User not signed in.");
        }

        String pushAddress = request == null ? null : request.token();
        if (pushAddress == null || pushAddress.isBlank()) {
            return ResponseEntity.badRequest().body("Missing FCM token.");
        }

        SweepOrchestrator sweeps = orchestrator.getIfAvailable();
        if (sweeps == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(SCHEDULING_DISABLED);
        }
        SweepSummary summary = sweeps.runTargetedSweep(subscriberId.get(), pushAddress);
        return ResponseEntity.ok(summary);
    }

    @RequestMapping(value = "/run", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<String> run() {
        if (!props.isManualTriggerEnabled()) {
            return ResponseEntity.notFound().build();
        }
        SweepOrchestrator sweeps = orchestrator.getIfAvailable();
        if (sweeps == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(SCHEDULING_DISABLED);
        }
        try {
            SweepSummary summary = sweeps.runGlobalSweep();
            log.info("Manual sweep finished created={} alreadyScheduled={} failed={} skipped={}",
                    summary.created(), summary.alreadyScheduled(), summary.failed(), summary.skipped());
            return ResponseEntity.ok(MANUAL_TRIGGERED);
        } catch (RuntimeException e) {
            log.error("Manual sweep failed msg={}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Internal Server Error: " + e.getMessage());
        }
    }

    private static String bearerToken(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return null;
        }
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }
}
