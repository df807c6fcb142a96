package io.prayernotify.web;

import io.prayernotify.push.FcmPushGateway;
import io.prayernotify.push.PushDeliveryException;
import io.prayernotify.push.PushGateway;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Push delivery endpoints. {@code /prayer} is what queued notification tasks call at fire time;
 * {@code /direct} sends an ad-hoc message immediately.
 */
@RestController
@RequestMapping("/notifications")
public class DispatchController {
    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    static final String SUCCESS = "Success";
    static final String FAILED = "Failed";

    private final PushGateway pushGateway;

    public DispatchController(PushGateway pushGateway) {
        this.pushGateway = pushGateway;
    }

    @PostMapping("/prayer")
    public ResponseEntity<String> prayer(@Valid @RequestBody DispatchRequest request) {
        return deliver("prayer", request);
    }

    @PostMapping("/direct")
    public ResponseEntity<String> direct(@Valid @RequestBody DispatchRequest request) {
        return deliver("direct", request);
    }

    private ResponseEntity<String> deliver(String kind, DispatchRequest request) {
        try {
            pushGateway.send(request.toPayload());
            return ResponseEntity.ok(SUCCESS);
        } catch (PushDeliveryException e) {
            log.error("Dispatch ({}) failed token={} title='{}' msg={}",
                    kind, FcmPushGateway.tokenPreview(request.pushAddress()), request.title(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(FAILED);
        } catch (RuntimeException e) {
            // e.g. the message builder rejecting a null data value
            log.error("Dispatch ({}) could not build message token={} title='{}' msg={}",
                    kind, FcmPushGateway.tokenPreview(request.pushAddress()), request.title(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(FAILED);
        }
    }
}
