package io.prayernotify.jobs;

import io.prayernotify.JobHandler;
import io.prayernotify.core.HttpTarget;
import io.prayernotify.prayer.NotificationTaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;

import java.util.Objects;

/**
 * Issues the HTTP request stored on a fired notification task. A non-2xx answer raises, which
 * makes the queue retry the task.
 */
public class HttpTargetJobHandler implements JobHandler<HttpTarget> {
    private static final Logger log = LoggerFactory.getLogger(HttpTargetJobHandler.class);

    private final RestClient restClient;

    public HttpTargetJobHandler(RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    }

    @Override
    public String name() {
        return NotificationTaskScheduler.JOB_NAME;
    }

    @Override
    public Class<HttpTarget> dataClass() {
        return HttpTarget.class;
    }

    @Override
    public void execute(HttpTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("notification task has no http target");
        }

        ResponseEntity<Void> response = restClient.method(HttpMethod.valueOf(target.method()))
                .uri(target.url())
                .headers(h -> target.headers().forEach(h::set))
                .body(target.decodedBody())
                .retrieve()
                .toBodilessEntity();

        log.debug("Notification task delivered url={} status={}", target.url(), response.getStatusCode());
    }
}
