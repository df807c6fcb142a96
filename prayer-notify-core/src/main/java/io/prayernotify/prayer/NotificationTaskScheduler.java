package io.prayernotify.prayer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prayernotify.TaskQueue;
import io.prayernotify.core.HttpTarget;
import io.prayernotify.core.PersistResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Submits delayed push deliveries to the {@link TaskQueue}, using the dedup key as the job's
 * unique name. When the job fires, the queue POSTs the payload to the dispatch endpoint.
 */
public class NotificationTaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(NotificationTaskScheduler.class);

    public static final String JOB_NAME = "prayer-notification";

    private final TaskQueue queue;
    private final ObjectMapper objectMapper;
    private final String dispatchUrl;

    public NotificationTaskScheduler(TaskQueue queue, ObjectMapper objectMapper, String dispatchUrl) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.dispatchUrl = Objects.requireNonNull(dispatchUrl, "dispatchUrl must not be null");
        if (dispatchUrl.isBlank()) {
            throw new IllegalArgumentException("dispatchUrl must not be blank");
        }
    }

    /**
     * Create the task unless one with the same key exists. Never throws; failures come back as
     * {@link SubmitOutcome.Status#FAILED}.
     */
    public SubmitOutcome submit(String key, NotificationPayload payload, Instant fireInstant) {
        try {
            HttpTarget target = HttpTarget.postJson(dispatchUrl, objectMapper.writeValueAsString(payload));
            PersistResult result = queue.create(JOB_NAME, target)
                    .uniqueKey(key)
                    .schedule(fireInstant)
                    .save();

            return switch (result) {
                case CREATED -> {
                    log.info("Prayer task scheduled key={} fireAt={} title='{}'", key, fireInstant, payload.title());
                    yield SubmitOutcome.created(key);
                }
                case ALREADY_EXISTS -> {
                    log.debug("Prayer task already exists, skipping key={}", key);
                    yield SubmitOutcome.alreadyExists(key);
                }
                case UPDATED -> {
                    log.error("Queue overwrote an existing prayer task key={}", key);
                    yield SubmitOutcome.failed(key,
                            new IllegalStateException("queue updated an existing task instead of rejecting it"));
                }
            };
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Prayer task submit failed key={} fireAt={} msg={}", key, fireInstant, e.getMessage(), e);
            return SubmitOutcome.failed(key, e);
        }
    }
}
