package io.prayernotify.prayer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prayernotify.TaskQueue;
import io.prayernotify.core.HttpTarget;
import io.prayernotify.core.JobSpec;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NotificationTaskSchedulerTest {

    private static final String DISPATCH_URL = "http://localhost:8080/notifications/prayer";
    private static final Instant FIRE_AT = Instant.parse("2026-01-15T06:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static NotificationPayload payload() {
        return new NotificationPayload("tok", "East Mosque", "Fajr at 06:00",
                Map.of("type", "prayer", "prayer", "fajr"));
    }

    @Test
    void submitShouldQueueHttpPostToDispatchEndpoint() throws Exception {
        InMemoryTaskQueue queue = new InMemoryTaskQueue();
        NotificationTaskScheduler scheduler = new NotificationTaskScheduler(queue, objectMapper, DISPATCH_URL);

        SubmitOutcome outcome = scheduler.submit("key-1", payload(), FIRE_AT);

        assertThat(outcome.status()).isEqualTo(SubmitOutcome.Status.CREATED);
        assertThat(queue.jobs()).hasSize(1);

        JobSpec<?> job = queue.jobs().get(0);
        assertThat(job.name()).isEqualTo(NotificationTaskScheduler.JOB_NAME);
        assertThat(job.uniqueKey()).isEqualTo("key-1");
        assertThat(job.nextRunAt()).isEqualTo(FIRE_AT);

        HttpTarget target = (HttpTarget) job.data();
        assertThat(target.method()).isEqualTo("POST");
        assertThat(target.url()).isEqualTo(DISPATCH_URL);
        assertThat(target.headers()).containsEntry("Content-Type", "application/json");

        JsonNode body = objectMapper.readTree(target.decodedBody());
        assertThat(body.get("pushAddress").asText()).isEqualTo("tok");
        assertThat(body.get("title").asText()).isEqualTo("East Mosque");
        assertThat(body.get("body").asText()).isEqualTo("Fajr at 06:00");
        assertThat(body.get("routingData").get("prayer").asText()).isEqualTo("fajr");
    }

    @Test
    void secondSubmitWithSameKeyShouldReportAlreadyExists() {
        InMemoryTaskQueue queue = new InMemoryTaskQueue();
        NotificationTaskScheduler scheduler = new NotificationTaskScheduler(queue, objectMapper, DISPATCH_URL);

        scheduler.submit("key-1", payload(), FIRE_AT);
        SubmitOutcome again = scheduler.submit("key-1", payload(), FIRE_AT);

        assertThat(again.status()).isEqualTo(SubmitOutcome.Status.ALREADY_EXISTS);
        assertThat(again.isSuccess()).isTrue();
        assertThat(queue.jobs()).hasSize(1);
    }

    @Test
    void queueErrorShouldBeReportedAsFailure() {
        TaskQueue queue = mock(TaskQueue.class);
        when(queue.create(anyString(), any())).thenThrow(new IllegalStateException("queue unavailable"));
        NotificationTaskScheduler scheduler = new NotificationTaskScheduler(queue, objectMapper, DISPATCH_URL);

        SubmitOutcome outcome = scheduler.submit("key-1", payload(), FIRE_AT);

        assertThat(outcome.status()).isEqualTo(SubmitOutcome.Status.FAILED);
        assertThat(outcome.error()).hasMessage("queue unavailable");
        assertThat(outcome.isSuccess()).isFalse();
    }
}
