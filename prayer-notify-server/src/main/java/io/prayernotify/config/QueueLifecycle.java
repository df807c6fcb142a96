package io.prayernotify.config;

import io.prayernotify.TaskQueue;
import io.prayernotify.core.PersistResult;
import io.prayernotify.jobs.DailySweepJobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the task queue with the Spring container lifecycle and registers the daily sweep.
 */
public class QueueLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(QueueLifecycle.class);

    private final TaskQueue queue;
    private final PrayerNotifyProperties props;
    private volatile boolean running = false;

    public QueueLifecycle(TaskQueue queue, PrayerNotifyProperties props) {
        this.queue = queue;
        this.props = props;
    }

    @Override
    public void start() {
        if (props.isDailySweepEnabled()) {
            PersistResult result = queue.every(DailySweepJobHandler.JOB_NAME, props.getDailySweep(), props.getZone(), null);
            log.info("Daily sweep registered rule='{}' zone={} result={}", props.getDailySweep(), props.getZone(), result);
        }
        queue.start();
        running = true;
    }

    @Override
    public void stop() {
        queue.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
