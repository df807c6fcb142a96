package io.prayernotify.jobs;

import io.prayernotify.JobHandler;
import io.prayernotify.prayer.SweepOrchestrator;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Runs the global sweep each time the recurring {@value #JOB_NAME} job fires.
 */
public class DailySweepJobHandler implements JobHandler<Void> {

    public static final String JOB_NAME = "prayer-daily-sweep";

    // resolved lazily: the orchestrator depends on the queue, which depends on this handler
    private final ObjectProvider<SweepOrchestrator> orchestrator;

    public DailySweepJobHandler(ObjectProvider<SweepOrchestrator> orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public String name() {
        return JOB_NAME;
    }

    @Override
    public Class<Void> dataClass() {
        return Void.class;
    }

    @Override
    public void execute(Void data) {
        orchestrator.getObject().runGlobalSweep();
    }
}
