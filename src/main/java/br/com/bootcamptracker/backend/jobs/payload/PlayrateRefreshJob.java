package br.com.bootcamptracker.backend.jobs.payload;

import br.com.bootcamptracker.backend.jobs.JobClass;
import br.com.bootcamptracker.backend.jobs.JobHandlers;

/**
 * Atualização global das playrates; trigger = "initial" ou "daily".
 */
public record PlayrateRefreshJob(String trigger) implements JobPayload {

    public static final String INITIAL = "initial";
    public static final String DAILY = "daily";

    @Override
    public JobClass jobClass() {
        return JobClass.PLAYRATE;
    }

    @Override
    public String entityId() {
        return trigger;
    }

    @Override
    public void dispatchTo(JobHandlers handlers) {
        handlers.handle(this);
    }
}
