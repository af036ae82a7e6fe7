package br.com.bootcamptracker.backend.jobs.payload;

import br.com.bootcamptracker.backend.jobs.JobClass;
import br.com.bootcamptracker.backend.jobs.JobHandlers;

public record StreamPollJob(Long playerId, String twitchUserId, String twitchLogin) implements JobPayload {

    @Override
    public JobClass jobClass() {
        return JobClass.STREAM;
    }

    @Override
    public String entityId() {
        return String.valueOf(playerId);
    }

    @Override
    public void dispatchTo(JobHandlers handlers) {
        handlers.handle(this);
    }
}
