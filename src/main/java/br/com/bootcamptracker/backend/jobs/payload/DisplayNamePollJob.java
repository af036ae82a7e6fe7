package br.com.bootcamptracker.backend.jobs.payload;

import br.com.bootcamptracker.backend.jobs.JobClass;
import br.com.bootcamptracker.backend.jobs.JobHandlers;

/**
 * Confere se o Riot ID do jogador mudou.
 */
public record DisplayNamePollJob(Long playerId, String puuid, String region) implements JobPayload {

    @Override
    public JobClass jobClass() {
        return JobClass.DISPLAY_NAME;
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
