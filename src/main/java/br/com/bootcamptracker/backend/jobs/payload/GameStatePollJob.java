package br.com.bootcamptracker.backend.jobs.payload;

import br.com.bootcamptracker.backend.jobs.JobClass;
import br.com.bootcamptracker.backend.jobs.JobHandlers;

/**
 * Poll da Spectator-V5 de um jogador.
 */
public record GameStatePollJob(Long playerId, String puuid, String region) implements JobPayload {

    @Override
    public JobClass jobClass() {
        return JobClass.GAME_STATE;
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
