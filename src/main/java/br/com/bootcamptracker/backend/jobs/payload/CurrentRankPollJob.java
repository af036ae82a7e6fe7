package br.com.bootcamptracker.backend.jobs.payload;

import br.com.bootcamptracker.backend.jobs.JobClass;
import br.com.bootcamptracker.backend.jobs.JobHandlers;

/**
 * Atualiza o rank atual (solo e flex) de um jogador.
 */
public record CurrentRankPollJob(Long playerId, String puuid, String region) implements JobPayload {

    @Override
    public JobClass jobClass() {
        return JobClass.CURRENT_RANK;
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
