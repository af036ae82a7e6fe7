package br.com.bootcamptracker.backend.jobs.payload;

import br.com.bootcamptracker.backend.jobs.JobClass;
import br.com.bootcamptracker.backend.jobs.JobHandlers;

/**
 * Busca a Match-V5 de uma partida encerrada.
 */
public record MatchDetailFetchJob(Long playerId, String gameId, String region) implements JobPayload {

    @Override
    public JobClass jobClass() {
        return JobClass.MATCH_DETAIL;
    }

    @Override
    public String entityId() {
        return String.valueOf(playerId);
    }

    /**
     * Formato da Match-V5: REGIAO_gameId (ex.: KR_7000000000)
     */
    public String matchId() {
        return region.toUpperCase() + "_" + gameId;
    }

    @Override
    public void dispatchTo(JobHandlers handlers) {
        handlers.handle(this);
    }
}
