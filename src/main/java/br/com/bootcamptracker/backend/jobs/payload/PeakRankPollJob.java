package br.com.bootcamptracker.backend.jobs.payload;

import br.com.bootcamptracker.backend.jobs.JobClass;
import br.com.bootcamptracker.backend.jobs.JobHandlers;

/**
 * Compara o rank atual com o pico registrado.
 */
public record PeakRankPollJob(Long playerId, String puuid, String region) implements JobPayload {

    @Override
    public JobClass jobClass() {
        return JobClass.PEAK_RANK;
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
