package br.com.bootcamptracker.backend.jobs.payload;

import br.com.bootcamptracker.backend.jobs.JobClass;
import br.com.bootcamptracker.backend.jobs.JobHandlers;

/**
 * Payload tipado de um job. Conjunto fechado: o worker despacha via
 * {@link #dispatchTo(JobHandlers)}.
 */
public sealed interface JobPayload permits GameStatePollJob, MatchDetailFetchJob, CurrentRankPollJob,
        PeakRankPollJob, StreamPollJob, DisplayNamePollJob, PlayrateRefreshJob {

    JobClass jobClass();

    /**
     * Entidade dona do job (id do jogador, ou um rótulo fixo para jobs globais)
     */
    String entityId();

    /**
     * Região do jogador, para logs de falha. Nulo quando não se aplica.
     */
    default String region() {
        return null;
    }

    void dispatchTo(JobHandlers handlers);
}
