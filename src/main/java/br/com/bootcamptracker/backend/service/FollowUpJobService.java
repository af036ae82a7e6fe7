package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.jobs.SchedulerService;
import br.com.bootcamptracker.backend.jobs.payload.CurrentRankPollJob;
import br.com.bootcamptracker.backend.jobs.payload.MatchDetailFetchJob;
import br.com.bootcamptracker.backend.jobs.payload.PeakRankPollJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Jobs avulsos disparados por eventos (fim de partida, jogador novo).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FollowUpJobService {

    // A Riot atualiza Match-V5 e League-V4 alguns segundos depois do fim da
    // partida; o rank atual roda depois do pico
    public static final long MATCH_DETAIL_DELAY_MS = 60_000;
    public static final long PEAK_RANK_DELAY_MS = 90_000;
    public static final long CURRENT_RANK_DELAY_MS = 95_000;

    public static final long INITIAL_RANK_DELAY_MS = 2_000;

    private final SchedulerService schedulerService;

    public void enqueueGameEndFollowUps(Long playerId, String puuid, String region, String gameId) {
        schedulerService.scheduleDelayed(new MatchDetailFetchJob(playerId, gameId, region), MATCH_DETAIL_DELAY_MS);
        schedulerService.scheduleDelayed(new PeakRankPollJob(playerId, puuid, region), PEAK_RANK_DELAY_MS);
        schedulerService.scheduleDelayed(new CurrentRankPollJob(playerId, puuid, region), CURRENT_RANK_DELAY_MS);
        log.debug("⏱️ [FollowUp] Match-detail, pico e rank atual agendados para jogador {} (partida {})", playerId,
                gameId);
    }

    /**
     * Chamado quando um jogador entra no roster: busca rank atual e a linha de
     * base do pico sem esperar o ciclo de 5 minutos.
     */
    public void queueInitialRankCheck(Long playerId, String puuid, String region) {
        schedulerService.scheduleDelayed(new CurrentRankPollJob(playerId, puuid, region), INITIAL_RANK_DELAY_MS);
        schedulerService.scheduleDelayed(new PeakRankPollJob(playerId, puuid, region), INITIAL_RANK_DELAY_MS);
        log.info("📊 [FollowUp] Checagem inicial de rank enfileirada para jogador {}", playerId);
    }
}
