package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.domain.entity.CurrentRank;
import br.com.bootcamptracker.backend.domain.entity.PeakRank;
import br.com.bootcamptracker.backend.domain.entity.RankQueue;
import br.com.bootcamptracker.backend.domain.entity.TrackedPlayer;
import br.com.bootcamptracker.backend.dto.LeagueEntryDTO;
import br.com.bootcamptracker.backend.exception.RiotApiException;
import br.com.bootcamptracker.backend.service.riot.RiotAPIService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Mantém o rank atual e o pico de cada fila ranqueada.
 * <p>
 * Pico só sobe (score estritamente maior). O rank atual é sobrescrito a cada
 * leitura bem-sucedida, mas um rank já estabelecido nunca é apagado por uma
 * resposta "sem rank". 429/5xx não alteram nada: o próximo poll tenta de novo.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RankTrackerService {

    private final RiotAPIService riotAPIService;
    private final TrackerPersistenceService persistenceService;

    public void updateCurrentRank(Long playerId, String puuid, String region) {
        if (puuid == null || puuid.isBlank()) {
            log.warn("⚠️ [RankTracker] Jogador {} sem PUUID, rank atual ignorado", playerId);
            return;
        }

        Optional<List<LeagueEntryDTO>> entries = fetchEntries(playerId, region, puuid, "rank atual");
        if (entries.isEmpty()) {
            return;
        }

        Instant now = Instant.now();
        boolean saved = persistenceService.updatePlayer(playerId, p -> applyCurrentRank(p, entries.get(), now));
        if (saved) {
            log.debug("✅ [RankTracker] Rank atual atualizado: jogador {}", playerId);
        }
    }

    public void updatePeakRank(Long playerId, String puuid, String region) {
        if (puuid == null || puuid.isBlank()) {
            log.warn("⚠️ [RankTracker] Jogador {} sem PUUID, pico ignorado", playerId);
            return;
        }

        Optional<List<LeagueEntryDTO>> entries = fetchEntries(playerId, region, puuid, "pico");
        if (entries.isEmpty()) {
            return;
        }

        Instant now = Instant.now();
        persistenceService.updatePlayer(playerId, p -> applyPeakRank(p, entries.get(), now));
    }

    private Optional<List<LeagueEntryDTO>> fetchEntries(Long playerId, String region, String puuid, String what) {
        try {
            return Optional.of(riotAPIService.getLeagueEntries(region, puuid));
        } catch (RiotApiException e) {
            if (e.isRateLimited()) {
                log.warn("⏳ [RankTracker] Rate limit ao buscar {} do jogador {}, fica para o próximo poll", what,
                        playerId);
                return Optional.empty();
            }
            if (e.isServerError()) {
                log.warn("⚠️ [RankTracker] Riot API {} ao buscar {} do jogador {}, mantendo dados", e.getStatusCode(),
                        what, playerId);
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Regra do rank atual.
     *
     * @return sempre true: rankUpdatedAt muda a cada leitura bem-sucedida
     */
    static boolean applyCurrentRank(TrackedPlayer player, List<LeagueEntryDTO> entries, Instant now) {
        boolean firstObservation = player.getRankUpdatedAt() == null;

        for (RankQueue queue : RankQueue.values()) {
            Optional<LeagueEntryDTO> entry = findEntry(entries, queue);
            CurrentRank previous = player.getCurrentRank(queue);

            if (entry.isPresent()) {
                LeagueEntryDTO e = entry.get();
                player.setCurrentRank(queue, CurrentRank.builder()
                        .tier(e.getTier())
                        .division(e.getRank())
                        .leaguePoints(orZero(e.getLeaguePoints()))
                        .wins(orZero(e.getWins()))
                        .losses(orZero(e.getLosses()))
                        .build());
            } else if (previous == null || previous.getTier() == null || firstObservation) {
                player.setCurrentRank(queue, null);
            } else {
                log.info("ℹ️ [RankTracker] {} aparece sem rank em {} (era {} {}), mantendo", player.getSummonerName(),
                        queue, previous.getTier(), previous.getDivision());
            }
        }

        player.setRankUpdatedAt(now);
        return true;
    }

    /**
     * Regra do pico.
     *
     * @return true se algo mudou e precisa ser gravado
     */
    static boolean applyPeakRank(TrackedPlayer player, List<LeagueEntryDTO> entries, Instant now) {
        boolean updated = false;

        for (RankQueue queue : RankQueue.values()) {
            Optional<LeagueEntryDTO> entry = findEntry(entries, queue);
            if (entry.isEmpty()) {
                continue;
            }
            LeagueEntryDTO e = entry.get();
            int observed = RankScore.score(e.getTier(), e.getRank(), orZero(e.getLeaguePoints()));
            int peak = RankScore.score(player.getPeakRank(queue));

            if (observed > peak) {
                player.setPeakRank(queue, PeakRank.builder()
                        .tier(e.getTier())
                        .division(e.getRank())
                        .leaguePoints(orZero(e.getLeaguePoints()))
                        .build());
                updated = true;
                log.info("📈 [RankTracker] Novo pico {} para {}: {} {} {}LP", queue, player.getSummonerName(),
                        e.getTier(), e.getRank(), e.getLeaguePoints());
            }
        }

        if (updated || player.getPeakUpdatedAt() == null) {
            player.setPeakUpdatedAt(now);
            return true;
        }
        return false;
    }

    private static Optional<LeagueEntryDTO> findEntry(List<LeagueEntryDTO> entries, RankQueue queue) {
        return entries.stream()
                .filter(e -> queue.getRiotQueueType().equals(e.getQueueType()))
                .findFirst();
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
