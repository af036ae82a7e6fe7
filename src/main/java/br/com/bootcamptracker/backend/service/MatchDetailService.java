package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.jobs.payload.MatchDetailFetchJob;
import br.com.bootcamptracker.backend.service.riot.RiotAPIService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MatchDetailService {

    private final RiotAPIService riotAPIService;
    private final TrackerPersistenceService persistenceService;

    /**
     * Busca a partida encerrada na Match-V5 e guarda na sessão. Erros
     * propagam e o job falha.
     */
    public void fetchMatchDetail(MatchDetailFetchJob job) {
        String matchId = job.matchId();
        JsonNode detail = riotAPIService.getMatchById(job.region(), matchId);
        if (detail == null) {
            log.warn("⚠️ [MatchDetail] Match-V5 sem corpo para {}", matchId);
            return;
        }

        if (persistenceService.storeMatchDetail(job.playerId(), job.gameId(), detail.toString())) {
            log.info("✅ [MatchDetail] Dados da partida {} salvos para jogador {}", matchId, job.playerId());
        }
    }
}
