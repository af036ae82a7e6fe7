package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.domain.entity.RankQueue;
import br.com.bootcamptracker.backend.dto.ActiveGameDTO;
import br.com.bootcamptracker.backend.dto.EnrichedParticipantDTO;
import br.com.bootcamptracker.backend.dto.LeagueEntryDTO;
import br.com.bootcamptracker.backend.service.riot.RiotAPIService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Busca o rank de solo/duo de cada participante do lobby em paralelo. Falha
 * de um participante vira "Unranked" só para ele.
 */
@Slf4j
@Service
public class ParticipantEnrichmentService {

    private final RiotAPIService riotAPIService;
    private final ExecutorService enrichmentExecutor;

    public ParticipantEnrichmentService(RiotAPIService riotAPIService,
            @Qualifier("enrichmentExecutor") ExecutorService enrichmentExecutor) {
        this.riotAPIService = riotAPIService;
        this.enrichmentExecutor = enrichmentExecutor;
    }

    public List<EnrichedParticipantDTO> enrich(String region, List<ActiveGameDTO.ParticipantDTO> participants) {
        log.debug("📊 [Enrichment] Enriquecendo {} participantes...", participants.size());

        List<CompletableFuture<EnrichedParticipantDTO>> futures = participants.stream()
                .map(p -> CompletableFuture.supplyAsync(() -> enrichParticipant(region, p), enrichmentExecutor))
                .toList();

        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    EnrichedParticipantDTO enrichParticipant(String region, ActiveGameDTO.ParticipantDTO participant) {
        EnrichedParticipantDTO enriched = EnrichedParticipantDTO.from(participant);
        if (participant.getPuuid() == null || participant.getPuuid().isBlank()) {
            return enriched;
        }

        try {
            Optional<LeagueEntryDTO> solo = riotAPIService.getLeagueEntries(region, participant.getPuuid()).stream()
                    .filter(e -> RankQueue.SOLO.getRiotQueueType().equals(e.getQueueType()))
                    .findFirst();

            if (solo.isPresent()) {
                LeagueEntryDTO entry = solo.get();
                enriched.setRank(entry.getTier() + " " + entry.getRank());
                enriched.setTier(entry.getTier());
                enriched.setDivision(entry.getRank());
                enriched.setLeaguePoints(entry.getLeaguePoints() != null ? entry.getLeaguePoints() : 0);
            }
        } catch (Exception e) {
            log.warn("⚠️ [Enrichment] Falha ao buscar rank de {}: {}", participant.getDisplayName(), e.getMessage());
        }
        return enriched;
    }
}
