package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.dto.AccountDTO;
import br.com.bootcamptracker.backend.service.riot.RiotAPIService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Acompanha trocas de Riot ID (gameName#tagLine) dos jogadores.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SummonerNameService {

    private final RiotAPIService riotAPIService;
    private final TrackerPersistenceService persistenceService;

    /**
     * Erros são só logados: um nome desatualizado não justifica falhar o job.
     */
    public void refreshDisplayName(Long playerId, String puuid, String region) {
        try {
            AccountDTO account = riotAPIService.getAccountByPuuid(region, puuid);
            if (account == null || account.getGameName() == null) {
                log.warn("⚠️ [SummonerName] Conta sem gameName para jogador {}", playerId);
                return;
            }

            String newName = account.getGameName();
            String newRiotId = account.getRiotId();

            persistenceService.updatePlayer(playerId, player -> {
                if (newName.equals(player.getSummonerName()) && Objects.equals(newRiotId, player.getRiotId())) {
                    return false;
                }
                log.info("🔄 [SummonerName] Troca de nome: {} ({}) → {} ({})", player.getSummonerName(),
                        player.getRiotId() != null ? player.getRiotId() : "N/A", newName, newRiotId);
                player.setSummonerName(newName);
                player.setRiotId(newRiotId);
                return true;
            });
        } catch (Exception e) {
            log.error("❌ [SummonerName] Erro ao atualizar nome do jogador {} ({}): {}", playerId, region,
                    e.getMessage());
        }
    }
}
