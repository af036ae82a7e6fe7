package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.domain.entity.PlayerStatus;
import br.com.bootcamptracker.backend.domain.entity.TrackedPlayer;
import br.com.bootcamptracker.backend.domain.repository.TrackedPlayerRepository;
import br.com.bootcamptracker.backend.dto.ActiveGameDTO;
import br.com.bootcamptracker.backend.exception.RiotApiException;
import br.com.bootcamptracker.backend.service.lock.PlayerStateLockService;
import br.com.bootcamptracker.backend.service.riot.RiotAPIService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Corrige jogadores presos em in_game (fim de partida perdido num restart).
 * Aplica a mesma transição de fim de partida, mas não agenda follow-ups:
 * a partida terminou há um tempo desconhecido.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleGameCleanupService {

    private final TrackedPlayerRepository trackedPlayerRepository;
    private final RiotAPIService riotAPIService;
    private final TrackerPersistenceService persistenceService;
    private final PlayerStateLockService playerStateLockService;

    /**
     * @return quantidade de jogadores corrigidos
     */
    public int cleanupStaleGames() {
        List<TrackedPlayer> inGame = trackedPlayerRepository.findByStatus(PlayerStatus.IN_GAME);
        if (inGame.isEmpty()) {
            log.debug("✓ [StaleCleanup] Nenhum jogador in_game para verificar");
            return 0;
        }

        log.info("📋 [StaleCleanup] Verificando {} jogadores marcados como in_game...", inGame.size());
        int cleaned = 0;

        for (TrackedPlayer player : inGame) {
            try {
                if (cleanupPlayer(player)) {
                    cleaned++;
                }
            } catch (RiotApiException e) {
                if (e.isTransient()) {
                    log.warn("⏳ [StaleCleanup] Riot API {} para {}, verifica no próximo ciclo", e.getStatusCode(),
                            player.getSummonerName());
                } else {
                    log.error("❌ [StaleCleanup] Erro ao verificar {} (id={}, região={}): {}",
                            player.getSummonerName(), player.getId(), player.getRegion(), e.getMessage());
                }
            } catch (Exception e) {
                log.error("❌ [StaleCleanup] Erro ao verificar {} (id={}, região={})", player.getSummonerName(),
                        player.getId(), player.getRegion(), e);
            }
        }

        if (cleaned > 0) {
            log.info("✅ [StaleCleanup] {} partidas presas encerradas", cleaned);
        }
        return cleaned;
    }

    private boolean cleanupPlayer(TrackedPlayer player) {
        if (!player.hasPuuid()) {
            return false;
        }

        Optional<ActiveGameDTO> activeGame = riotAPIService.getActiveGame(player.getRegion(), player.getPuuid());
        if (activeGame.isPresent()) {
            // Ainda em partida; se for outra, o poll de game-state registra
            return false;
        }

        if (!playerStateLockService.acquireStateLock(player.getId())) {
            return false;
        }
        try {
            TrackedPlayer current = trackedPlayerRepository.findById(player.getId()).orElse(null);
            if (current == null || current.getStatus() != PlayerStatus.IN_GAME) {
                return false;
            }
            // Outra partida registrada depois da consulta à Riot: não é a que estava presa
            if (!Objects.equals(current.getLastGameId(), player.getLastGameId())) {
                log.debug("⏭️ [StaleCleanup] {} entrou na partida {} durante a verificação, mantendo",
                        current.getSummonerName(), current.getLastGameId());
                return false;
            }
            log.info("🧹 [StaleCleanup] Encerrando partida presa de {} (ID: {})", current.getSummonerName(),
                    current.getLastGameId());
            persistenceService.recordGameEnded(current.getId(), current.getLastGameId(), Instant.now());
            return true;
        } finally {
            playerStateLockService.releaseStateLock(player.getId());
        }
    }
}
