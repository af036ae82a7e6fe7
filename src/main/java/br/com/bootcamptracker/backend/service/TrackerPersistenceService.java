package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.domain.entity.GameSession;
import br.com.bootcamptracker.backend.domain.entity.GameSessionStatus;
import br.com.bootcamptracker.backend.domain.entity.PlayerStatus;
import br.com.bootcamptracker.backend.domain.entity.TrackedPlayer;
import br.com.bootcamptracker.backend.domain.repository.GameSessionRepository;
import br.com.bootcamptracker.backend.domain.repository.TrackedPlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Escritas do tracker no banco.
 * <p>
 * As transições de partida (início e fim) gravam jogador e sessão na mesma
 * transação: nunca fica visível um jogador in_game sem sessão, nem o inverso.
 * Este é o único lugar que altera status e lastGameId do jogador.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackerPersistenceService {

    private final TrackedPlayerRepository trackedPlayerRepository;
    private final GameSessionRepository gameSessionRepository;

    /**
     * Partida nova: jogador vai para in_game e a sessão é criada (ou
     * atualizada, se já existir para o mesmo par partida/jogador) com o lobby
     * enriquecido.
     */
    @Transactional
    public GameSession recordNewGame(Long playerId, String gameId, Instant startedAt, String enrichedRosterJson) {
        TrackedPlayer player = trackedPlayerRepository.findById(playerId)
                .orElseThrow(() -> new IllegalStateException("Jogador não encontrado: " + playerId));

        player.setStatus(PlayerStatus.IN_GAME);
        player.setLastGameId(gameId);
        trackedPlayerRepository.save(player);

        GameSession session = gameSessionRepository.findByExternalGameIdAndTrackedPlayerId(gameId, playerId)
                .orElseGet(() -> GameSession.builder()
                        .externalGameId(gameId)
                        .trackedPlayerId(playerId)
                        .startedAt(startedAt)
                        .build());
        if (session.getStatus() == GameSessionStatus.COMPLETED) {
            // Spectator devolveu 404 no meio da partida e ela foi encerrada cedo; reabre
            log.info("♻️ [Persistence] Sessão da partida {} / jogador {} reaberta", gameId, playerId);
            session.setEndedAt(null);
        }
        session.setStatus(GameSessionStatus.IN_PROGRESS);
        session.setEnrichedRosterJson(enrichedRosterJson);

        GameSession saved = gameSessionRepository.save(session);
        log.info("💾 [Persistence] Partida {} registrada para jogador {}", gameId, playerId);
        return saved;
    }

    /**
     * Fim de partida: jogador volta a idle e a sessão em andamento é
     * concluída.
     *
     * @param gameId pode ser nulo (jogador preso em in_game sem partida); aí só
     *               o status é corrigido
     * @return true se alguma sessão foi concluída
     */
    @Transactional
    public boolean recordGameEnded(Long playerId, String gameId, Instant endedAt) {
        TrackedPlayer player = trackedPlayerRepository.findById(playerId)
                .orElseThrow(() -> new IllegalStateException("Jogador não encontrado: " + playerId));

        player.setStatus(PlayerStatus.IDLE);
        trackedPlayerRepository.save(player);

        if (gameId == null) {
            return false;
        }

        Optional<GameSession> sessionOpt = gameSessionRepository.findByExternalGameIdAndTrackedPlayerId(gameId,
                playerId);
        if (sessionOpt.isEmpty() || sessionOpt.get().getStatus() != GameSessionStatus.IN_PROGRESS) {
            log.debug("ℹ️ [Persistence] Nenhuma sessão em andamento para partida {} / jogador {}", gameId, playerId);
            return false;
        }

        GameSession session = sessionOpt.get();
        session.setStatus(GameSessionStatus.COMPLETED);
        session.setEndedAt(endedAt);
        gameSessionRepository.save(session);
        log.info("🏁 [Persistence] Partida {} concluída para jogador {}", gameId, playerId);
        return true;
    }

    /**
     * Aplica uma alteração (rank, nome) no jogador carregado dentro da
     * transação. Só as colunas alteradas são gravadas.
     *
     * @return resultado da mutação; false se o jogador não existe
     */
    @Transactional
    public boolean updatePlayer(Long playerId, Predicate<TrackedPlayer> mutation) {
        Optional<TrackedPlayer> playerOpt = trackedPlayerRepository.findById(playerId);
        if (playerOpt.isEmpty()) {
            log.warn("⚠️ [Persistence] Jogador {} não encontrado, atualização ignorada", playerId);
            return false;
        }
        TrackedPlayer player = playerOpt.get();
        boolean changed = mutation.test(player);
        if (changed) {
            trackedPlayerRepository.save(player);
        }
        return changed;
    }

    /**
     * Guarda o registro completo da Match-V5 na sessão. O lobby enriquecido
     * não é alterado.
     */
    @Transactional
    public boolean storeMatchDetail(Long playerId, String gameId, String matchDetailJson) {
        Optional<GameSession> sessionOpt = gameSessionRepository.findByExternalGameIdAndTrackedPlayerId(gameId,
                playerId);
        if (sessionOpt.isEmpty()) {
            log.warn("⚠️ [Persistence] Sessão da partida {} / jogador {} não encontrada", gameId, playerId);
            return false;
        }
        GameSession session = sessionOpt.get();
        session.setMatchDetailJson(matchDetailJson);
        gameSessionRepository.save(session);
        return true;
    }
}
