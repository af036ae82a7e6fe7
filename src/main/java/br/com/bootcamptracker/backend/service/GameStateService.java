package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.domain.entity.PlayerStatus;
import br.com.bootcamptracker.backend.domain.entity.TrackedPlayer;
import br.com.bootcamptracker.backend.domain.repository.TrackedPlayerRepository;
import br.com.bootcamptracker.backend.dto.ActiveGameDTO;
import br.com.bootcamptracker.backend.dto.EnrichedGameDTO;
import br.com.bootcamptracker.backend.dto.EnrichedParticipantDTO;
import br.com.bootcamptracker.backend.dto.LanePosition;
import br.com.bootcamptracker.backend.exception.RiotApiException;
import br.com.bootcamptracker.backend.service.lock.PlayerStateLockService;
import br.com.bootcamptracker.backend.service.riot.RiotAPIService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Máquina de estados de partida de um jogador, alimentada pelo poll da
 * Spectator-V5.
 *
 * <pre>
 * sem partida, idle                  → nada
 * partida, idle ou id diferente      → NEW_GAME (enriquece, grava)
 * partida, mesmo id de lastGameId    → ONGOING (sem novo enriquecimento)
 * sem partida, in_game               → GAME_ENDED (grava, agenda follow-ups)
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameStateService {

    public enum Transition {
        NONE,
        NEW_GAME,
        ONGOING,
        GAME_ENDED
    }

    private final TrackedPlayerRepository trackedPlayerRepository;
    private final RiotAPIService riotAPIService;
    private final ParticipantEnrichmentService participantEnrichmentService;
    private final RoleIdentificationService roleIdentificationService;
    private final TrackerPersistenceService persistenceService;
    private final FollowUpJobService followUpJobService;
    private final PlayerStateLockService playerStateLockService;
    private final ObjectMapper objectMapper;

    public static Transition decide(TrackedPlayer player, Optional<ActiveGameDTO> activeGame) {
        boolean inGame = player.getStatus() == PlayerStatus.IN_GAME;
        if (activeGame.isPresent()) {
            String gameId = String.valueOf(activeGame.get().getGameId());
            if (!inGame || !gameId.equals(player.getLastGameId())) {
                return Transition.NEW_GAME;
            }
            return Transition.ONGOING;
        }
        return inGame ? Transition.GAME_ENDED : Transition.NONE;
    }

    public Transition pollGameState(Long playerId, String puuid, String region) {
        if (puuid == null || puuid.isBlank()) {
            log.warn("⚠️ [GameState] Jogador {} sem PUUID, poll ignorado", playerId);
            return Transition.NONE;
        }

        Optional<TrackedPlayer> snapshot = trackedPlayerRepository.findById(playerId);
        if (snapshot.isEmpty()) {
            log.warn("⚠️ [GameState] Jogador {} não encontrado, poll ignorado", playerId);
            return Transition.NONE;
        }

        Optional<ActiveGameDTO> activeGame;
        try {
            activeGame = riotAPIService.getActiveGame(region, puuid);
        } catch (RiotApiException e) {
            if (e.isTransient()) {
                log.warn("⏳ [GameState] Riot API {} no poll do jogador {} ({}), fica para o próximo",
                        e.getStatusCode(), playerId, region);
                return Transition.NONE;
            }
            throw e;
        }

        if (decide(snapshot.get(), activeGame) == Transition.NONE) {
            return Transition.NONE;
        }

        if (!playerStateLockService.acquireStateLock(playerId)) {
            log.debug("⏳ [GameState] Transição do jogador {} já em andamento, pulando", playerId);
            return Transition.NONE;
        }
        try {
            // Relê dentro do lock: a limpeza de partidas presas pode ter mudado o estado
            TrackedPlayer player = trackedPlayerRepository.findById(playerId).orElse(null);
            if (player == null) {
                return Transition.NONE;
            }

            Transition transition = decide(player, activeGame);
            switch (transition) {
                case NEW_GAME -> handleNewGame(player, activeGame.get(), region);
                case ONGOING -> handleOngoing(player, activeGame.get());
                case GAME_ENDED -> handleGameEnded(player, puuid, region);
                case NONE -> {
                }
            }
            return transition;
        } finally {
            playerStateLockService.releaseStateLock(playerId);
        }
    }

    private void handleNewGame(TrackedPlayer player, ActiveGameDTO game, String region) {
        String gameId = String.valueOf(game.getGameId());
        log.info("🎮 [GameState] Nova partida para {} (ID: {})", player.getSummonerName(), gameId);

        List<EnrichedParticipantDTO> enriched = participantEnrichmentService.enrich(region, game.getParticipants());
        Map<String, LanePosition> roles = roleIdentificationService.identifyRoles(enriched);

        List<EnrichedParticipantDTO> withRoles = new ArrayList<>(enriched.size());
        for (int i = 0; i < enriched.size(); i++) {
            EnrichedParticipantDTO p = enriched.get(i);
            LanePosition role = roles.getOrDefault(RoleIdentificationService.participantKey(p, i),
                    LanePosition.MIDDLE);
            withRoles.add(p.toBuilder().inferredRole(role).build());
        }

        EnrichedGameDTO snapshot = EnrichedGameDTO.builder()
                .gameId(game.getGameId())
                .gameType(game.getGameType())
                .gameMode(game.getGameMode())
                .gameStartTime(game.getGameStartTime())
                .mapId(game.getMapId())
                .platformId(game.getPlatformId())
                .gameQueueConfigId(game.getGameQueueConfigId())
                .participants(withRoles)
                .build();

        Instant startedAt = game.getGameStartTime() != null && game.getGameStartTime() > 0
                ? Instant.ofEpochMilli(game.getGameStartTime())
                : Instant.now();

        persistenceService.recordNewGame(player.getId(), gameId, startedAt, toJson(snapshot));
    }

    // ONGOING só acontece com o jogador já in_game na mesma partida: nada a gravar
    private void handleOngoing(TrackedPlayer player, ActiveGameDTO game) {
        log.debug("♻️ [GameState] Partida {} já registrada para {}, sem novo enriquecimento", game.getGameId(),
                player.getSummonerName());
    }

    private void handleGameEnded(TrackedPlayer player, String puuid, String region) {
        String gameId = player.getLastGameId();
        persistenceService.recordGameEnded(player.getId(), gameId, Instant.now());

        if (gameId == null) {
            log.info("🔧 [GameState] {} estava in_game sem partida registrada, voltou para idle",
                    player.getSummonerName());
            return;
        }

        log.info("🏁 [GameState] Partida encerrada para {} (ID: {})", player.getSummonerName(), gameId);
        followUpJobService.enqueueGameEndFollowUps(player.getId(), puuid, region, gameId);
    }

    private String toJson(EnrichedGameDTO snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao serializar lobby da partida " + snapshot.getGameId(), e);
        }
    }
}
