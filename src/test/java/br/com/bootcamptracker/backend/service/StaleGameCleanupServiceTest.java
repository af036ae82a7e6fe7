package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.domain.entity.PlayerStatus;
import br.com.bootcamptracker.backend.domain.entity.TrackedPlayer;
import br.com.bootcamptracker.backend.domain.repository.TrackedPlayerRepository;
import br.com.bootcamptracker.backend.dto.ActiveGameDTO;
import br.com.bootcamptracker.backend.exception.RiotApiException;
import br.com.bootcamptracker.backend.service.lock.PlayerStateLockService;
import br.com.bootcamptracker.backend.service.riot.RiotAPIService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StaleGameCleanupServiceTest {

    private TrackedPlayerRepository trackedPlayerRepository;
    private RiotAPIService riotAPIService;
    private TrackerPersistenceService persistenceService;
    private PlayerStateLockService playerStateLockService;
    private StaleGameCleanupService cleanupService;

    @BeforeEach
    void setup() {
        trackedPlayerRepository = mock(TrackedPlayerRepository.class);
        riotAPIService = mock(RiotAPIService.class);
        persistenceService = mock(TrackerPersistenceService.class);
        playerStateLockService = mock(PlayerStateLockService.class);
        when(playerStateLockService.acquireStateLock(anyLong())).thenReturn(true);

        cleanupService = new StaleGameCleanupService(trackedPlayerRepository, riotAPIService, persistenceService,
                playerStateLockService);
    }

    @Test
    void testStuckPlayerIsMovedToIdle() {
        // given
        TrackedPlayer stuck = stuckPlayer(1L, "G1");
        givenInGame(stuck);
        when(riotAPIService.getActiveGame("kr", "puuid-1")).thenReturn(Optional.empty());

        // act
        int cleaned = cleanupService.cleanupStaleGames();

        // assert
        assertThat(cleaned).isEqualTo(1);
        verify(persistenceService).recordGameEnded(eq(1L), eq("G1"), any(Instant.class));
        verify(playerStateLockService).releaseStateLock(1L);
    }

    @Test
    void testPlayerStillInGameIsLeftAlone() {
        // given
        givenInGame(stuckPlayer(1L, "G1"));
        when(riotAPIService.getActiveGame("kr", "puuid-1"))
                .thenReturn(Optional.of(ActiveGameDTO.builder().gameId(1L).build()));

        // act
        int cleaned = cleanupService.cleanupStaleGames();

        // assert
        assertThat(cleaned).isZero();
        verifyNoInteractions(persistenceService, playerStateLockService);
    }

    @Test
    void testOnePlayerFailureDoesNotStopTheRest() {
        // given
        givenInGame(stuckPlayer(1L, "G1"), stuckPlayer(2L, "G2"), stuckPlayer(3L, "G3"));
        when(riotAPIService.getActiveGame("kr", "puuid-1")).thenThrow(new RuntimeException("boom"));
        when(riotAPIService.getActiveGame("kr", "puuid-2"))
                .thenThrow(new RiotApiException(429, "/lol/spectator", "Too Many Requests"));
        when(riotAPIService.getActiveGame("kr", "puuid-3")).thenReturn(Optional.empty());

        // act
        int cleaned = cleanupService.cleanupStaleGames();

        // assert
        assertThat(cleaned).isEqualTo(1);
        verify(persistenceService).recordGameEnded(eq(3L), eq("G3"), any(Instant.class));
        verify(persistenceService, never()).recordGameEnded(eq(1L), any(), any());
        verify(persistenceService, never()).recordGameEnded(eq(2L), any(), any());
    }

    @Test
    void testSkipsPlayerWhoseTransitionIsInProgress() {
        // given
        givenInGame(stuckPlayer(1L, "G1"));
        when(riotAPIService.getActiveGame("kr", "puuid-1")).thenReturn(Optional.empty());
        when(playerStateLockService.acquireStateLock(1L)).thenReturn(false);

        // act
        int cleaned = cleanupService.cleanupStaleGames();

        // assert
        assertThat(cleaned).isZero();
        verifyNoInteractions(persistenceService);
    }

    @Test
    void testSkipsPlayerAlreadyIdleAfterLock() {
        // given
        givenInGame(stuckPlayer(1L, "G1"));
        TrackedPlayer idle = stuckPlayer(1L, "G1");
        idle.setStatus(PlayerStatus.IDLE);
        when(trackedPlayerRepository.findById(1L)).thenReturn(Optional.of(idle));
        when(riotAPIService.getActiveGame("kr", "puuid-1")).thenReturn(Optional.empty());

        // act
        int cleaned = cleanupService.cleanupStaleGames();

        // assert
        assertThat(cleaned).isZero();
        verifyNoInteractions(persistenceService);
    }

    @Test
    void testKeepsGameRecordedAfterUpstreamCheck() {
        // given
        givenInGame(stuckPlayer(1L, "G1"));
        when(riotAPIService.getActiveGame("kr", "puuid-1")).thenReturn(Optional.empty());
        when(trackedPlayerRepository.findById(1L)).thenReturn(Optional.of(stuckPlayer(1L, "G2")));

        // act
        int cleaned = cleanupService.cleanupStaleGames();

        // assert
        assertThat(cleaned).isZero();
        verify(persistenceService, never()).recordGameEnded(anyLong(), any(), any());
        verify(playerStateLockService).releaseStateLock(1L);
    }

    private void givenInGame(TrackedPlayer... players) {
        when(trackedPlayerRepository.findByStatus(PlayerStatus.IN_GAME)).thenReturn(List.of(players));
        for (TrackedPlayer p : players) {
            when(trackedPlayerRepository.findById(p.getId())).thenReturn(Optional.of(p));
        }
    }

    private static TrackedPlayer stuckPlayer(Long id, String lastGameId) {
        return TrackedPlayer.builder()
                .id(id)
                .summonerName("player" + id)
                .puuid("puuid-" + id)
                .region("kr")
                .status(PlayerStatus.IN_GAME)
                .lastGameId(lastGameId)
                .build();
    }
}
