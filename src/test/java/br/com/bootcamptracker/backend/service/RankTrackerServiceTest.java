package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.domain.entity.CurrentRank;
import br.com.bootcamptracker.backend.domain.entity.PeakRank;
import br.com.bootcamptracker.backend.domain.entity.TrackedPlayer;
import br.com.bootcamptracker.backend.dto.LeagueEntryDTO;
import br.com.bootcamptracker.backend.exception.RiotApiException;
import br.com.bootcamptracker.backend.service.riot.RiotAPIService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RankTrackerServiceTest {

    private RiotAPIService riotAPIService;
    private TrackerPersistenceService persistenceService;
    private RankTrackerService rankTrackerService;
    private TrackedPlayer player;

    @BeforeEach
    void setup() {
        riotAPIService = mock(RiotAPIService.class);
        persistenceService = mock(TrackerPersistenceService.class);
        rankTrackerService = new RankTrackerService(riotAPIService, persistenceService);

        player = TrackedPlayer.builder()
                .id(1L)
                .summonerName("Faker")
                .puuid("puuid-1")
                .region("kr")
                .build();

        // Aplica a mutação no jogador em memória, como a transação faria
        when(persistenceService.updatePlayer(eq(1L), any())).thenAnswer(inv -> {
            Predicate<TrackedPlayer> mutation = inv.getArgument(1);
            return mutation.test(player);
        });
    }

    @Test
    void testCurrentRankIsOverwrittenOnSuccess() {
        // given
        player.setCurrentSolo(rank("SILVER", "I", 90));
        player.setRankUpdatedAt(Instant.parse("2026-10-01T00:00:00Z"));
        givenEntries(solo("GOLD", "IV", 12, 30, 20));

        // act
        rankTrackerService.updateCurrentRank(1L, "puuid-1", "kr");

        // assert
        assertThat(player.getCurrentSolo().getTier()).isEqualTo("GOLD");
        assertThat(player.getCurrentSolo().getDivision()).isEqualTo("IV");
        assertThat(player.getCurrentSolo().getLeaguePoints()).isEqualTo(12);
        assertThat(player.getCurrentSolo().getWins()).isEqualTo(30);
        assertThat(player.getCurrentFlex()).isNull();
        assertThat(player.getRankUpdatedAt()).isAfter(Instant.parse("2026-10-01T00:00:00Z"));
    }

    @Test
    void testUnrankedPlayerStaysUnranked() {
        // given
        givenEntries();

        // act
        rankTrackerService.updateCurrentRank(1L, "puuid-1", "kr");

        // assert
        assertThat(player.getCurrentSolo()).isNull();
        assertThat(player.getCurrentFlex()).isNull();
        assertThat(player.getRankUpdatedAt()).isNotNull();
    }

    @Test
    void testEstablishedRankSurvivesEmptyResponse() {
        // given
        player.setCurrentSolo(rank("GOLD", "II", 40));
        player.setRankUpdatedAt(Instant.parse("2026-10-01T00:00:00Z"));
        givenEntries();

        // act
        rankTrackerService.updateCurrentRank(1L, "puuid-1", "kr");

        // assert
        assertThat(player.getCurrentSolo().getTier()).isEqualTo("GOLD");
        assertThat(player.getCurrentSolo().getLeaguePoints()).isEqualTo(40);
    }

    @Test
    void testServerErrorKeepsCurrentRank() {
        // given
        player.setCurrentSolo(rank("GOLD", "II", 40));
        Instant checkedAt = Instant.parse("2026-10-01T00:00:00Z");
        player.setRankUpdatedAt(checkedAt);
        when(riotAPIService.getLeagueEntries("kr", "puuid-1"))
                .thenThrow(new RiotApiException(503, "/lol/league", "Service Unavailable"));

        // act
        rankTrackerService.updateCurrentRank(1L, "puuid-1", "kr");

        // assert
        assertThat(player.getCurrentSolo().getTier()).isEqualTo("GOLD");
        assertThat(player.getRankUpdatedAt()).isEqualTo(checkedAt);
        verify(persistenceService, never()).updatePlayer(any(), any());
    }

    @Test
    void testRateLimitSkipsPeakUpdate() {
        // given
        when(riotAPIService.getLeagueEntries("kr", "puuid-1"))
                .thenThrow(new RiotApiException(429, "/lol/league", "Too Many Requests"));

        // act
        rankTrackerService.updatePeakRank(1L, "puuid-1", "kr");

        // assert
        verify(persistenceService, never()).updatePlayer(any(), any());
    }

    @Test
    void testForbiddenErrorFailsTheJob() {
        // given
        when(riotAPIService.getLeagueEntries("kr", "puuid-1"))
                .thenThrow(new RiotApiException(403, "/lol/league", "Forbidden"));

        // act & assert
        assertThatThrownBy(() -> rankTrackerService.updateCurrentRank(1L, "puuid-1", "kr"))
                .isInstanceOf(RiotApiException.class);
    }

    @Test
    void testPeakOnlyMovesUp() {
        // given
        List<List<LeagueEntryDTO>> observations = List.of(
                List.of(solo("GOLD", "II", 40, 10, 10)),
                List.of(solo("SILVER", "I", 90, 10, 11)),
                List.of(solo("GOLD", "I", 10, 11, 11)),
                List.of(),
                List.of(solo("GOLD", "I", 5, 11, 12)));
        int previous = RankScore.NO_PEAK;

        for (List<LeagueEntryDTO> entries : observations) {
            givenEntries(entries.toArray(new LeagueEntryDTO[0]));

            // act
            rankTrackerService.updatePeakRank(1L, "puuid-1", "kr");

            // assert
            int current = RankScore.score(player.getPeakSolo());
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }

        assertThat(player.getPeakSolo().getTier()).isEqualTo("GOLD");
        assertThat(player.getPeakSolo().getDivision()).isEqualTo("I");
        assertThat(player.getPeakSolo().getLeaguePoints()).isEqualTo(10);
        assertThat(player.getPeakFlex()).isNull();
    }

    @Test
    void testFirstPeakCheckStampsTimestampEvenWithoutRank() {
        // given
        givenEntries();

        // act
        rankTrackerService.updatePeakRank(1L, "puuid-1", "kr");

        // assert
        assertThat(player.getPeakUpdatedAt()).isNotNull();
        assertThat(player.getPeakSolo()).isNull();
    }

    @Test
    void testEqualPeakIsNotRewritten() {
        // given
        Instant stamped = Instant.parse("2026-10-01T00:00:00Z");
        player.setPeakSolo(PeakRank.builder().tier("GOLD").division("II").leaguePoints(40).build());
        player.setPeakUpdatedAt(stamped);

        // act
        boolean changed = RankTrackerService.applyPeakRank(player, List.of(solo("GOLD", "II", 40, 1, 1)),
                Instant.now());

        // assert
        assertThat(changed).isFalse();
        assertThat(player.getPeakUpdatedAt()).isEqualTo(stamped);
    }

    @Test
    void testFlexPeakTrackedSeparately() {
        // given
        LeagueEntryDTO flex = LeagueEntryDTO.builder()
                .queueType("RANKED_FLEX_SR").tier("PLATINUM").rank("III").leaguePoints(20).build();
        player.setPeakSolo(PeakRank.builder().tier("DIAMOND").division("IV").leaguePoints(0).build());
        player.setPeakUpdatedAt(Instant.parse("2026-10-01T00:00:00Z"));

        // act
        boolean changed = RankTrackerService.applyPeakRank(player, List.of(solo("GOLD", "I", 0, 1, 1), flex),
                Instant.now());

        // assert
        assertThat(changed).isTrue();
        assertThat(player.getPeakSolo().getTier()).isEqualTo("DIAMOND");
        assertThat(player.getPeakFlex().getTier()).isEqualTo("PLATINUM");
    }

    private void givenEntries(LeagueEntryDTO... entries) {
        when(riotAPIService.getLeagueEntries("kr", "puuid-1")).thenReturn(List.of(entries));
    }

    private static LeagueEntryDTO solo(String tier, String division, int lp, int wins, int losses) {
        return LeagueEntryDTO.builder()
                .queueType("RANKED_SOLO_5x5")
                .tier(tier)
                .rank(division)
                .leaguePoints(lp)
                .wins(wins)
                .losses(losses)
                .build();
    }

    private static CurrentRank rank(String tier, String division, int lp) {
        return CurrentRank.builder().tier(tier).division(division).leaguePoints(lp).wins(0).losses(0).build();
    }
}
