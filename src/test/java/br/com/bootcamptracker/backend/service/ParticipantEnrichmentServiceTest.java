package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.dto.ActiveGameDTO;
import br.com.bootcamptracker.backend.dto.EnrichedParticipantDTO;
import br.com.bootcamptracker.backend.dto.LeagueEntryDTO;
import br.com.bootcamptracker.backend.exception.RiotApiException;
import br.com.bootcamptracker.backend.service.riot.RiotAPIService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ParticipantEnrichmentServiceTest {

    private RiotAPIService riotAPIService;
    private ExecutorService executor;
    private ParticipantEnrichmentService enrichmentService;

    @BeforeEach
    void setup() {
        riotAPIService = mock(RiotAPIService.class);
        executor = Executors.newFixedThreadPool(4);
        enrichmentService = new ParticipantEnrichmentService(riotAPIService, executor);

        when(riotAPIService.getLeagueEntries(eq("kr"), anyString())).thenReturn(List.of(
                LeagueEntryDTO.builder().queueType("RANKED_FLEX_SR").tier("SILVER").rank("I").leaguePoints(10).build(),
                LeagueEntryDTO.builder().queueType("RANKED_SOLO_5x5").tier("GOLD").rank("II").leaguePoints(40)
                        .build()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testOneFailingLookupDoesNotAffectOthers() {
        // given
        List<ActiveGameDTO.ParticipantDTO> lobby = lobby(10);
        when(riotAPIService.getLeagueEntries("kr", "p-3"))
                .thenThrow(new RiotApiException(500, "/lol/league", "Internal Server Error"));

        // act
        List<EnrichedParticipantDTO> enriched = enrichmentService.enrich("kr", lobby);

        // assert
        assertThat(enriched).hasSize(10);
        assertThat(enriched).extracting(EnrichedParticipantDTO::getPuuid)
                .containsExactly("p-0", "p-1", "p-2", "p-3", "p-4", "p-5", "p-6", "p-7", "p-8", "p-9");

        EnrichedParticipantDTO failed = enriched.get(3);
        assertThat(failed.getRank()).isEqualTo(EnrichedParticipantDTO.UNRANKED);
        assertThat(failed.getTier()).isNull();
        assertThat(failed.getLeaguePoints()).isZero();

        EnrichedParticipantDTO ok = enriched.get(0);
        assertThat(ok.getRank()).isEqualTo("GOLD II");
        assertThat(ok.getTier()).isEqualTo("GOLD");
        assertThat(ok.getDivision()).isEqualTo("II");
        assertThat(ok.getLeaguePoints()).isEqualTo(40);
        assertThat(ok.getChampionId()).isEqualTo(100);
    }

    @Test
    void testFlexOnlyPlayerIsUnranked() {
        // given
        when(riotAPIService.getLeagueEntries("kr", "p-0")).thenReturn(List.of(
                LeagueEntryDTO.builder().queueType("RANKED_FLEX_SR").tier("SILVER").rank("I").leaguePoints(10)
                        .build()));

        // act
        List<EnrichedParticipantDTO> enriched = enrichmentService.enrich("kr", lobby(1));

        // assert
        assertThat(enriched.get(0).getRank()).isEqualTo(EnrichedParticipantDTO.UNRANKED);
    }

    @Test
    void testParticipantWithoutPuuidIsNotLookedUp() {
        // given
        ActiveGameDTO.ParticipantDTO bot = ActiveGameDTO.ParticipantDTO.builder()
                .teamId(100)
                .championId(1)
                .bot(true)
                .build();

        // act
        List<EnrichedParticipantDTO> enriched = enrichmentService.enrich("kr", List.of(bot));

        // assert
        assertThat(enriched.get(0).getRank()).isEqualTo(EnrichedParticipantDTO.UNRANKED);
        verify(riotAPIService, never()).getLeagueEntries(anyString(), anyString());
    }

    private static List<ActiveGameDTO.ParticipantDTO> lobby(int size) {
        List<ActiveGameDTO.ParticipantDTO> participants = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            participants.add(ActiveGameDTO.ParticipantDTO.builder()
                    .teamId(i < 5 ? 100 : 200)
                    .championId(100 + i)
                    .spell1Id(4)
                    .spell2Id(14)
                    .puuid("p-" + i)
                    .summonerName("summoner" + i)
                    .build());
        }
        return participants;
    }
}
