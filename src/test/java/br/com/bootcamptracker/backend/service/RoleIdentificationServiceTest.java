package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.dto.EnrichedParticipantDTO;
import br.com.bootcamptracker.backend.dto.LanePosition;
import br.com.bootcamptracker.backend.dto.RolePlayrates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class RoleIdentificationServiceTest {

    private static final int FLASH = 4;

    private ChampionPlayrateService championPlayrateService;
    private RoleIdentificationService roleIdentificationService;

    @BeforeEach
    void setup() {
        championPlayrateService = mock(ChampionPlayrateService.class);
        when(championPlayrateService.getPlayrateMap()).thenReturn(Map.of());
        roleIdentificationService = new RoleIdentificationService(championPlayrateService);
    }

    @Test
    void testSmiteHolderIsJungle() {
        // given
        List<EnrichedParticipantDTO> team = List.of(
                participant("a", 100, 1, FLASH, 14),
                participant("b", 100, 2, FLASH, 11),
                participant("c", 100, 3, FLASH, 7),
                participant("d", 100, 4, FLASH, 3),
                participant("e", 100, 5, FLASH, 12));

        // act
        Map<String, LanePosition> roles = roleIdentificationService.identifyRoles(team);

        // assert
        assertThat(roles.get("b")).isEqualTo(LanePosition.JUNGLE);
        assertThat(roles.values()).containsOnlyOnce(LanePosition.JUNGLE);
    }

    @Test
    void testSpellsDecideRolesWithoutPlayrates() {
        // given
        List<EnrichedParticipantDTO> team = List.of(
                participant("jungle", 100, 1, 11, FLASH),
                participant("top", 100, 2, 12, FLASH),
                participant("mid", 100, 3, 14, FLASH),
                participant("adc", 100, 4, 7, FLASH),
                participant("support", 100, 5, 3, FLASH));

        // act
        Map<String, LanePosition> roles = RoleIdentificationService.assignRoles(team, Map.of());

        // assert
        assertThat(roles).containsEntry("jungle", LanePosition.JUNGLE)
                .containsEntry("top", LanePosition.TOP)
                .containsEntry("mid", LanePosition.MIDDLE)
                .containsEntry("adc", LanePosition.BOTTOM)
                .containsEntry("support", LanePosition.UTILITY);
    }

    @Test
    void testPlayratesDecideWhenSpellsAreNeutral() {
        // given
        Map<Integer, RolePlayrates> playrates = Map.of(
                10, new RolePlayrates(5, 0, 90, 3, 2),
                20, new RolePlayrates(1, 0, 4, 85, 10),
                30, new RolePlayrates(2, 1, 3, 4, 70),
                40, new RolePlayrates(60, 5, 20, 1, 1));
        List<EnrichedParticipantDTO> team = List.of(
                participant("support", 100, 30, FLASH, 21),
                participant("adc", 100, 20, FLASH, 21),
                participant("jungle", 100, 50, 11, FLASH),
                participant("top", 100, 40, FLASH, 21),
                participant("mid", 100, 10, FLASH, 21));

        // act
        Map<String, LanePosition> roles = RoleIdentificationService.assignRoles(team, playrates);

        // assert
        assertThat(roles).containsEntry("top", LanePosition.TOP)
                .containsEntry("mid", LanePosition.MIDDLE)
                .containsEntry("adc", LanePosition.BOTTOM)
                .containsEntry("support", LanePosition.UTILITY)
                .containsEntry("jungle", LanePosition.JUNGLE);
    }

    @Test
    void testTiesGoToFirstPlayerInScanOrder() {
        // given
        List<EnrichedParticipantDTO> team = List.of(
                participant("p0", 100, 1, 11, FLASH),
                participant("p1", 100, 2, FLASH, 21),
                participant("p2", 100, 3, FLASH, 21),
                participant("p3", 100, 4, FLASH, 21),
                participant("p4", 100, 5, FLASH, 21));

        // act
        Map<String, LanePosition> roles = RoleIdentificationService.assignRoles(team, Map.of());

        // assert
        assertThat(roles).containsEntry("p1", LanePosition.TOP)
                .containsEntry("p2", LanePosition.MIDDLE)
                .containsEntry("p3", LanePosition.BOTTOM)
                .containsEntry("p4", LanePosition.UTILITY);
    }

    @Test
    void testParticipantsWithoutPuuidUseLobbySlot() {
        // given
        EnrichedParticipantDTO anonymous = participant(null, 100, 1, 11, FLASH);

        // act
        Map<String, LanePosition> roles = RoleIdentificationService.assignRoles(List.of(anonymous), Map.of());

        // assert
        assertThat(roles).containsEntry("slot-0", LanePosition.JUNGLE);
    }

    @Test
    void testPlayrateStoreFailureFallsBackToSpells() {
        // given
        when(championPlayrateService.getPlayrateMap()).thenThrow(new DataAccessResourceFailureException("down"));
        List<EnrichedParticipantDTO> team = List.of(
                participant("a", 100, 1, 11, FLASH),
                participant("b", 100, 2, 12, FLASH),
                participant("c", 100, 3, 14, FLASH),
                participant("d", 100, 4, 7, FLASH),
                participant("e", 100, 5, 3, FLASH));

        // act
        Map<String, LanePosition> roles = roleIdentificationService.identifyRoles(team);

        // assert
        assertThat(new HashSet<>(roles.values())).hasSize(5);
    }

    @Test
    void testEveryTeamGetsFiveDistinctRoles() {
        // given
        Random random = new Random(42);
        int[] spells = { 1, 3, 4, 6, 7, 12, 14, 21 };

        for (int round = 0; round < 200; round++) {
            Map<Integer, RolePlayrates> playrates = new HashMap<>();
            List<EnrichedParticipantDTO> lobby = new ArrayList<>();
            for (int teamId : new int[] { 100, 200 }) {
                int smiteSlot = random.nextInt(5);
                for (int slot = 0; slot < 5; slot++) {
                    int championId = random.nextInt(160) + 1;
                    if (random.nextBoolean()) {
                        playrates.put(championId, new RolePlayrates(random.nextDouble() * 100,
                                random.nextDouble() * 100, random.nextDouble() * 100, random.nextDouble() * 100,
                                random.nextDouble() * 100));
                    }
                    int spell2 = slot == smiteSlot ? 11 : spells[random.nextInt(spells.length)];
                    lobby.add(participant("r" + round + "-t" + teamId + "-" + slot, teamId, championId,
                            FLASH, spell2));
                }
            }

            // act
            Map<String, LanePosition> roles = RoleIdentificationService.assignRoles(lobby, playrates);

            // assert
            for (int teamId : new int[] { 100, 200 }) {
                Set<LanePosition> teamRoles = EnumSet.noneOf(LanePosition.class);
                for (EnrichedParticipantDTO p : lobby) {
                    if (p.getTeamId() == teamId) {
                        teamRoles.add(roles.get(p.getPuuid()));
                    }
                }
                assertThat(teamRoles).containsExactlyInAnyOrder(LanePosition.values());
            }
        }
    }

    private static EnrichedParticipantDTO participant(String puuid, int teamId, int championId, int spell1,
            int spell2) {
        return EnrichedParticipantDTO.builder()
                .puuid(puuid)
                .teamId(teamId)
                .championId(championId)
                .spell1Id(spell1)
                .spell2Id(spell2)
                .rank(EnrichedParticipantDTO.UNRANKED)
                .build();
    }
}
