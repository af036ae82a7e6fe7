package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.dto.EnrichedParticipantDTO;
import br.com.bootcamptracker.backend.dto.LanePosition;
import br.com.bootcamptracker.backend.dto.RolePlayrates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Inferência da rota de cada participante de uma partida ao vivo.
 * <p>
 * 1. Quem tem Smite é JUNGLE.
 * 2. Para o resto de cada time, monta a matriz jogador × {TOP, MIDDLE,
 * BOTTOM, UTILITY} com a playrate do campeão (25% em cada rota se
 * desconhecido) e aplica os bônus dos feitiços.
 * 3. Atribuição gulosa: maior probabilidade restante da matriz, sem
 * backtracking. Empate fica com o primeiro na ordem de varredura.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleIdentificationService {

    static final int SMITE = 11;
    static final int HEAL = 7;
    static final int EXHAUST = 3;
    static final int[] TELEPORT = { 12, 14 };
    // 14 conta como Teleport e como Ignite
    static final int IGNITE = 14;

    static final int[] TEAMS = { 100, 200 };
    private static final double DEFAULT_PLAYRATE = 25.0;

    // Ordem de varredura das colunas da matriz
    private static final List<LanePosition> MATRIX_ROLES = List.of(
            LanePosition.TOP, LanePosition.MIDDLE, LanePosition.BOTTOM, LanePosition.UTILITY);

    private final ChampionPlayrateService championPlayrateService;

    /**
     * @return chave do participante ({@link #participantKey}) → rota
     */
    public Map<String, LanePosition> identifyRoles(List<EnrichedParticipantDTO> participants) {
        Map<Integer, RolePlayrates> playrates;
        try {
            playrates = championPlayrateService.getPlayrateMap();
        } catch (DataAccessException e) {
            log.warn("⚠️ [RoleIdentification] Playrates indisponíveis, usando só os feitiços: {}", e.getMessage());
            playrates = Collections.emptyMap();
        }
        return assignRoles(participants, playrates);
    }

    /**
     * Chave estável do participante: puuid, ou a posição no lobby quando a
     * Spectator não informa puuid.
     */
    public static String participantKey(EnrichedParticipantDTO participant, int index) {
        String puuid = participant.getPuuid();
        return (puuid != null && !puuid.isBlank()) ? puuid : "slot-" + index;
    }

    static Map<String, LanePosition> assignRoles(List<EnrichedParticipantDTO> participants,
            Map<Integer, RolePlayrates> playrates) {
        Map<String, LanePosition> assignments = new LinkedHashMap<>();

        for (int i = 0; i < participants.size(); i++) {
            EnrichedParticipantDTO p = participants.get(i);
            if (p.hasSpell(SMITE)) {
                assignments.put(participantKey(p, i), LanePosition.JUNGLE);
                log.debug("✅ JUNGLE (Smite): campeão {}", p.getChampionId());
            }
        }

        for (int teamId : TEAMS) {
            List<String> keys = new ArrayList<>();
            List<double[]> matrix = new ArrayList<>();

            for (int i = 0; i < participants.size(); i++) {
                EnrichedParticipantDTO p = participants.get(i);
                String key = participantKey(p, i);
                if (!Objects.equals(p.getTeamId(), teamId) || assignments.containsKey(key)) {
                    continue;
                }
                keys.add(key);
                matrix.add(probabilities(p, playrates));
            }

            if (keys.isEmpty()) {
                continue;
            }

            greedyAssign(keys, matrix, assignments);
            validateTeam(teamId, participants, assignments);
        }

        return assignments;
    }

    /**
     * Linha da matriz na ordem de {@link #MATRIX_ROLES}.
     */
    static double[] probabilities(EnrichedParticipantDTO p, Map<Integer, RolePlayrates> playrates) {
        RolePlayrates rates = p.getChampionId() != null ? playrates.get(p.getChampionId()) : null;

        double top = rates != null ? rates.top() : DEFAULT_PLAYRATE;
        double mid = rates != null ? rates.mid() : DEFAULT_PLAYRATE;
        double bottom = rates != null ? rates.adc() : DEFAULT_PLAYRATE;
        double utility = rates != null ? rates.support() : DEFAULT_PLAYRATE;

        if (p.hasSpell(HEAL)) {
            bottom *= 3;
        }
        if (p.hasSpell(EXHAUST)) {
            utility *= 2.5;
        }
        if (p.hasSpell(TELEPORT[0]) || p.hasSpell(TELEPORT[1])) {
            top *= 2;
        }
        if (p.hasSpell(IGNITE)) {
            mid *= 1.5;
            utility *= 1.3;
        }

        return new double[] { top, mid, bottom, utility };
    }

    private static void greedyAssign(List<String> keys, List<double[]> matrix, Map<String, LanePosition> out) {
        List<Integer> remainingPlayers = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            remainingPlayers.add(i);
        }
        List<Integer> remainingRoles = new ArrayList<>(List.of(0, 1, 2, 3));

        while (!remainingPlayers.isEmpty() && !remainingRoles.isEmpty()) {
            double max = -1;
            int bestPlayer = -1;
            int bestRole = -1;

            for (int player : remainingPlayers) {
                for (int role : remainingRoles) {
                    double prob = matrix.get(player)[role];
                    if (prob > max) {
                        max = prob;
                        bestPlayer = player;
                        bestRole = role;
                    }
                }
            }

            if (bestPlayer == -1) {
                break;
            }

            LanePosition lane = MATRIX_ROLES.get(bestRole);
            out.put(keys.get(bestPlayer), lane);
            log.debug("  ✓ {}: {} ({}%)", lane, keys.get(bestPlayer), String.format("%.2f", max));

            remainingPlayers.remove(Integer.valueOf(bestPlayer));
            remainingRoles.remove(Integer.valueOf(bestRole));
        }
    }

    private static void validateTeam(int teamId, List<EnrichedParticipantDTO> participants,
            Map<String, LanePosition> assignments) {
        Set<LanePosition> roles = EnumSet.noneOf(LanePosition.class);
        int assigned = 0;
        for (int i = 0; i < participants.size(); i++) {
            EnrichedParticipantDTO p = participants.get(i);
            LanePosition role = assignments.get(participantKey(p, i));
            if (Objects.equals(p.getTeamId(), teamId) && role != null) {
                roles.add(role);
                assigned++;
            }
        }

        if (roles.size() != 5 || assigned != 5) {
            log.warn("⚠️ [RoleIdentification] Time {} com {} rotas distintas para {} jogadores: {}", teamId,
                    roles.size(), assigned, roles);
        } else {
            log.debug("✅ [RoleIdentification] Time {}: {}", teamId, roles);
        }
    }
}
