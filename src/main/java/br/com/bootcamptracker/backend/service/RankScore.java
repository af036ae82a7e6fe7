package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.domain.entity.PeakRank;

import java.util.Map;

/**
 * Pontuação comparável de um rank: tier*1000 + divisão*100 + LP.
 * Master ou acima não tem divisão, então compara só tier e LP.
 */
public final class RankScore {

    private static final Map<String, Integer> TIER_ORDER = Map.of(
            "CHALLENGER", 8,
            "GRANDMASTER", 7,
            "MASTER", 6,
            "DIAMOND", 5,
            "EMERALD", 4,
            "PLATINUM", 3,
            "GOLD", 2,
            "SILVER", 1,
            "BRONZE", 0,
            "IRON", -1);

    private static final Map<String, Integer> DIVISION_ORDER = Map.of(
            "I", 4,
            "II", 3,
            "III", 2,
            "IV", 1);

    private static final int MASTER_TIER_VALUE = 6;

    /** Pontuação de um pico inexistente: qualquer rank observado é maior. */
    public static final int NO_PEAK = -1;

    private RankScore() {
    }

    public static int score(String tier, String division, int leaguePoints) {
        int tierValue = tier == null ? 0 : TIER_ORDER.getOrDefault(tier.toUpperCase(), 0);
        int divisionValue = division == null ? 0 : DIVISION_ORDER.getOrDefault(division.toUpperCase(), 0);

        if (tierValue >= MASTER_TIER_VALUE) {
            return tierValue * 1000 + leaguePoints;
        }
        return tierValue * 1000 + divisionValue * 100 + leaguePoints;
    }

    public static int score(PeakRank peak) {
        if (peak == null || !peak.isComplete()) {
            return NO_PEAK;
        }
        return score(peak.getTier(), peak.getDivision(), peak.getLeaguePoints());
    }
}
