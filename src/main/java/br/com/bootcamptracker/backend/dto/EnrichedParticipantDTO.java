package br.com.bootcamptracker.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Participante do lobby com o rank no momento da partida e a rota inferida.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedParticipantDTO {
    public static final String UNRANKED = "Unranked";

    private String puuid;
    private String riotId;
    private String summonerName;
    private String riotIdGameName;
    private String riotIdTagline;
    private Integer championId;
    private Integer spell1Id;
    private Integer spell2Id;
    private Integer teamId;
    private Integer profileIconId;
    private Boolean bot;

    // Rank de solo/duo no momento da partida
    private String rank;
    private String tier;
    private String division;
    private int leaguePoints;

    private LanePosition inferredRole;

    public static EnrichedParticipantDTO from(ActiveGameDTO.ParticipantDTO participant) {
        return EnrichedParticipantDTO.builder()
                .puuid(participant.getPuuid())
                .riotId(participant.getRiotId())
                .summonerName(participant.getSummonerName())
                .riotIdGameName(participant.getRiotIdGameName())
                .riotIdTagline(participant.getRiotIdTagline())
                .championId(participant.getChampionId())
                .spell1Id(participant.getSpell1Id())
                .spell2Id(participant.getSpell2Id())
                .teamId(participant.getTeamId())
                .profileIconId(participant.getProfileIconId())
                .bot(participant.getBot())
                .rank(UNRANKED)
                .build();
    }

    public boolean hasSpell(int spellId) {
        return (spell1Id != null && spell1Id == spellId) || (spell2Id != null && spell2Id == spellId);
    }
}
