package br.com.bootcamptracker.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Partida ao vivo devolvida pela Spectator-V5.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActiveGameDTO {
    private Long gameId;
    private String gameType;
    private Long gameStartTime;
    private Long mapId;
    private Long gameLength;
    private String platformId;
    private String gameMode;
    private Long gameQueueConfigId;
    @Builder.Default
    private List<ParticipantDTO> participants = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ParticipantDTO {
        private Integer teamId;
        private Integer spell1Id;
        private Integer spell2Id;
        private Integer championId;
        private Integer profileIconId;
        private String puuid;
        private String riotId;
        private String summonerName;
        private String riotIdGameName;
        private String riotIdTagline;
        private Boolean bot;

        /**
         * Melhor nome disponível (a Spectator-V5 nem sempre traz todos)
         */
        public String getDisplayName() {
            if (summonerName != null && !summonerName.isBlank())
                return summonerName;
            if (riotIdGameName != null && !riotIdGameName.isBlank())
                return riotIdGameName;
            if (riotId != null && !riotId.isBlank())
                return riotId;
            return "Unknown";
        }
    }
}
