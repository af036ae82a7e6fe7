package br.com.bootcamptracker.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Snapshot do lobby gravado na GameSession quando a partida é detectada.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedGameDTO {
    private Long gameId;
    private String gameType;
    private String gameMode;
    private Long gameStartTime;
    private Long mapId;
    private String platformId;
    private Long gameQueueConfigId;
    private List<EnrichedParticipantDTO> participants;
}
