package br.com.bootcamptracker.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "game_sessions", uniqueConstraints = @UniqueConstraint(name = "uk_game_session_game_player", columnNames = {
        "riot_game_id", "tracked_player_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameSession {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "riot_game_id", nullable = false, length = 50)
    private String externalGameId;

    @Column(name = "tracked_player_id", nullable = false)
    private Long trackedPlayerId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private GameSessionStatus status;

    // JSON do lobby enriquecido (participantes + rank + role), gravado uma vez
    @Column(name = "enriched_roster", columnDefinition = "LONGTEXT")
    private String enrichedRosterJson;

    // JSON completo da Match-V5, buscado depois que o jogo termina
    @Column(name = "match_detail", columnDefinition = "LONGTEXT")
    private String matchDetailJson;
}
