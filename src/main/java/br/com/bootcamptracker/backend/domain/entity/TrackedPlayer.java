package br.com.bootcamptracker.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Jogador acompanhado. Com {@link DynamicUpdate} cada job grava só as colunas
 * que alterou (rank, nome, estado de jogo).
 */
@Entity
@DynamicUpdate
@Table(name = "tracked_players")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackedPlayer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "riot_id")
    private String riotId; // gameName#tagLine

    @Column(name = "summoner_name", nullable = false)
    private String summonerName;

    @Column(name = "puuid", nullable = false, length = 100)
    private String puuid;

    @Column(name = "region", nullable = false, length = 10)
    private String region;

    @Column(name = "twitch_login")
    private String twitchLogin;

    @Column(name = "twitch_user_id")
    private String twitchUserId;

    // Janela de acompanhamento do bootcamp
    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "planned_end_date", nullable = false)
    private LocalDate plannedEndDate;

    @Column(name = "actual_end_date")
    private LocalDate actualEndDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PlayerStatus status;

    @Column(name = "last_game_id")
    private String lastGameId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "tier", column = @Column(name = "current_solo_tier", length = 20)),
            @AttributeOverride(name = "division", column = @Column(name = "current_solo_rank", length = 5)),
            @AttributeOverride(name = "leaguePoints", column = @Column(name = "current_solo_lp")),
            @AttributeOverride(name = "wins", column = @Column(name = "current_solo_wins")),
            @AttributeOverride(name = "losses", column = @Column(name = "current_solo_losses"))
    })
    private CurrentRank currentSolo;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "tier", column = @Column(name = "current_flex_tier", length = 20)),
            @AttributeOverride(name = "division", column = @Column(name = "current_flex_rank", length = 5)),
            @AttributeOverride(name = "leaguePoints", column = @Column(name = "current_flex_lp")),
            @AttributeOverride(name = "wins", column = @Column(name = "current_flex_wins")),
            @AttributeOverride(name = "losses", column = @Column(name = "current_flex_losses"))
    })
    private CurrentRank currentFlex;

    @Column(name = "rank_updated_at")
    private Instant rankUpdatedAt;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "tier", column = @Column(name = "peak_solo_tier", length = 20)),
            @AttributeOverride(name = "division", column = @Column(name = "peak_solo_rank", length = 5)),
            @AttributeOverride(name = "leaguePoints", column = @Column(name = "peak_solo_lp"))
    })
    private PeakRank peakSolo;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "tier", column = @Column(name = "peak_flex_tier", length = 20)),
            @AttributeOverride(name = "division", column = @Column(name = "peak_flex_rank", length = 5)),
            @AttributeOverride(name = "leaguePoints", column = @Column(name = "peak_flex_lp"))
    })
    private PeakRank peakFlex;

    @Column(name = "peak_updated_at")
    private Instant peakUpdatedAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public CurrentRank getCurrentRank(RankQueue queue) {
        return queue == RankQueue.SOLO ? currentSolo : currentFlex;
    }

    public void setCurrentRank(RankQueue queue, CurrentRank rank) {
        if (queue == RankQueue.SOLO) {
            currentSolo = rank;
        } else {
            currentFlex = rank;
        }
    }

    public PeakRank getPeakRank(RankQueue queue) {
        return queue == RankQueue.SOLO ? peakSolo : peakFlex;
    }

    public void setPeakRank(RankQueue queue, PeakRank rank) {
        if (queue == RankQueue.SOLO) {
            peakSolo = rank;
        } else {
            peakFlex = rank;
        }
    }

    public boolean hasTwitch() {
        return twitchUserId != null && !twitchUserId.isBlank()
                && twitchLogin != null && !twitchLogin.isBlank();
    }

    public boolean hasPuuid() {
        return puuid != null && !puuid.isBlank();
    }

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        createdAt = (createdAt == null) ? now : createdAt;
        updatedAt = now;
        if (status == null)
            status = PlayerStatus.IDLE;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }
}
