package br.com.bootcamptracker.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "twitch_streams")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TwitchStream {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tracked_player_id", nullable = false)
    private Long trackedPlayerId;

    @Column(name = "twitch_user_id", nullable = false)
    private String twitchUserId;

    @Column(name = "stream_url", nullable = false)
    private String streamUrl;

    @Column(name = "live", nullable = false)
    private boolean live;

    @Column(name = "title")
    private String title;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "last_checked")
    private Instant lastChecked;

    @PrePersist
    @PreUpdate
    public void touch() {
        lastChecked = Instant.now();
    }
}
