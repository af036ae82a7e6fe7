package br.com.bootcamptracker.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Frequência (%) com que cada campeão é jogado em cada rota.
 */
@Entity
@Table(name = "champion_playrates")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChampionPlayrate {
    @Id
    @Column(name = "champion_id")
    private Integer championId;

    @Column(name = "top_rate", nullable = false)
    private double topRate;

    @Column(name = "jungle_rate", nullable = false)
    private double jungleRate;

    @Column(name = "mid_rate", nullable = false)
    private double midRate;

    @Column(name = "adc_rate", nullable = false)
    private double adcRate;

    @Column(name = "support_rate", nullable = false)
    private double supportRate;

    @Column(name = "patch", length = 10)
    private String patch;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = Instant.now();
    }
}
