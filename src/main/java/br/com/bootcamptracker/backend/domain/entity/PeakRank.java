package br.com.bootcamptracker.backend.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PeakRank {

    @Column(name = "tier", length = 20)
    private String tier;

    @Column(name = "division", length = 5)
    private String division;

    @Column(name = "lp")
    private Integer leaguePoints;

    /**
     * Pico só é comparável com os três campos preenchidos
     */
    public boolean isComplete() {
        return tier != null && division != null && leaguePoints != null;
    }
}
