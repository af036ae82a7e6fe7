package br.com.bootcamptracker.backend.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Rank atual de uma fila. Quando todas as colunas são nulas o Hibernate
 * devolve o embeddable como null (jogador sem rank).
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrentRank {

    @Column(name = "tier", length = 20)
    private String tier;

    @Column(name = "division", length = 5)
    private String division;

    @Column(name = "lp")
    private Integer leaguePoints;

    @Column(name = "wins")
    private Integer wins;

    @Column(name = "losses")
    private Integer losses;
}
