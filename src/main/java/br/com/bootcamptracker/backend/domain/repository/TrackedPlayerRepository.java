package br.com.bootcamptracker.backend.domain.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import br.com.bootcamptracker.backend.domain.entity.PlayerStatus;
import br.com.bootcamptracker.backend.domain.entity.TrackedPlayer;

public interface TrackedPlayerRepository extends JpaRepository<TrackedPlayer, Long> {

    /**
     * Roster ativo: janela de acompanhamento cobre o dia informado.
     */
    @Query("SELECT p FROM TrackedPlayer p WHERE p.startDate <= :today "
            + "AND COALESCE(p.actualEndDate, p.plannedEndDate) >= :today")
    List<TrackedPlayer> findActiveRoster(@Param("today") LocalDate today);

    List<TrackedPlayer> findByStatus(PlayerStatus status);
}
