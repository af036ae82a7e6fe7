package br.com.bootcamptracker.backend.domain.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import br.com.bootcamptracker.backend.domain.entity.GameSession;

public interface GameSessionRepository extends JpaRepository<GameSession, Long> {

    Optional<GameSession> findByExternalGameIdAndTrackedPlayerId(String externalGameId, Long trackedPlayerId);
}
