package br.com.bootcamptracker.backend.domain.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import br.com.bootcamptracker.backend.domain.entity.TwitchStream;

public interface TwitchStreamRepository extends JpaRepository<TwitchStream, Long> {

    Optional<TwitchStream> findFirstByTrackedPlayerIdOrderByIdDesc(Long trackedPlayerId);
}
