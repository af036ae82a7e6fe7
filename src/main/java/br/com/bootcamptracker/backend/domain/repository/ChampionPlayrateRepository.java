package br.com.bootcamptracker.backend.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;

import br.com.bootcamptracker.backend.domain.entity.ChampionPlayrate;

public interface ChampionPlayrateRepository extends JpaRepository<ChampionPlayrate, Integer> {
}
