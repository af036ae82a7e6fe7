package br.com.bootcamptracker.backend.domain.entity;

public enum GameSessionStatus {
    IN_PROGRESS,
    COMPLETED
}
