package br.com.bootcamptracker.backend.domain.entity;

/**
 * Estado de jogo de um jogador acompanhado.
 */
public enum PlayerStatus {
    IDLE,
    IN_GAME
}
