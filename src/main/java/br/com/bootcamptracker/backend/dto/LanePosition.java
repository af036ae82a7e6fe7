package br.com.bootcamptracker.backend.dto;

/**
 * Rotas atribuídas pelo classificador. A ordem das constantes é a ordem de
 * varredura da matriz de probabilidades (JUNGLE fica fora da matriz).
 */
public enum LanePosition {
    TOP,
    JUNGLE,
    MIDDLE,
    BOTTOM,
    UTILITY
}
