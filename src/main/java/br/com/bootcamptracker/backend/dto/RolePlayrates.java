package br.com.bootcamptracker.backend.dto;

/**
 * Frequência (%) de um campeão em cada rota.
 */
public record RolePlayrates(double top, double jungle, double mid, double adc, double support) {
}
