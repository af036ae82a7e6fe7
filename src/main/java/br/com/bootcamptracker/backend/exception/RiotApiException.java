package br.com.bootcamptracker.backend.exception;

import lombok.Getter;

/**
 * Falha HTTP (ou de transporte) numa chamada à API da Riot.
 * statusCode = 0 quando a resposta nem chegou.
 */
@Getter
public class RiotApiException extends RuntimeException {

    private final int statusCode;
    private final String path;

    public RiotApiException(int statusCode, String path, String message) {
        super(String.format("Riot API %d em %s: %s", statusCode, path, message));
        this.statusCode = statusCode;
        this.path = path;
    }

    public RiotApiException(String path, String message, Throwable cause) {
        super(String.format("Riot API falhou em %s: %s", path, message), cause);
        this.statusCode = 0;
        this.path = path;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    /**
     * 429 e 5xx: a próxima execução do job tenta de novo, nada é alterado.
     */
    public boolean isTransient() {
        return isRateLimited() || isServerError();
    }
}
