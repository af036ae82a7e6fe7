package br.com.bootcamptracker.backend.exception;

import lombok.Getter;

@Getter
public class TwitchApiException extends RuntimeException {

    private final int statusCode;

    public TwitchApiException(int statusCode, String message) {
        super(String.format("Twitch API %d: %s", statusCode, message));
        this.statusCode = statusCode;
    }

    public TwitchApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
}
