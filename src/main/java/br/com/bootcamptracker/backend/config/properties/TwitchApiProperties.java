package br.com.bootcamptracker.backend.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "twitch.api")
public class TwitchApiProperties {

    private String clientId;
    private String clientSecret;
    private String baseUrl = "https://api.twitch.tv/helix";
    private String tokenUrl = "https://id.twitch.tv/oauth2/token";

    public boolean isConfigured() {
        return clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank();
    }
}
