package br.com.bootcamptracker.backend.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "riot.api")
public class RiotApiProperties {

    private String key;
    private int timeoutMs = 10_000;

    // Limite da aplicação (externo) e limite por chamada (interno)
    private Limiter appLimiter = new Limiter(20, 1, 10);
    private Limiter methodLimiter = new Limiter(10, 1, 5);

    public boolean isConfigured() {
        return key != null && !key.trim().isEmpty();
    }

    @Data
    public static class Limiter {
        private long rate;
        private long intervalSeconds;
        private int maxConcurrent;

        public Limiter() {
        }

        public Limiter(long rate, long intervalSeconds, int maxConcurrent) {
            this.rate = rate;
            this.intervalSeconds = intervalSeconds;
            this.maxConcurrent = maxConcurrent;
        }
    }
}
