package br.com.bootcamptracker.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Scheduler scheduler = new Scheduler();
    private Tracker tracker = new Tracker();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        // Threads do timer que disparam os jobs (a execução fica nos pools de cada fila)
        private int timerPoolSize = 4;
        private int shutdownTimeoutSeconds = 30;
    }

    @Data
    public static class Tracker {
        private long rosterSyncInitialDelayMs = 10_000;
        private long rosterSyncIntervalMs = 120_000;
        private long staleCleanupIntervalMs = 300_000;
        private long statusLogIntervalMs = 60_000;
    }
}
