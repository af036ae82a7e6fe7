package br.com.bootcamptracker.backend.jobs;

import lombok.Getter;

/**
 * Classes de job conhecidas pelo scheduler.
 * <p>
 * O prefixo forma a chave determinística (ver {@link JobKeys}); o intervalo é
 * o período das execuções repetidas (0 = só execuções avulsas/cron).
 */
@Getter
public enum JobClass {
    GAME_STATE("spectator", JobQueue.SPECTATOR, 60_000L),
    CURRENT_RANK("periodic-current-rank", JobQueue.RANK, 300_000L),
    PEAK_RANK("periodic-peak-rank", JobQueue.RANK, 300_000L),
    STREAM("twitch-stream", JobQueue.TWITCH_STREAM, 60_000L),
    DISPLAY_NAME("summoner-name", JobQueue.SUMMONER_NAME, 3_600_000L),
    MATCH_DETAIL("match-data", JobQueue.MATCH_DATA, 0L),
    PLAYRATE("playrate", JobQueue.PLAYRATE, 0L);

    private final String keyPrefix;
    private final JobQueue queue;
    private final long intervalMs;

    JobClass(String keyPrefix, JobQueue queue, long intervalMs) {
        this.keyPrefix = keyPrefix;
        this.queue = queue;
        this.intervalMs = intervalMs;
    }

    /**
     * Classes que o sync do roster mantém registradas por jogador
     */
    public boolean isPerPlayerRepeating() {
        return intervalMs > 0;
    }
}
