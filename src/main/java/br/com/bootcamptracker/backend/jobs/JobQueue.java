package br.com.bootcamptracker.backend.jobs;

import lombok.Getter;

/**
 * Filas de trabalho. Cada fila tem um pool próprio com teto de concorrência
 * proporcional ao custo das chamadas que os seus jobs fazem.
 */
@Getter
public enum JobQueue {
    SPECTATOR("spectator", 5),
    MATCH_DATA("match-data", 2),
    RANK("rank", 3),
    TWITCH_STREAM("twitch-stream", 3),
    SUMMONER_NAME("summoner-name", 2),
    PLAYRATE("playrate", 1);

    private final String queueName;
    private final int concurrency;

    JobQueue(String queueName, int concurrency) {
        this.queueName = queueName;
        this.concurrency = concurrency;
    }
}
