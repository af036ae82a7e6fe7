package br.com.bootcamptracker.backend.domain.entity;

/**
 * Filas ranqueadas acompanhadas, com o queueType devolvido pela League API.
 */
public enum RankQueue {
    SOLO("RANKED_SOLO_5x5"),
    FLEX("RANKED_FLEX_SR");

    private final String riotQueueType;

    RankQueue(String riotQueueType) {
        this.riotQueueType = riotQueueType;
    }

    public String getRiotQueueType() {
        return riotQueueType;
    }
}
