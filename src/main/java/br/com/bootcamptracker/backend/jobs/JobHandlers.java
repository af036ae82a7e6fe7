package br.com.bootcamptracker.backend.jobs;

import br.com.bootcamptracker.backend.jobs.payload.*;

/**
 * Ponto de entrada dos workers: um método por variante de payload, então
 * toda variante nova obriga um handler novo em tempo de compilação.
 */
public interface JobHandlers {

    void handle(GameStatePollJob job);

    void handle(MatchDetailFetchJob job);

    void handle(CurrentRankPollJob job);

    void handle(PeakRankPollJob job);

    void handle(StreamPollJob job);

    void handle(DisplayNamePollJob job);

    void handle(PlayrateRefreshJob job);
}
