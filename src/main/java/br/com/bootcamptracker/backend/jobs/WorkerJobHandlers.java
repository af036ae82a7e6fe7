package br.com.bootcamptracker.backend.jobs;

import br.com.bootcamptracker.backend.jobs.payload.*;
import br.com.bootcamptracker.backend.service.*;
import br.com.bootcamptracker.backend.service.twitch.TwitchStreamService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WorkerJobHandlers implements JobHandlers {

    private final GameStateService gameStateService;
    private final MatchDetailService matchDetailService;
    private final RankTrackerService rankTrackerService;
    private final TwitchStreamService twitchStreamService;
    private final SummonerNameService summonerNameService;
    private final ChampionPlayrateService championPlayrateService;

    @Override
    public void handle(GameStatePollJob job) {
        gameStateService.pollGameState(job.playerId(), job.puuid(), job.region());
    }

    @Override
    public void handle(MatchDetailFetchJob job) {
        matchDetailService.fetchMatchDetail(job);
    }

    @Override
    public void handle(CurrentRankPollJob job) {
        rankTrackerService.updateCurrentRank(job.playerId(), job.puuid(), job.region());
    }

    @Override
    public void handle(PeakRankPollJob job) {
        rankTrackerService.updatePeakRank(job.playerId(), job.puuid(), job.region());
    }

    @Override
    public void handle(StreamPollJob job) {
        twitchStreamService.checkStream(job);
    }

    @Override
    public void handle(DisplayNamePollJob job) {
        summonerNameService.refreshDisplayName(job.playerId(), job.puuid(), job.region());
    }

    @Override
    public void handle(PlayrateRefreshJob job) {
        championPlayrateService.refreshPlayrates();
    }
}
