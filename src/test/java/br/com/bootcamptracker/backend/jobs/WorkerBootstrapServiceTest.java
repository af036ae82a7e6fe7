package br.com.bootcamptracker.backend.jobs;

import br.com.bootcamptracker.backend.jobs.payload.PlayrateRefreshJob;
import br.com.bootcamptracker.backend.service.RosterSyncService;
import br.com.bootcamptracker.backend.service.StaleGameCleanupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.mockito.Mockito.*;

class WorkerBootstrapServiceTest {

    private SchedulerService schedulerService;
    private JobHandlers jobHandlers;
    private StaleGameCleanupService staleGameCleanupService;
    private RosterSyncService rosterSyncService;
    private WorkerBootstrapService bootstrap;

    @BeforeEach
    void setup() {
        schedulerService = mock(SchedulerService.class);
        jobHandlers = mock(JobHandlers.class);
        staleGameCleanupService = mock(StaleGameCleanupService.class);
        rosterSyncService = mock(RosterSyncService.class);
        when(rosterSyncService.reconcileRoster()).thenReturn(new RosterSyncService.ReconcileResult(8, 0));

        bootstrap = new WorkerBootstrapService(schedulerService, jobHandlers, staleGameCleanupService,
                rosterSyncService);
    }

    @Test
    void testInitializeWorkersRunsStartupSequenceInOrder() {
        // act
        bootstrap.initializeWorkers();

        // assert
        InOrder order = inOrder(schedulerService, staleGameCleanupService, rosterSyncService);
        order.verify(schedulerService).start(jobHandlers);
        for (JobClass jobClass : JobClass.values()) {
            order.verify(schedulerService).obliterate(jobClass);
        }
        order.verify(staleGameCleanupService).cleanupStaleGames();
        order.verify(rosterSyncService).reconcileRoster();
        order.verify(schedulerService).scheduleDelayed(new PlayrateRefreshJob(PlayrateRefreshJob.INITIAL), 5_000);
        order.verify(schedulerService).scheduleDaily(new PlayrateRefreshJob(PlayrateRefreshJob.DAILY), "0 0 0 * * *");
    }

    @Test
    void testStaleCleanupFailureDoesNotAbortStartup() {
        // given
        when(staleGameCleanupService.cleanupStaleGames()).thenThrow(new RuntimeException("db down"));

        // act
        bootstrap.initializeWorkers();

        // assert
        verify(rosterSyncService).reconcileRoster();
        verify(schedulerService).scheduleDaily(new PlayrateRefreshJob(PlayrateRefreshJob.DAILY), "0 0 0 * * *");
    }
}
