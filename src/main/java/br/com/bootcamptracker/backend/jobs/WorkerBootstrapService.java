package br.com.bootcamptracker.backend.jobs;

import br.com.bootcamptracker.backend.jobs.payload.PlayrateRefreshJob;
import br.com.bootcamptracker.backend.service.RosterSyncService;
import br.com.bootcamptracker.backend.service.StaleGameCleanupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sequência de inicialização dos workers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerBootstrapService {

    static final long INITIAL_PLAYRATE_DELAY_MS = 5_000;
    static final String DAILY_PLAYRATE_CRON = "0 0 0 * * *";

    private final SchedulerService schedulerService;
    private final JobHandlers jobHandlers;
    private final StaleGameCleanupService staleGameCleanupService;
    private final RosterSyncService rosterSyncService;

    public void initializeWorkers() {
        log.info("🚀 [Bootstrap] Inicializando workers...");
        schedulerService.start(jobHandlers);

        // Nenhum intervalo antigo sobrevive a um deploy
        for (JobClass jobClass : JobClass.values()) {
            schedulerService.obliterate(jobClass);
        }

        try {
            log.info("🧹 [Bootstrap] Verificando partidas presas...");
            staleGameCleanupService.cleanupStaleGames();
        } catch (Exception e) {
            log.error("❌ [Bootstrap] Falha na limpeza inicial de partidas presas", e);
        }

        RosterSyncService.ReconcileResult result = rosterSyncService.reconcileRoster();
        log.info("📅 [Bootstrap] {} jobs repetidos agendados a partir do roster", result.added());

        schedulerService.scheduleDelayed(new PlayrateRefreshJob(PlayrateRefreshJob.INITIAL), INITIAL_PLAYRATE_DELAY_MS);
        schedulerService.scheduleDaily(new PlayrateRefreshJob(PlayrateRefreshJob.DAILY), DAILY_PLAYRATE_CRON);

        log.info("✅ [Bootstrap] Workers prontos");
    }
}
