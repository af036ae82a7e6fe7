package br.com.bootcamptracker.backend.scheduled;

import br.com.bootcamptracker.backend.domain.repository.TrackedPlayerRepository;
import br.com.bootcamptracker.backend.jobs.JobQueue;
import br.com.bootcamptracker.backend.jobs.SchedulerService;
import br.com.bootcamptracker.backend.service.RosterSyncService;
import br.com.bootcamptracker.backend.service.StaleGameCleanupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;

/**
 * Processos periódicos fora das filas: sync do roster, limpeza de partidas
 * presas e log de status. Cada ciclo captura os próprios erros para não
 * derrubar o agendamento.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrackerScheduledTasks {

    private final RosterSyncService rosterSyncService;
    private final StaleGameCleanupService staleGameCleanupService;
    private final SchedulerService schedulerService;
    private final TrackedPlayerRepository trackedPlayerRepository;

    @Scheduled(initialDelayString = "${app.tracker.roster-sync-initial-delay-ms:10000}", fixedRateString = "${app.tracker.roster-sync-interval-ms:120000}")
    public void syncRosterWithJobs() {
        try {
            rosterSyncService.reconcileRoster();
        } catch (Exception e) {
            log.error("❌ [RosterSync] Erro ao sincronizar roster com os jobs", e);
        }
    }

    // A execução de startup acontece no bootstrap dos workers
    @Scheduled(initialDelayString = "${app.tracker.stale-cleanup-interval-ms:300000}", fixedRateString = "${app.tracker.stale-cleanup-interval-ms:300000}")
    public void cleanupStaleGames() {
        if (!schedulerService.isRunning()) {
            return;
        }
        try {
            staleGameCleanupService.cleanupStaleGames();
        } catch (Exception e) {
            log.error("❌ [StaleCleanup] Erro na limpeza periódica", e);
        }
    }

    @Scheduled(fixedRateString = "${app.tracker.status-log-interval-ms:60000}")
    public void logQueueStatus() {
        if (!schedulerService.isRunning()) {
            return;
        }
        try {
            Map<JobQueue, SchedulerService.QueueStats> stats = schedulerService.getQueueStats();
            int rosterSize = trackedPlayerRepository.findActiveRoster(LocalDate.now()).size();

            log.info("📊 [Status] {} jogadores ativos no roster", rosterSize);
            stats.forEach((queue, s) -> log.info("📊 [Status] {}: waiting={}, active={}, delayed={}, completed={}, failed={}",
                    queue.getQueueName(), s.waiting(), s.active(), s.delayed(), s.completed(), s.failed()));
        } catch (Exception e) {
            log.error("❌ [Status] Erro ao coletar status das filas", e);
        }
    }
}
