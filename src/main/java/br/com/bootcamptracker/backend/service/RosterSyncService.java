package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.domain.entity.TrackedPlayer;
import br.com.bootcamptracker.backend.domain.repository.TrackedPlayerRepository;
import br.com.bootcamptracker.backend.jobs.JobClass;
import br.com.bootcamptracker.backend.jobs.JobDescriptor;
import br.com.bootcamptracker.backend.jobs.JobKeys;
import br.com.bootcamptracker.backend.jobs.SchedulerService;
import br.com.bootcamptracker.backend.jobs.payload.*;
import br.com.bootcamptracker.backend.service.twitch.TwitchAPIService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.*;

/**
 * Mantém os jobs repetidos iguais ao roster ativo: agenda o que falta e
 * remove jobs de jogadores que saíram do roster. Jogadores adicionados ou
 * removidos por fora entram/saem em no máximo um ciclo, sem restart.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RosterSyncService {

    private final TrackedPlayerRepository trackedPlayerRepository;
    private final SchedulerService schedulerService;
    private final TwitchAPIService twitchAPIService;
    private final FollowUpJobService followUpJobService;

    public record ReconcileResult(int added, int removed) {
    }

    public ReconcileResult reconcileRoster() {
        if (!schedulerService.isRunning()) {
            log.warn("⚠️ [RosterSync] Workers não iniciados, sync ignorado");
            return new ReconcileResult(0, 0);
        }

        List<TrackedPlayer> roster = trackedPlayerRepository.findActiveRoster(LocalDate.now());
        Map<String, JobPayload> expected = expectedJobs(roster, twitchAPIService.isConfigured());
        log.debug("🔄 [RosterSync] Sincronizando {} jogadores ativos ({} jobs esperados)", roster.size(),
                expected.size());

        int removed = 0;
        Set<String> registered = new HashSet<>();
        for (JobClass jobClass : JobClass.values()) {
            if (!jobClass.isPerPlayerRepeating()) {
                continue;
            }
            for (JobDescriptor descriptor : schedulerService.getRepeatableJobs(jobClass)) {
                if (expected.containsKey(descriptor.key())) {
                    registered.add(descriptor.key());
                } else if (schedulerService.removeRepeatable(descriptor.key())) {
                    log.info("🗑️ [RosterSync] Job órfão removido: {}", descriptor.key());
                    removed++;
                }
            }
        }

        int added = 0;
        for (Map.Entry<String, JobPayload> entry : expected.entrySet()) {
            if (registered.contains(entry.getKey())) {
                continue;
            }
            JobPayload payload = entry.getValue();
            schedulerService.scheduleRepeating(payload, payload.jobClass().getIntervalMs());
            added++;
            if (payload instanceof CurrentRankPollJob job) {
                queueInitialRankIfNeverChecked(roster, job);
            }
        }

        if (added > 0 || removed > 0) {
            log.info("✅ [RosterSync] Sync concluído: {} adicionados, {} removidos", added, removed);
        } else {
            log.debug("✅ [RosterSync] Todos os jogadores em dia com os jobs");
        }
        return new ReconcileResult(added, removed);
    }

    // Jogador recém-chegado ainda sem rank: não espera o primeiro ciclo de 5 minutos
    private void queueInitialRankIfNeverChecked(List<TrackedPlayer> roster, CurrentRankPollJob job) {
        for (TrackedPlayer player : roster) {
            if (player.getId().equals(job.playerId()) && player.getRankUpdatedAt() == null) {
                followUpJobService.queueInitialRankCheck(job.playerId(), job.puuid(), job.region());
                return;
            }
        }
    }

    /**
     * Jobs repetidos que o roster exige, por chave. Jogador sem PUUID não
     * recebe jobs; stream só para quem tem login e id da Twitch.
     */
    static Map<String, JobPayload> expectedJobs(List<TrackedPlayer> roster, boolean twitchEnabled) {
        Map<String, JobPayload> expected = new LinkedHashMap<>();
        for (TrackedPlayer player : roster) {
            if (!player.hasPuuid()) {
                continue;
            }
            Long id = player.getId();
            String puuid = player.getPuuid();
            String region = player.getRegion();

            put(expected, new GameStatePollJob(id, puuid, region));
            put(expected, new DisplayNamePollJob(id, puuid, region));
            put(expected, new CurrentRankPollJob(id, puuid, region));
            put(expected, new PeakRankPollJob(id, puuid, region));
            if (twitchEnabled && player.hasTwitch()) {
                put(expected, new StreamPollJob(id, player.getTwitchUserId(), player.getTwitchLogin()));
            }
        }
        return expected;
    }

    private static void put(Map<String, JobPayload> expected, JobPayload payload) {
        expected.put(JobKeys.jobKey(payload.jobClass(), payload.entityId()), payload);
    }
}
