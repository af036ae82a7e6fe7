package br.com.bootcamptracker.backend.jobs;

import br.com.bootcamptracker.backend.config.AppProperties;
import br.com.bootcamptracker.backend.jobs.payload.JobPayload;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scheduler dos workers.
 * <p>
 * Um timer dispara os jobs e cada {@link JobQueue} executa os seus num pool
 * fixo com o teto de concorrência da fila. Jobs repetidos são identificados
 * pela chave determinística: registrar a mesma chave de novo não faz nada, e
 * um disparo cuja chave ainda está na fila ou executando é pulado, então
 * nunca há duas instâncias da mesma chave ao mesmo tempo.
 * <p>
 * Ciclo de vida: {@link #start(JobHandlers)} e {@link #shutdown()} são os
 * únicos pontos de entrada. Os handlers chegam no start para quebrar o ciclo
 * handlers → serviços → scheduler.
 */
@Slf4j
@Service
public class SchedulerService {

    private final TaskScheduler jobTimer;
    private final AppProperties appProperties;

    private final Map<JobQueue, ExecutorService> workers = new EnumMap<>(JobQueue.class);
    private final Map<JobQueue, QueueCounters> counters = new EnumMap<>(JobQueue.class);
    private final Map<String, RepeatableJob> repeatableJobs = new ConcurrentHashMap<>();
    private final Map<String, DelayedJob> delayedJobs = new ConcurrentHashMap<>();
    private final Set<String> outstandingKeys = ConcurrentHashMap.newKeySet();
    private final AtomicLong delayedSequence = new AtomicLong();

    private volatile JobHandlers handlers;
    private volatile boolean running = false;

    public SchedulerService(@Qualifier("jobTimer") TaskScheduler jobTimer, AppProperties appProperties) {
        this.jobTimer = jobTimer;
        this.appProperties = appProperties;
        for (JobQueue queue : JobQueue.values()) {
            counters.put(queue, new QueueCounters());
        }
    }

    private record RepeatableJob(JobDescriptor descriptor, JobPayload payload, ScheduledFuture<?> future) {
    }

    private record DelayedJob(JobClass jobClass, CompletableFuture<ScheduledFuture<?>> future) {

        void cancel() {
            future.thenAccept(f -> f.cancel(false));
        }
    }

    /**
     * Contagens por fila, no formato do log de status.
     */
    public record QueueStats(long waiting, long active, long delayed, long completed, long failed) {
    }

    private static final class QueueCounters {
        final AtomicLong waiting = new AtomicLong();
        final AtomicLong active = new AtomicLong();
        final AtomicLong delayed = new AtomicLong();
        final AtomicLong completed = new AtomicLong();
        final AtomicLong failed = new AtomicLong();
    }

    // ========================================
    // CICLO DE VIDA
    // ========================================

    public synchronized void start(JobHandlers jobHandlers) {
        if (running) {
            log.warn("⚠️ [Scheduler] start() chamado com o scheduler já rodando");
            return;
        }
        this.handlers = Objects.requireNonNull(jobHandlers, "handlers");

        for (JobQueue queue : JobQueue.values()) {
            workers.put(queue, Executors.newFixedThreadPool(queue.getConcurrency(),
                    new CustomizableThreadFactory("worker-" + queue.getQueueName() + "-")));
        }
        running = true;

        log.info("✅ [Scheduler] Workers iniciados: {}", describePools());
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        log.info("🛑 [Scheduler] Encerrando workers...");

        repeatableJobs.values().forEach(job -> job.future().cancel(false));
        repeatableJobs.clear();
        delayedJobs.values().forEach(DelayedJob::cancel);
        delayedJobs.clear();

        workers.values().forEach(ExecutorService::shutdown);
        long timeout = appProperties.getScheduler().getShutdownTimeoutSeconds();
        for (Map.Entry<JobQueue, ExecutorService> entry : workers.entrySet()) {
            try {
                if (!entry.getValue().awaitTermination(timeout, TimeUnit.SECONDS)) {
                    log.warn("⚠️ [Scheduler] Fila {} não terminou em {}s, interrompendo",
                            entry.getKey().getQueueName(), timeout);
                    entry.getValue().shutdownNow();
                }
            } catch (InterruptedException e) {
                entry.getValue().shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        workers.clear();
        outstandingKeys.clear();
        log.info("✅ [Scheduler] Workers encerrados");
    }

    public boolean isRunning() {
        return running;
    }

    // ========================================
    // AGENDAMENTO
    // ========================================

    /**
     * Registra um job repetido. A primeira execução acontece no próximo
     * múltiplo do intervalo e depois a cada intervalo.
     *
     * @return descriptor registrado (o já existente, se a chave já estava
     *         registrada)
     */
    public JobDescriptor scheduleRepeating(JobPayload payload, long intervalMs) {
        ensureRunning();
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs deve ser positivo: " + intervalMs);
        }

        JobDescriptor descriptor = JobDescriptor.of(payload.jobClass(), payload.entityId(), intervalMs);
        RepeatableJob job = repeatableJobs.computeIfAbsent(descriptor.key(), key -> {
            long now = System.currentTimeMillis();
            Instant firstRun = Instant.ofEpochMilli(now + (intervalMs - (now % intervalMs)));
            ScheduledFuture<?> future = jobTimer.scheduleAtFixedRate(
                    () -> fire(payload, key), firstRun, Duration.ofMillis(intervalMs));
            log.debug("➕ [Scheduler] Job repetido registrado: {} a cada {}ms", key, intervalMs);
            return new RepeatableJob(descriptor, payload, future);
        });
        return job.descriptor();
    }

    /**
     * Registra um job global disparado por expressão cron (ex.: "0 0 0 * * *").
     */
    public JobDescriptor scheduleDaily(JobPayload payload, String cron) {
        ensureRunning();
        JobDescriptor descriptor = JobDescriptor.of(payload.jobClass(), payload.entityId(), 0L);
        RepeatableJob job = repeatableJobs.computeIfAbsent(descriptor.key(), key -> {
            ScheduledFuture<?> future = jobTimer.schedule(() -> fire(payload, key), new CronTrigger(cron));
            log.debug("➕ [Scheduler] Job cron registrado: {} ({})", key, cron);
            return new RepeatableJob(descriptor, payload, future);
        });
        return job.descriptor();
    }

    /**
     * Enfileira uma execução avulsa depois do atraso informado. Não passa pela
     * deduplicação por chave.
     */
    public void scheduleDelayed(JobPayload payload, long delayMs) {
        if (!running) {
            log.warn("⚠️ [Scheduler] Workers não iniciados, job {} descartado",
                    JobKeys.jobKey(payload.jobClass(), payload.entityId()));
            return;
        }

        JobQueue queue = payload.jobClass().getQueue();
        String id = JobKeys.jobKey(payload.jobClass(), payload.entityId()) + ":" + delayedSequence.incrementAndGet();

        // Registrado antes do agendamento: com atraso curto a tarefa pode rodar antes de schedule() retornar
        DelayedJob delayed = new DelayedJob(payload.jobClass(), new CompletableFuture<>());
        delayedJobs.put(id, delayed);
        counters.get(queue).delayed.incrementAndGet();

        ScheduledFuture<?> future = jobTimer.schedule(() -> {
            if (delayedJobs.remove(id) == null) {
                // removido por obliterate ou shutdown
                return;
            }
            counters.get(queue).delayed.decrementAndGet();
            submit(payload, null);
        }, Instant.now().plusMillis(delayMs));
        delayed.future().complete(future);

        log.debug("⏱️ [Scheduler] Job {} agendado em {}ms", id, delayMs);
    }

    // ========================================
    // INSPEÇÃO E REMOÇÃO
    // ========================================

    public List<JobDescriptor> getRepeatableJobs(JobClass jobClass) {
        List<JobDescriptor> result = new ArrayList<>();
        for (RepeatableJob job : repeatableJobs.values()) {
            if (job.descriptor().jobClass() == jobClass) {
                result.add(job.descriptor());
            }
        }
        result.sort(Comparator.comparing(JobDescriptor::key));
        return result;
    }

    public boolean removeRepeatable(String key) {
        RepeatableJob removed = repeatableJobs.remove(key);
        if (removed == null) {
            return false;
        }
        removed.future().cancel(false);
        log.debug("🗑️ [Scheduler] Job repetido removido: {}", key);
        return true;
    }

    /**
     * Remove todos os jobs repetidos e atrasados da classe.
     *
     * @return quantidade de jobs removidos
     */
    public int obliterate(JobClass jobClass) {
        int removed = 0;
        for (JobDescriptor descriptor : getRepeatableJobs(jobClass)) {
            if (removeRepeatable(descriptor.key())) {
                removed++;
            }
        }

        Iterator<Map.Entry<String, DelayedJob>> it = delayedJobs.entrySet().iterator();
        while (it.hasNext()) {
            DelayedJob delayed = it.next().getValue();
            if (delayed.jobClass() == jobClass) {
                delayed.cancel();
                it.remove();
                counters.get(jobClass.getQueue()).delayed.decrementAndGet();
                removed++;
            }
        }

        if (removed > 0) {
            log.info("🧹 [Scheduler] {} jobs removidos da classe {}", removed, jobClass);
        }
        return removed;
    }

    public Map<JobQueue, QueueStats> getQueueStats() {
        Map<JobQueue, QueueStats> stats = new EnumMap<>(JobQueue.class);
        counters.forEach((queue, c) -> stats.put(queue, new QueueStats(
                c.waiting.get(), c.active.get(), c.delayed.get(), c.completed.get(), c.failed.get())));
        return stats;
    }

    // ========================================
    // EXECUÇÃO
    // ========================================

    private void fire(JobPayload payload, String key) {
        if (!outstandingKeys.add(key)) {
            log.debug("⏭️ [Scheduler] {} ainda pendente, disparo pulado", key);
            return;
        }
        if (!submit(payload, key)) {
            outstandingKeys.remove(key);
        }
    }

    private boolean submit(JobPayload payload, String key) {
        JobQueue queue = payload.jobClass().getQueue();
        ExecutorService pool = workers.get(queue);
        if (!running || pool == null) {
            return false;
        }

        QueueCounters c = counters.get(queue);
        c.waiting.incrementAndGet();
        try {
            pool.execute(() -> execute(payload, key, c));
            return true;
        } catch (RejectedExecutionException e) {
            c.waiting.decrementAndGet();
            log.debug("⏭️ [Scheduler] Fila {} encerrada, job descartado", queue.getQueueName());
            return false;
        }
    }

    private void execute(JobPayload payload, String key, QueueCounters c) {
        c.waiting.decrementAndGet();
        c.active.incrementAndGet();
        try {
            payload.dispatchTo(handlers);
            c.completed.incrementAndGet();
        } catch (Exception e) {
            // Falha fica no job; o pool continua atendendo os demais
            c.failed.incrementAndGet();
            log.error("❌ [Scheduler] Job falhou: class={}, entity={}, region={}: {}",
                    payload.jobClass(), payload.entityId(), payload.region(), e.getMessage(), e);
        } finally {
            c.active.decrementAndGet();
            if (key != null) {
                outstandingKeys.remove(key);
            }
        }
    }

    private void ensureRunning() {
        if (!running) {
            throw new IllegalStateException("Workers não iniciados. Chame start() antes de agendar jobs.");
        }
    }

    private String describePools() {
        StringBuilder sb = new StringBuilder();
        for (JobQueue queue : JobQueue.values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(queue.getQueueName()).append('=').append(queue.getConcurrency());
        }
        return sb.toString();
    }
}
