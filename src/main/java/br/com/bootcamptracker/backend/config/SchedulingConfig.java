package br.com.bootcamptracker.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {

    @Override
    public void configureTasks(@NonNull ScheduledTaskRegistrar taskRegistrar) {
        // Pool dedicado para as tarefas periódicas (sync do roster, limpeza, status)
        taskRegistrar.setScheduler(Executors.newScheduledThreadPool(3));
    }

    /**
     * Timer dos jobs do SchedulerService. Só dispara; a execução acontece no
     * pool de cada fila.
     */
    @Bean(name = "jobTimer", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler jobTimer(AppProperties appProperties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(appProperties.getScheduler().getTimerPoolSize());
        scheduler.setThreadNamePrefix("job-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Executor do fan-out de enriquecimento dos participantes. Sem limite
     * próprio: quem limita é o teto da fila de game-state e os rate limiters.
     */
    @Bean(name = "enrichmentExecutor", destroyMethod = "shutdown")
    public ExecutorService enrichmentExecutor() {
        return Executors.newCachedThreadPool();
    }
}
