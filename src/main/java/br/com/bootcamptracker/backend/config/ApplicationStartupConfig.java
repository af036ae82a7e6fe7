package br.com.bootcamptracker.backend.config;

import br.com.bootcamptracker.backend.config.properties.RiotApiProperties;
import br.com.bootcamptracker.backend.jobs.WorkerBootstrapService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.lang.NonNull;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ApplicationStartupConfig implements ApplicationListener<ApplicationReadyEvent> {

    private final Environment environment;
    private final AppProperties appProperties;
    private final RiotApiProperties riotApiProperties;
    private final WorkerBootstrapService workerBootstrapService;

    @Override
    public void onApplicationEvent(@NonNull ApplicationReadyEvent event) {
        String profile = environment.getProperty("spring.profiles.active", "default");

        log.info("🎉 =================================================");
        log.info("🎉 BOOTCAMP TRACKER INICIALIZADO (profile: {})", profile);
        log.info("🎉 =================================================");

        if (!appProperties.getScheduler().isEnabled()) {
            log.warn("⚠️ app.scheduler.enabled=false, workers não serão iniciados");
            return;
        }
        if (!riotApiProperties.isConfigured()) {
            log.warn("⚠️ riot.api.key não configurada, os polls da Riot vão falhar até a chave ser definida");
        }

        try {
            workerBootstrapService.initializeWorkers();
        } catch (Exception e) {
            log.error("❌ Erro ao inicializar os workers", e);
        }
    }
}
