package br.com.bootcamptracker.backend.service.riot;

import br.com.bootcamptracker.backend.config.properties.RiotApiProperties;
import br.com.bootcamptracker.backend.exception.RiotApiException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RRateLimiter;
import org.redisson.api.RateIntervalUnit;
import org.redisson.api.RateType;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Limitadores da Riot API: toda chamada passa pelo limite da aplicação e
 * depois pelo limite por chamada.
 * <p>
 * A taxa (tokens por intervalo) fica num {@link RRateLimiter} do Redisson,
 * compartilhado entre instâncias; o número de chamadas em voo é limitado por
 * um {@link Semaphore} local em cada nível.
 */
@Slf4j
@Component
public class RiotRateLimiter {

    static final String APP_LIMITER_KEY = "riot:ratelimit:app";
    static final String METHOD_LIMITER_KEY = "riot:ratelimit:method";

    private final RedissonClient redissonClient;
    private final RiotApiProperties riotApiProperties;

    private final Semaphore appSlots;
    private final Semaphore methodSlots;

    private volatile RRateLimiter appLimiter;
    private volatile RRateLimiter methodLimiter;

    public RiotRateLimiter(RedissonClient redissonClient, RiotApiProperties riotApiProperties) {
        this.redissonClient = redissonClient;
        this.riotApiProperties = riotApiProperties;
        this.appSlots = new Semaphore(riotApiProperties.getAppLimiter().getMaxConcurrent(), true);
        this.methodSlots = new Semaphore(riotApiProperties.getMethodLimiter().getMaxConcurrent(), true);
    }

    /**
     * Executa a chamada respeitando os dois limitadores.
     *
     * @param path usado só para contexto de erro
     */
    public <T> T execute(String path, Supplier<T> call) {
        ensureLimiters();
        try {
            appSlots.acquire();
            try {
                appLimiter.acquire();
                methodSlots.acquire();
                try {
                    methodLimiter.acquire();
                    return call.get();
                } finally {
                    methodSlots.release();
                }
            } finally {
                appSlots.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RiotApiException(path, "interrompido aguardando rate limiter", e);
        }
    }

    private void ensureLimiters() {
        if (appLimiter != null && methodLimiter != null) {
            return;
        }
        synchronized (this) {
            if (appLimiter == null) {
                appLimiter = createLimiter(APP_LIMITER_KEY, riotApiProperties.getAppLimiter());
            }
            if (methodLimiter == null) {
                methodLimiter = createLimiter(METHOD_LIMITER_KEY, riotApiProperties.getMethodLimiter());
            }
        }
    }

    private RRateLimiter createLimiter(String key, RiotApiProperties.Limiter config) {
        RRateLimiter limiter = redissonClient.getRateLimiter(key);
        // trySetRate não sobrescreve: a primeira instância define a taxa
        boolean created = limiter.trySetRate(RateType.OVERALL, config.getRate(), config.getIntervalSeconds(),
                RateIntervalUnit.SECONDS);
        log.info("🚦 [RiotRateLimiter] {} → {} req/{}s, {} em voo{}", key, config.getRate(),
                config.getIntervalSeconds(), config.getMaxConcurrent(), created ? "" : " (taxa já existente)");
        return limiter;
    }
}
