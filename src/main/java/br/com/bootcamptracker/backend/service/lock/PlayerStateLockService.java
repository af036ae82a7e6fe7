package br.com.bootcamptracker.backend.service.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Lock distribuído das transições de estado de um jogador.
 * <p>
 * O poll de game-state e a limpeza de partidas presas podem decidir uma
 * transição para o mesmo jogador ao mesmo tempo (inclusive em instâncias
 * diferentes); só quem adquire o lock aplica a transição.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerStateLockService {

    private final RedisTemplate<String, Object> redisTemplate;

    private static final String STATE_LOCK_PREFIX = "tracker:player:state:lock";
    private static final long LOCK_TTL = 30; // segundos

    /**
     * @return true se o lock foi adquirido, false se já existe ou o Redis falhou
     */
    public boolean acquireStateLock(Long playerId) {
        try {
            Boolean acquired = redisTemplate.opsForValue()
                    .setIfAbsent(lockKey(playerId), "locked", Duration.ofSeconds(LOCK_TTL));

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("🔒 [PlayerStateLock] Lock adquirido: playerId={}", playerId);
                return true;
            }

            log.debug("⏳ [PlayerStateLock] Lock já existe: playerId={}", playerId);
            return false;
        } catch (Exception e) {
            log.error("❌ [PlayerStateLock] Erro ao adquirir lock: playerId={}: {}", playerId, e.getMessage());
            return false;
        }
    }

    /**
     * DEVE ser chamado em finally.
     */
    public void releaseStateLock(Long playerId) {
        try {
            redisTemplate.delete(lockKey(playerId));
            log.debug("🔓 [PlayerStateLock] Lock liberado: playerId={}", playerId);
        } catch (Exception e) {
            log.error("❌ [PlayerStateLock] Erro ao liberar lock: playerId={}: {}", playerId, e.getMessage());
        }
    }

    private static String lockKey(Long playerId) {
        return STATE_LOCK_PREFIX + ":" + playerId;
    }
}
