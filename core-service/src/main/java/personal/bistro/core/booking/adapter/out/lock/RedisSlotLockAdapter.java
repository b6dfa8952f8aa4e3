package personal.bistro.core.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import personal.bistro.core.booking.application.port.out.SlotLockPort;

import java.time.Duration;
import java.util.List;

/**
 * Redis Slot Lock Adapter
 * SET NX + TTL 기반 분산 잠금, Lua Script 로 소유자 검증 후 해제
 * 대기 시간 동안 짧은 간격으로 재시도한다.
 */
@Slf4j
public class RedisSlotLockAdapter implements SlotLockPort {

    private static final String LOCK_PREFIX = "booking:lock:";
    private static final long RETRY_INTERVAL_MILLIS = 50;

    // 락 해제 Lua Script (본인 소유인 경우만 삭제)
    private static final String UNLOCK_SCRIPT = """
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """;

    private final StringRedisTemplate redisTemplate;
    private final Duration waitTimeout;
    private final Duration lockTtl;

    public RedisSlotLockAdapter(StringRedisTemplate redisTemplate, Duration waitTimeout, Duration lockTtl) {
        this.redisTemplate = redisTemplate;
        this.waitTimeout = waitTimeout;
        this.lockTtl = lockTtl;
    }

    @Override
    public boolean tryLock(String key, String owner) {
        String lockKey = LOCK_PREFIX + key;
        long deadline = System.currentTimeMillis() + waitTimeout.toMillis();

        try {
            do {
                Boolean acquired = redisTemplate.opsForValue().setIfAbsent(lockKey, owner, lockTtl);
                if (Boolean.TRUE.equals(acquired)) {
                    log.debug("[RedisLock] Lock acquired: key={}", lockKey);
                    return true;
                }
                Thread.sleep(RETRY_INTERVAL_MILLIS);
            } while (System.currentTimeMillis() < deadline);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RedisLock] Interrupted while waiting: key={}", lockKey);
            return false;
        } catch (Exception e) {
            log.error("[RedisLock] Failed to acquire lock: key={}", lockKey, e);
            return false;
        }

        log.debug("[RedisLock] Lock wait timed out: key={}", lockKey);
        return false;
    }

    @Override
    public void unlock(String key, String owner) {
        String lockKey = LOCK_PREFIX + key;
        try {
            Long result = redisTemplate.execute(
                    new DefaultRedisScript<>(UNLOCK_SCRIPT, Long.class),
                    List.of(lockKey),
                    owner);

            if (result != null && result == 1L) {
                log.debug("[RedisLock] Lock released: key={}", lockKey);
            } else {
                log.warn("[RedisLock] Lock not owned or already expired: key={}", lockKey);
            }
        } catch (Exception e) {
            log.error("[RedisLock] Failed to release lock: key={}", lockKey, e);
        }
    }
}
