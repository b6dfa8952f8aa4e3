package personal.bistro.core.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.bistro.core.booking.application.port.out.SlotLockPort;

import java.time.Duration;

/**
 * Slot Lock Adapter Factory
 * 설정에 따라 SlotLockPort 구현체를 생성
 *
 * 설정:
 * - booking.lock.strategy=local → LocalSlotLockAdapter (기본값, 단일 인스턴스)
 * - booking.lock.strategy=redis → RedisSlotLockAdapter (다중 인스턴스)
 */
@Slf4j
@Configuration
public class SlotLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "booking.lock.strategy", havingValue = "local", matchIfMissing = true)
    public SlotLockPort localSlotLockAdapter(SlotLockProperties properties) {
        log.info("Creating LocalSlotLockAdapter - wait: {}ms", properties.getWaitMillis());
        return new LocalSlotLockAdapter(Duration.ofMillis(properties.getWaitMillis()));
    }

    @Bean
    @ConditionalOnProperty(name = "booking.lock.strategy", havingValue = "redis")
    public SlotLockPort redisSlotLockAdapter(StringRedisTemplate redisTemplate, SlotLockProperties properties) {
        log.info("Creating RedisSlotLockAdapter - wait: {}ms, TTL: {}s",
                properties.getWaitMillis(), properties.getTtlSeconds());
        return new RedisSlotLockAdapter(
                redisTemplate,
                Duration.ofMillis(properties.getWaitMillis()),
                Duration.ofSeconds(properties.getTtlSeconds()));
    }
}
