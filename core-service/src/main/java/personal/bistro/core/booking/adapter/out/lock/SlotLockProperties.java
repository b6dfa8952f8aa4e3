package personal.bistro.core.booking.adapter.out.lock;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Slot Lock 설정 Properties
 *
 * 설정 예시:
 * booking:
 *   lock:
 *     strategy: redis   # local | redis
 *     wait-millis: 3000 # 잠금 대기 시간
 *     ttl-seconds: 10   # Redis 잠금 TTL
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "booking.lock")
public class SlotLockProperties {

    /**
     * 잠금 전략
     * - local: JVM 내부 ReentrantLock (단일 인스턴스)
     * - redis: Redis SET NX 기반 분산 잠금 (다중 인스턴스)
     */
    private String strategy = "local";

    /**
     * 잠금 획득 대기 시간 (밀리초)
     */
    private long waitMillis = 3000;

    /**
     * Redis 잠금 TTL (초), 트랜잭션 최대 실행 시간보다 길어야 한다.
     */
    private int ttlSeconds = 10;
}
