package personal.bistro.core.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.bistro.core.booking.application.port.out.SlotLockPort;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local Slot Lock Adapter
 * 키별 ReentrantLock 을 사용하는 단일 인스턴스용 잠금
 * 잠금은 획득한 스레드에서 해제해야 한다.
 * 키별 잠금은 보유/대기 중인 스레드가 없으면 맵에서 제거된다.
 */
@Slf4j
public class LocalSlotLockAdapter implements SlotLockPort {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final Map<String, String> owners = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public LocalSlotLockAdapter(Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    @Override
    public boolean tryLock(String key, String owner) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry target = existing != null ? existing : new LockEntry();
            target.users++;
            return target;
        });
        try {
            boolean acquired = entry.lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (acquired) {
                owners.put(key, owner);
                log.debug("[LocalLock] Lock acquired: key={}", key);
            } else {
                release(key);
                log.debug("[LocalLock] Lock wait timed out: key={}", key);
            }
            return acquired;
        } catch (InterruptedException e) {
            release(key);
            Thread.currentThread().interrupt();
            log.warn("[LocalLock] Interrupted while waiting: key={}", key);
            return false;
        }
    }

    @Override
    public void unlock(String key, String owner) {
        LockEntry entry = locks.get(key);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            log.warn("[LocalLock] Unlock skipped (not held by current thread): key={}", key);
            return;
        }
        if (!owner.equals(owners.get(key))) {
            log.warn("[LocalLock] Unlock skipped (owner mismatch): key={}", key);
            return;
        }
        if (entry.lock.getHoldCount() == 1) {
            owners.remove(key);
        }
        entry.lock.unlock();
        release(key);
        log.debug("[LocalLock] Lock released: key={}", key);
    }

    int trackedKeyCount() {
        return locks.size();
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    /**
     * users: 잠금을 보유하거나 기다리는 요청 수 (compute 안에서만 변경)
     */
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
