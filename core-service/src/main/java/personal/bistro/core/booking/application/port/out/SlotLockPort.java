package personal.bistro.core.booking.application.port.out;

/**
 * Slot Lock (Output Port)
 * (테이블, 날짜) 단위 상호 배제
 * 같은 키에 대한 점유 변경은 한 번에 하나만 진행된다.
 */
public interface SlotLockPort {

    /**
     * 잠금 시도
     *
     * @param key   잠금 키 (예: table:5:2026-11-02)
     * @param owner 잠금 소유자 토큰 (해제 시 검증)
     * @return true: 획득 성공, false: 대기 시간 안에 획득 실패
     */
    boolean tryLock(String key, String owner);

    /**
     * 잠금 해제 (소유자가 일치할 때만)
     */
    void unlock(String key, String owner);
}
