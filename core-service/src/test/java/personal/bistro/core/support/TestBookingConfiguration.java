package personal.bistro.core.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.LocalDateTime;

/**
 * 통합 테스트 공통 빈
 * 고정 시계와 Kafka 대신 알림을 기록하는 포트를 주입한다.
 */
@TestConfiguration
public class TestBookingConfiguration {

    public static final LocalDateTime DEFAULT_NOW = LocalDateTime.of(2026, 11, 1, 9, 0);

    @Bean
    @Primary
    public TestClock testClock() {
        return new TestClock(DEFAULT_NOW);
    }

    @Bean
    @Primary
    public RecordingNotificationPort recordingNotificationPort() {
        return new RecordingNotificationPort();
    }
}
