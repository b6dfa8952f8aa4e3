package personal.bistro.core.booking.adapter.out.kafka;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import personal.bistro.core.support.TestBookingConfiguration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 브로커 장애 시 send() 가 요청 스레드를 오래 붙잡지 않도록 producer 대기 시간을 제한한다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestBookingConfiguration.class)
@DisplayName("Kafka producer 설정 테스트")
class KafkaProducerSettingsTest {

    @Autowired
    private KafkaProperties kafkaProperties;

    @Test
    @DisplayName("메타데이터 대기(max.block.ms)는 500ms 로 제한된다")
    void producerBlockTimeIsBounded() {
        assertThat(kafkaProperties.getProducer().getProperties())
                .containsEntry("max.block.ms", "500");
    }

    @Test
    @DisplayName("알림 payload 는 타입 헤더 없이 JSON 으로 직렬화한다")
    void jsonWithoutTypeHeaders() {
        assertThat(kafkaProperties.getProducer().getProperties())
                .containsEntry("spring.json.add.type.headers", "false");
    }
}
