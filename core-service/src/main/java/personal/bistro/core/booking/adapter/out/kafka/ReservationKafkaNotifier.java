package personal.bistro.core.booking.adapter.out.kafka;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.bistro.core.booking.application.port.out.ReservationNotificationPort;
import personal.bistro.core.booking.domain.model.Reservation;

/**
 * Reservation Kafka Notifier (Adapter Layer)
 * 예약 알림을 Kafka 토픽으로 발행 (fire-and-forget)
 * 발행 실패는 로그만 남기고 호출자에게 전파하지 않는다.
 */
@Slf4j
@Component
public class ReservationKafkaNotifier implements ReservationNotificationPort {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topicPrefix;

    public ReservationKafkaNotifier(KafkaTemplate<String, Object> kafkaTemplate,
                                    @Value("${notification.topic-prefix:reservation}") String topicPrefix) {
        this.kafkaTemplate = kafkaTemplate;
        this.topicPrefix = topicPrefix;
    }

    @Override
    public void notifyCreated(Reservation reservation) {
        publish("created", reservation);
    }

    @Override
    public void notifyUpdated(Reservation reservation) {
        publish("updated", reservation);
    }

    @Override
    public void notifyCancelled(Reservation reservation) {
        publish("cancelled", reservation);
    }

    private void publish(String eventType, Reservation reservation) {
        String topic = topicPrefix + "." + eventType;
        String key = String.valueOf(reservation.id());

        try {
            kafkaTemplate.send(topic, key, ReservationNotification.of(eventType, reservation))
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish notification: topic={}, key={}", topic, key, ex);
                        } else {
                            log.debug("Notification published: topic={}, key={}, offset={}",
                                    topic, key, result.getRecordMetadata().offset());
                        }
                    });
        } catch (Exception e) {
            log.warn("Failed to send notification: topic={}, key={}", topic, key, e);
        }
    }
}
