package kr.hhplus.be.reconciliation.infrastructure.kafka;

import kr.hhplus.be.reconciliation.application.port.out.SyncNotification;
import kr.hhplus.be.reconciliation.application.port.out.SyncNotificationPort;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import kr.hhplus.be.reconciliation.infrastructure.kafka.message.SyncNotificationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * POS 동기화 진행 알림 발행 (공연 ID 를 키로 사용)
 * 발행 실패는 동기화에 영향을 주지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncNotificationKafkaProducer implements SyncNotificationPort {

    static final String ALL_PERFORMANCES_KEY = "all";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ReconciliationProperties properties;

    @Override
    public void notify(SyncNotification notification) {
        String topic = properties.getNotification().getTopic();
        String key = notification.performanceId() == null ? ALL_PERFORMANCES_KEY : notification.performanceId();
        SyncNotificationMessage message = SyncNotificationMessage.from(notification, LocalDateTime.now());

        try {
            kafkaTemplate.send(topic, key, message)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            log.info("[Kafka] 동기화 알림 발행 성공 - topic: {}, key: {}, type: {}, partition: {}",
                                    topic, key, message.syncType(), result.getRecordMetadata().partition());
                        } else {
                            log.error("[Kafka] 동기화 알림 발행 실패 - topic: {}, key: {}, type: {}",
                                    topic, key, message.syncType(), ex);
                        }
                    });
        } catch (Exception e) {
            log.error("[Kafka] 동기화 알림 발행 요청 실패 - topic: {}, key: {}, operationId: {}",
                    topic, key, notification.operationId(), e);
        }
    }
}
