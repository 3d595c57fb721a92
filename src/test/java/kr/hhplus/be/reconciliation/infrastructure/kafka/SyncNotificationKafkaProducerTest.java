package kr.hhplus.be.reconciliation.infrastructure.kafka;

import kr.hhplus.be.reconciliation.application.port.out.SyncNotification;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import kr.hhplus.be.reconciliation.infrastructure.kafka.message.SyncNotificationMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncNotificationKafkaProducerTest {

    private static final String TOPIC = "pos-sync-notifications";

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private SyncNotificationKafkaProducer producer;

    @BeforeEach
    void setUp() {
        producer = new SyncNotificationKafkaProducer(kafkaTemplate, new ReconciliationProperties());
    }

    @Test
    @DisplayName("완료 알림은 공연 ID 를 키로 success 패턴 / ended 유형으로 발행")
    void completed() {
        // given
        when(kafkaTemplate.send(eq(TOPIC), eq("perf-1"), any()))
                .thenReturn(new CompletableFuture<SendResult<String, Object>>());

        // when
        producer.notify(new SyncNotification(SyncNotification.Type.COMPLETED, "op-1", "perf-1",
                "Richard Rodgers Theatre", "Hamilton", 3, 2, 1, 0, 1.5, List.of("tm_pk_1: timeout")));

        // then
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("perf-1"), captor.capture());
        SyncNotificationMessage message = (SyncNotificationMessage) captor.getValue();
        assertThat(message.pattern()).isEqualTo(SyncNotificationMessage.SUCCESS_PATTERN);
        assertThat(message.syncType()).isEqualTo("ended");
        assertThat(message.synced()).isEqualTo(2);
        assertThat(message.errors()).containsExactly("tm_pk_1: timeout");
    }

    @Test
    @DisplayName("전체 공연 동기화 실패 알림은 all 키 / error 패턴")
    void failedForAllPerformances() {
        when(kafkaTemplate.send(eq(TOPIC), eq(SyncNotificationKafkaProducer.ALL_PERFORMANCES_KEY), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        producer.notify(new SyncNotification(SyncNotification.Type.FAILED, "op-2", null,
                null, null, 0, 0, 0, 0, 0.2, List.of("queue error")));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("all"), captor.capture());
        SyncNotificationMessage message = (SyncNotificationMessage) captor.getValue();
        assertThat(message.pattern()).isEqualTo(SyncNotificationMessage.ERROR_PATTERN);
        assertThat(message.syncType()).isEqualTo("failed");
    }

    @Test
    @DisplayName("발행 요청 자체가 실패해도 예외를 전파하지 않는다")
    void sendThrows() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("closed"));

        assertThatCode(() -> producer.notify(SyncNotification.started("op-3", "perf-1", "venue", "event", 5)))
                .doesNotThrowAnyException();
    }
}
