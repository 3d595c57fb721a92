package kr.hhplus.be.reconciliation.application.port.out;

/**
 * 상위 시스템으로 보내는 동기화 알림 (전송 실패는 호출자에게 영향을 주지 않는다)
 */
public interface SyncNotificationPort {

    void notify(SyncNotification notification);
}
