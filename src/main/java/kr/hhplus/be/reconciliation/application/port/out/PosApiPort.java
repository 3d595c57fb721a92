package kr.hhplus.be.reconciliation.application.port.out;

import java.time.LocalDateTime;

/**
 * 외부 POS 인벤토리 API
 *
 * 모든 호출은 예외 대신 결과 객체로 응답한다 (네트워크 오류/타임아웃 포함).
 */
public interface PosApiPort {

    PosCreateResult createListing(PosListingPayload payload);

    PosDeleteResult deleteListing(String listingId);

    PosHoldResult applyAdminHold(String listingId, LocalDateTime expiresAt, String notes);
}
