package kr.hhplus.be.reconciliation.infrastructure.pos;

import kr.hhplus.be.reconciliation.application.port.out.PosApiPort;
import kr.hhplus.be.reconciliation.application.port.out.PosCreateResult;
import kr.hhplus.be.reconciliation.application.port.out.PosDeleteResult;
import kr.hhplus.be.reconciliation.application.port.out.PosHoldResult;
import kr.hhplus.be.reconciliation.application.port.out.PosListingPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * 외부 POS 인벤토리 API 클라이언트
 *
 * 네트워크 오류와 오류 응답은 예외 대신 실패 결과로 돌려준다. 삭제 시 404 는 이미 없는 것으로 본다.
 */
@Slf4j
@Component
public class PosRestClientAdapter implements PosApiPort {

    private static final String INVENTORY_PATH = "/inventory/";
    private static final DateTimeFormatter HOLD_EXPIRATION = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final RestClient restClient;

    public PosRestClientAdapter(@Qualifier("posRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public PosCreateResult createListing(PosListingPayload payload) {
        try {
            Map<?, ?> body = restClient.post()
                    .uri(INVENTORY_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(Map.class);

            Object id = body == null ? null : body.get("id");
            if (id == null) {
                log.warn("[POS] 리스팅 생성 응답에 ID 없음 - externalId: {}", payload.externalId());
                return PosCreateResult.failed(null, "POS response missing listing id");
            }
            return PosCreateResult.created(String.valueOf(id));

        } catch (RestClientResponseException e) {
            log.warn("[POS] 리스팅 생성 실패 - externalId: {}, status: {}, body: {}",
                    payload.externalId(), e.getStatusCode().value(), e.getResponseBodyAsString());
            return PosCreateResult.failed(e.getStatusCode().value(), errorMessage(e));
        } catch (RestClientException e) {
            log.warn("[POS] 리스팅 생성 요청 실패 - externalId: {}, error: {}", payload.externalId(), e.getMessage());
            return PosCreateResult.failed(null, e.getMessage());
        }
    }

    @Override
    public PosDeleteResult deleteListing(String listingId) {
        try {
            restClient.delete()
                    .uri(INVENTORY_PATH + "{id}", listingId)
                    .retrieve()
                    .toBodilessEntity();
            return PosDeleteResult.deleted();

        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return PosDeleteResult.notFound();
            }
            log.warn("[POS] 리스팅 삭제 실패 - listingId: {}, status: {}", listingId, e.getStatusCode().value());
            return PosDeleteResult.failed(e.getStatusCode().value(), errorMessage(e));
        } catch (RestClientException e) {
            log.warn("[POS] 리스팅 삭제 요청 실패 - listingId: {}, error: {}", listingId, e.getMessage());
            return PosDeleteResult.failed(null, e.getMessage());
        }
    }

    @Override
    public PosHoldResult applyAdminHold(String listingId, LocalDateTime expiresAt, String notes) {
        Map<String, Object> body = Map.of("adminHold", Map.of(
                "expirationDate", expiresAt.format(HOLD_EXPIRATION),
                "notes", notes == null ? "" : notes
        ));
        try {
            restClient.put()
                    .uri(INVENTORY_PATH + "{id}", listingId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
            return PosHoldResult.held();

        } catch (RestClientResponseException e) {
            log.warn("[POS] 관리자 홀드 실패 - listingId: {}, status: {}", listingId, e.getStatusCode().value());
            return PosHoldResult.failed(e.getStatusCode().value(), errorMessage(e));
        } catch (RestClientException e) {
            log.warn("[POS] 관리자 홀드 요청 실패 - listingId: {}, error: {}", listingId, e.getMessage());
            return PosHoldResult.failed(null, e.getMessage());
        }
    }

    private static String errorMessage(RestClientResponseException e) {
        String body = e.getResponseBodyAsString();
        return body.isBlank() ? e.getStatusText() : body;
    }
}
