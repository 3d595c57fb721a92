package kr.hhplus.be.reconciliation.infrastructure.pos;

import kr.hhplus.be.reconciliation.application.port.out.PosCreateResult;
import kr.hhplus.be.reconciliation.application.port.out.PosDeleteResult;
import kr.hhplus.be.reconciliation.application.port.out.PosHoldResult;
import kr.hhplus.be.reconciliation.application.port.out.PosListingPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class PosRestClientAdapterTest {

    private static final String BASE_URL = "http://pos.test";

    private MockRestServiceServer server;
    private PosRestClientAdapter adapter;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new PosRestClientAdapter(builder.build());
    }

    private static PosListingPayload payload() {
        return new PosListingPayload("USD", new BigDecimal("50.00"), "InApp", null,
                new PosListingPayload.Seating("101", "A"), null, "tm_pk_abc", 2, true,
                "tm_pk_abc", false, List.of(new PosListingPayload.ListingNote("Seats 1-2")));
    }

    @Nested
    @DisplayName("리스팅 생성")
    class Create {

        @Test
        @DisplayName("201 응답의 id 를 리스팅 ID 로 돌려준다")
        void created() {
            server.expect(requestTo(BASE_URL + "/inventory/"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.externalId").value("tm_pk_abc"))
                    .andExpect(jsonPath("$.seating.section").value("101"))
                    .andExpect(jsonPath("$.ticketCount").value(2))
                    .andRespond(withStatus(HttpStatus.CREATED)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body("{\"id\": 12345}"));

            PosCreateResult result = adapter.createListing(payload());

            assertThat(result.success()).isTrue();
            assertThat(result.listingId()).isEqualTo("12345");
            server.verify();
        }

        @Test
        @DisplayName("응답에 id 가 없으면 실패")
        void missingId() {
            server.expect(requestTo(BASE_URL + "/inventory/"))
                    .andRespond(withStatus(HttpStatus.CREATED)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body("{}"));

            PosCreateResult result = adapter.createListing(payload());

            assertThat(result.success()).isFalse();
            assertThat(result.errorMessage()).contains("missing listing id");
        }

        @Test
        @DisplayName("오류 응답은 상태 코드와 본문을 담은 실패 결과")
        void serverError() {
            server.expect(requestTo(BASE_URL + "/inventory/"))
                    .andRespond(withServerError().body("inventory locked"));

            PosCreateResult result = adapter.createListing(payload());

            assertThat(result.success()).isFalse();
            assertThat(result.httpStatus()).isEqualTo(500);
            assertThat(result.errorMessage()).isEqualTo("inventory locked");
        }

        @Test
        @DisplayName("네트워크 오류도 예외 대신 실패 결과")
        void networkError() {
            server.expect(requestTo(BASE_URL + "/inventory/"))
                    .andRespond(withException(new IOException("Read timed out")));

            PosCreateResult result = adapter.createListing(payload());

            assertThat(result.success()).isFalse();
            assertThat(result.httpStatus()).isNull();
            assertThat(result.errorMessage()).contains("Read timed out");
        }
    }

    @Nested
    @DisplayName("리스팅 삭제")
    class Delete {

        @Test
        @DisplayName("204 는 삭제 성공")
        void deleted() {
            server.expect(requestTo(BASE_URL + "/inventory/L-1"))
                    .andExpect(method(HttpMethod.DELETE))
                    .andRespond(withNoContent());

            assertThat(adapter.deleteListing("L-1").outcome()).isEqualTo(PosDeleteResult.Outcome.DELETED);
        }

        @Test
        @DisplayName("404 는 이미 없는 것으로 보고 성공 처리")
        void notFound() {
            server.expect(requestTo(BASE_URL + "/inventory/L-1"))
                    .andRespond(withResourceNotFound());

            PosDeleteResult result = adapter.deleteListing("L-1");

            assertThat(result.outcome()).isEqualTo(PosDeleteResult.Outcome.NOT_FOUND);
            assertThat(result.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("그 밖의 오류는 재시도 대상 실패")
        void failed() {
            server.expect(requestTo(BASE_URL + "/inventory/L-1"))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            PosDeleteResult result = adapter.deleteListing("L-1");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.httpStatus()).isEqualTo(503);
        }
    }

    @Test
    @DisplayName("관리자 홀드는 만료일과 메모를 담아 PUT")
    void adminHold() {
        server.expect(requestTo(BASE_URL + "/inventory/L-1"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.adminHold.expirationDate").value("2027-10-01T12:00:00"))
                .andExpect(jsonPath("$.adminHold.notes").value("Admin hold by kim"))
                .andRespond(withSuccess());

        PosHoldResult result = adapter.applyAdminHold("L-1",
                LocalDateTime.of(2027, 10, 1, 12, 0), "Admin hold by kim");

        assertThat(result.success()).isTrue();
        server.verify();
    }
}
