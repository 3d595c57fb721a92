package kr.hhplus.be.reconciliation.domain.performance;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 공연 (POS 리스팅에 필요한 이벤트/공연장 정보 + POS 연동 여부)
 */
public class Performance {

    private final String performanceId;
    private final String venueId;
    private String eventName;
    private LocalDateTime eventDate;
    private boolean eventDateConfirmed;
    private String venueName;
    private String city;
    private String stateProvince;
    private String countryCode;
    private boolean posEnabled;
    private final Long version;

    private Performance(String performanceId, String venueId, String eventName, LocalDateTime eventDate,
                        boolean eventDateConfirmed, String venueName, String city, String stateProvince,
                        String countryCode, boolean posEnabled, Long version) {
        this.performanceId = Objects.requireNonNull(performanceId, "공연 ID는 필수입니다");
        this.venueId = Objects.requireNonNull(venueId, "공연장 ID는 필수입니다");
        this.eventName = eventName;
        this.eventDate = eventDate;
        this.eventDateConfirmed = eventDateConfirmed;
        this.venueName = venueName;
        this.city = city;
        this.stateProvince = stateProvince;
        this.countryCode = countryCode == null || countryCode.isBlank() ? "US" : countryCode;
        this.posEnabled = posEnabled;
        this.version = version;
    }

    // 신규 공연은 POS 연동이 켜진 상태로 시작
    public static Performance create(String performanceId, String venueId, String eventName,
                                     LocalDateTime eventDate, String venueName, String city,
                                     String stateProvince, String countryCode) {
        return new Performance(performanceId, venueId, eventName, eventDate, true,
                venueName, city, stateProvince, countryCode, true, null);
    }

    public static Performance restore(String performanceId, String venueId, String eventName,
                                      LocalDateTime eventDate, boolean eventDateConfirmed, String venueName,
                                      String city, String stateProvince, String countryCode,
                                      boolean posEnabled, Long version) {
        return new Performance(performanceId, venueId, eventName, eventDate, eventDateConfirmed,
                venueName, city, stateProvince, countryCode, posEnabled, version);
    }

    /**
     * 스크랩으로 받은 최신 이벤트 정보 반영 (POS 연동 여부는 유지)
     */
    public void updateInfo(String eventName, LocalDateTime eventDate, String venueName,
                           String city, String stateProvince, String countryCode) {
        this.eventName = eventName;
        this.eventDate = eventDate;
        this.venueName = venueName;
        this.city = city;
        this.stateProvince = stateProvince;
        if (countryCode != null && !countryCode.isBlank()) {
            this.countryCode = countryCode;
        }
    }

    public void enablePos() {
        this.posEnabled = true;
    }

    public void disablePos() {
        this.posEnabled = false;
    }

    public String getPerformanceId() { return performanceId; }
    public String getVenueId() { return venueId; }
    public String getEventName() { return eventName; }
    public LocalDateTime getEventDate() { return eventDate; }
    public boolean isEventDateConfirmed() { return eventDateConfirmed; }
    public String getVenueName() { return venueName; }
    public String getCity() { return city; }
    public String getStateProvince() { return stateProvince; }
    public String getCountryCode() { return countryCode; }
    public boolean isPosEnabled() { return posEnabled; }
    public Long getVersion() { return version; }
}
