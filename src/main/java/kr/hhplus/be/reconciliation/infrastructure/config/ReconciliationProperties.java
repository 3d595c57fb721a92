package kr.hhplus.be.reconciliation.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    private Lease lease = new Lease();
    private Sync sync = new Sync();
    private Generation generation = new Generation();
    private Pos pos = new Pos();
    private Notification notification = new Notification();
    private CycleLock cycleLock = new CycleLock();

    @Getter
    @Setter
    public static class Lease {
        private int staleAfterMinutes = 30;
        private int optimisticMaxAttempts = 3;
        private long optimisticBaseDelayMs = 100;
    }

    @Getter
    @Setter
    public static class Sync {
        private int batchSize = 50;
        private long batchDelayMs = 1000;
        private int maxAttempts = 5;
        private int staleOperationMinutes = 60;
        private int highRetryThreshold = 3;
        private boolean autoSyncAfterReconcile = true;
    }

    @Getter
    @Setter
    public static class Generation {
        private int minPackSize = 2;
        private String strategy = "maximal";
        private String defaultPrefix = "unk";
        // source → 팩 ID 접두어
        private Map<String, String> sourcePrefixes = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Pos {
        private String baseUrl = "http://localhost:8089";
        private String authToken = "";
        private int timeoutSeconds = 30;
        private String currency = "USD";
        private String deliveryType = "InApp";
        private int adminHoldExpirationDays = 365;
    }

    @Getter
    @Setter
    public static class Notification {
        private String topic = "pos-sync-notifications";
    }

    @Getter
    @Setter
    public static class CycleLock {
        private long ttlSeconds = 300;
        private int retryCount = 3;
        private long retryDelayMs = 200;
    }
}
