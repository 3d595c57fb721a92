package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 스크랩 소스 → 팩 ID 접두어 (기동 시 설정에서 로딩, reload 로만 갱신)
 */
@Slf4j
@Component
public class SourcePrefixRegistry {

    private final String defaultPrefix;
    private volatile Map<String, String> prefixes;

    public SourcePrefixRegistry(ReconciliationProperties properties) {
        this.defaultPrefix = properties.getGeneration().getDefaultPrefix();
        this.prefixes = Map.copyOf(properties.getGeneration().getSourcePrefixes());
    }

    public String prefixOf(String source) {
        if (source == null) {
            return defaultPrefix;
        }
        return prefixes.getOrDefault(source, defaultPrefix);
    }

    public void reload(Map<String, String> newPrefixes) {
        if (newPrefixes == null || newPrefixes.isEmpty()) {
            throw new IllegalArgumentException("교체할 접두어 목록이 비어 있습니다");
        }
        newPrefixes.forEach((source, prefix) -> {
            if (source == null || source.isBlank() || prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("소스와 접두어는 비어 있을 수 없습니다: " + source + "=" + prefix);
            }
        });
        this.prefixes = Map.copyOf(newPrefixes);
        log.info("[팩생성] 소스 접두어 갱신 - count: {}", newPrefixes.size());
    }

    public Map<String, String> snapshot() {
        return prefixes;
    }
}
