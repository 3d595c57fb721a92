package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourcePrefixRegistryTest {

    private SourcePrefixRegistry registry;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getGeneration().getSourcePrefixes().put("ticketmaster", "tm");
        registry = new SourcePrefixRegistry(properties);
    }

    @Test
    @DisplayName("등록되지 않은 소스와 null 소스는 기본 접두어")
    void unknownSource_usesDefault() {
        assertThat(registry.prefixOf("ticketmaster")).isEqualTo("tm");
        assertThat(registry.prefixOf("seatgeek")).isEqualTo("unk");
        assertThat(registry.prefixOf(null)).isEqualTo("unk");
    }

    @Test
    @DisplayName("reload 하면 이후 조회부터 새 목록을 쓴다")
    void reload_replacesMapping() {
        registry.reload(Map.of("seatgeek", "sg"));

        assertThat(registry.prefixOf("seatgeek")).isEqualTo("sg");
        assertThat(registry.prefixOf("ticketmaster")).isEqualTo("unk");
        assertThat(registry.snapshot()).containsOnlyKeys("seatgeek");
    }

    @Test
    @DisplayName("빈 목록이나 빈 접두어로는 교체할 수 없고 기존 목록이 유지된다")
    void reload_rejectsBlankEntries() {
        Map<String, String> blank = new HashMap<>();
        blank.put("seatgeek", " ");

        assertThatThrownBy(() -> registry.reload(Map.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.reload(blank)).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.prefixOf("ticketmaster")).isEqualTo("tm");
    }
}
