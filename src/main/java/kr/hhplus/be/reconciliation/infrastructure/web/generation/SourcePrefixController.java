package kr.hhplus.be.reconciliation.infrastructure.web.generation;

import kr.hhplus.be.reconciliation.application.service.SourcePrefixRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 스크랩 소스별 팩 ID 접두어 조회/교체
 * 접두어를 바꾸면 이후 생성되는 팩 ID가 달라지므로 새 소스를 추가할 때만 쓴다.
 */
@RestController
@RequestMapping("/api/v1/source-prefixes")
@RequiredArgsConstructor
public class SourcePrefixController {
    private final SourcePrefixRegistry sourcePrefixRegistry;

    @GetMapping
    public Map<String, String> prefixes() {
        return sourcePrefixRegistry.snapshot();
    }

    @PutMapping
    public Map<String, String> replace(@RequestBody Map<String, String> prefixes) {
        sourcePrefixRegistry.reload(prefixes);
        return sourcePrefixRegistry.snapshot();
    }
}
