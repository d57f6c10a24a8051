package io.github.hongjungwan.zkvault.api.domain;

import java.util.Map;

/**
 * 환경 전체 조회 결과. 복호화에 실패한 키는 values에서 빠지고 failures에 원인과 함께 기록.
 */
public record BulkReadResult(Map<String, String> values, Map<String, Throwable> failures) {

    public BulkReadResult {
        values = Map.copyOf(values);
        failures = Map.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
