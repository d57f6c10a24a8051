package io.github.hongjungwan.zkvault.core.token;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * 세션이 발급한 임시 토큰의 정리 목록. 종료 시 순차적으로 폐기하며 개별 실패는 기록 후 계속 진행.
 */
@Slf4j
public class EphemeralTokenRegistry {

    private final Map<String, String> pending = new LinkedHashMap<>();

    /** 정리 대상 등록 (publicId -> project) */
    public synchronized void register(String project, String publicId) {
        pending.put(publicId, project);
    }

    /** 명시적으로 폐기된 토큰 제외 */
    public synchronized boolean unregister(String publicId) {
        return pending.remove(publicId) != null;
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized boolean contains(String publicId) {
        return pending.containsKey(publicId);
    }

    /**
     * 등록된 모든 토큰에 대해 revoker(project, publicId)를 순차 실행.
     *
     * @return 폐기에 성공한 개수
     */
    public int drain(BiConsumer<String, String> revoker) {
        List<Map.Entry<String, String>> snapshot;
        synchronized (this) {
            snapshot = pending.entrySet().stream()
                    .map(e -> Map.entry(e.getKey(), e.getValue()))
                    .toList();
            pending.clear();
        }

        int revoked = 0;
        for (Map.Entry<String, String> entry : snapshot) {
            String publicId = entry.getKey();
            try {
                revoker.accept(entry.getValue(), publicId);
                revoked++;
            } catch (RuntimeException e) {
                log.warn("Failed to revoke ephemeral token {} during cleanup: {}",
                        TokenIds.mask(publicId), e.getMessage());
            }
        }
        if (!snapshot.isEmpty()) {
            log.info("Ephemeral token cleanup finished: {}/{} revoked", revoked, snapshot.size());
        }
        return revoked;
    }
}
