package io.github.hongjungwan.zkvault.spi;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 해시 지향 키-값 저장소 SPI. 저장소 운영자는 신뢰하지 않으며 암호문과 메타데이터만 전달됨.
 * 구현체는 통신 실패를 {@link io.github.hongjungwan.zkvault.api.exception.SecretStoreException}으로 변환.
 */
public interface SecretStore {

    /** 필드 값 조회 */
    Optional<String> hget(String key, String field);

    /** 해시 전체 조회 (없으면 빈 맵) */
    Map<String, String> hgetAll(String key);

    /** 여러 필드 저장 */
    void hset(String key, Map<String, String> fields);

    /** 단일 필드 저장 */
    default void hset(String key, String field, String value) {
        hset(key, Map.of(field, value));
    }

    /** 필드 삭제. 실제 삭제된 개수 반환 */
    long hdel(String key, String... fields);

    /** 키 삭제 */
    boolean del(String key);

    boolean exists(String key);

    /** 필드 단위 만료 설정 */
    void expireField(String key, String field, Duration ttl);

    /**
     * 필드 값이 expected와 같을 때만 value로 교체. expected가 null이면 필드가 없어야 함.
     *
     * @return 교체 여부
     */
    boolean compareAndSetField(String key, String field, String expected, String value);

    /** glob 패턴에 맞는 모든 키. 구현체는 커서가 끝날 때까지 순회 */
    List<String> scan(String pattern);

    /** 연결 확인 */
    boolean ping();
}
