package io.github.hongjungwan.zkvault.api.config;

import com.github.benmanes.caffeine.cache.Ticker;
import io.github.hongjungwan.zkvault.core.internal.VaultExecutors;
import lombok.Builder;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * SDK 설정. 런타임 클라이언트 자격 증명, 캐시 정책, 히스토리 보존, 쓰기 재시도 설정 포함.
 */
@Getter
@Builder(toBuilder = true)
public class VaultConfig {

    /** 프로젝트 이름 (':' 및 '@' 사용 불가) */
    private final String project;

    /** 환경 이름 */
    @Builder.Default
    private final String environment = "development";

    /** 서비스 토큰 publicId. 쓰기 작업의 감사 식별자로도 사용 */
    private final String tokenId;

    /** 서비스 토큰 시크릿 */
    private final String token;

    /** 캐시 신선 구간 (기본: 5분) */
    @Builder.Default
    private final Duration cacheTtl = Duration.ofSeconds(300);

    /** stale 값 제공 구간. ttl 이후 이 기간 동안 백그라운드 갱신 (기본: 1일) */
    @Builder.Default
    private final Duration cacheStaleWhileRevalidate = Duration.ofSeconds(86_400);

    /** 메타데이터에 historyLimit이 없을 때 적용할 보존 개수 */
    @Builder.Default
    private final int defaultHistoryLimit = 10;

    /** compare-and-set 충돌 시 최대 시도 횟수 */
    @Builder.Default
    private final int writeRetries = 3;

    /** 재시도 간격 */
    @Builder.Default
    private final Duration writeRetryDelay = Duration.ofMillis(50);

    /** 로드한 시크릿을 System properties로 내보낼지 여부 */
    @Builder.Default
    private final boolean populateSystemProperties = false;

    /** 병렬 조회/복호화 및 백그라운드 갱신용 Executor */
    @Builder.Default
    private final Executor executor = VaultExecutors.shared();

    /** 버전 생성 시각, 토큰 만료 계산용 */
    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    /** 캐시 나이 계산용 Ticker (테스트에서 교체) */
    @Builder.Default
    private final Ticker cacheTicker = Ticker.systemTicker();

    /** 개발용 기본 설정 */
    public static VaultConfig defaultConfig() {
        return VaultConfig.builder().build();
    }

    /** 서비스 토큰 기반 런타임 클라이언트 설정 */
    public static VaultConfig clientConfig(String project, String environment, String tokenId, String token) {
        return VaultConfig.builder()
                .project(project)
                .environment(environment)
                .tokenId(tokenId)
                .token(token)
                .build();
    }
}
