package io.github.hongjungwan.zkvault.starter;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * zkvault SDK 설정 Properties (prefix: zkvault).
 */
@Data
@ConfigurationProperties(prefix = "zkvault")
public class ZkVaultProperties {

    /** SDK 활성화 여부 */
    private boolean enabled = true;

    /** 프로젝트 이름 */
    private String project;

    /** 환경 이름 */
    private String environment = "development";

    /** 서비스 토큰 publicId (stk_...) */
    private String tokenId;

    /** 서비스 토큰 시크릿 (redenv_sk_...) */
    private String token;

    /** 신규 프로젝트의 히스토리 보존 개수 */
    private int historyLimit = 10;

    /** compare-and-set 충돌 시 최대 시도 횟수 */
    private int writeRetries = 3;

    /** 로드한 시크릿을 System properties로 내보낼지 여부 */
    private boolean populateSystemProperties = false;

    /** 시작 시 자가 진단 실행 여부 */
    private boolean diagnoseOnStartup = true;

    /** 캐시 설정 */
    private CacheProperties cache = new CacheProperties();

    @Data
    public static class CacheProperties {
        private Duration ttl = Duration.ofMinutes(5);
        private Duration staleWhileRevalidate = Duration.ofDays(1);
    }
}
