package io.github.hongjungwan.zkvault.api.domain;

/**
 * 발급 직후 한 번만 반환되는 토큰 자격 증명. 시크릿은 어디에도 저장되지 않음.
 */
public record TokenCredentials(String publicId, String secret) {

    @Override
    public String toString() {
        return "TokenCredentials{publicId=" + publicId + ", secret=****}";
    }
}
