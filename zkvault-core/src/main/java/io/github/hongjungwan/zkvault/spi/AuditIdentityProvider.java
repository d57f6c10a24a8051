package io.github.hongjungwan.zkvault.spi;

/**
 * 시크릿 버전에 기록할 작성자 식별자 제공.
 */
@FunctionalInterface
public interface AuditIdentityProvider {

    String currentIdentity();
}
