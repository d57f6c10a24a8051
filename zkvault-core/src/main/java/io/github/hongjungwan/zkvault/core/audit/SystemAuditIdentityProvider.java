package io.github.hongjungwan.zkvault.core.audit;

import io.github.hongjungwan.zkvault.spi.AuditIdentityProvider;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * 기본 감사 식별자: {@code user@host}.
 */
@Slf4j
public class SystemAuditIdentityProvider implements AuditIdentityProvider {

    static final String UNKNOWN = "unknown";

    @Override
    public String currentIdentity() {
        String user = System.getProperty("user.name");
        return (user == null || user.isBlank() ? UNKNOWN : user) + "@" + hostName();
    }

    private String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Failed to resolve local host name: {}", e.getMessage());
            return UNKNOWN;
        }
    }
}
