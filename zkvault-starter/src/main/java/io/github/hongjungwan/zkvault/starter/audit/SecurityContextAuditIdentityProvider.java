package io.github.hongjungwan.zkvault.starter.audit;

import io.github.hongjungwan.zkvault.spi.AuditIdentityProvider;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Security 기반 작성자 식별자 제공.
 *
 * SecurityContextHolder에서 현재 인증된 사용자 이름을 추출하고,
 * Spring Security가 없거나 인증 정보가 없으면 위임 provider 사용.
 */
@Slf4j
public class SecurityContextAuditIdentityProvider implements AuditIdentityProvider {

    static final String SECURITY_CONTEXT_HOLDER = "org.springframework.security.core.context.SecurityContextHolder";
    private static final String USER_DETAILS = "org.springframework.security.core.userdetails.UserDetails";
    private static final String ANONYMOUS_USER = "anonymousUser";

    // Spring Security 클래스 존재 여부 (런타임 체크)
    private static final boolean SPRING_SECURITY_PRESENT = isPresent(SECURITY_CONTEXT_HOLDER);

    private final AuditIdentityProvider fallback;

    public SecurityContextAuditIdentityProvider(AuditIdentityProvider fallback) {
        this.fallback = fallback;
    }

    @Override
    public String currentIdentity() {
        if (SPRING_SECURITY_PRESENT) {
            String user = extractFromSecurityContext();
            if (user != null) {
                return user;
            }
        }
        return fallback.currentIdentity();
    }

    private String extractFromSecurityContext() {
        try {
            // 리플렉션으로 Spring Security 호출 (컴파일 의존성 없이)
            Object securityContext = Class.forName(SECURITY_CONTEXT_HOLDER)
                    .getMethod("getContext")
                    .invoke(null);
            if (securityContext == null) {
                return null;
            }

            Object authentication = securityContext.getClass()
                    .getMethod("getAuthentication")
                    .invoke(securityContext);
            if (authentication == null) {
                return null;
            }

            Boolean authenticated = (Boolean) authentication.getClass()
                    .getMethod("isAuthenticated")
                    .invoke(authentication);
            if (!Boolean.TRUE.equals(authenticated)) {
                return null;
            }

            Object principal = authentication.getClass()
                    .getMethod("getPrincipal")
                    .invoke(authentication);
            if (principal != null && isUserDetails(principal)) {
                return (String) principal.getClass()
                        .getMethod("getUsername")
                        .invoke(principal);
            }

            String name = (String) authentication.getClass()
                    .getMethod("getName")
                    .invoke(authentication);
            return name == null || name.isBlank() || ANONYMOUS_USER.equals(name) ? null : name;

        } catch (ReflectiveOperationException | ClassCastException e) {
            log.debug("Failed to extract user from SecurityContext: {}", e.getMessage());
            return null;
        }
    }

    private static boolean isUserDetails(Object principal) {
        try {
            return Class.forName(USER_DETAILS).isInstance(principal);
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    static boolean isPresent(String className) {
        try {
            Class.forName(className);
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }
}
