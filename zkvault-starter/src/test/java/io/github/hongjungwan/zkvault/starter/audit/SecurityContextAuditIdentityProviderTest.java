package io.github.hongjungwan.zkvault.starter.audit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SecurityContextAuditIdentityProvider 테스트")
class SecurityContextAuditIdentityProviderTest {

    private final SecurityContextAuditIdentityProvider provider =
            new SecurityContextAuditIdentityProvider(() -> "ci@build-host");

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Nested
    @DisplayName("인증된 사용자")
    class AuthenticatedTests {

        @Test
        @DisplayName("UserDetails principal이면 username 사용")
        void shouldUseUserDetailsUsername() {
            UserDetails alice = User.withUsername("alice").password("{noop}secret").roles("ADMIN").build();
            SecurityContextHolder.getContext().setAuthentication(
                    UsernamePasswordAuthenticationToken.authenticated(alice, null, alice.getAuthorities()));

            assertThat(provider.currentIdentity()).isEqualTo("alice");
        }

        @Test
        @DisplayName("일반 principal이면 Authentication 이름 사용")
        void shouldUseAuthenticationName() {
            SecurityContextHolder.getContext().setAuthentication(
                    new TestingAuthenticationToken("bob", "pw", "ROLE_USER"));

            assertThat(provider.currentIdentity()).isEqualTo("bob");
        }
    }

    @Nested
    @DisplayName("위임 provider 사용")
    class FallbackTests {

        @Test
        @DisplayName("인증 정보가 없으면 위임")
        void shouldFallBackWithoutAuthentication() {
            assertThat(provider.currentIdentity()).isEqualTo("ci@build-host");
        }

        @Test
        @DisplayName("익명 사용자는 위임")
        void shouldFallBackForAnonymousUser() {
            SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
                    "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));

            assertThat(provider.currentIdentity()).isEqualTo("ci@build-host");
        }

        @Test
        @DisplayName("인증되지 않은 토큰은 위임")
        void shouldFallBackForUnauthenticatedToken() {
            SecurityContextHolder.getContext().setAuthentication(
                    UsernamePasswordAuthenticationToken.unauthenticated("mallory", "pw"));

            assertThat(provider.currentIdentity()).isEqualTo("ci@build-host");
        }
    }

    @Test
    @DisplayName("클래스 존재 여부 확인")
    void shouldDetectPresentClass() {
        assertThat(SecurityContextAuditIdentityProvider.isPresent("java.lang.String")).isTrue();
        assertThat(SecurityContextAuditIdentityProvider.isPresent("com.example.Missing")).isFalse();
    }
}
