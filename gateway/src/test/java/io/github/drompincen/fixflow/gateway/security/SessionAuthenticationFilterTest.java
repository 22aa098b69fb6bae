package io.github.drompincen.fixflow.gateway.security;

import io.github.drompincen.fixflow.protocol.api.UserRole;
import io.github.drompincen.fixflow.runtime.auth.AuthService;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionAuthenticationFilterTest {

    @Mock private AuthService authService;

    private SessionAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new SessionAuthenticationFilter(authService, "session_token");
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void cookieSessionInstallsPrincipalWithRoleAuthority() throws Exception {
        CurrentUser user = new CurrentUser("u1", "u1@fixflow.test", "Uma", UserRole.SUPERVISOR, null);
        when(authService.resolveCurrentUser("tok", null)).thenReturn(Optional.of(user));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/work-orders");
        request.setCookies(new Cookie("session_token", "tok"));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth).isNotNull();
        assertThat(auth.getPrincipal()).isEqualTo(user);
        assertThat(auth.getAuthorities()).extracting(Object::toString).containsExactly("ROLE_SUPERVISOR");
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void bearerHeaderIsPassedThrough() throws Exception {
        when(authService.resolveCurrentUser(null, "Bearer abc")).thenReturn(Optional.empty());
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/auth/me");
        request.addHeader("Authorization", "Bearer abc");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void requestWithoutCredentialsSkipsLookup() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("POST", "/api/auth/login"), new MockHttpServletResponse(), chain);

        verifyNoInteractions(authService);
        assertThat(chain.getRequest()).isNotNull();
    }
}
