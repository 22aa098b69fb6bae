package io.github.drompincen.fixflow.gateway.security;

import io.github.drompincen.fixflow.runtime.auth.AuthService;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.WebUtils;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the caller from the session cookie or the {@code Authorization: Bearer}
 * header and installs a {@link CurrentUser} principal. Requests without valid
 * credentials pass through unauthenticated and are rejected by the entry point.
 */
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

    private final AuthService authService;
    private final String cookieName;

    public SessionAuthenticationFilter(AuthService authService, String cookieName) {
        this.authService = authService;
        this.cookieName = cookieName;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Cookie cookie = WebUtils.getCookie(request, cookieName);
        String sessionToken = cookie != null ? cookie.getValue() : null;
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (sessionToken != null || authorization != null) {
            Optional<CurrentUser> user = authService.resolveCurrentUser(sessionToken, authorization);
            if (user.isPresent()) {
                CurrentUser principal = user.get();
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        principal, null,
                        List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name())));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                log.warn("Rejected credentials on {} {}", request.getMethod(), request.getRequestURI());
            }
        }
        chain.doFilter(request, response);
    }
}
