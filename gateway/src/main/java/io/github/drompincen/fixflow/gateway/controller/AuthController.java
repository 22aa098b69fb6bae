package io.github.drompincen.fixflow.gateway.controller;

import io.github.drompincen.fixflow.persistence.document.UserDocument;
import io.github.drompincen.fixflow.protocol.api.AuthResponse;
import io.github.drompincen.fixflow.protocol.api.LoginRequest;
import io.github.drompincen.fixflow.protocol.api.MessageResponse;
import io.github.drompincen.fixflow.protocol.api.PublicUserDto;
import io.github.drompincen.fixflow.protocol.api.RegisterRequest;
import io.github.drompincen.fixflow.protocol.api.SessionUserResponse;
import io.github.drompincen.fixflow.runtime.auth.AuthResult;
import io.github.drompincen.fixflow.runtime.auth.AuthService;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.auth.SessionLogin;
import io.github.drompincen.fixflow.runtime.config.FixFlowProperties;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    static final String SESSION_ID_HEADER = "X-Session-ID";

    private final AuthService authService;
    private final String cookieName;
    private final Clock clock;

    public AuthController(AuthService authService, FixFlowProperties properties, Clock clock) {
        this.authService = authService;
        this.cookieName = properties.getAuth().getCookieName();
        this.clock = clock;
    }

    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest req) {
        AuthResult result = authService.register(req);
        return ResponseEntity.status(HttpStatus.CREATED).body(new AuthResponse(result.token(), toDto(result.user())));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest req) {
        AuthResult result = authService.login(req);
        return ResponseEntity.ok(new AuthResponse(result.token(), toDto(result.user())));
    }

    @PostMapping("/google/session")
    public ResponseEntity<SessionUserResponse> externalSession(
            @RequestHeader(name = SESSION_ID_HEADER, required = false) String sessionId) {
        SessionLogin login = authService.exchangeExternalSession(sessionId);
        Duration remaining = Duration.between(clock.instant(), login.expiresAt());
        ResponseCookie cookie = sessionCookie(login.sessionToken(), remaining.isNegative() ? Duration.ZERO : remaining);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(new SessionUserResponse(toDto(login.user())));
    }

    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(
            @CookieValue(name = "${fixflow.auth.cookie-name:session_token}", required = false) String sessionToken) {
        authService.logout(sessionToken);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookie("", Duration.ZERO).toString())
                .body(new MessageResponse("Logged out successfully"));
    }

    @GetMapping("/me")
    public PublicUserDto me(@AuthenticationPrincipal CurrentUser user) {
        return new PublicUserDto(user.id(), user.email(), user.name(), user.role(), user.picture());
    }

    private ResponseCookie sessionCookie(String value, Duration maxAge) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .secure(true)
                .sameSite("None")
                .path("/")
                .maxAge(maxAge)
                .build();
    }

    private static PublicUserDto toDto(UserDocument user) {
        return new PublicUserDto(user.getId(), user.getEmail(), user.getName(), user.getRole(), user.getPicture());
    }
}
