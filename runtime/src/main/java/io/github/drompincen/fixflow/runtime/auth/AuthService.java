package io.github.drompincen.fixflow.runtime.auth;

import io.github.drompincen.fixflow.persistence.document.SessionDocument;
import io.github.drompincen.fixflow.persistence.document.UserDocument;
import io.github.drompincen.fixflow.persistence.repository.SessionRepository;
import io.github.drompincen.fixflow.persistence.repository.UserRepository;
import io.github.drompincen.fixflow.protocol.api.LoginRequest;
import io.github.drompincen.fixflow.protocol.api.RegisterRequest;
import io.github.drompincen.fixflow.protocol.api.UserRole;
import io.github.drompincen.fixflow.runtime.config.FixFlowProperties;
import io.github.drompincen.fixflow.runtime.error.ErrorKind;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Password registration and login, external-identity sessions, and resolution of the
 * caller from a session cookie or bearer token.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final UserRepository userRepository;
    private final SessionRepository sessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final IdentityExchange identityExchange;
    private final Duration sessionTtl;
    private final Clock clock;
    private final String unknownUserHash;

    public AuthService(UserRepository userRepository, SessionRepository sessionRepository,
                       PasswordEncoder passwordEncoder, TokenService tokenService,
                       IdentityExchange identityExchange, FixFlowProperties properties, Clock clock) {
        this.userRepository = userRepository;
        this.sessionRepository = sessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.identityExchange = identityExchange;
        this.sessionTtl = properties.getAuth().getSessionTtl();
        this.clock = clock;
        this.unknownUserHash = passwordEncoder.encode("unknown-user");
    }

    public AuthResult register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw FixFlowException.conflict("Email already registered");
        }

        UserDocument user = new UserDocument();
        user.setEmail(email);
        user.setName(request.name());
        user.setRole(request.role() != null ? request.role() : UserRole.CLIENT);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setActive(true);
        user.setCreatedAt(clock.instant());
        try {
            user = userRepository.save(user);
        } catch (DuplicateKeyException e) {
            throw FixFlowException.conflict("Email already registered");
        }

        log.info("Registered user {} with role {}", user.getId(), user.getRole());
        return new AuthResult(tokenService.issue(user), user);
    }

    public AuthResult login(LoginRequest request) {
        UserDocument user = userRepository.findByEmail(normalizeEmail(request.email())).orElse(null);
        String storedHash = user != null && user.getPasswordHash() != null ? user.getPasswordHash() : unknownUserHash;
        // one hash comparison per attempt, known account or not
        boolean matches = passwordEncoder.matches(request.password(), storedHash);
        if (user == null || user.getPasswordHash() == null || !matches) {
            log.warn("Failed login for {}", request.email());
            throw FixFlowException.unauthenticated("Invalid credentials");
        }
        if (!user.isActive()) {
            log.warn("Login attempt on inactive account {}", user.getId());
            throw FixFlowException.unauthenticated("Account is inactive");
        }
        return new AuthResult(tokenService.issue(user), user);
    }

    /**
     * Exchanges a provider session id, creating a client account on first sight of the
     * email, and stores the provider's session token for cookie authentication.
     */
    public SessionLogin exchangeExternalSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw FixFlowException.badRequest("Session ID required");
        }

        ExternalIdentity identity;
        try {
            identity = identityExchange.exchange(sessionId);
        } catch (IdentityExchangeException e) {
            if (e.isTimeout()) {
                throw new FixFlowException(ErrorKind.UPSTREAM_TIMEOUT, e.getMessage(), e);
            }
            throw new FixFlowException(ErrorKind.BAD_REQUEST, "Failed to validate session: " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        String email = normalizeEmail(identity.email());
        UserDocument user = userRepository.findByEmail(email).orElseGet(() -> {
            UserDocument created = new UserDocument();
            created.setEmail(email);
            created.setName(identity.name() != null ? identity.name() : email);
            created.setPicture(identity.picture());
            created.setRole(UserRole.CLIENT);
            created.setActive(true);
            created.setCreatedAt(now);
            UserDocument saved = userRepository.save(created);
            log.info("Created user {} from external identity", saved.getId());
            return saved;
        });
        if (!user.isActive()) {
            throw FixFlowException.unauthenticated("Account is inactive");
        }

        SessionDocument session = new SessionDocument();
        session.setSessionToken(identity.sessionToken());
        session.setUserId(user.getId());
        session.setCreatedAt(now);
        session.setExpiresAt(now.plus(sessionTtl));
        sessionRepository.save(session);

        return new SessionLogin(user, session.getSessionToken(), session.getExpiresAt());
    }

    /**
     * Resolves the caller. A live session cookie wins over a bearer token; either way the
     * user must still exist and be active.
     */
    public Optional<CurrentUser> resolveCurrentUser(String sessionToken, String authorizationHeader) {
        Instant now = clock.instant();
        if (sessionToken != null && !sessionToken.isBlank()) {
            Optional<CurrentUser> fromSession = sessionRepository.findBySessionToken(sessionToken).stream()
                    .filter(s -> !s.isExpiredAt(now))
                    .findFirst()
                    .flatMap(s -> activeUser(s.getUserId()));
            if (fromSession.isPresent()) {
                return fromSession;
            }
        }

        if (authorizationHeader != null && authorizationHeader.startsWith(BEARER_PREFIX)) {
            String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
            return tokenService.verify(token).flatMap(claims -> activeUser(claims.userId()));
        }
        return Optional.empty();
    }

    public CurrentUser requireCurrentUser(String sessionToken, String authorizationHeader) {
        return resolveCurrentUser(sessionToken, authorizationHeader)
                .orElseThrow(() -> FixFlowException.unauthenticated("Not authenticated"));
    }

    /** Deletes every session stored under the token. Succeeds when there is none. */
    public long logout(String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) {
            return 0;
        }
        long removed = sessionRepository.deleteBySessionToken(sessionToken);
        log.debug("Logout removed {} session(s)", removed);
        return removed;
    }

    private Optional<CurrentUser> activeUser(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return userRepository.findById(userId)
                .filter(UserDocument::isActive)
                .map(CurrentUser::from);
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
