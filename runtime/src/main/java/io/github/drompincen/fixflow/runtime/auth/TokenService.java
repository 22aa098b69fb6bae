package io.github.drompincen.fixflow.runtime.auth;

import io.github.drompincen.fixflow.persistence.document.UserDocument;
import io.github.drompincen.fixflow.runtime.config.FixFlowProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and verifies HS256 bearer tokens carrying {@code user_id}, {@code email} and
 * {@code exp} claims.
 */
@Service
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    static final String USER_ID_CLAIM = "user_id";
    static final String EMAIL_CLAIM = "email";

    private final SecretKey key;
    private final Duration ttl;
    private final Clock clock;

    public TokenService(FixFlowProperties properties, Clock clock) {
        String secret = properties.getAuth().getJwtSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("fixflow.auth.jwt-secret must be set");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = Duration.ofMinutes(properties.getAuth().getTokenTtlMinutes());
        this.clock = clock;
    }

    public String issue(UserDocument user) {
        Instant now = clock.instant();
        return Jwts.builder()
                .claim(USER_ID_CLAIM, user.getId())
                .claim(EMAIL_CLAIM, user.getEmail())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key)
                .compact();
    }

    /** Empty when the token is malformed, badly signed or expired. */
    public Optional<TokenClaims> verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            String userId = claims.get(USER_ID_CLAIM, String.class);
            if (userId == null) {
                log.debug("Token without {} claim", USER_ID_CLAIM);
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(userId, claims.get(EMAIL_CLAIM, String.class),
                    claims.getExpiration().toInstant()));
        } catch (ExpiredJwtException e) {
            log.debug("Token expired at {}", e.getClaims().getExpiration());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public record TokenClaims(String userId, String email, Instant expiresAt) {}
}
