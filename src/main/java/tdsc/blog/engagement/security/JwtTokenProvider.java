package tdsc.blog.engagement.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tdsc.blog.engagement.exception.TokenVerificationException;
import tdsc.blog.engagement.exception.TokenVerificationException.Reason;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HMAC-signed access tokens.
 *
 * <p>The token subject is the user id; {@code iat} and {@code exp} are set from the
 * injected {@link Clock}. Verification uses the same clock, so expiry is deterministic
 * under test.</p>
 */
@Slf4j
@Component
public class JwtTokenProvider {

    private final SecretKey signingKey;
    private final MacAlgorithm algorithm;
    private final Duration lifetime;
    private final Clock clock;
    private final JwtParser parser;

    public JwtTokenProvider(JwtProperties properties, Clock clock) {
        this.algorithm = resolveAlgorithm(properties.getAlgorithm());
        byte[] secret = properties.getSecret().getBytes(StandardCharsets.UTF_8);
        int requiredBits = minimumKeyBits(properties.getAlgorithm());
        if (secret.length * 8 < requiredBits) {
            throw new IllegalStateException("JWT secret is too short for " + properties.getAlgorithm()
                    + ": need at least " + requiredBits / 8 + " bytes, got " + secret.length);
        }
        this.signingKey = Keys.hmacShaKeyFor(secret);
        this.lifetime = Duration.ofMinutes(properties.getExpireMinutes());
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
        log.info("JWT provider initialised: algorithm={}, lifetime={}min",
                properties.getAlgorithm(), properties.getExpireMinutes());
    }

    /**
     * Issue a token for the given user
     *
     * @param userId the subject
     * @return compact signed JWT
     */
    public String issueToken(Long userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(lifetime)))
                .signWith(signingKey, algorithm)
                .compact();
    }

    /**
     * Verify signature, algorithm and expiry, and extract the user id
     *
     * @param token compact JWT, without the "Bearer " prefix
     * @return the user id carried in the subject claim
     * @throws TokenVerificationException with reason EXPIRED, INVALID (including a token signed
     *                                    with an HS algorithm other than the configured one) or MALFORMED
     */
    public Long verifyToken(String token) {
        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            throw new TokenVerificationException(Reason.EXPIRED, "Token expired", e);
        } catch (MalformedJwtException e) {
            throw new TokenVerificationException(Reason.MALFORMED, "Malformed token", e);
        } catch (JwtException e) {
            throw new TokenVerificationException(Reason.INVALID, "Invalid token: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(Reason.MALFORMED, "Empty token", e);
        }

        String tokenAlgorithm = jws.getHeader().getAlgorithm();
        if (!algorithm.getId().equals(tokenAlgorithm)) {
            throw new TokenVerificationException(Reason.INVALID,
                    "Token algorithm " + tokenAlgorithm + " does not match " + algorithm.getId());
        }

        String subject = jws.getPayload().getSubject();
        if (subject == null || subject.isBlank()) {
            throw new TokenVerificationException(Reason.MALFORMED, "Token has no subject");
        }
        try {
            return Long.valueOf(subject);
        } catch (NumberFormatException e) {
            throw new TokenVerificationException(Reason.MALFORMED, "Token subject is not a user id", e);
        }
    }

    public Duration getLifetime() {
        return lifetime;
    }

    private static MacAlgorithm resolveAlgorithm(String name) {
        switch (name) {
            case "HS256":
                return Jwts.SIG.HS256;
            case "HS384":
                return Jwts.SIG.HS384;
            case "HS512":
                return Jwts.SIG.HS512;
            default:
                throw new IllegalStateException("Unsupported JWT algorithm: " + name);
        }
    }

    private static int minimumKeyBits(String name) {
        return Integer.parseInt(name.substring(2));
    }
}
