package com.example.pomodoro.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import io.jsonwebtoken.security.WeakKeyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HS256-signed identity tokens.
 */
@Component
@Slf4j
public class JwtTokenService {

    static final String USERNAME_CLAIM = "username";
    private static final SignatureAlgorithm ALGORITHM = SignatureAlgorithm.HS256;

    private final Key key;
    private final Duration expiration;
    private final Clock clock;

    public JwtTokenService(@Value("${jwt.secret:}") String secret,
                           @Value("${jwt.expiration-minutes:10080}") long expirationMinutes,
                           Clock clock) {
        this.key = signingKey(secret);
        this.expiration = Duration.ofMinutes(expirationMinutes);
        this.clock = clock;
    }

    private static Key signingKey(String secret) {
        if (secret == null || secret.isBlank()) {
            log.warn("jwt.secret is not set, using a random signing key. Issued tokens will not survive a restart.");
            return Keys.secretKeyFor(ALGORITHM);
        }
        try {
            return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        } catch (WeakKeyException ex) {
            throw new IllegalStateException("jwt.secret must be at least 32 bytes long", ex);
        }
    }

    public String issue(Long userId, String username) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(String.valueOf(userId))
                .claim(USERNAME_CLAIM, username)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(expiration)))
                .signWith(key, ALGORITHM)
                .compact();
    }

    /**
     * @throws TokenVerificationException with the failure kind when the token is not acceptable
     */
    public AuthenticatedUser verify(String token) {
        Jws<Claims> jws;
        try {
            jws = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token);
        } catch (ExpiredJwtException ex) {
            throw new TokenVerificationException(TokenVerificationException.Kind.EXPIRED, ex);
        } catch (SignatureException | UnsupportedJwtException | WeakKeyException ex) {
            // unsigned tokens land here as UnsupportedJwtException, HS384/HS512 tokens as WeakKeyException
            throw new TokenVerificationException(TokenVerificationException.Kind.SIGNATURE_INVALID, ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new TokenVerificationException(TokenVerificationException.Kind.MALFORMED, ex);
        }

        if (!ALGORITHM.getValue().equals(jws.getHeader().getAlgorithm())) {
            throw new TokenVerificationException(TokenVerificationException.Kind.SIGNATURE_INVALID);
        }

        try {
            Claims claims = jws.getBody();
            String username = claims.get(USERNAME_CLAIM, String.class);
            if (claims.getExpiration() == null || username == null) {
                throw new TokenVerificationException(TokenVerificationException.Kind.MALFORMED);
            }
            return new AuthenticatedUser(Long.parseLong(claims.getSubject()), username);
        } catch (JwtException | NumberFormatException ex) {
            throw new TokenVerificationException(TokenVerificationException.Kind.MALFORMED, ex);
        }
    }
}
