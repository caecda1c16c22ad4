package com.loyaltycard.security;

import com.loyaltycard.common.exception.InvalidTokenException;
import com.loyaltycard.common.exception.InvalidTokenException.Reason;
import com.loyaltycard.config.TokenProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and validates signed, time-limited bearer tokens.
 *
 * Tokens are not persisted and cannot be revoked: a token stays valid until
 * its expiry, which is re-checked on every use.
 */
@Service
@Slf4j
public class TokenService {

    static final String VENDOR_ID_CLAIM = "vendor_id";
    static final String EMAIL_CLAIM = "email";

    private final SigningAlgorithm algorithm;
    private final SecretKey signingKey;
    private final Duration ttl;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(TokenProperties properties, Clock clock) {
        byte[] secret = properties.getSecret().getBytes(StandardCharsets.UTF_8);
        this.algorithm = properties.getAlgorithm();
        if (secret.length < algorithm.getMinimumKeyBytes()) {
            throw new IllegalStateException(String.format(
                "Token secret is %d bytes, %s requires at least %d",
                secret.length, algorithm, algorithm.getMinimumKeyBytes()));
        }
        this.signingKey = new SecretKeySpec(secret, algorithm.getJcaName());
        this.ttl = properties.getTtl();
        this.clock = clock;
        this.parser = Jwts.parser()
            .verifyWith(signingKey)
            .clock(() -> Date.from(clock.instant()))
            .build();

        log.info("Token service initialized: algorithm={}, ttl={}", algorithm, ttl);
    }

    public String issue(String vendorId, String email) {
        Instant now = clock.instant();
        return Jwts.builder()
            .claim(VENDOR_ID_CLAIM, vendorId)
            .claim(EMAIL_CLAIM, email)
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(ttl)))
            .signWith(signingKey, algorithm.getMacAlgorithm())
            .compact();
    }

    /**
     * Verifies signature and expiry.
     *
     * @throws InvalidTokenException with reason EXPIRED, MALFORMED or MISSING_CLAIM
     */
    public TokenClaims validate(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(Reason.MALFORMED, "Invalid token");
        }

        String vendorId;
        String email;
        Date expiration;
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            vendorId = claims.get(VENDOR_ID_CLAIM, String.class);
            email = claims.get(EMAIL_CLAIM, String.class);
            expiration = claims.getExpiration();
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException(Reason.EXPIRED, "Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(Reason.MALFORMED, "Invalid token", e);
        }

        if (vendorId == null || vendorId.isBlank()) {
            throw new InvalidTokenException(Reason.MISSING_CLAIM, "Invalid token: missing vendor_id");
        }
        // every issued token carries an expiry
        if (expiration == null) {
            throw new InvalidTokenException(Reason.MALFORMED, "Invalid token: missing expiry");
        }
        // valid only while now < exp
        if (!clock.instant().isBefore(expiration.toInstant())) {
            throw new InvalidTokenException(Reason.EXPIRED, "Token expired");
        }
        return new TokenClaims(vendorId, email, expiration.toInstant());
    }
}
