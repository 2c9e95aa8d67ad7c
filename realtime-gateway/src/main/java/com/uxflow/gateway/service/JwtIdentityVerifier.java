package com.uxflow.gateway.service;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.IdentityClaims;
import com.uxflow.gateway.domain.Tier;
import com.uxflow.gateway.exception.AdmissionException;
import com.uxflow.gateway.exception.AdmissionFailure;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;

/**
 * HMAC-signed JWT verification.
 *
 * The user id comes from the {@code sub} claim (or a {@code userId} claim for
 * tokens issued by older auth services) and the tier from the {@code tier}
 * claim.
 */
@Service
@Slf4j
public class JwtIdentityVerifier implements IdentityVerifier {

    static final String TIER_CLAIM = "tier";
    static final String USER_ID_CLAIM = "userId";

    private final SecretKey secretKey;
    private final JwtParser parser;
    private final Clock clock;
    private final GatewayMetrics metricsService;

    public JwtIdentityVerifier(GatewayProperties properties, Clock clock, GatewayMetrics metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(properties.getSecurity().getJwtSecret().getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
        this.metricsService = metricsService;
        this.parser = Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public IdentityClaims verify(String credential) {
        if (credential == null || credential.isBlank()) {
            throw reject(AdmissionFailure.UNAUTHENTICATED, "Authentication required", null);
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(credential).getPayload();
        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token: {}", e.getMessage());
            throw reject(AdmissionFailure.EXPIRED, "Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
            throw reject(AdmissionFailure.UNAUTHENTICATED, "Invalid token", e);
        }

        String userId = claims.getSubject();
        if (userId == null || userId.isBlank()) {
            userId = claims.get(USER_ID_CLAIM, String.class);
        }
        if (userId == null || userId.isBlank()) {
            log.warn("JWT token without user id");
            throw reject(AdmissionFailure.UNAUTHENTICATED, "Invalid token", null);
        }

        metricsService.recordAuthenticationAttempt("success");
        return IdentityClaims.builder()
                .userId(userId)
                .tier(Tier.fromClaim(claims.get(TIER_CLAIM)))
                .expiresAt(claims.getExpiration() != null ? claims.getExpiration().toInstant() : null)
                .credential(credential)
                .build();
    }

    /**
     * Issue a token signed with the gateway secret (development and tests).
     */
    public String generateToken(String userId, Tier tier, Duration ttl) {
        Date now = Date.from(clock.instant());
        return Jwts.builder()
                .subject(userId)
                .claim(TIER_CLAIM, tier.name().toLowerCase())
                .issuedAt(now)
                .expiration(new Date(now.getTime() + ttl.toMillis()))
                .signWith(secretKey)
                .compact();
    }

    private AdmissionException reject(AdmissionFailure failure, String message, Throwable cause) {
        metricsService.recordAuthenticationAttempt(failure.name().toLowerCase());
        return new AdmissionException(failure, message, cause);
    }
}
