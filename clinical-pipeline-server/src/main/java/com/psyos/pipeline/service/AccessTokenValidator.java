package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.exception.UnauthenticatedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Validates signed access tokens and turns them into the caller's tenant context.
 *
 * Claims: sub (user id), tenantId, role.
 */
@Service
@Slf4j
public class AccessTokenValidator {

    static final String CLAIM_TENANT = "tenantId";
    static final String CLAIM_ROLE = "role";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;

    public AccessTokenValidator(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
    }

    /**
     * @param authorization raw Authorization header value, with or without the Bearer prefix
     * @throws UnauthenticatedException for a missing, malformed, badly signed or expired token
     */
    public TenantUserContext authenticate(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            metricsService.recordAuthenticationAttempt(false);
            throw new UnauthenticatedException("Missing access token");
        }
        String token = authorization.startsWith("Bearer ")
                ? authorization.substring(7).trim()
                : authorization.trim();

        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String userId = claims.getSubject();
            String tenantId = claims.get(CLAIM_TENANT, String.class);
            String role = claims.get(CLAIM_ROLE, String.class);
            if (userId == null || tenantId == null || role == null) {
                throw new UnauthenticatedException("Access token lacks tenant context");
            }

            metricsService.recordAuthenticationAttempt(true);
            return new TenantUserContext(tenantId, userId, UserRole.valueOf(role));
        } catch (ExpiredJwtException e) {
            log.warn("Expired access token: subject={}", e.getClaims().getSubject());
            metricsService.recordAuthenticationAttempt(false);
            throw new UnauthenticatedException("Access token expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid access token: {}", e.getMessage());
            metricsService.recordAuthenticationAttempt(false);
            throw new UnauthenticatedException("Invalid access token");
        } catch (UnauthenticatedException e) {
            metricsService.recordAuthenticationAttempt(false);
            throw e;
        }
    }

    /**
     * Issues a token for the given context (development and tests).
     */
    public String issueToken(TenantUserContext context) {
        return Jwts.builder()
                .subject(context.getUserId())
                .claim(CLAIM_TENANT, context.getTenantId())
                .claim(CLAIM_ROLE, context.getRole().name())
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
                .signWith(secretKey)
                .compact();
    }
}
