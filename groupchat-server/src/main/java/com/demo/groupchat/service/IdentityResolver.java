package com.demo.groupchat.service;

import com.demo.groupchat.domain.CallerIdentity;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Caller identity from a JWT bearer token
 *
 * Handles:
 * - signature and expiration checks
 * - mapping of sub / email / phone_number / name claims
 * - token issuing for development and tests
 */
@Service
@Slf4j
public class IdentityResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;

    public IdentityResolver(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
    }

    /**
     * Verify the Authorization header value and return the caller. Fails with
     * {@code UNAUTHENTICATED} when the token is missing, malformed, badly signed or expired.
     */
    public CallerIdentity resolve(String authorization) {
        if (!StringUtils.hasText(authorization)) {
            metricsService.incrementCounter("chat.auth.attempts", "success", "false");
            throw new ChatServiceException(ErrorCode.UNAUTHENTICATED, "Missing bearer token");
        }
        String token = authorization.startsWith(BEARER_PREFIX)
                ? authorization.substring(BEARER_PREFIX.length())
                : authorization;

        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (!StringUtils.hasText(claims.getSubject())) {
                throw new ChatServiceException(ErrorCode.UNAUTHENTICATED, "Token has no subject");
            }
            metricsService.incrementCounter("chat.auth.attempts", "success", "true");
            return CallerIdentity.builder()
                    .userId(claims.getSubject())
                    .email(claims.get("email", String.class))
                    .phoneNumber(claims.get("phone_number", String.class))
                    .displayName(claims.get("name", String.class))
                    .build();

        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token: {}", e.getMessage());
            metricsService.incrementCounter("chat.auth.attempts", "success", "false");
            throw new ChatServiceException(ErrorCode.UNAUTHENTICATED, "Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
            metricsService.incrementCounter("chat.auth.attempts", "success", "false");
            throw new ChatServiceException(ErrorCode.UNAUTHENTICATED, "Invalid token", e);
        }
    }

    /**
     * Generate JWT token (for testing/development)
     */
    public String generateToken(CallerIdentity identity) {
        return Jwts.builder()
                .subject(identity.getUserId())
                .claim("email", identity.getEmail())
                .claim("phone_number", identity.getPhoneNumber())
                .claim("name", identity.getDisplayName())
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
                .signWith(secretKey)
                .compact();
    }
}
