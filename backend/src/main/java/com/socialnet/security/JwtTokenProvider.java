package com.socialnet.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * JWT Token Provider for issuing and validating access and refresh tokens.
 *
 * Two token types are issued, distinguished by the "type" claim:
 * - access: short-lived, accepted by JwtAuthenticationFilter on every request
 * - refresh: long-lived, accepted only by /api/auth/refresh and /api/auth/logout
 *
 * Every token carries a random jti so a single refresh token can be revoked by
 * writing its jti to the blacklist. Tokens are signed with HS256.
 *
 * Claims:
 * - sub: User ID (UUID)
 * - jti: Token ID (UUID)
 * - email: User email address
 * - staff: Staff flag (access tokens only)
 * - type: "access" or "refresh"
 * - iat / exp: Issue and expiry timestamps
 *
 * @see io.jsonwebtoken.Jwts
 * @see com.socialnet.service.TokenBlacklistService
 */
@Component
@Slf4j
public class JwtTokenProvider {

    public static final String TYPE_ACCESS = "access";
    public static final String TYPE_REFRESH = "refresh";

    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_STAFF = "staff";
    private static final String CLAIM_TYPE = "type";

    private final Clock clock;

    @Value("${jwt.secret}")
    private String jwtSecret;

    @Value("${jwt.access-expiration:900000}")
    private long accessExpirationMs;

    @Value("${jwt.refresh-expiration:86400000}")
    private long refreshExpirationMs;

    private SecretKey secretKey;

    public JwtTokenProvider(Clock clock) {
        this.clock = clock;
    }

    /**
     * Initialize the secret key after properties are injected.
     */
    @PostConstruct
    public void init() {
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        log.info("JWT Token Provider initialized: accessExpiration={} ms, refreshExpiration={} ms",
                accessExpirationMs, refreshExpirationMs);
    }

    /**
     * Generate a short-lived access token.
     *
     * @param userId the user's unique identifier
     * @param email the user's email address
     * @param staff whether the user is staff
     * @return JWT token string
     */
    public String generateAccessToken(UUID userId, String email, boolean staff) {
        String token = buildToken(userId, email, TYPE_ACCESS, accessExpirationMs)
                .claim(CLAIM_STAFF, staff)
                .compact();

        log.debug("Generated access token for user: {} (email: {})", userId, email);
        return token;
    }

    /**
     * Generate a long-lived refresh token.
     *
     * @param userId the user's unique identifier
     * @param email the user's email address
     * @return JWT token string
     */
    public String generateRefreshToken(UUID userId, String email) {
        String token = buildToken(userId, email, TYPE_REFRESH, refreshExpirationMs).compact();

        log.debug("Generated refresh token for user: {} (email: {})", userId, email);
        return token;
    }

    private JwtBuilder buildToken(UUID userId, String email, String type, long expirationMs) {
        Date now = Date.from(clock.instant());
        Date expiryDate = new Date(now.getTime() + expirationMs);

        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(userId.toString())
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_TYPE, type)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(secretKey, Jwts.SIG.HS256);
    }

    /**
     * Validate JWT token signature, expiration, and structure.
     *
     * @param token the JWT token to validate
     * @return true if token is valid, false otherwise
     */
    public boolean validateToken(String token) {
        try {
            parseClaims(token);
            return true;
        } catch (SecurityException ex) {
            log.error("Invalid JWT signature: {}", ex.getMessage());
        } catch (MalformedJwtException ex) {
            log.error("Invalid JWT token: {}", ex.getMessage());
        } catch (ExpiredJwtException ex) {
            log.warn("Expired JWT token: {}", ex.getMessage());
        } catch (UnsupportedJwtException ex) {
            log.error("Unsupported JWT token: {}", ex.getMessage());
        } catch (IllegalArgumentException ex) {
            log.error("JWT claims string is empty: {}", ex.getMessage());
        }
        return false;
    }

    /**
     * Parse a token that has already been validated.
     *
     * @param token the JWT token
     * @return the token's details
     * @throws JwtException if the token is invalid
     */
    public TokenDetails parse(String token) {
        Claims claims = parseClaims(token);
        return TokenDetails.builder()
                .tokenId(claims.getId())
                .userId(UUID.fromString(claims.getSubject()))
                .email(claims.get(CLAIM_EMAIL, String.class))
                .type(claims.get(CLAIM_TYPE, String.class))
                .staff(Boolean.TRUE.equals(claims.get(CLAIM_STAFF, Boolean.class)))
                .expiresAt(LocalDateTime.ofInstant(claims.getExpiration().toInstant(), clock.getZone()))
                .build();
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /**
     * Build the Spring Security Authentication for a validated access token.
     *
     * The principal is the user ID string. Every user gets ROLE_USER; staff users
     * also get ROLE_ADMIN.
     *
     * @param token the JWT token
     * @return Authentication object with user details
     */
    public Authentication getAuthentication(String token) {
        TokenDetails details = parse(token);

        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
        if (details.isStaff()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(details.getUserId().toString(), null, authorities);
        authentication.setDetails(details.getEmail());
        return authentication;
    }

    /**
     * Extract JWT token from Authorization header ("Bearer {token}").
     *
     * @param bearerToken the Authorization header value
     * @return the JWT token string, or null if header is invalid
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    public long getAccessExpirationMs() {
        return accessExpirationMs;
    }
}
