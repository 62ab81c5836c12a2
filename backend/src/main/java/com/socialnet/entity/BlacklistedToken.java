package com.socialnet.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Revoked refresh token, keyed by the token's jti claim.
 *
 * Rows are written on logout and purged by the CLEANUP_TOKENS job once the
 * token's natural expiry has passed, since an expired token is rejected anyway.
 *
 * Database Table: blacklisted_tokens
 */
@Entity
@Table(name = "blacklisted_tokens", indexes = {
    @Index(name = "idx_blacklisted_expires_at", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlacklistedToken {

    /**
     * JWT id (jti) of the revoked token.
     */
    @Id
    @Column(name = "token_id", nullable = false, updatable = false, length = 64)
    private String tokenId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "blacklisted_at", nullable = false)
    private LocalDateTime blacklistedAt;

    /**
     * Natural expiry of the revoked token. Eligible for deletion when this is not after now.
     */
    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;
}
