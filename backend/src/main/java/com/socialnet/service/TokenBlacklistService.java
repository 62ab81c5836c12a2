package com.socialnet.service;

import com.socialnet.entity.BlacklistedToken;
import com.socialnet.repository.BlacklistedTokenRepository;
import com.socialnet.security.TokenDetails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Manages revoked refresh tokens.
 *
 * On logout the refresh token's jti is stored with its natural expiry. The refresh
 * endpoint checks this table before issuing a new access token. Expired entries
 * are removed by the CLEANUP_TOKENS job, not by this service on its own.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TokenBlacklistService {

    private final BlacklistedTokenRepository blacklistedTokenRepository;
    private final Clock clock;

    /**
     * Revoke a parsed token by its jti. Revoking an already revoked token is a no-op.
     *
     * @param token the token's claims
     */
    public void blacklist(TokenDetails token) {
        if (blacklistedTokenRepository.existsByTokenId(token.getTokenId())) {
            log.debug("Token already blacklisted: jti={}", token.getTokenId());
            return;
        }

        BlacklistedToken entry = BlacklistedToken.builder()
                .tokenId(token.getTokenId())
                .userId(token.getUserId())
                .expiresAt(token.getExpiresAt())
                .blacklistedAt(LocalDateTime.now(clock))
                .build();

        blacklistedTokenRepository.save(entry);
        log.info("Token blacklisted for user '{}' (jti={}, expiresAt={})",
                token.getUserId(), token.getTokenId(), token.getExpiresAt());
    }

    public boolean isBlacklisted(String tokenId) {
        return tokenId != null && blacklistedTokenRepository.existsByTokenId(tokenId);
    }

    /**
     * Delete every entry whose natural expiry is not after {@code now}.
     *
     * @param now the cutoff
     * @return number of entries deleted
     */
    public int purgeExpired(LocalDateTime now) {
        int deleted = blacklistedTokenRepository.deleteExpired(now);
        log.info("Purged expired blacklisted tokens: deleted={}, cutoff={}", deleted, now);
        return deleted;
    }
}
