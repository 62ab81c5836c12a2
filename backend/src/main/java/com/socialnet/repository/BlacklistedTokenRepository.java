package com.socialnet.repository;

import com.socialnet.entity.BlacklistedToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Repository for revoked refresh tokens.
 */
@Repository
public interface BlacklistedTokenRepository extends JpaRepository<BlacklistedToken, String> {

    /** Check whether a token (by jti) has been revoked. */
    boolean existsByTokenId(String tokenId);

    /**
     * Delete every entry whose natural expiry is not after {@code cutoff}.
     *
     * @return number of rows deleted
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM BlacklistedToken t WHERE t.expiresAt <= :cutoff")
    int deleteExpired(@Param("cutoff") LocalDateTime cutoff);
}
