package com.socialnet.security;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Claims of a parsed JWT, as used by the auth flow.
 */
@Data
@Builder
public class TokenDetails {

    private String tokenId;

    private UUID userId;

    private String email;

    private String type;

    private boolean staff;

    private LocalDateTime expiresAt;

    public boolean isAccessToken() {
        return JwtTokenProvider.TYPE_ACCESS.equals(type);
    }

    public boolean isRefreshToken() {
        return JwtTokenProvider.TYPE_REFRESH.equals(type);
    }
}
