package com.socialnet.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for login, registration and token refresh.
 *
 * Example JSON response for login:
 * <pre>
 * {
 *   "accessToken": "eyJhbGciOiJIUzI1NiJ9...",
 *   "refreshToken": "eyJhbGciOiJIUzI1NiJ9...",
 *   "tokenType": "Bearer",
 *   "expiresIn": 900000,
 *   "userId": "550e8400-e29b-41d4-a716-446655440000",
 *   "email": "user@example.com"
 * }
 * </pre>
 *
 * Refresh responses carry only a new access token; registration carries no tokens.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {

    private String accessToken;

    private String refreshToken;

    private String tokenType;

    /**
     * Access token lifetime in milliseconds.
     */
    private Long expiresIn;

    private String userId;

    private String email;

    private String username;
}
