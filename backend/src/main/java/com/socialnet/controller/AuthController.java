package com.socialnet.controller;

import com.socialnet.dto.request.LoginRequest;
import com.socialnet.dto.request.RefreshTokenRequest;
import com.socialnet.dto.request.RegisterRequest;
import com.socialnet.dto.response.AuthResponse;
import com.socialnet.dto.response.MessageResponse;
import com.socialnet.security.CurrentUser;
import com.socialnet.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for authentication endpoints.
 *
 * Authentication Flow:
 * 1. User POSTs to /api/auth/register with email, password and profile data
 * 2. User POSTs to /api/auth/login and receives an access + refresh token pair
 * 3. User sends the access token in the Authorization header for protected endpoints
 * 4. When the access token expires, the client POSTs the refresh token to /api/auth/refresh
 * 5. On logout the refresh token is blacklisted until it would have expired
 *
 * Register, login and refresh are public. Logout requires a valid access token.
 *
 * Error Responses:
 * - 400 Bad Request: Invalid input (validation errors, missing refresh token on logout)
 * - 401 Unauthorized: Wrong credentials, invalid or revoked refresh token
 * - 403 Forbidden: Logging out with another user's refresh token
 * - 409 Conflict: Email or username already registered
 *
 * All errors are handled by GlobalExceptionHandler and returned in RFC 7807 format.
 *
 * @see com.socialnet.service.AuthService
 * @see com.socialnet.security.JwtTokenProvider
 * @see com.socialnet.config.SecurityConfig
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;

    /**
     * Register a new user and its profile.
     *
     * Endpoint: POST /api/auth/register
     * Authentication: Not required (public endpoint)
     *
     * Example request:
     * <pre>
     * {
     *   "email": "user@example.com",
     *   "password": "s3cret-pass",
     *   "username": "jdoe",
     *   "firstName": "John",
     *   "lastName": "Doe"
     * }
     * </pre>
     */
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registration request received for username: {}", request.getUsername());
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    /**
     * Exchange credentials for an access + refresh token pair.
     *
     * Endpoint: POST /api/auth/login
     * Authentication: Not required (public endpoint)
     *
     * Example response:
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
     */
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login request received for email: {}", request.getEmail());
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * Issue a new access token for a valid, non-revoked refresh token.
     *
     * Endpoint: POST /api/auth/refresh
     * Authentication: Not required (the refresh token is the credential)
     */
    @PostMapping("/refresh")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(authService.refresh(request.getRefreshToken()));
    }

    /**
     * Revoke the caller's refresh token.
     *
     * Endpoint: POST /api/auth/logout
     * Authentication: Required (JWT access token)
     *
     * Example response:
     * <pre>
     * {
     *   "message": "Logged out successfully"
     * }
     * </pre>
     */
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(@RequestBody(required = false) RefreshTokenRequest request,
                                                  Authentication authentication) {
        String refreshToken = request != null ? request.getRefreshToken() : null;
        String message = authService.logout(refreshToken, CurrentUser.id(authentication));
        return ResponseEntity.ok(new MessageResponse(message));
    }
}
