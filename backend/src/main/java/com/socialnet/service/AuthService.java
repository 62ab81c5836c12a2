package com.socialnet.service;

import com.socialnet.dto.request.LoginRequest;
import com.socialnet.dto.request.RegisterRequest;
import com.socialnet.dto.response.AuthResponse;
import com.socialnet.entity.Profile;
import com.socialnet.entity.User;
import com.socialnet.exception.DuplicateResourceException;
import com.socialnet.exception.UnauthorizedException;
import com.socialnet.repository.ProfileRepository;
import com.socialnet.repository.UserRepository;
import com.socialnet.security.JwtTokenProvider;
import com.socialnet.security.TokenDetails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Service for registration and the JWT token lifecycle.
 *
 * 1. Register: create the user (BCrypt password) and its profile
 * 2. Login: verify the password, issue an access + refresh token pair
 * 3. Refresh: exchange a valid, non-revoked refresh token for a new access token
 * 4. Logout: revoke the refresh token by blacklisting its jti
 *
 * Revoked entries are purged later by the CLEANUP_TOKENS job once the token would
 * have expired anyway.
 *
 * @see com.socialnet.security.JwtTokenProvider
 * @see com.socialnet.service.TokenBlacklistService
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuthService {

    public static final String LOGOUT_MESSAGE = "Logged out successfully";

    private final UserRepository userRepository;
    private final ProfileRepository profileRepository;
    private final JwtTokenProvider jwtTokenProvider;
    private final TokenBlacklistService tokenBlacklistService;
    private final PasswordEncoder passwordEncoder;

    /**
     * Register a new user together with its profile.
     *
     * @param request registration data
     * @return the new user's id, email and username
     * @throws DuplicateResourceException if the email or username is taken
     */
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());
        log.info("Registration requested for email: {}", email);

        if (userRepository.existsByEmail(email)) {
            log.warn("Registration rejected, email already registered: {}", email);
            throw DuplicateResourceException.emailTaken(email);
        }
        if (profileRepository.existsByUsername(request.getUsername())) {
            log.warn("Registration rejected, username taken: {}", request.getUsername());
            throw DuplicateResourceException.usernameTaken(request.getUsername());
        }

        User user = userRepository.save(new User(email, passwordEncoder.encode(request.getPassword())));
        Profile profile = profileRepository.save(
                new Profile(user, request.getUsername(), request.getFirstName(), request.getLastName()));

        log.info("User registered: userId={}, profileId={}, username={}",
                user.getId(), profile.getId(), profile.getUsername());

        return AuthResponse.builder()
                .userId(user.getId().toString())
                .email(user.getEmail())
                .username(profile.getUsername())
                .build();
    }

    /**
     * Verify credentials and issue an access + refresh token pair.
     *
     * @throws BadCredentialsException if the email is unknown or the password is wrong
     */
    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        String email = normalizeEmail(request.getEmail());

        User user = userRepository.findByEmail(email)
                .filter(u -> passwordEncoder.matches(request.getPassword(), u.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("Login failed for email: {}", email);
                    return new BadCredentialsException("Invalid email or password.");
                });

        String accessToken = jwtTokenProvider.generateAccessToken(
                user.getId(), user.getEmail(), Boolean.TRUE.equals(user.getIsStaff()));
        String refreshToken = jwtTokenProvider.generateRefreshToken(user.getId(), user.getEmail());

        log.info("Login successful for user: {} (ID: {})", email, user.getId());

        return AuthResponse.builder()
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .tokenType("Bearer")
                .expiresIn(jwtTokenProvider.getAccessExpirationMs())
                .userId(user.getId().toString())
                .email(user.getEmail())
                .build();
    }

    /**
     * Exchange a refresh token for a new access token.
     *
     * @throws BadCredentialsException if the token is invalid, expired, not a
     *         refresh token, revoked, or its user no longer exists
     */
    @Transactional(readOnly = true)
    public AuthResponse refresh(String refreshToken) {
        TokenDetails details = parseRefreshToken(refreshToken);

        if (tokenBlacklistService.isBlacklisted(details.getTokenId())) {
            log.warn("Refresh rejected, token revoked: jti={}", details.getTokenId());
            throw new BadCredentialsException("Refresh token has been revoked.");
        }

        User user = userRepository.findById(details.getUserId())
                .orElseThrow(() -> new BadCredentialsException("User no longer exists."));

        String accessToken = jwtTokenProvider.generateAccessToken(
                user.getId(), user.getEmail(), Boolean.TRUE.equals(user.getIsStaff()));

        log.info("Access token refreshed for user: {}", user.getId());

        return AuthResponse.builder()
                .accessToken(accessToken)
                .tokenType("Bearer")
                .expiresIn(jwtTokenProvider.getAccessExpirationMs())
                .userId(user.getId().toString())
                .email(user.getEmail())
                .build();
    }

    /**
     * Revoke the caller's refresh token.
     *
     * @param refreshToken the refresh token to revoke
     * @param currentUserId the authenticated caller
     * @return confirmation message
     * @throws IllegalArgumentException if the token is missing or invalid
     * @throws UnauthorizedException if the token belongs to another user
     */
    @Transactional
    public String logout(String refreshToken, UUID currentUserId) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new IllegalArgumentException("Refresh token is required.");
        }
        if (!jwtTokenProvider.validateToken(refreshToken)) {
            throw new IllegalArgumentException("Refresh token is invalid or expired.");
        }

        TokenDetails details = jwtTokenProvider.parse(refreshToken);
        if (!details.isRefreshToken()) {
            throw new IllegalArgumentException("A refresh token is required to log out.");
        }
        if (!details.getUserId().equals(currentUserId)) {
            log.warn("Logout rejected, token of user {} presented by {}", details.getUserId(), currentUserId);
            throw UnauthorizedException.accessDenied("refresh token", details.getTokenId());
        }

        tokenBlacklistService.blacklist(details);
        log.info("User logged out: userId={}", currentUserId);
        return LOGOUT_MESSAGE;
    }

    private TokenDetails parseRefreshToken(String refreshToken) {
        if (refreshToken == null || !jwtTokenProvider.validateToken(refreshToken)) {
            throw new BadCredentialsException("Refresh token is invalid or expired.");
        }
        TokenDetails details = jwtTokenProvider.parse(refreshToken);
        if (!details.isRefreshToken()) {
            throw new BadCredentialsException("Token is not a refresh token.");
        }
        return details;
    }

    private String normalizeEmail(String email) {
        if (email == null || email.trim().isEmpty()) {
            throw new IllegalArgumentException("Email cannot be null or empty");
        }
        return email.trim().toLowerCase();
    }
}
