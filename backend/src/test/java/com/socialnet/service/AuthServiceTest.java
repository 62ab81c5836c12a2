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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthService.
 *
 * Tests the business logic for authentication including:
 * - Registration with duplicate checks
 * - Login and token pair issuance
 * - Refresh with revoked-token rejection
 * - Logout blacklisting
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService Unit Tests")
class AuthServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private ProfileRepository profileRepository;

    @Mock
    private JwtTokenProvider jwtTokenProvider;

    @Mock
    private TokenBlacklistService tokenBlacklistService;

    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private AuthService authService;

    private User testUser;
    private UUID testUserId;
    private String testEmail;

    @BeforeEach
    void setUp() {
        testUserId = UUID.randomUUID();
        testEmail = "test@example.com";
        testUser = new User(testEmail, "hashed");
        testUser.setId(testUserId);
        testUser.setIsStaff(false);
    }

    @Test
    @DisplayName("register should create user and profile")
    void testRegister_Success() {
        // Arrange
        RegisterRequest request = RegisterRequest.builder()
                .email("Test@Example.com ")
                .password("password123")
                .username("tester")
                .firstName("Test")
                .lastName("User")
                .build();
        when(userRepository.existsByEmail(testEmail)).thenReturn(false);
        when(profileRepository.existsByUsername("tester")).thenReturn(false);
        when(passwordEncoder.encode("password123")).thenReturn("hashed");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User saved = invocation.getArgument(0);
            saved.setId(testUserId);
            return saved;
        });
        when(profileRepository.save(any(Profile.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        AuthResponse response = authService.register(request);

        // Assert
        assertEquals(testUserId.toString(), response.getUserId());
        assertEquals(testEmail, response.getEmail());
        assertEquals("tester", response.getUsername());
        assertNull(response.getAccessToken());
    }

    @Test
    @DisplayName("register should reject a taken email")
    void testRegister_DuplicateEmail() {
        // Arrange
        RegisterRequest request = RegisterRequest.builder()
                .email(testEmail).password("password123").username("tester").build();
        when(userRepository.existsByEmail(testEmail)).thenReturn(true);

        // Act & Assert
        assertThrows(DuplicateResourceException.class, () -> authService.register(request));
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("login should issue an access and refresh token pair")
    void testLogin_Success() {
        // Arrange
        when(userRepository.findByEmail(testEmail)).thenReturn(Optional.of(testUser));
        when(passwordEncoder.matches("password123", "hashed")).thenReturn(true);
        when(jwtTokenProvider.generateAccessToken(testUserId, testEmail, false)).thenReturn("access");
        when(jwtTokenProvider.generateRefreshToken(testUserId, testEmail)).thenReturn("refresh");
        when(jwtTokenProvider.getAccessExpirationMs()).thenReturn(900000L);

        // Act
        AuthResponse response = authService.login(new LoginRequest(testEmail, "password123"));

        // Assert
        assertEquals("access", response.getAccessToken());
        assertEquals("refresh", response.getRefreshToken());
        assertEquals("Bearer", response.getTokenType());
        assertEquals(900000L, response.getExpiresIn());
    }

    @Test
    @DisplayName("login should reject a wrong password")
    void testLogin_WrongPassword() {
        // Arrange
        when(userRepository.findByEmail(testEmail)).thenReturn(Optional.of(testUser));
        when(passwordEncoder.matches(anyString(), anyString())).thenReturn(false);

        // Act & Assert
        assertThrows(BadCredentialsException.class,
                () -> authService.login(new LoginRequest(testEmail, "wrong")));
    }

    @Test
    @DisplayName("refresh should reject a blacklisted refresh token")
    void testRefresh_Revoked() {
        // Arrange
        when(jwtTokenProvider.validateToken("refresh")).thenReturn(true);
        when(jwtTokenProvider.parse("refresh")).thenReturn(refreshDetails(testUserId));
        when(tokenBlacklistService.isBlacklisted("jti-1")).thenReturn(true);

        // Act & Assert
        assertThrows(BadCredentialsException.class, () -> authService.refresh("refresh"));
        verify(jwtTokenProvider, never()).generateAccessToken(any(), anyString(), anyBoolean());
    }

    @Test
    @DisplayName("refresh should issue a new access token for a valid refresh token")
    void testRefresh_Success() {
        // Arrange
        when(jwtTokenProvider.validateToken("refresh")).thenReturn(true);
        when(jwtTokenProvider.parse("refresh")).thenReturn(refreshDetails(testUserId));
        when(tokenBlacklistService.isBlacklisted("jti-1")).thenReturn(false);
        when(userRepository.findById(testUserId)).thenReturn(Optional.of(testUser));
        when(jwtTokenProvider.generateAccessToken(testUserId, testEmail, false)).thenReturn("new-access");

        // Act
        AuthResponse response = authService.refresh("refresh");

        // Assert
        assertEquals("new-access", response.getAccessToken());
        assertNull(response.getRefreshToken());
    }

    @Test
    @DisplayName("logout should blacklist the caller's refresh token")
    void testLogout_Success() {
        // Arrange
        TokenDetails details = refreshDetails(testUserId);
        when(jwtTokenProvider.validateToken("refresh")).thenReturn(true);
        when(jwtTokenProvider.parse("refresh")).thenReturn(details);

        // Act
        String message = authService.logout("refresh", testUserId);

        // Assert
        assertEquals(AuthService.LOGOUT_MESSAGE, message);
        verify(tokenBlacklistService).blacklist(details);
    }

    @Test
    @DisplayName("logout should reject a missing token and another user's token")
    void testLogout_Rejected() {
        // Arrange
        when(jwtTokenProvider.validateToken("refresh")).thenReturn(true);
        when(jwtTokenProvider.parse("refresh")).thenReturn(refreshDetails(UUID.randomUUID()));

        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> authService.logout(" ", testUserId));
        assertThrows(UnauthorizedException.class, () -> authService.logout("refresh", testUserId));
        verify(tokenBlacklistService, never()).blacklist(any());
    }

    private TokenDetails refreshDetails(UUID userId) {
        return TokenDetails.builder()
                .tokenId("jti-1")
                .userId(userId)
                .email(testEmail)
                .type(JwtTokenProvider.TYPE_REFRESH)
                .expiresAt(LocalDateTime.now().plusDays(1))
                .build();
    }
}
