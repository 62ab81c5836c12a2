package com.socialnet.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * JWT Authentication Filter for request validation.
 *
 * Filter Execution Flow:
 * 1. Extract JWT token from Authorization header (Bearer {token})
 * 2. Validate token signature and expiration
 * 3. Reject refresh tokens; only access tokens authenticate a request
 * 4. Set the Authentication in the SecurityContext
 * 5. Pass request to next filter in chain
 *
 * Requests without a usable token continue unauthenticated; SecurityConfig decides
 * whether the endpoint needs authentication.
 *
 * @see JwtTokenProvider
 * @see com.socialnet.config.SecurityConfig
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            String token = jwtTokenProvider.extractTokenFromHeader(request.getHeader("Authorization"));

            if (token != null && jwtTokenProvider.validateToken(token)) {
                if (jwtTokenProvider.parse(token).isAccessToken()) {
                    Authentication authentication = jwtTokenProvider.getAuthentication(token);
                    SecurityContextHolder.getContext().setAuthentication(authentication);

                    log.debug("Set authentication for user: {} on path: {}",
                            authentication.getPrincipal(), request.getRequestURI());
                } else {
                    log.warn("Refresh token used as bearer credential on path: {}", request.getRequestURI());
                }
            } else if (token != null) {
                log.warn("Invalid JWT token on path: {}", request.getRequestURI());
            }
        } catch (Exception ex) {
            // Leave the context empty; authorization rules reject the request if needed
            log.error("Cannot set user authentication: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) throws ServletException {
        return request.getRequestURI().startsWith("/error");
    }
}
