package com.example.pomodoro.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Set;

/**
 * Resolves the caller from an {@code Authorization: Bearer <token>} header.
 * A header that is present but unusable ends the request with 401 right here;
 * a missing header is left to the authorization rules of the filter chain.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String[] PUBLIC_PATHS = {"/", "/error", "/api/auth/register", "/api/auth/login"};
    private static final Set<String> PUBLIC_PATH_SET = Set.of(PUBLIC_PATHS);
    private static final String BEARER = "Bearer";

    private final JwtTokenService tokenService;
    private final AuthenticationEntryPoint authenticationEntryPoint;

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return PUBLIC_PATH_SET.contains(path);
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            AuthenticatedUser principal = authenticate(header);
            UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                    principal, null, Collections.emptyList());
            auth.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(auth);
        } catch (TokenAuthenticationException ex) {
            SecurityContextHolder.clearContext();
            log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getReason());
            authenticationEntryPoint.commence(request, response, ex);
            return;
        }
        filterChain.doFilter(request, response);
    }

    private AuthenticatedUser authenticate(String header) {
        String token = extractBearerToken(header);
        try {
            return tokenService.verify(token);
        } catch (TokenVerificationException ex) {
            throw TokenAuthenticationException.from(ex);
        }
    }

    static String extractBearerToken(String header) {
        String[] parts = header.trim().split("\\s+");
        if (!BEARER.equalsIgnoreCase(parts[0])) {
            throw new TokenAuthenticationException(TokenAuthenticationException.Reason.MALFORMED_AUTH_HEADER);
        }
        if (parts.length == 1) {
            throw new TokenAuthenticationException(TokenAuthenticationException.Reason.AUTHENTICATION_REQUIRED);
        }
        if (parts.length > 2) {
            throw new TokenAuthenticationException(TokenAuthenticationException.Reason.MALFORMED_AUTH_HEADER);
        }
        return parts[1];
    }
}
