package com.mingle.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.mingle.backend.modules.auth.application.JwtTokenService;
import com.mingle.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.mingle.backend.modules.auth.application.JwtTokenService.ParsedToken;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves {@code Authorization: Bearer <token>} into a {@link JwtAuthenticationPrincipal}.
 * An invalid token leaves the request anonymous and records the reason for
 * {@link RestAuthenticationEntryPoint}, so protected endpoints answer 401 before any data is touched.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final String AUTH_ERROR_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".error";
    static final String ERROR_INVALID_TOKEN = "INVALID_ACCESS_TOKEN";
    static final String ERROR_MALFORMED_HEADER = "MALFORMED_AUTHORIZATION_HEADER";

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final List<SimpleGrantedAuthority> USER_AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private final JwtTokenService jwtTokenService;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService) {
        this.jwtTokenService = jwtTokenService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && !authorization.isBlank()) {
            if (authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
                authenticate(request, authorization.substring(BEARER_PREFIX.length()).trim());
            } else {
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, ERROR_MALFORMED_HEADER);
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, String token) {
        try {
            ParsedToken parsed = jwtTokenService.parseAccessToken(token);
            JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                    parsed.userId(),
                    parsed.email(),
                    parsed.name()
            );

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, token, USER_AUTHORITIES);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } catch (InvalidTokenException ex) {
            log.debug("Rejected bearer token on {}: {}", request.getRequestURI(), ex.getMessage());
            SecurityContextHolder.clearContext();
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, ERROR_INVALID_TOKEN);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getMethod().equalsIgnoreCase("OPTIONS");
    }
}
