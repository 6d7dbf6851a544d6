package com.soulsense.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.soulsense.backend.modules.auth.application.AuthService;
import com.soulsense.backend.modules.auth.application.JwtTokenService;
import com.soulsense.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.soulsense.backend.modules.auth.domain.InvalidTokenException;
import com.soulsense.backend.modules.auth.domain.SessionValidation;
import com.soulsense.backend.modules.auth.domain.TokenScope;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code Authorization: Bearer} access tokens. The token must carry the access scope
 * and its session must still be active; logging out therefore invalidates outstanding access tokens.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final List<SimpleGrantedAuthority> USER_AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private final JwtTokenService jwtTokenService;
    private final AuthService authService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public SessionAuthenticationFilter(
            JwtTokenService jwtTokenService,
            AuthService authService,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.jwtTokenService = jwtTokenService;
        this.authService = authService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            AuthenticatedUser principal;
            try {
                principal = authenticate(token);
            } catch (InvalidTokenException ex) {
                SecurityContextHolder.clearContext();
                log.debug("Rejected bearer token on {}: {}", request.getRequestURI(), ex.getDetailMessage());
                authenticationEntryPoint.commence(request, response,
                        new BadCredentialsException(ex.getDetailMessage(), ex));
                return;
            }

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, token, USER_AUTHORITIES);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }

        filterChain.doFilter(request, response);
    }

    private AuthenticatedUser authenticate(String token) {
        ParsedToken parsed = jwtTokenService.parse(token, TokenScope.ACCESS);
        if (parsed.sessionId() == null) {
            throw new InvalidTokenException("Access token is not bound to a session");
        }
        SessionValidation validation = authService.validateSession(parsed.sessionId());
        if (!validation.valid() || !parsed.userId().equals(validation.userId())) {
            throw new InvalidTokenException("Session is no longer active");
        }
        return new AuthenticatedUser(parsed.userId(), validation.username(), parsed.sessionId());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/auth/") || path.startsWith("/actuator");
    }
}
