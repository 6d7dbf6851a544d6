package com.soulsense.backend.global.security;

import java.io.IOException;

import com.soulsense.backend.global.error.ProblemResponse;
import com.soulsense.backend.modules.auth.domain.AuthErrorCode;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Writes the 401 problem body for missing, expired, forged or session-revoked access tokens.
 * Every case produces the same body.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final String BEARER_CHALLENGE = "Bearer realm=\"soulsense\"";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        AuthErrorCode error = AuthErrorCode.INVALID_TOKEN;
        ProblemResponse body = ProblemResponse.of(error.getStatus(), error.getCode(), error.getPublicMessage(),
                request.getRequestURI());

        response.setStatus(error.getStatus().value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
