package com.soulsense.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;

/**
 * Caller address and user agent as seen by the web layer.
 *
 * <p>The address is the servlet remote address. Forwarded headers are applied by the container
 * ({@code server.forward-headers-strategy: native}) and only when they come from a trusted proxy, so
 * a client cannot pick its own address by sending {@code X-Forwarded-For}.
 */
public record ClientInfo(String ipAddress, String userAgent) {

    public static ClientInfo from(HttpServletRequest request) {
        return new ClientInfo(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
    }
}
