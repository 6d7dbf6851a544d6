package com.soulsense.backend.modules.auth.presentation;

import java.util.List;

import com.soulsense.backend.global.security.AuthenticatedUser;
import com.soulsense.backend.global.security.SecurityUtils;
import com.soulsense.backend.global.web.ClientInfo;
import com.soulsense.backend.modules.auth.application.AuthService;
import com.soulsense.backend.modules.auth.presentation.dto.LogoutAllResponse;
import com.soulsense.backend.modules.auth.presentation.dto.SessionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sessions")
@Tag(name = "Sessions", description = "Active login sessions of the current user")
public class SessionController {

    private final AuthService authService;

    public SessionController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping
    @Operation(summary = "List active sessions")
    public ResponseEntity<List<SessionResponse>> list() {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        List<SessionResponse> sessions = authService.listActiveSessions(user.username()).stream()
                .map(session -> SessionResponse.from(session, user.sessionId()))
                .toList();
        return ResponseEntity.ok(sessions);
    }

    @DeleteMapping("/current")
    @Operation(summary = "Log out the current session")
    public ResponseEntity<Void> logout(HttpServletRequest httpRequest) {
        ClientInfo client = ClientInfo.from(httpRequest);
        authService.logout(SecurityUtils.getCurrentSessionId(), client.ipAddress(), client.userAgent());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    @Operation(summary = "Log out every session")
    public ResponseEntity<LogoutAllResponse> logoutEverywhere(HttpServletRequest httpRequest) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        ClientInfo client = ClientInfo.from(httpRequest);
        int count = authService.logoutEverywhere(user.username(), client.ipAddress(), client.userAgent());
        return ResponseEntity.ok(new LogoutAllResponse(count));
    }
}
