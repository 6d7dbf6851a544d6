package com.soulsense.backend.modules.auth.presentation;

import java.util.UUID;

import com.soulsense.backend.global.security.SecurityUtils;
import com.soulsense.backend.global.web.ClientInfo;
import com.soulsense.backend.modules.auth.application.AuthService;
import com.soulsense.backend.modules.auth.presentation.dto.TwoFactorCodeRequest;
import com.soulsense.backend.modules.auth.presentation.dto.TwoFactorDisableRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/account/2fa")
@Tag(name = "Two-factor", description = "Enable or disable emailed login codes")
public class TwoFactorController {

    private final AuthService authService;

    public TwoFactorController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/setup")
    @Operation(summary = "Send a setup code")
    public ResponseEntity<Void> setup() {
        authService.initiateTwoFactorSetup(SecurityUtils.getCurrentUserId());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/enable")
    @Operation(summary = "Confirm the setup code and turn two-factor login on")
    public ResponseEntity<Void> enable(@Valid @RequestBody TwoFactorCodeRequest request,
                                       HttpServletRequest httpRequest) {
        UUID userId = SecurityUtils.getCurrentUserId();
        ClientInfo client = ClientInfo.from(httpRequest);
        authService.enableTwoFactor(userId, request.code(), client.ipAddress(), client.userAgent());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/disable")
    @Operation(summary = "Turn two-factor login off")
    public ResponseEntity<Void> disable(@Valid @RequestBody TwoFactorDisableRequest request,
                                        HttpServletRequest httpRequest) {
        UUID userId = SecurityUtils.getCurrentUserId();
        ClientInfo client = ClientInfo.from(httpRequest);
        authService.disableTwoFactor(userId, request.currentPassword(), client.ipAddress(), client.userAgent());
        return ResponseEntity.noContent().build();
    }
}
