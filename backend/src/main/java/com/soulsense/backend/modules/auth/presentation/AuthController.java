package com.soulsense.backend.modules.auth.presentation;

import com.soulsense.backend.global.web.ClientInfo;
import com.soulsense.backend.modules.auth.application.AuthService;
import com.soulsense.backend.modules.auth.domain.AuthErrorCode;
import com.soulsense.backend.modules.auth.domain.AuthException;
import com.soulsense.backend.modules.auth.domain.AuthState;
import com.soulsense.backend.modules.auth.domain.LoginResult;
import com.soulsense.backend.modules.auth.presentation.dto.LoginRequest;
import com.soulsense.backend.modules.auth.presentation.dto.LoginResponse;
import com.soulsense.backend.modules.auth.presentation.dto.PasswordResetCompleteRequest;
import com.soulsense.backend.modules.auth.presentation.dto.PasswordResetRequest;
import com.soulsense.backend.modules.auth.presentation.dto.RefreshRequest;
import com.soulsense.backend.modules.auth.presentation.dto.RegisterRequest;
import com.soulsense.backend.modules.auth.presentation.dto.RegisterResponse;
import com.soulsense.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.soulsense.backend.modules.auth.presentation.dto.TwoFactorVerifyRequest;
import com.soulsense.backend.modules.ratelimit.application.RateLimitFamily;
import com.soulsense.backend.modules.ratelimit.application.RateLimitedException;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Auth", description = "Registration, login, token refresh and password reset")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @Operation(summary = "Register an account")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request,
                                                     HttpServletRequest httpRequest) {
        ClientInfo client = ClientInfo.from(httpRequest);
        RegisterResponse body = RegisterResponse.from(
                authService.register(request.toFields(), client.ipAddress(), client.userAgent()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/login")
    @Operation(summary = "Log in with username or email",
            description = "Answers PRE_AUTH with a pre-auth token when the account has two-factor login enabled.")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        ClientInfo client = ClientInfo.from(httpRequest);
        LoginResult result = authService.login(request.identifier(), request.password(), client.ipAddress(),
                client.userAgent());
        return ResponseEntity.ok(toResponse(result, RateLimitFamily.LOGIN));
    }

    @PostMapping("/2fa/verify")
    @Operation(summary = "Complete a two-factor login")
    public ResponseEntity<LoginResponse> verifyTwoFactor(@Valid @RequestBody TwoFactorVerifyRequest request,
                                                         HttpServletRequest httpRequest) {
        ClientInfo client = ClientInfo.from(httpRequest);
        LoginResult result = authService.verify2fa(request.preAuthToken(), request.code(), client.ipAddress(),
                client.userAgent());
        return ResponseEntity.ok(toResponse(result, RateLimitFamily.OTP_VERIFY));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Rotate a refresh token")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(TokenPairResponse.from(authService.refreshAccessToken(request.refreshToken())));
    }

    @PostMapping("/password-reset")
    @Operation(summary = "Request a password reset code")
    public ResponseEntity<Void> initiatePasswordReset(@Valid @RequestBody PasswordResetRequest request,
                                                      HttpServletRequest httpRequest) {
        authService.initiatePasswordReset(request.email(), ClientInfo.from(httpRequest).ipAddress());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/password-reset/complete")
    @Operation(summary = "Set a new password with a reset code")
    public ResponseEntity<Void> completePasswordReset(@Valid @RequestBody PasswordResetCompleteRequest request,
                                                      HttpServletRequest httpRequest) {
        ClientInfo client = ClientInfo.from(httpRequest);
        authService.completePasswordReset(request.email(), request.code(), request.newPassword(),
                client.ipAddress(), client.userAgent());
        return ResponseEntity.noContent().build();
    }

    private static LoginResponse toResponse(LoginResult result, RateLimitFamily family) {
        if (result.success()) {
            return LoginResponse.from(result);
        }
        if (result.state() == AuthState.RATE_LIMITED) {
            throw new RateLimitedException(family, result.retryAfterSeconds());
        }
        AuthErrorCode code = result.errorCode() != null ? result.errorCode() : AuthErrorCode.INVALID_CREDENTIALS;
        throw new AuthException(code);
    }
}
