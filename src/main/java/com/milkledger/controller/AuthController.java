package com.milkledger.controller;

import com.milkledger.domain.User;
import com.milkledger.dto.ApiResponses;
import com.milkledger.dto.RefreshRequest;
import com.milkledger.dto.RegisterUserRequest;
import com.milkledger.security.TokenLifecycleService;
import com.milkledger.security.TokenPair;
import com.milkledger.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication controller.
 *
 * HTTP CONTRACT SUMMARY:
 * POST /auth/register  → 201 | 400 | 409 (email taken)
 * POST /auth/login     → 200 | 401 (bad credentials) | 403 (email not verified)
 * POST /auth/refresh   → 200 | 401 (invalid, expired, wrong kind or already rotated)
 * POST /auth/logout    → 200 | 401
 * GET  /auth/me        → 200 | 401
 *
 * Access tokens go in subsequent requests as:
 *   Authorization: Bearer <access_token>
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Registration, login and token management")
public class AuthController {

    private final UserService           userService;
    private final TokenLifecycleService tokenLifecycleService;

    public AuthController(UserService           userService,
                          TokenLifecycleService tokenLifecycleService) {
        this.userService           = userService;
        this.tokenLifecycleService = tokenLifecycleService;
    }

    public record LoginRequest(
            @NotBlank @Email String email,
            @NotBlank        String password) {}

    @PostMapping("/register")
    @Operation(summary = "Register", description = "Create an account and receive a token pair")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Account created"),
        @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    public ResponseEntity<ApiResponses.AuthResponse> register(
            @Valid @RequestBody RegisterUserRequest request) {

        User user = userService.register(request.getEmail(), request.getUsername(), request.getPassword());
        TokenPair pair = tokenLifecycleService.issuePair(user.getId());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ApiResponses.AuthResponse("Registration successful", pair, user));
    }

    @PostMapping("/login")
    @Operation(summary = "Login", description = "Validate credentials and receive a token pair")
    public ResponseEntity<ApiResponses.AuthResponse> login(
            @Valid @RequestBody LoginRequest request) {

        User user = userService.authenticate(request.email(), request.password());
        TokenPair pair = tokenLifecycleService.issuePair(user.getId());

        return ResponseEntity.ok(new ApiResponses.AuthResponse("Login successful", pair, user));
    }

    /**
     * Rotate the refresh token. The presented token stops working immediately.
     */
    @PostMapping("/refresh")
    @Operation(summary = "Refresh", description = "Exchange the current refresh token for a new pair")
    public ResponseEntity<ApiResponses.TokenResponse> refresh(
            @Valid @RequestBody RefreshRequest request) {

        TokenPair pair = tokenLifecycleService.refresh(request.getRefreshToken());
        return ResponseEntity.ok(new ApiResponses.TokenResponse(pair));
    }

    /**
     * Revoke the refresh token. The current access token keeps working until it expires.
     */
    @PostMapping("/logout")
    @Operation(summary = "Logout", description = "Revoke the refresh token")
    public ResponseEntity<ApiResponses.MessageResponse> logout(@AuthenticationPrincipal Long userId) {
        tokenLifecycleService.revoke(userId);
        return ResponseEntity.ok(new ApiResponses.MessageResponse("Logged out successfully"));
    }

    @GetMapping("/me")
    @Operation(summary = "Current user", description = "Profile and pricing settings of the caller")
    public ResponseEntity<ApiResponses.ProfileResponse> me(@AuthenticationPrincipal Long userId) {
        return ResponseEntity.ok(new ApiResponses.ProfileResponse(userService.getById(userId)));
    }
}
