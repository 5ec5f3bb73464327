package com.milkledger.controller;

import com.milkledger.domain.User;
import com.milkledger.dto.ApiResponses;
import com.milkledger.dto.SettingsRequest;
import com.milkledger.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unit price and currency of the authenticated user.
 *
 * A price change applies retroactively: record costs are not stored, so the
 * next GET /milk/records re-prices every record.
 */
@RestController
@RequestMapping("/settings")
@Tag(name = "Settings", description = "Milk price and currency")
public class SettingsController {

    private final UserService userService;

    public SettingsController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    @Operation(summary = "Get settings", description = "Current price, currency and the supported currency list")
    public ResponseEntity<ApiResponses.SettingsResponse> get(@AuthenticationPrincipal Long userId) {
        return ResponseEntity.ok(new ApiResponses.SettingsResponse(null, userService.getById(userId)));
    }

    @PutMapping
    @Operation(summary = "Update settings", description = "Partial update; absent fields are kept")
    public ResponseEntity<ApiResponses.SettingsResponse> update(
            @Valid @RequestBody SettingsRequest request,
            @AuthenticationPrincipal Long userId) {

        User user = userService.updateSettings(
                userId,
                request.getMilkPricePerLitre(),
                request.getCurrency(),
                request.getCurrencySymbol());
        return ResponseEntity.ok(new ApiResponses.SettingsResponse("Settings updated successfully", user));
    }
}
