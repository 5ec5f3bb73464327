package com.milkledger.controller;

import com.milkledger.domain.MilkRecord;
import com.milkledger.domain.User;
import com.milkledger.dto.ApiResponses;
import com.milkledger.dto.MilkRecordRequest;
import com.milkledger.report.MonthlyReport;
import com.milkledger.report.MonthlyReportCalculator;
import com.milkledger.service.MilkRecordService;
import com.milkledger.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for milk delivery records.
 *
 * RULES:
 * - No business logic: ownership and quantity rules live in MilkRecordService
 *   and MilkRecord, pricing and grouping in MonthlyReportCalculator
 * - Costs are computed on every response from the caller's current price
 * - A record owned by another user is a 404, never a 403
 *
 * HTTP CONTRACT SUMMARY:
 * GET    /milk/records        → 200 (month-grouped, empty maps if none)
 * GET    /milk/records/{id}   → 200 | 404
 * POST   /milk/records        → 201 | 400
 * PUT    /milk/records/{id}   → 200 | 400 | 404
 * DELETE /milk/records/{id}   → 200 | 404
 */
@RestController
@RequestMapping("/milk/records")
@Tag(name = "Milk Records", description = "Daily milk deliveries and monthly totals")
public class MilkRecordController {

    private final MilkRecordService       recordService;
    private final UserService             userService;
    private final MonthlyReportCalculator reportCalculator;

    public MilkRecordController(MilkRecordService       recordService,
                                UserService             userService,
                                MonthlyReportCalculator reportCalculator) {
        this.recordService    = recordService;
        this.userService      = userService;
        this.reportCalculator = reportCalculator;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // READ
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping
    @Operation(
        summary = "List records by month",
        description = "All records priced at the current unit price, grouped by MM-YYYY with per-month totals"
    )
    public ResponseEntity<ApiResponses.MonthlyRecordsResponse> listByMonth(@AuthenticationPrincipal Long userId) {
        User user = userService.getById(userId);
        MonthlyReport report = reportCalculator.compute(recordService.listAll(userId), user.getMilkPricePerLitre());
        return ResponseEntity.ok(new ApiResponses.MonthlyRecordsResponse(report, user.getCurrencySymbol()));
    }

    @GetMapping("/{recordId}")
    @Operation(summary = "Get record")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Record found"),
        @ApiResponse(responseCode = "404", description = "No such record for this user")
    })
    public ResponseEntity<ApiResponses.RecordEnvelope> get(
            @Parameter(description = "Record ID") @PathVariable Long recordId,
            @AuthenticationPrincipal Long userId) {

        MilkRecord record = recordService.get(userId, recordId);
        return ResponseEntity.ok(new ApiResponses.RecordEnvelope(null, priced(record, userId)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // MUTATIONS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Add a delivery. {@code date} defaults to today.
     */
    @PostMapping
    @Operation(summary = "Add record", description = "Record a delivery; date defaults to today")
    public ResponseEntity<ApiResponses.RecordEnvelope> create(
            @Valid @RequestBody MilkRecordRequest request,
            @AuthenticationPrincipal Long userId) {

        if (request.getMilkQty() == null) {
            throw new IllegalArgumentException("Milk quantity is required");
        }
        MilkRecord record = recordService.create(userId, request.getDate(), request.getMilkQty());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ApiResponses.RecordEnvelope("Record added successfully", priced(record, userId)));
    }

    @PutMapping("/{recordId}")
    @Operation(summary = "Edit record", description = "Change date and/or quantity; absent fields are kept")
    public ResponseEntity<ApiResponses.RecordEnvelope> update(
            @Parameter(description = "Record ID") @PathVariable Long recordId,
            @Valid @RequestBody MilkRecordRequest request,
            @AuthenticationPrincipal Long userId) {

        MilkRecord record = recordService.update(userId, recordId, request.getDate(), request.getMilkQty());
        return ResponseEntity.ok(new ApiResponses.RecordEnvelope("Record updated successfully", priced(record, userId)));
    }

    @DeleteMapping("/{recordId}")
    @Operation(summary = "Delete record")
    public ResponseEntity<ApiResponses.MessageResponse> delete(
            @Parameter(description = "Record ID") @PathVariable Long recordId,
            @AuthenticationPrincipal Long userId) {

        recordService.delete(userId, recordId);
        return ResponseEntity.ok(new ApiResponses.MessageResponse("Record deleted successfully"));
    }

    private ApiResponses.RecordResponse priced(MilkRecord record, Long userId) {
        User user = userService.getById(userId);
        return new ApiResponses.RecordResponse(record, reportCalculator.costOf(record, user.getMilkPricePerLitre()));
    }
}
