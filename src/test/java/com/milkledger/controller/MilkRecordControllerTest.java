package com.milkledger.controller;

import com.milkledger.domain.MilkRecord;
import com.milkledger.domain.User;
import com.milkledger.exception.UnauthorizedException;
import com.milkledger.report.MonthlyReportCalculator;
import com.milkledger.security.SecurityConfig;
import com.milkledger.security.TokenLifecycleService;
import com.milkledger.service.MilkRecordService;
import com.milkledger.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Controller slice tests: HTTP contract verification.
 * No database. Real security chain and real report calculator;
 * token verification and services are mocked.
 */
@WebMvcTest(MilkRecordController.class)
@Import({SecurityConfig.class, MonthlyReportCalculator.class})
class MilkRecordControllerTest {

    private static final String BEARER = "Bearer good-token";

    @Autowired MockMvc mockMvc;

    @MockBean TokenLifecycleService tokenLifecycleService;
    @MockBean MilkRecordService     recordService;
    @MockBean UserService           userService;

    @BeforeEach
    void setUp() {
        User user = new User("u@test.com", "u", "hash", new BigDecimal("50.00"), "INR", "₹");
        ReflectionTestUtils.setField(user, "id", 1L);

        lenient().when(tokenLifecycleService.verifyAccess("good-token")).thenReturn(1L);
        lenient().when(userService.getById(1L)).thenReturn(user);
    }

    private static MilkRecord record(long id, String date, String qty) {
        MilkRecord record = new MilkRecord(1L, LocalDate.parse(date), new BigDecimal(qty));
        ReflectionTestUtils.setField(record, "id", id);
        return record;
    }

    // ── authentication ───────────────────────────────────────────────────────

    @Test @DisplayName("GET /milk/records without token → 401 JSON body")
    void noToken() throws Exception {
        mockMvc.perform(get("/milk/records"))
               .andExpect(status().isUnauthorized())
               .andExpect(jsonPath("$.error").value("UNAUTHORIZED"))
               .andExpect(jsonPath("$.message").value(TokenLifecycleService.UNAUTHORIZED_MESSAGE));
        verifyNoInteractions(recordService);
    }

    @Test @DisplayName("GET /milk/records with rejected token → 401")
    void rejectedToken() throws Exception {
        when(tokenLifecycleService.verifyAccess("bad-token"))
            .thenThrow(new UnauthorizedException(TokenLifecycleService.UNAUTHORIZED_MESSAGE));

        mockMvc.perform(get("/milk/records").header("Authorization", "Bearer bad-token"))
               .andExpect(status().isUnauthorized());
        verifyNoInteractions(recordService);
    }

    // ── listing ──────────────────────────────────────────────────────────────

    @Test @DisplayName("GET /milk/records → month-grouped, totals per month, dd-MM-yyyy dates")
    void listByMonth() throws Exception {
        when(recordService.listAll(1L)).thenReturn(List.of(
                record(3, "2025-02-05", "3.0"),
                record(2, "2025-01-20", "1.5"),
                record(1, "2025-01-10", "2.0")));

        mockMvc.perform(get("/milk/records").header("Authorization", BEARER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.monthly_totals['01-2025']").value(175.0))
               .andExpect(jsonPath("$.monthly_totals['02-2025']").value(150.0))
               .andExpect(jsonPath("$.total_records").value(3))
               .andExpect(jsonPath("$.total_cost").value(325.0))
               .andExpect(jsonPath("$.currency_symbol").value("₹"))
               .andExpect(jsonPath("$.monthly_data['01-2025'][0].id").value(1))
               .andExpect(jsonPath("$.monthly_data['01-2025'][0].date").value("10-01-2025"))
               .andExpect(jsonPath("$.monthly_data['01-2025'][0].cost").value(100.0))
               .andExpect(jsonPath("$.monthly_data['01-2025'][1].milk_qty").value(1.5));
    }

    @Test @DisplayName("GET /milk/records with no records → empty maps, zero count")
    void listEmpty() throws Exception {
        when(recordService.listAll(1L)).thenReturn(List.of());

        mockMvc.perform(get("/milk/records").header("Authorization", BEARER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.monthly_data").isEmpty())
               .andExpect(jsonPath("$.monthly_totals").isEmpty())
               .andExpect(jsonPath("$.total_records").value(0));
    }

    // ── single record ────────────────────────────────────────────────────────

    @Test @DisplayName("GET /milk/records/{id} unknown → 404")
    void getNotFound() throws Exception {
        when(recordService.get(1L, 99L)).thenThrow(new NoSuchElementException("Record not found: 99"));

        mockMvc.perform(get("/milk/records/99").header("Authorization", BEARER))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test @DisplayName("GET /milk/records/abc → 400")
    void getNonNumericId() throws Exception {
        mockMvc.perform(get("/milk/records/abc").header("Authorization", BEARER))
               .andExpect(status().isBadRequest());
    }

    // ── create ───────────────────────────────────────────────────────────────

    @Test @DisplayName("POST without date → 201, service receives null date")
    void createWithoutDate() throws Exception {
        when(recordService.create(eq(1L), isNull(), eq(new BigDecimal("1.5"))))
            .thenReturn(record(5, "2025-03-14", "1.5"));

        mockMvc.perform(post("/milk/records")
                .header("Authorization", BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"milk_qty\": 1.5}"))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.message").exists())
               .andExpect(jsonPath("$.record.id").value(5))
               .andExpect(jsonPath("$.record.date").value("14-03-2025"))
               .andExpect(jsonPath("$.record.cost").value(75.0));
    }

    @Test @DisplayName("POST with ISO date → passed through")
    void createWithDate() throws Exception {
        when(recordService.create(1L, LocalDate.of(2025, 1, 10), new BigDecimal("2.0")))
            .thenReturn(record(6, "2025-01-10", "2.0"));

        mockMvc.perform(post("/milk/records")
                .header("Authorization", BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"milk_qty\": 2.0, \"date\": \"2025-01-10\"}"))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.record.date").value("10-01-2025"));
    }

    @Test @DisplayName("POST with negative milk_qty → 400")
    void createNegative() throws Exception {
        mockMvc.perform(post("/milk/records")
                .header("Authorization", BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"milk_qty\": -1}"))
               .andExpect(status().isBadRequest());
        verifyNoInteractions(recordService);
    }

    @Test @DisplayName("POST without milk_qty → 400")
    void createMissingQuantity() throws Exception {
        mockMvc.perform(post("/milk/records")
                .header("Authorization", BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"date\": \"2025-01-10\"}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.message").value("Milk quantity is required"));
    }

    @Test @DisplayName("POST with unparseable date → 400")
    void createBadDate() throws Exception {
        mockMvc.perform(post("/milk/records")
                .header("Authorization", BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"milk_qty\": 1, \"date\": \"10/01/2025\"}"))
               .andExpect(status().isBadRequest());
    }

    // ── update / delete ──────────────────────────────────────────────────────

    @Test @DisplayName("PUT another user's record → 404")
    void updateForeign() throws Exception {
        when(recordService.update(eq(1L), eq(42L), any(), any()))
            .thenThrow(new NoSuchElementException("Record not found: 42"));

        mockMvc.perform(put("/milk/records/42")
                .header("Authorization", BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"milk_qty\": 1}"))
               .andExpect(status().isNotFound());
    }

    @Test @DisplayName("DELETE own record → 200 with message")
    void deleteOwn() throws Exception {
        mockMvc.perform(delete("/milk/records/5").header("Authorization", BEARER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.message").value("Record deleted successfully"));
        verify(recordService).delete(1L, 5L);
    }
}
