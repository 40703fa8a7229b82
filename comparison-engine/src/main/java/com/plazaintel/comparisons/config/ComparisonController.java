package com.plazaintel.comparisons.config;

import com.plazaintel.comparisons.model.EnsureResult;
import com.plazaintel.comparisons.model.PeriodListing;
import com.plazaintel.comparisons.service.ComparisonException;
import com.plazaintel.comparisons.service.ComparisonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ComparisonController {

    private final ComparisonService comparisonService;

    // ── Periods ──────────────────────────────────────────────────────────────

    /**
     * GET /periods
     *
     * Years (newest first) and the months of each that can be compared.
     */
    @GetMapping("/periods")
    public ResponseEntity<?> periodsAvailable() {
        return handle("periods_available", () -> {
            PeriodListing listing = comparisonService.periodsAvailable();
            return success(Map.of("years", listing.years(), "monthsPerYear", listing.monthsPerYear()));
        });
    }

    /**
     * POST /periods/2023/05/ensure
     *
     * Make one period resident, downloading it if needed.
     */
    @PostMapping("/periods/{year}/{month}/ensure")
    public ResponseEntity<?> ensurePeriod(@PathVariable String year, @PathVariable String month) {
        return handle("ensure_period", () -> {
            EnsureResult result = comparisonService.ensurePeriod(year, month);
            if (!result.ok()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(result.reason()));
            }
            return success(Map.of("reason", result.reason()));
        });
    }

    // ── Comparisons ──────────────────────────────────────────────────────────

    /**
     * GET /comparisons?year1=2024&month1=01&year2=2024&month2=06&region=Jalisco
     */
    @GetMapping("/comparisons")
    public ResponseEntity<?> compare(
            @RequestParam String year1,
            @RequestParam String month1,
            @RequestParam String year2,
            @RequestParam String month2,
            @RequestParam(defaultValue = "Todos") String region) {
        return handle("compare", () ->
                success(Map.of("result", comparisonService.compare(year1, month1, year2, month2, region))));
    }

    /**
     * GET /comparisons/years?year1=2023&year2=2024
     */
    @GetMapping("/comparisons/years")
    public ResponseEntity<?> compareYears(@RequestParam String year1, @RequestParam String year2) {
        return handle("compare_years", () ->
                success(Map.of("result", comparisonService.compareYears(year1, year2))));
    }

    // ── Maintenance ──────────────────────────────────────────────────────────

    @PostMapping("/caches/clear")
    public ResponseEntity<?> clearCaches() {
        return handle("clear_caches", () -> success(Map.of("cleared", comparisonService.clearCaches())));
    }

    @PostMapping("/index/reload")
    public ResponseEntity<?> reloadIndex() {
        return handle("reload_index", () -> success(comparisonService.reloadIndex()));
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        return handle("status", () -> success(comparisonService.status()));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ResponseEntity<?> handle(String operation, Supplier<ResponseEntity<?>> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (ComparisonException e) {
            log.info("{} could not be answered: {}", operation, e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(e.getMessage()));
        } catch (Exception e) {
            log.error("{} failed: {}", operation, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(error(e.getMessage()));
        }
    }

    private static ResponseEntity<?> success(Map<String, ?> body) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "success");
        out.putAll(body);
        return ResponseEntity.ok(out);
    }

    private static Map<String, String> error(String message) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("status", "error");
        out.put("error", message == null ? "unknown error" : message);
        return out;
    }
}
