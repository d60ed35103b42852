package com.b2b.inventory.controller;

import com.b2b.inventory.model.ErrorResponse;
import com.b2b.inventory.model.LowStockAlertReport;
import com.b2b.inventory.service.alert.LowStockAlertService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/companies/{companyId}/alerts/low-stock[?window_days=N]
 */
@RestController
@RequestMapping("/api/companies/{companyId}/alerts")
@RequiredArgsConstructor
public class LowStockAlertController {

    private final LowStockAlertService alertService;

    @GetMapping("/low-stock")
    public ResponseEntity<?> getLowStockAlerts(
            @PathVariable long companyId,
            @RequestParam(name = "window_days", required = false) Integer windowDays) {
        if (windowDays == null) {
            return ResponseEntity.ok(alertService.getLowStockAlerts(companyId));
        }
        if (windowDays < 1) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("window_days must be at least 1.", "window_days"));
        }
        LowStockAlertReport report = alertService.getLowStockAlerts(companyId, windowDays);
        return ResponseEntity.ok(report);
    }
}
