package com.moldstudio.reservation.api.controller;

import com.moldstudio.common.dto.BaseResponse;
import com.moldstudio.reservation.api.dto.IncentiveEntryResponse;
import com.moldstudio.reservation.api.dto.IncentiveSummaryResponse;
import com.moldstudio.reservation.api.dto.LedgerCorrection;
import com.moldstudio.reservation.domain.service.IncentiveLedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.YearMonth;
import java.util.List;

@RestController
@RequestMapping("/api/v1/incentives")
@RequiredArgsConstructor
@PreAuthorize("hasRole('MANAGER')")
public class IncentiveController {

    private final IncentiveLedgerService incentiveLedger;

    @GetMapping
    public ResponseEntity<BaseResponse<List<IncentiveEntryResponse>>> listEntries(
            @RequestParam(required = false) @DateTimeFormat(pattern = "yyyy-MM") YearMonth month,
            @RequestParam(required = false) String staffInCharge) {
        return ResponseEntity.ok(BaseResponse.success(incentiveLedger.list(month, staffInCharge)));
    }

    @GetMapping("/summary")
    public ResponseEntity<BaseResponse<List<IncentiveSummaryResponse>>> monthlySummary(
            @RequestParam @DateTimeFormat(pattern = "yyyy-MM") YearMonth month) {
        return ResponseEntity.ok(BaseResponse.success(incentiveLedger.summary(month)));
    }

    /**
     * Recomputes the ledger from all reservations; returns the keys that were wrong.
     */
    @PostMapping("/rebuild")
    public ResponseEntity<BaseResponse<List<LedgerCorrection>>> rebuild() {
        List<LedgerCorrection> corrections = incentiveLedger.rebuild();
        return ResponseEntity.ok(BaseResponse.success("Incentive ledger rebuilt", corrections));
    }
}
