package com.phillippitts.worktracker.presentation.controller;

import com.phillippitts.worktracker.domain.PositionSample;
import com.phillippitts.worktracker.service.location.ReportedPositionCapability;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Receives periodic device position reports, used to answer verification checks.
 */
@RestController
class PositionController {

    private final ReportedPositionCapability capability;
    private final Clock clock;

    PositionController(ReportedPositionCapability capability, Clock clock) {
        this.capability = capability;
        this.clock = clock;
    }

    @PostMapping("/api/positions")
    ResponseEntity<Void> report(@Valid @RequestBody PositionReport report) {
        Instant at = report.timestamp() != null ? report.timestamp() : clock.instant();
        capability.reportPosition(new PositionSample(report.latitude(), report.longitude(), report.accuracy(), at));
        return ResponseEntity.accepted().build();
    }

    record PositionReport(
            @NotNull @DecimalMin("-90.0") @DecimalMax("90.0") Double latitude,
            @NotNull @DecimalMin("-180.0") @DecimalMax("180.0") Double longitude,
            @PositiveOrZero Double accuracy,
            Instant timestamp
    ) {}
}
