package com.phillippitts.worktracker.presentation.controller;

import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.service.tracking.SessionStateMachine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual clock-in and clock-out. Conflicts surface as 409 via the global handler.
 */
@RestController
class ClockController {

    private final SessionStateMachine stateMachine;

    ClockController(SessionStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @PostMapping("/api/sites/{siteId}/clock-in")
    ResponseEntity<TrackingSession> clockIn(@PathVariable String siteId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(stateMachine.clockIn(siteId));
    }

    @PostMapping("/api/sites/{siteId}/clock-out")
    ResponseEntity<TrackingSession> clockOut(@PathVariable String siteId) {
        return ResponseEntity.ok(stateMachine.clockOut(siteId));
    }
}
