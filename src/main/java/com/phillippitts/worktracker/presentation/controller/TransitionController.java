package com.phillippitts.worktracker.presentation.controller;

import com.phillippitts.worktracker.domain.LocationTransition;
import com.phillippitts.worktracker.service.location.GeofencePayloadParser;
import com.phillippitts.worktracker.service.location.ReportedPositionCapability;
import com.phillippitts.worktracker.service.tracking.TransitionOutcome;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Receives geofence crossings pushed by the device.
 *
 * <p>The body is parsed leniently by {@link GeofencePayloadParser}; ignored transitions still
 * answer 200 with {@code action = IGNORED} because they were recorded.
 */
@RestController
class TransitionController {

    private final ReportedPositionCapability capability;
    private final Clock clock;

    TransitionController(ReportedPositionCapability capability, Clock clock) {
        this.capability = capability;
        this.clock = clock;
    }

    @PostMapping(path = "/api/transitions", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<TransitionOutcome> transition(@RequestBody String body) {
        LocationTransition transition = GeofencePayloadParser.parse(body, clock.instant());
        return ResponseEntity.ok(capability.deliverTransition(transition));
    }
}
