package com.phillippitts.worktracker.presentation.controller;

import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.domain.TransitionEvent;
import com.phillippitts.worktracker.service.site.SiteService;
import com.phillippitts.worktracker.service.tracking.SessionQueryService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Read-only session and audit queries.
 */
@RestController
class SessionController {

    private final SessionQueryService queries;
    private final SiteService sites;

    SessionController(SessionQueryService queries, SiteService sites) {
        this.queries = queries;
        this.sites = sites;
    }

    @GetMapping("/api/sessions")
    List<TrackingSession> overlapping(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return queries.getSessionsOverlapping(from, to);
    }

    @GetMapping("/api/sites/{siteId}/session")
    ResponseEntity<TrackingSession> active(@PathVariable String siteId) {
        sites.get(siteId);
        return queries.getActiveSession(siteId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/api/sites/{siteId}/history")
    List<TrackingSession> history(@PathVariable String siteId,
                                  @RequestParam(defaultValue = "50") int limit) {
        sites.get(siteId);
        return queries.history(siteId, limit);
    }

    @GetMapping("/api/sites/{siteId}/events")
    List<TransitionEvent> events(@PathVariable String siteId,
                                 @RequestParam(defaultValue = "50") int limit) {
        sites.get(siteId);
        return queries.events(siteId, limit);
    }
}
