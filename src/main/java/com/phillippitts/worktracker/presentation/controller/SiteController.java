package com.phillippitts.worktracker.presentation.controller;

import com.phillippitts.worktracker.domain.Site;
import com.phillippitts.worktracker.service.site.SiteDraft;
import com.phillippitts.worktracker.service.site.SiteService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Site definitions. Radius and coordinate bounds are enforced by {@link SiteService}.
 */
@RestController
class SiteController {

    private final SiteService sites;

    SiteController(SiteService sites) {
        this.sites = sites;
    }

    @GetMapping("/api/sites")
    List<Site> list() {
        return sites.listAll();
    }

    @PostMapping("/api/sites")
    ResponseEntity<Site> create(@Valid @RequestBody SiteRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sites.create(request.toDraft()));
    }

    @GetMapping("/api/sites/{siteId}")
    Site get(@PathVariable String siteId) {
        return sites.get(siteId);
    }

    @PutMapping("/api/sites/{siteId}")
    Site update(@PathVariable String siteId, @Valid @RequestBody SiteRequest request) {
        return sites.update(siteId, request.toDraft());
    }

    @DeleteMapping("/api/sites/{siteId}")
    ResponseEntity<Void> delete(@PathVariable String siteId) {
        sites.delete(siteId);
        return ResponseEntity.noContent().build();
    }

    record SiteRequest(
            @NotBlank String name,
            @NotNull Double latitude,
            @NotNull Double longitude,
            Double radiusMeters,
            Boolean active
    ) {
        SiteDraft toDraft() {
            return new SiteDraft(name, latitude, longitude, radiusMeters, active);
        }
    }
}
