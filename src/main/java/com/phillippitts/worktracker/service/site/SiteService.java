package com.phillippitts.worktracker.service.site;

import com.phillippitts.worktracker.config.properties.TrackingProperties;
import com.phillippitts.worktracker.domain.Site;
import com.phillippitts.worktracker.exception.InvalidSiteException;
import com.phillippitts.worktracker.exception.SiteNotFoundException;
import com.phillippitts.worktracker.service.debounce.EventDebouncer;
import com.phillippitts.worktracker.service.location.LocationCapability;
import com.phillippitts.worktracker.service.store.TrackingStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Manages site definitions and keeps the location capability's monitors in step with them.
 *
 * <p>Active sites are monitored, inactive ones are not. A site with an open session cannot be
 * deleted; the session has to be closed first so no session references a missing site.
 */
@Service
public class SiteService {

    private static final Logger LOG = LogManager.getLogger(SiteService.class);

    private final SiteRepository repository;
    private final LocationCapability location;
    private final TrackingStore store;
    private final EventDebouncer debouncer;
    private final TrackingProperties.SiteProperties bounds;
    private final Clock clock;

    public SiteService(SiteRepository repository,
                       LocationCapability location,
                       TrackingStore store,
                       EventDebouncer debouncer,
                       TrackingProperties props,
                       Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.location = Objects.requireNonNull(location, "location");
        this.store = Objects.requireNonNull(store, "store");
        this.debouncer = Objects.requireNonNull(debouncer, "debouncer");
        this.bounds = Objects.requireNonNull(props, "props").getSite();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Site create(SiteDraft draft) {
        double radius = validate(draft);
        Instant now = clock.instant();
        Site site = new Site(UUID.randomUUID().toString(), draft.name().trim(), draft.latitude(), draft.longitude(),
                radius, draft.active() == null || draft.active(), now, now);
        repository.save(site);
        syncMonitor(site);
        LOG.info("Created site {} '{}' radius={}m active={}", site.id(), site.name(), Math.round(radius), site.active());
        return site;
    }

    public Site update(String id, SiteDraft draft) {
        Site current = get(id);
        double radius = validate(draft);
        boolean active = draft.active() == null ? current.active() : draft.active();
        Site updated = new Site(id, draft.name().trim(), draft.latitude(), draft.longitude(), radius, active,
                current.createdAt(), clock.instant());
        repository.save(updated);
        syncMonitor(updated);
        LOG.info("Updated site {} '{}' radius={}m active={}", id, updated.name(), Math.round(radius), active);
        return updated;
    }

    /**
     * Deletes a site and stops monitoring it.
     *
     * @throws SiteNotFoundException if the site does not exist
     * @throws InvalidSiteException  if the site has an open session
     */
    public void delete(String id) {
        get(id);
        if (store.getActiveOrPendingSession(id).isPresent()) {
            throw new InvalidSiteException("site " + id + " has an open session; clock out first");
        }
        repository.deleteById(id);
        location.unregisterMonitor(id);
        debouncer.forget(id);
        LOG.info("Deleted site {}", id);
    }

    public Site get(String id) {
        return repository.findById(id).orElseThrow(() -> new SiteNotFoundException(id));
    }

    public List<Site> listAll() {
        return repository.findAll();
    }

    public List<Site> listActive() {
        return repository.findAll().stream().filter(Site::active).toList();
    }

    /**
     * Registers a monitor for every active site. Called once the engine is ready.
     *
     * @return number of monitors registered
     */
    public int registerActiveMonitors() {
        List<Site> active = listActive();
        active.forEach(location::registerMonitor);
        LOG.info("Registered {} site monitor(s)", active.size());
        return active.size();
    }

    private void syncMonitor(Site site) {
        if (site.active()) {
            location.registerMonitor(site);
        } else {
            location.unregisterMonitor(site.id());
        }
    }

    private double validate(SiteDraft draft) {
        if (draft == null) {
            throw new InvalidSiteException("site definition is required");
        }
        if (draft.name() == null || draft.name().isBlank()) {
            throw new InvalidSiteException("name must not be blank");
        }
        if (draft.latitude() < -90.0 || draft.latitude() > 90.0) {
            throw new InvalidSiteException("latitude out of range: " + draft.latitude());
        }
        if (draft.longitude() < -180.0 || draft.longitude() > 180.0) {
            throw new InvalidSiteException("longitude out of range: " + draft.longitude());
        }
        double radius = draft.radiusMeters() == null ? bounds.getDefaultRadiusMeters() : draft.radiusMeters();
        if (Double.isNaN(radius) || radius < bounds.getMinRadiusMeters() || radius > bounds.getMaxRadiusMeters()) {
            throw new InvalidSiteException(String.format("radius %.0fm outside [%.0f, %.0f]",
                    radius, bounds.getMinRadiusMeters(), bounds.getMaxRadiusMeters()));
        }
        return radius;
    }
}
