package com.phillippitts.worktracker.service.tracking;

import com.phillippitts.worktracker.service.location.LocationCapability;
import com.phillippitts.worktracker.service.site.SiteService;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Wires the engine to the location capability and drives restart recovery.
 *
 * <ul>
 *   <li>On construction: the state machine becomes the capability's transition listener.</li>
 *   <li>On application ready: monitors are re-registered for active sites and persisted
 *       pending exits are reconciled.</li>
 *   <li>Every {@code tracking.reconcile-interval-ms}: pending exits are swept again.</li>
 * </ul>
 */
@Component
public class TrackingLifecycle {

    private static final Logger LOG = LogManager.getLogger(TrackingLifecycle.class);

    private final SessionStateMachine stateMachine;
    private final LocationCapability location;
    private final SiteService siteService;

    public TrackingLifecycle(SessionStateMachine stateMachine, LocationCapability location, SiteService siteService) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.location = Objects.requireNonNull(location, "location");
        this.siteService = Objects.requireNonNull(siteService, "siteService");
    }

    @PostConstruct
    public void wireListener() {
        location.setTransitionListener(stateMachine::handleTransition);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        siteService.registerActiveMonitors();
        int resolved = stateMachine.reconcilePendingExits();
        LOG.info("Tracking engine ready; {} pending exit(s) resolved at startup", resolved);
    }

    @Scheduled(fixedDelayString = "${tracking.reconcile-interval-ms:60000}",
            initialDelayString = "${tracking.reconcile-interval-ms:60000}")
    public void sweep() {
        try {
            stateMachine.reconcilePendingExits();
        } catch (RuntimeException e) {
            LOG.warn("Pending exit sweep failed; will retry next interval: {}", e.toString());
        }
    }
}
