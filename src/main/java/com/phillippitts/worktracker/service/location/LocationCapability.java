package com.phillippitts.worktracker.service.location;

import com.phillippitts.worktracker.domain.PositionSample;
import com.phillippitts.worktracker.domain.Site;
import com.phillippitts.worktracker.exception.PositionUnavailableException;

import java.util.Set;

/**
 * Platform seam for region monitoring and on-demand positioning.
 *
 * <p>The engine never talks to a location provider directly. Implementations register
 * circular monitors, deliver crossings to the registered {@link TransitionListener},
 * and answer active position fetches used by exit verification.
 */
public interface LocationCapability {

    /**
     * Starts (or refreshes) monitoring of a site's circle.
     */
    void registerMonitor(Site site);

    /**
     * Stops monitoring a site. Unknown ids are ignored.
     */
    void unregisterMonitor(String siteId);

    /**
     * @return ids of currently monitored sites
     */
    Set<String> monitoredSiteIds();

    /**
     * Sets the single consumer of transitions produced by this capability.
     */
    void setTransitionListener(TransitionListener listener);

    /**
     * Actively obtains the current device position.
     *
     * @return latest position
     * @throws PositionUnavailableException if no usable position can be obtained
     */
    PositionSample fetchCurrentPosition();
}
