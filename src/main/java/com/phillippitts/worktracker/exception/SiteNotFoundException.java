package com.phillippitts.worktracker.exception;

/**
 * Thrown when an operation references a site id that is not registered.
 */
public class SiteNotFoundException extends WorkTrackerException {

    private final String siteId;

    public SiteNotFoundException(String siteId) {
        super("Site not found: " + siteId);
        this.siteId = siteId;
    }

    public String getSiteId() {
        return siteId;
    }
}
