package com.phillippitts.worktracker.service.site;

import com.phillippitts.worktracker.domain.Site;

import java.util.List;
import java.util.Optional;

/**
 * Storage for site definitions.
 */
public interface SiteRepository {

    Optional<Site> findById(String id);

    /** All sites, ordered by name. */
    List<Site> findAll();

    /** Inserts or replaces a site by id. */
    Site save(Site site);

    /** @return {@code true} if a site was removed */
    boolean deleteById(String id);
}
