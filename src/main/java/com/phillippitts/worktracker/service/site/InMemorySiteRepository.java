package com.phillippitts.worktracker.service.site;

import com.phillippitts.worktracker.domain.Site;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local site storage.
 */
@Repository
public class InMemorySiteRepository implements SiteRepository {

    private final ConcurrentMap<String, Site> sites = new ConcurrentHashMap<>();

    @Override
    public Optional<Site> findById(String id) {
        return Optional.ofNullable(sites.get(id));
    }

    @Override
    public List<Site> findAll() {
        return sites.values().stream()
                .sorted(Comparator.comparing(Site::name, String.CASE_INSENSITIVE_ORDER).thenComparing(Site::id))
                .toList();
    }

    @Override
    public Site save(Site site) {
        sites.put(site.id(), site);
        return site;
    }

    @Override
    public boolean deleteById(String id) {
        return sites.remove(id) != null;
    }
}
