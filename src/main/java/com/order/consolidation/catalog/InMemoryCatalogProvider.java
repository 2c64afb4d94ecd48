package com.order.consolidation.catalog;

import com.order.consolidation.core.model.CatalogEntry;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Catalog provider backed by a map of distributor id to entries.
 */
public class InMemoryCatalogProvider implements CatalogProvider {

    private final ConcurrentMap<String, List<CatalogEntry>> catalogs = new ConcurrentHashMap<>();

    /**
     * Replaces the distributor's catalog.
     */
    public void register(String distributorId, List<CatalogEntry> entries) {
        catalogs.put(distributorId, List.copyOf(entries));
    }

    @Override
    public List<CatalogEntry> catalogFor(String distributorId) {
        if (distributorId == null) {
            return List.of();
        }
        return catalogs.getOrDefault(distributorId, List.of());
    }
}
