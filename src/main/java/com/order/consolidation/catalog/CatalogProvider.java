package com.order.consolidation.catalog;

import com.order.consolidation.core.model.CatalogEntry;

import java.util.List;

/**
 * Supplies the product catalog of a distributor.
 */
@FunctionalInterface
public interface CatalogProvider {

    /**
     * Returns the distributor's catalog, or an empty list if it has none.
     */
    List<CatalogEntry> catalogFor(String distributorId);
}
