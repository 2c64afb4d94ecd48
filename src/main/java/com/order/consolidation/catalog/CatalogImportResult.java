package com.order.consolidation.catalog;

import com.order.consolidation.core.model.CatalogEntry;

import java.util.List;

/**
 * Result of a catalog import.
 *
 * @param entries the records that were imported
 * @param errors  one entry per rejected record
 */
public record CatalogImportResult(
        List<CatalogEntry> entries,
        List<ImportError> errors
) {
    public CatalogImportResult {
        entries = entries != null ? List.copyOf(entries) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that could not be imported.
     *
     * @param index   position of the record in the input array (0-based)
     * @param recordId the record's id, if it had one
     * @param message the reason
     */
    public record ImportError(int index, String recordId, String message) {}

    @Override
    public String toString() {
        return "CatalogImportResult{imported=" + entries.size() + ", errors=" + errors.size() + '}';
    }
}
