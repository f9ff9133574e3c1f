package com.example.berry.infrastructure.catalog;

import java.util.List;

/**
 * Persistent catalog edited on the device.
 */
public interface CatalogStore {

    /**
     * Stored entries, or null when the catalog was never saved or cannot be read.
     */
    List<CatalogEntry> load();

    /**
     * Replaces the stored catalog.
     *
     * @return false when the write failed; the previous catalog is left in place
     */
    boolean store(List<CatalogEntry> entries);
}
