package com.example.berry.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class CatalogItem {

    public static final String TEMP_ID = "temp";

    private final String id;
    private final String uri;
    private final String name;
    private final String type;
    private final String artist;
    /**
     * Transient entry for a context that plays but is not in the catalog.
     */
    private final boolean temp;
    /**
     * Wall time the entry was saved on the device, 0 for configured entries.
     */
    private final long addedAtEpochMs;

    public boolean hasUri(String contextUri) {
        return uri != null && uri.equals(contextUri);
    }
}
