package com.example.berry.infrastructure.catalog;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogEntry {

    private String id;

    /**
     * album | playlist
     */
    private String type;

    private String uri;

    private String name;

    private String artist;

    private long addedAtEpochMs;
}
