package com.example.berry.common.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.catalog")
public class AppCatalogProperties {

    /**
     * Saved catalog. Once it exists it replaces the configured items.
     */
    private String file = System.getProperty("user.home") + "/berry/catalog.json";

    private List<Item> items = new ArrayList<>();

    @Data
    public static class Item {

        private String id;

        private String uri;

        private String name;

        /**
         * album | playlist
         */
        private String type = "album";

        private String artist;
    }
}
