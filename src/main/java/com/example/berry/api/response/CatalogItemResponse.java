package com.example.berry.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogItemResponse {

    private String id;
    private String uri;
    private String name;
    /**
     * album | playlist
     */
    private String type;
    private String artist;
    private boolean temp;
}
