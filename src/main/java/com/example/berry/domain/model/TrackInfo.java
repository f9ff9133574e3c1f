package com.example.berry.domain.model;

import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class TrackInfo {

    private final String uri;
    private final String name;
    private final List<String> artistNames;
    private final String albumName;
    private final String albumCoverUrl;
    private final long positionMs;
    private final long durationMs;

    public List<String> getArtistNames() {
        return artistNames == null ? Collections.<String>emptyList() : artistNames;
    }

    /**
     * Artists joined for display, or null when the track has none.
     */
    public String joinedArtists() {
        List<String> names = getArtistNames();
        return names.isEmpty() ? null : String.join(", ", names);
    }
}
