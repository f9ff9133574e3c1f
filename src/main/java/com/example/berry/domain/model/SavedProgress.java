package com.example.berry.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SavedProgress {

    private String trackUri;

    private long positionMs;

    private String trackName;

    private String artist;

    /**
     * Wall-clock epoch millis of the save, used for expiry.
     */
    private long updatedAtEpochMs;
}
