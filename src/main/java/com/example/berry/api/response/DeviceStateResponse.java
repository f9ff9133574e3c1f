package com.example.berry.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the screen renders for one frame.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStateResponse {

    private boolean connected;
    private boolean sleeping;
    private NowPlayingResponse nowPlaying;
    private boolean showLoading;
    private boolean spinnerVisible;
    private boolean displayPlaying;
    private int selectedIndex;
    private int targetIndex;
    private boolean settled;
    private boolean dragging;
    private List<CatalogItemResponse> items;
    private String volumeMode;
    private String volumeIcon;
    private String navigationPausedContextUri;
    /**
     * -1 when no auto-pause is armed.
     */
    private long autoPauseRemainingMs;
    /**
     * Catalog item awaiting delete confirmation, null when delete mode is off.
     */
    private String deleteModeItemId;
}
