package com.example.berry.infrastructure.system;

/**
 * Local mixer. Best-effort: failures are logged and swallowed.
 */
public interface SystemVolumeControl {

    /**
     * Amplifier levels owned by the volume ladder.
     */
    void setLevels(int speakerPercent, int headphonePercent);

    /**
     * Master level, used for fades.
     */
    void setMasterLevel(int percent);

    int getMasterLevel();
}
