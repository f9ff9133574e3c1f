package com.example.berry.domain.enumtype;

/**
 * Which side currently owns the perceived volume.
 */
public enum VolumeMode {
    /**
     * Remote held at 100%, the device mixer cycles its ladder.
     */
    LOCAL,
    /**
     * Device mixer at 100%, the remote controller's value is authoritative.
     */
    REMOTE
}
