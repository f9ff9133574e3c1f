package com.example.berry.domain.enumtype;

/**
 * Optimistic play/pause intent shown until the next status report arrives.
 */
public enum PendingAction {
    PLAY,
    PAUSE
}
