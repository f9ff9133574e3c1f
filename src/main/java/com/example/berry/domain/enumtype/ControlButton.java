package com.example.berry.domain.enumtype;

public enum ControlButton {
    PLAY_PAUSE,
    NEXT,
    PREV,
    VOLUME
}
