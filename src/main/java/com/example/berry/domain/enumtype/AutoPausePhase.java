package com.example.berry.domain.enumtype;

public enum AutoPausePhase {
    IDLE,
    ARMED,
    FADING
}
