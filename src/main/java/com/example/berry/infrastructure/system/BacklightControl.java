package com.example.berry.infrastructure.system;

public interface BacklightControl {

    void setPower(boolean on);
}
