package com.example.berry.infrastructure.librespot;

/**
 * Last context announced by the player's push event feed.
 */
public interface PlaybackContextSource {

    String lastContextUri();
}
