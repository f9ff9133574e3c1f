package com.example.berry.domain.model;

/**
 * Auto-play after the carousel rests on a cover. One item armed at a time.
 * Not thread-safe: owned by the UI loop.
 */
public class PlayTimer {

    private final long delayMs;
    private final long cooldownMs;

    private CatalogItem item;
    private long armedAt;
    private String lastFiredUri;
    private long lastFiredAt;
    private boolean fired;

    public PlayTimer(long delayMs, long cooldownMs) {
        this.delayMs = delayMs;
        this.cooldownMs = cooldownMs;
    }

    /**
     * Arms the timer for an item. Re-arming the item already armed keeps the original start.
     */
    public void arm(CatalogItem candidate, long nowMs) {
        if (candidate == null) {
            cancel();
            return;
        }
        if (item != null && item.hasUri(candidate.getUri())) {
            return;
        }
        item = candidate;
        armedAt = nowMs;
    }

    public void cancel() {
        item = null;
        armedAt = 0L;
    }

    /**
     * Returns the item to play once the delay has passed, and disarms.
     */
    public CatalogItem poll(long nowMs) {
        if (item == null || nowMs - armedAt < delayMs) {
            return null;
        }
        CatalogItem result = item;
        lastFiredUri = result.getUri();
        lastFiredAt = nowMs;
        fired = true;
        cancel();
        return result;
    }

    public boolean isArmed() {
        return item != null;
    }

    public CatalogItem getItem() {
        return item;
    }

    public boolean isInCooldown(long nowMs) {
        return fired && nowMs - lastFiredAt < cooldownMs;
    }

    public String getLastFiredUri() {
        return lastFiredUri;
    }

    public void clearLastFired() {
        lastFiredUri = null;
    }
}
