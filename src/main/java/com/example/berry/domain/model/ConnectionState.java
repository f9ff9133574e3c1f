package com.example.berry.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public final class ConnectionState {

    private static final ConnectionState INITIAL = new ConnectionState(0, false);

    private final int failureCount;
    private final boolean connected;

    private ConnectionState(int failureCount, boolean connected) {
        this.failureCount = failureCount;
        this.connected = connected;
    }

    public static ConnectionState initial() {
        return INITIAL;
    }

    public ConnectionState onSuccess() {
        return new ConnectionState(0, true);
    }

    /**
     * Counts the failure; connectivity is only dropped once the count reaches the threshold.
     */
    public ConnectionState onFailure(int graceThreshold) {
        int failures = failureCount + 1;
        boolean stillConnected = connected && failures < graceThreshold;
        return new ConnectionState(failures, stillConnected);
    }

    /**
     * Optimistic reset used on wake; the next poll corrects it.
     */
    public ConnectionState optimisticReset() {
        return new ConnectionState(0, true);
    }
}
