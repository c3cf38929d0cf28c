package com.mycelium.core.runtime;

import java.time.Duration;

/**
 * @param heartbeatInterval idle poll timeout; also the tick period
 * @param mailboxCapacity   mailbox bound for agents spawned with these settings
 */
public record RuntimeSettings(Duration heartbeatInterval, int mailboxCapacity) {

    public RuntimeSettings {
        if (heartbeatInterval == null || heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (mailboxCapacity < 1) {
            throw new IllegalArgumentException("mailboxCapacity must be positive");
        }
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(Duration.ofSeconds(1), 256);
    }
}
