package com.mycelium.core.bus;

public enum DeadLetterReason {
    /** TTL elapsed before delivery or before dispatch. */
    EXPIRED,
    /** No agent with the recipient id is registered. */
    UNKNOWN_RECIPIENT,
    /** Recipient was unregistered with the envelope still queued. */
    AGENT_REMOVED,
    /** Recipient stopped with the envelope still queued, or was already stopped. */
    AGENT_STOPPED,
    /** Recipient mailbox was at capacity. */
    MAILBOX_FULL,
    /** Report arrived for a correlation that was abandoned. */
    ABANDONED
}
