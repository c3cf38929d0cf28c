package com.mycelium.core.bus;

import com.mycelium.core.model.Envelope;

import java.time.Instant;

/**
 * An envelope that could not be delivered to one recipient.
 */
public record DeadLetter(
    Envelope envelope,
    String recipientId,
    DeadLetterReason reason,
    Instant timestamp
) {
}
