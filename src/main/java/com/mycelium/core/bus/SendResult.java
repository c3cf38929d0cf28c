package com.mycelium.core.bus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@link MessageBus#send} call: which recipients got the envelope and
 * why the others did not. Every fault listed here has also been dead-lettered.
 *
 * @param envelopeId id of the sent envelope
 * @param delivered  recipients whose mailbox accepted the envelope
 * @param faults     recipient id to dead-letter reason, in recipient order
 */
public record SendResult(
    String envelopeId,
    List<String> delivered,
    Map<String, DeadLetterReason> faults
) {

    public SendResult {
        delivered = List.copyOf(delivered);
        faults = Collections.unmodifiableMap(new LinkedHashMap<>(faults));
    }

    public boolean allDelivered() {
        return faults.isEmpty();
    }

    public boolean anyDelivered() {
        return !delivered.isEmpty();
    }

    /**
     * @throws RoutingException when any recipient was not reached
     */
    public SendResult requireDelivered() {
        if (faults.isEmpty()) {
            return this;
        }
        RoutingFault fault = faults.containsValue(DeadLetterReason.UNKNOWN_RECIPIENT)
                ? RoutingFault.UNKNOWN_RECIPIENT
                : RoutingFault.UNDELIVERABLE;
        throw new RoutingException(fault, "Envelope " + envelopeId + " not delivered: " + faults);
    }
}
