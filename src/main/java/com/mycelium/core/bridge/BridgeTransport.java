package com.mycelium.core.bridge;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Moves encoded envelope frames to and from a remote host. Implementations decide the
 * framing and the connection; the bridge only sees whole frames.
 */
public interface BridgeTransport extends AutoCloseable {

    void send(String frame) throws IOException;

    /** Registers the single consumer for incoming frames. */
    void onFrame(Consumer<String> consumer);

    @Override
    void close() throws IOException;
}
