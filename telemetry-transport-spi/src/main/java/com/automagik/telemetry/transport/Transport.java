package com.automagik.telemetry.transport;

import com.automagik.telemetry.model.Batch;
import java.io.Closeable;
import java.io.IOException;

/**
 * Backend SPI: deliver one batch. Implementations own retry and compression and report the result
 * as a {@link SendOutcome}; they must not throw from {@link #send}.
 */
public interface Transport extends Closeable {

    SendOutcome send(Batch batch);

    /** Short backend name used in log lines and status snapshots. */
    String name();

    @Override
    default void close() throws IOException {
        /* no-op */
    }
}
