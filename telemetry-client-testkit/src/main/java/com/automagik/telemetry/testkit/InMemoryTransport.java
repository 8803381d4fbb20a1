package com.automagik.telemetry.testkit;

import com.automagik.telemetry.model.Batch;
import com.automagik.telemetry.model.TelemetryEvent;
import com.automagik.telemetry.transport.SendOutcome;
import com.automagik.telemetry.transport.Transport;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** Test double that records batches in memory. The outcome of each send can be scripted. */
public class InMemoryTransport implements Transport {
    private final List<Batch> batches = new CopyOnWriteArrayList<>();
    private volatile Function<Batch, SendOutcome> responder = b -> SendOutcome.success(1);
    private volatile boolean closed;

    @Override
    public SendOutcome send(Batch batch) {
        batches.add(batch);
        return responder.apply(batch);
    }

    @Override
    public String name() {
        return "in-memory";
    }

    /** Replaces the canned response, e.g. to simulate a backend that always fails. */
    public InMemoryTransport respondWith(Function<Batch, SendOutcome> responder) {
        this.responder = responder;
        return this;
    }

    public List<Batch> batches() {
        return List.copyOf(batches);
    }

    public List<Integer> batchSizes() {
        List<Integer> sizes = new ArrayList<>();
        for (Batch b : batches) sizes.add(b.size());
        return sizes;
    }

    public List<TelemetryEvent> events() {
        List<TelemetryEvent> out = new ArrayList<>();
        for (Batch b : batches) out.addAll(b.events());
        return out;
    }

    public boolean isClosed() {
        return closed;
    }

    public void clear() {
        batches.clear();
    }

    @Override
    public void close() {
        closed = true;
    }
}
