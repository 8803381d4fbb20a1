package com.automagik.telemetry.model;

import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.api.trace.TraceId;
import java.util.concurrent.ThreadLocalRandom;

/** Random W3C trace/span identifiers in lowercase hex. */
public final class TraceIds {

    private TraceIds() {}

    /** 32 hex chars, never all zeros. */
    public static String newTraceId() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        long hi;
        long lo;
        do {
            hi = rnd.nextLong();
            lo = rnd.nextLong();
        } while (hi == 0 && lo == 0);
        return TraceId.fromLongs(hi, lo);
    }

    /** 16 hex chars, never all zeros. */
    public static String newSpanId() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        long id;
        do {
            id = rnd.nextLong();
        } while (id == 0);
        return SpanId.fromLong(id);
    }

    public static boolean isValidTraceId(String id) {
        return TraceId.isValid(id);
    }

    public static boolean isValidSpanId(String id) {
        return SpanId.isValid(id);
    }
}
