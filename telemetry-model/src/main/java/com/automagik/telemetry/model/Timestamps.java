package com.automagik.telemetry.model;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

public final class Timestamps {

    private Timestamps() {}

    public static long epochNanos(Instant instant) {
        return TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
    }
}
