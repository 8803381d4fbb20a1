package com.automagik.telemetry.transport.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPOutputStream;

/** Gzips payloads strictly larger than the threshold. */
public final class Compressor {
    public static final String GZIP = "gzip";

    private final boolean enabled;
    private final int threshold;

    public Compressor(boolean enabled, int threshold) {
        if (threshold < 0) throw new IllegalArgumentException("threshold must be >= 0");
        this.enabled = enabled;
        this.threshold = threshold;
    }

    public CompressedPayload maybeCompress(byte[] body) {
        if (!enabled || body.length <= threshold) return new CompressedPayload(body, null);
        return new CompressedPayload(gzip(body), GZIP);
    }

    static byte[] gzip(byte[] data) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(32, data.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(data);
        } catch (IOException e) {
            // in-memory streams only
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }
}
