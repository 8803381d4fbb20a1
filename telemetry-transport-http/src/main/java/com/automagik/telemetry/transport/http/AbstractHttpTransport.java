package com.automagik.telemetry.transport.http;

import com.automagik.telemetry.transport.SendOutcome;
import com.automagik.telemetry.transport.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for the HTTP backends: compress once, then post with retries. Subclasses build the
 * payload and pick the URL.
 */
public abstract class AbstractHttpTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(AbstractHttpTransport.class);

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected final HttpTransportOptions options;
    private final Compressor compressor;
    private final RetryExecutor retry;
    private final HttpPoster poster;

    protected AbstractHttpTransport(HttpTransportOptions options, RetryExecutor.Sleeper sleeper) {
        this.options = options;
        this.compressor = new Compressor(options.compressionEnabled(), options.compressionThreshold());
        this.retry = new RetryExecutor(options.maxRetries(), options.retryBackoffBase(), sleeper, options.verbose());
        this.poster = new HttpPoster(options.timeout());
    }

    protected SendOutcome deliver(
            String description, HttpUrl url, byte[] body, String contentType, Map<String, String> headers) {
        CompressedPayload payload = compressor.maybeCompress(body);
        return retry.execute(description, () -> poster.post(url, payload, contentType, headers));
    }

    /** Logs a dropped event at the level the verbose flag asks for. */
    protected void reportDropped(String what, Exception cause) {
        if (options.verbose()) {
            log.warn("Dropping {} that cannot be encoded: {}", what, cause.getMessage());
        } else {
            log.debug("Dropping {} that cannot be encoded: {}", what, cause.getMessage());
        }
    }

    /** Parses a configured URL, ignoring surrounding whitespace. */
    protected static HttpUrl parseUrl(String url) {
        HttpUrl parsed = url == null ? null : HttpUrl.parse(url.trim());
        if (parsed == null) throw new IllegalArgumentException("invalid URL: " + url);
        return parsed;
    }

    @Override
    public void close() {
        poster.close();
    }
}
