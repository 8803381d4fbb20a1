package com.automagik.telemetry.transport.http;

import com.automagik.telemetry.transport.SendOutcome;
import com.automagik.telemetry.transport.TransportException;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an attempt once, then retries it up to {@code maxRetries} times with exponential backoff, so three
 * retries wait {@code base}, {@code 2*base} and {@code 4*base}. Network errors, 5xx and 429 are retried;
 * anything else ends the loop. Never throws.
 */
public final class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    @FunctionalInterface
    public interface Attempt {
        void run() throws IOException;
    }

    @FunctionalInterface
    public interface Sleeper {
        Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxRetries;
    private final Duration backoffBase;
    private final Sleeper sleeper;
    private final boolean verbose;

    public RetryExecutor(int maxRetries, Duration backoffBase, Sleeper sleeper, boolean verbose) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
        this.backoffBase = backoffBase;
        this.sleeper = sleeper;
        this.verbose = verbose;
    }

    public SendOutcome execute(String description, Attempt attempt) {
        Exception last = null;
        int maxAttempts = maxRetries + 1;
        for (int i = 0; i < maxAttempts; i++) {
            try {
                attempt.run();
                if (i > 0) log.debug("{} succeeded on attempt {}", description, i + 1);
                return SendOutcome.success(i + 1);
            } catch (TransportException e) {
                last = e;
                if (!e.isRetryable()) {
                    report("{} rejected permanently: {}", description, e.getMessage());
                    return SendOutcome.failure(i + 1, e);
                }
            } catch (IOException e) {
                last = e;
            } catch (RuntimeException e) {
                report("{} failed: {}", description, e.toString());
                return SendOutcome.failure(i + 1, e);
            }

            if (i + 1 >= maxAttempts) break;
            Duration delay = backoffFor(i);
            log.debug("{} attempt {} failed ({}); retrying in {} ms", description, i + 1, last, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                report("{} interrupted after attempt {}", description, i + 1);
                return SendOutcome.failure(i + 1, last);
            }
        }
        report("{} gave up after {} attempts: {}", description, maxAttempts, String.valueOf(last));
        return SendOutcome.failure(maxAttempts, last);
    }

    /** Wait before retry {@code i + 1}, after failed attempt {@code i} (0-based): {@code base * 2^i}. */
    Duration backoffFor(int attemptIndex) {
        return backoffBase.multipliedBy(1L << Math.min(attemptIndex, 30));
    }

    private void report(String format, Object... args) {
        if (verbose) {
            log.warn(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
