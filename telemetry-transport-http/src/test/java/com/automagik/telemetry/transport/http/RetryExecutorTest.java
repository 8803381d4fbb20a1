package com.automagik.telemetry.transport.http;

import static org.assertj.core.api.Assertions.assertThat;

import com.automagik.telemetry.transport.SendOutcome;
import com.automagik.telemetry.transport.TransportException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryExecutor retry = new RetryExecutor(3, Duration.ofMillis(100), sleeps::add, false);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void always_failing_retries_three_times_with_doubling_backoff() {
        AtomicInteger calls = new AtomicInteger();

        SendOutcome outcome = retry.execute("test", () -> {
            calls.incrementAndGet();
            throw new IOException("connection refused");
        });

        assertThat(calls).hasValue(4);
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(4);
        assertThat(outcome.lastError()).hasMessage("connection refused");
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
    }

    @Test
    void retries_server_errors_until_success() {
        AtomicInteger calls = new AtomicInteger();

        SendOutcome outcome = retry.execute("test", () -> {
            if (calls.incrementAndGet() < 2) throw TransportException.forStatus(503, "busy");
        });

        assertThat(outcome).isEqualTo(SendOutcome.success(2));
        assertThat(sleeps).containsExactly(Duration.ofMillis(100));
    }

    @Test
    void client_errors_are_not_retried() {
        AtomicInteger calls = new AtomicInteger();

        SendOutcome outcome = retry.execute("test", () -> {
            calls.incrementAndGet();
            throw TransportException.forStatus(400, "bad request");
        });

        assertThat(calls).hasValue(1);
        assertThat(outcome.success()).isFalse();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void too_many_requests_is_retried() {
        AtomicInteger calls = new AtomicInteger();

        retry.execute("test", () -> {
            calls.incrementAndGet();
            throw TransportException.forStatus(429, "");
        });

        assertThat(calls).hasValue(4);
    }

    @Test
    void runtime_failures_are_permanent_and_not_thrown() {
        SendOutcome outcome = retry.execute("test", () -> {
            throw new IllegalStateException("bug");
        });

        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.lastError()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void zero_retries_means_a_single_attempt() {
        AtomicInteger calls = new AtomicInteger();

        SendOutcome outcome = new RetryExecutor(0, Duration.ofMillis(100), sleeps::add, false).execute("test", () -> {
            calls.incrementAndGet();
            throw new IOException("down");
        });

        assertThat(calls).hasValue(1);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void interruption_stops_retrying_and_keeps_the_flag() {
        RetryExecutor interrupted = new RetryExecutor(3, Duration.ofMillis(100), d -> {
            throw new InterruptedException();
        }, true);
        AtomicInteger calls = new AtomicInteger();

        SendOutcome outcome = interrupted.execute("test", () -> {
            calls.incrementAndGet();
            throw new IOException("down");
        });

        assertThat(calls).hasValue(1);
        assertThat(outcome.success()).isFalse();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
