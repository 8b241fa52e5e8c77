package com.ofacwatch.screening.pipeline;

import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeBoundedInvoker")
class TimeBoundedInvokerTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private final TimeBoundedInvoker invoker = new TimeBoundedInvoker(registry(), "test-lane-");

    private static TimeLimiterRegistry registry() {
        TimeLimiterRegistry registry = TimeLimiterRegistry.ofDefaults();
        registry.timeLimiter(TimeBoundedInvoker.FETCH,
                TimeLimiterConfig.custom().timeoutDuration(Duration.ofMillis(200)).build());
        return registry;
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        invoker.shutdown();
    }

    private String ignoreInterrupts() {
        boolean released = false;
        while (!released) {
            try {
                release.await();
                released = true;
            } catch (InterruptedException e) {
                // keeps blocking like a socket read
            }
        }
        return "late";
    }

    @Test
    @DisplayName("Should return the result of a call within its limit")
    void shouldReturnResult() throws Exception {
        assertThat(invoker.call("bbc-world", TimeBoundedInvoker.FETCH, () -> "ok")).isEqualTo("ok");
        assertThat(invoker.call("bbc-world", TimeBoundedInvoker.FETCH, () -> "again")).isEqualTo("again");
        assertThat(invoker.laneCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject calls on a lane whose worker is stuck and keep other lanes working")
    void shouldContainStuckWorkerToItsLane() throws Exception {
        assertThatThrownBy(() -> invoker.call("stuck", TimeBoundedInvoker.FETCH, this::ignoreInterrupts))
                .isInstanceOf(TimeoutException.class);
        assertThatThrownBy(() -> invoker.call("stuck", TimeBoundedInvoker.FETCH, () -> "queued"))
                .isInstanceOf(TimeoutException.class);
        assertThatThrownBy(() -> invoker.call("stuck", TimeBoundedInvoker.FETCH, () -> "rejected"))
                .isInstanceOf(RejectedExecutionException.class)
                .hasMessageContaining("stuck");

        assertThat(invoker.call("healthy", TimeBoundedInvoker.FETCH, () -> "ok")).isEqualTo("ok");
        assertThat(invoker.laneCount()).isEqualTo(2);
    }
}
