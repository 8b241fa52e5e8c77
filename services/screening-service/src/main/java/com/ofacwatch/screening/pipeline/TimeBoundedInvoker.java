package com.ofacwatch.screening.pipeline;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs blocking calls under a named resilience4j {@link TimeLimiter}, one worker lane per source.
 *
 * <p>A call that outlives its limit fails with {@link java.util.concurrent.TimeoutException}
 * and its worker is interrupted. A call blocked in socket I/O may ignore the interrupt and
 * keep its worker; only the lane of that source is held up. A lane holds one running and one
 * waiting call, further calls are rejected until the stuck call returns.</p>
 */
@Slf4j
public class TimeBoundedInvoker {

    public static final String FETCH = "fetch";
    public static final String EXTRACTION = "extraction";

    private final TimeLimiterRegistry registry;
    private final String threadNamePrefix;
    private final ConcurrentMap<String, ThreadPoolExecutor> lanes = new ConcurrentHashMap<>();

    public TimeBoundedInvoker(TimeLimiterRegistry registry) {
        this(registry, "ofacwatch-worker-");
    }

    public TimeBoundedInvoker(TimeLimiterRegistry registry, String threadNamePrefix) {
        this.registry = registry;
        this.threadNamePrefix = threadNamePrefix;
    }

    public <T> T call(String lane, String limiterName, Callable<T> task) throws Exception {
        TimeLimiter limiter = registry.timeLimiter(limiterName);
        ThreadPoolExecutor executor = lanes.computeIfAbsent(lane, this::newLane);
        try {
            return limiter.executeFutureSupplier(() -> executor.submit(task));
        } catch (RejectedExecutionException e) {
            throw new RejectedExecutionException("Worker of " + lane + " is still busy with an earlier timed out call", e);
        }
    }

    public void shutdown() {
        lanes.forEach((lane, executor) -> executor.shutdownNow());
        log.info("Stopped {} worker lanes", lanes.size());
        lanes.clear();
    }

    int laneCount() {
        return lanes.size();
    }

    private ThreadPoolExecutor newLane(String lane) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(threadNamePrefix + lane + "-");
        threadFactory.setDaemon(true);
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(1), threadFactory);
    }
}
