package com.lumina.agent.core;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches the in-flight model call and reports it once when it runs past the
 * threshold. It only reports: deciding to retry belongs to the user, through
 * {@link AgentLoop#retryTimedOutRequest()}.
 */
@Slf4j
public class RequestTimeoutMonitor {

    private final ScheduledExecutorService scheduler;
    private final StateManager stateManager;
    private final long thresholdMs;
    private final long checkIntervalMs;

    public RequestTimeoutMonitor(ScheduledExecutorService scheduler,
                                 StateManager stateManager,
                                 Duration threshold,
                                 Duration checkInterval) {
        this.scheduler = scheduler;
        this.stateManager = stateManager;
        this.thresholdMs = threshold.toMillis();
        this.checkIntervalMs = checkInterval.toMillis();
    }

    /**
     * Starts watching the call dispatched at {@code startMillis}.
     * The caller cancels the returned future when the call settles.
     */
    public ScheduledFuture<?> watch(long startMillis) {
        AtomicBoolean reported = new AtomicBoolean();
        return scheduler.scheduleAtFixedRate(() -> {
            Long inFlightSince = stateManager.getState().getLlmRequestStartTime();
            if (inFlightSince == null || inFlightSince.longValue() != startMillis) {
                return;
            }
            long elapsed = System.currentTimeMillis() - startMillis;
            if (elapsed >= thresholdMs && reported.compareAndSet(false, true)) {
                log.warn("Model call running for {}ms, over the {}ms threshold", elapsed, thresholdMs);
                stateManager.publish(AgentEventType.REQUEST_TIMEOUT,
                        Map.of("elapsedMs", elapsed, "thresholdMs", thresholdMs));
            }
        }, checkIntervalMs, checkIntervalMs, TimeUnit.MILLISECONDS);
    }

    public long getThresholdMs() {
        return thresholdMs;
    }
}
