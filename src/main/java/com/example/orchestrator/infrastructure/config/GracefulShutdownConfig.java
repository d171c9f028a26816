package com.example.orchestrator.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks order requests in flight and, when the context closes, waits for them to
 * finish so that an inserted order still gets its final status written.
 */
@Component
public class GracefulShutdownConfig implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownConfig.class);

    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final AtomicInteger inFlightOrders = new AtomicInteger(0);
    private final Duration maxWait;
    private final Duration pollInterval;

    @Autowired
    public GracefulShutdownConfig(@Value("${shutdown.max-wait-seconds:5}") int maxWaitSeconds) {
        this(Duration.ofSeconds(maxWaitSeconds), DEFAULT_POLL_INTERVAL);
    }

    public GracefulShutdownConfig(Duration maxWait, Duration pollInterval) {
        this.maxWait = maxWait;
        this.pollInterval = pollInterval;
    }

    public void orderRequestStarted() {
        int count = inFlightOrders.incrementAndGet();
        log.debug("Order request started. In flight: {}", count);
    }

    public void orderRequestFinished() {
        int count = inFlightOrders.decrementAndGet();
        log.debug("Order request finished. In flight: {}", count);
    }

    public int getInFlightOrderCount() {
        return inFlightOrders.get();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Order service shutting down with {} order request(s) in flight", inFlightOrders.get());

        if (awaitDrain()) {
            log.info("All order requests finished, order service stopped");
        } else {
            log.warn("Stopped waiting after {}s; {} order request(s) may be left pending",
                    maxWait.toSeconds(), inFlightOrders.get());
        }
    }

    /**
     * Blocks until no order request is in flight or the maximum wait has elapsed.
     *
     * @return true if every in-flight request finished in time
     */
    public boolean awaitDrain() {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (inFlightOrders.get() > 0) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            log.info("Waiting for {} order request(s), {} ms left",
                    inFlightOrders.get(), Duration.ofNanos(remaining).toMillis());
            try {
                Thread.sleep(Math.min(pollInterval.toMillis(), Duration.ofNanos(remaining).toMillis() + 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for order requests to finish");
                return false;
            }
        }
        return true;
    }
}
