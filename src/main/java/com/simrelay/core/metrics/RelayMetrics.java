package com.simrelay.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Custom Micrometer metrics for snapshot ingestion and the command queue.
 */
@Service
public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param result "accepted", "unauthorized", "forbidden" or "bad_request"
     */
    public void recordIngest(String result) {
        Counter.builder("simrelay.ingest.requests")
                .description("Snapshot uploads by outcome")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordCommandCreated(int priority) {
        Counter.builder("simrelay.commands.created")
                .tag("priority", String.valueOf(priority))
                .register(registry)
                .increment();
    }

    public void recordCommandsClaimed(int count) {
        if (count == 0) {
            return;
        }
        Counter.builder("simrelay.commands.claimed")
                .register(registry)
                .increment(count);
    }

    public void recordCommandResolved(String status) {
        Counter.builder("simrelay.commands.resolved")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordEvictions(int count) {
        if (count == 0) {
            return;
        }
        Counter.builder("simrelay.commands.evicted")
                .description("Terminal commands dropped by history trimming")
                .register(registry)
                .increment(count);
    }

    /**
     * Registers the queue gauges. The suppliers are sampled on scrape.
     */
    public void bindQueueGauges(Supplier<Number> retained, Supplier<Number> staleClaims) {
        Gauge.builder("simrelay.commands.retained", retained)
                .description("Commands currently held by the queue")
                .register(registry);
        Gauge.builder("simrelay.commands.stale_claims", staleClaims)
                .description("In-progress commands claimed longer ago than the stale threshold")
                .register(registry);
    }
}
