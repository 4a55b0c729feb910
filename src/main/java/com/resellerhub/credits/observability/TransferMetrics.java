package com.resellerhub.credits.observability;

import com.resellerhub.credits.model.EntryType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger writes.
 *
 * Metrics exposed:
 * - credit.movements{type, outcome}: committed, replayed and rejected transfers/issuances
 * - credit.movement.duration{type}: wall time of the whole unit, lock waits included
 */
@Component
public class TransferMetrics {

    private final MeterRegistry registry;

    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCommitted(EntryType type, Duration duration) {
        count(type, "committed");
        timer(type).record(duration);
    }

    public void recordReplayed(EntryType type) {
        count(type, "replayed");
    }

    /**
     * @param errorCode the error code of the rejecting exception, e.g. INSUFFICIENT_FUNDS
     */
    public void recordRejected(EntryType type, String errorCode) {
        count(type, errorCode.toLowerCase());
    }

    private void count(EntryType type, String outcome) {
        registry.counter("credit.movements",
                "type", type.name().toLowerCase(),
                "outcome", outcome
        ).increment();
    }

    private Timer timer(EntryType type) {
        return Timer.builder("credit.movement.duration")
                .description("Time taken to commit a credit movement")
                .tag("type", type.name().toLowerCase())
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }
}
