package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.ledger.exception.LedgerException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: Counter per operation, tagged with result (success/rejected/error)
 *   and, for rejections, the error code
 * - ledger.operation.latency: Timer per operation
 * - ledger.units.minted / ledger.units.burned: Counters of units created and destroyed
 * - ledger.airdrop.recipients: Distribution of airdrop batch sizes
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter unitsMinted;
    private final Counter unitsBurned;
    private final DistributionSummary airdropRecipients;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.unitsMinted = Counter.builder("ledger.units.minted")
                .description("Units created by mint operations")
                .register(registry);

        this.unitsBurned = Counter.builder("ledger.units.burned")
                .description("Units destroyed by burn operations")
                .register(registry);

        this.airdropRecipients = DistributionSummary.builder("ledger.airdrop.recipients")
                .description("Recipients per successful airdrop")
                .register(registry);
    }

    /**
     * Times an operation and counts its outcome.
     * Exceptions are recorded and rethrown unchanged.
     */
    public <T> T record(String operation, Supplier<T> action) {
        Timer.Sample sample = Timer.start(registry);
        try {
            T result = action.get();
            registry.counter("ledger.operations", "operation", operation, "result", "success", "code", "none")
                    .increment();
            return result;
        } catch (LedgerException e) {
            registry.counter("ledger.operations", "operation", operation, "result", "rejected",
                    "code", e.getCode().name()).increment();
            throw e;
        } catch (RuntimeException e) {
            registry.counter("ledger.operations", "operation", operation, "result", "error", "code", "none")
                    .increment();
            throw e;
        } finally {
            sample.stop(registry.timer("ledger.operation.latency", "operation", operation));
        }
    }

    public void recordMinted(long amount) {
        unitsMinted.increment(amount);
    }

    public void recordBurned(long amount) {
        unitsBurned.increment(amount);
    }

    public void recordAirdrop(int recipients) {
        airdropRecipients.record(recipients);
    }
}
