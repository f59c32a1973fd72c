package io.ledger.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.IntSupplier;
import java.util.function.Supplier;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksApplied = registry.counter("ledger.blocks.applied");
    private static final Counter blocksUndone = registry.counter("ledger.blocks.undone");
    private static final Counter outputsCreated = registry.counter("ledger.outputs.created");
    private static final Counter outputsSpent = registry.counter("ledger.outputs.spent");
    private static final Counter blocksRejected = registry.counter("ledger.blocks.rejected");
    private static final Timer applyTime = registry.timer("ledger.block.apply.time");

    // the registry is process-wide, so the size gauge reads whichever pool was opened last
    private static volatile IntSupplier unspentSize = () -> 0;

    static {
        Gauge.builder("ledger.unspent.size", () -> unspentSize.getAsInt()).register(registry);
    }

    private LedgerMetrics() {}

    public static <T> T recordApply(Supplier<T> applyLogic) {
        return applyTime.record(applyLogic);
    }

    public static void blockApplied(int spent, int created) {
        blocksApplied.increment();
        outputsSpent.increment(spent);
        outputsCreated.increment(created);
    }

    public static void blockUndone() {
        blocksUndone.increment();
    }

    public static void blockRejected() {
        blocksRejected.increment();
    }

    /** Points the {@code ledger.unspent.size} gauge at a pool; the latest call wins. */
    public static void trackUnspentSize(IntSupplier size) {
        unspentSize = size;
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
