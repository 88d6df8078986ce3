package io.codecarver.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class CarveMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter carvesSucceeded = Counter.builder("carve.success")
            .description("Runtime code carved at its derived address")
            .register(registry);
    private static final Timer carveTime = registry.timer("carve.time");
    private static final DistributionSummary carvedBytes = DistributionSummary.builder("carve.bytes")
            .baseUnit("bytes")
            .description("Size of carved runtime code")
            .register(registry);

    private CarveMetrics() {}

    public static <T> T recordCarve(Supplier<T> carveLogic) {
        return carveTime.record(carveLogic);
    }

    public static void recordSuccess(int codeLength) {
        carvesSucceeded.increment();
        carvedBytes.record(codeLength);
    }

    public static void recordFailure(String reason) {
        Counter.builder("carve.failure")
                .description("Rejected or failed carve attempts")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public static void recordVerification(boolean carved) {
        Counter.builder("carve.verify")
                .tag("result", carved ? "carved" : "not_carved")
                .register(registry)
                .increment();
    }

    public static double count(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0 : counter.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ")
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
