package com.example.search.observability.metrics;

import com.example.search.aggregation.model.SourceOutcome;
import com.example.search.source.model.SourceId;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Per-source adapter call metrics.
 * Tag values come from closed enums, so cardinality stays bounded.
 */
@Component
public class AdapterMetrics {

    private static final String TAG_SOURCE = "source";
    private static final String TAG_OPERATION = "operation";
    private static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;

    public AdapterMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCall(
            @NonNull SourceId source,
            @NonNull String operation,
            @NonNull SourceOutcome.Status status,
            @NonNull Duration elapsed) {

        String outcome = status.name().toLowerCase(Locale.ROOT);
        Timer.builder("aggregator.adapter.calls")
                .description("Source adapter call latency")
                .tags(TAG_SOURCE, source.key(), TAG_OPERATION, operation, TAG_OUTCOME, outcome)
                .register(registry)
                .record(elapsed);
    }

    public void recordSkipped(@NonNull SourceId source, @NonNull String reason) {
        Counter.builder("aggregator.source.skipped")
                .description("Requested sources excluded before fan-out")
                .tags(TAG_SOURCE, source.key(), "reason", reason)
                .register(registry)
                .increment();
    }
}
