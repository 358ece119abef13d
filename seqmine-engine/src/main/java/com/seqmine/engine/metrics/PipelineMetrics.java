package com.seqmine.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Micrometer metrics for pipeline runs.
 * 
 * Metrics exposed:
 * - Records normalized, sessions encoded
 * - Rules decomposed and malformed rules seen
 * - Per-stage duration
 * 
 * Until bound to a registry, meters are recorded in a private {@link SimpleMeterRegistry}.
 */
public class PipelineMetrics implements MeterBinder {

    // Metric names
    public static final String RECORDS_NORMALIZED = "seqmine.records.normalized";
    public static final String SESSIONS_ENCODED = "seqmine.sessions.encoded";
    public static final String RULES_DECOMPOSED = "seqmine.rules.decomposed";
    public static final String RULES_MALFORMED = "seqmine.rules.malformed";
    public static final String STAGE_DURATION = "seqmine.stage.duration";
    public static final String RUNS = "seqmine.runs";

    private MeterRegistry registry = new SimpleMeterRegistry();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void recordsNormalized(int count) {
        counter(RECORDS_NORMALIZED, "Records that passed temporal normalization").increment(count);
    }

    public void sessionsEncoded(int count) {
        counter(SESSIONS_ENCODED, "Sessions encoded as transactions").increment(count);
    }

    public void rulesDecomposed(int total, int malformed) {
        counter(RULES_DECOMPOSED, "Rules split into LHS and RHS").increment(total);
        counter(RULES_MALFORMED, "Rules without exactly one separator").increment(malformed);
    }

    public void runFinished(String outcome) {
        Counter.builder(RUNS)
            .tag("outcome", outcome)
            .description("Pipeline runs by outcome")
            .register(registry)
            .increment();
    }

    public void stageDuration(String stage, Duration duration) {
        Timer.builder(STAGE_DURATION)
            .tag("stage", stage)
            .description("Wall time per pipeline stage")
            .register(registry)
            .record(duration);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .description(description)
            .register(registry);
    }
}
