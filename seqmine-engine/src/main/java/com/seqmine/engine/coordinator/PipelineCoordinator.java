package com.seqmine.engine.coordinator;

import com.seqmine.core.exception.ConfigurationException;
import com.seqmine.core.exception.MiningEngineException;
import com.seqmine.core.exception.SeqMineException;
import com.seqmine.core.model.DecomposedRule;
import com.seqmine.core.model.DecomposedRuleTable;
import com.seqmine.core.model.EncodedTransactionSet;
import com.seqmine.core.model.MiningParameters;
import com.seqmine.core.model.NormalizedRecords;
import com.seqmine.core.model.RawTable;
import com.seqmine.core.model.Rule;
import com.seqmine.core.model.RuleMetric;
import com.seqmine.core.spi.SequenceMiningEngine;
import com.seqmine.engine.encode.SequenceEncoder;
import com.seqmine.engine.logging.LoggingContext;
import com.seqmine.engine.metrics.PipelineMetrics;
import com.seqmine.engine.normalize.TemporalNormalizer;
import com.seqmine.engine.rules.RuleDecomposer;
import com.seqmine.engine.service.SequenceMiningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Coordinator for a single synchronous pipeline run.
 * Each stage consumes its whole input before the next one starts.
 */
public class PipelineCoordinator implements SequenceMiningService {

    private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final TemporalNormalizer normalizer;
    private final SequenceEncoder encoder;
    private final RuleDecomposer decomposer;
    private final SequenceMiningEngine engine;
    private final MiningParameters defaultParameters;
    private final PipelineMetrics metrics;
    private final int defaultReportTopK;

    public PipelineCoordinator(
            TemporalNormalizer normalizer,
            SequenceEncoder encoder,
            RuleDecomposer decomposer,
            SequenceMiningEngine engine,
            MiningParameters defaultParameters,
            PipelineMetrics metrics) {
        this(normalizer, encoder, decomposer, engine, defaultParameters, metrics,
            PipelineRequest.DEFAULT_REPORT_TOP_K);
    }

    public PipelineCoordinator(
            TemporalNormalizer normalizer,
            SequenceEncoder encoder,
            RuleDecomposer decomposer,
            SequenceMiningEngine engine,
            MiningParameters defaultParameters,
            PipelineMetrics metrics,
            int defaultReportTopK) {
        this.normalizer = normalizer;
        this.encoder = encoder;
        this.decomposer = decomposer;
        this.engine = engine;
        this.defaultParameters = defaultParameters;
        this.metrics = metrics;
        this.defaultReportTopK = defaultReportTopK;
    }

    @Override
    public PipelineResult run(PipelineRequest request) {
        validateRequest(request);
        String runId = request.runId() != null ? request.runId() : LoggingContext.newRunId();
        MiningParameters parameters = request.parameters() != null ? request.parameters() : defaultParameters;
        int reportTopK = request.reportTopK() != null ? request.reportTopK() : defaultReportTopK;
        Instant started = Instant.now();

        try (var ctx = LoggingContext.forRun(runId, request.source().describe())) {
            try {
                log.info("Starting pipeline run {} with {}", runId, parameters);

                RawTable raw = stage("read", () -> request.source().read());

                NormalizedRecords normalized = stage("normalize", () -> normalizer.normalize(
                    raw, request.sessionKeyField(), request.timestampField()));
                metrics.recordsNormalized(normalized.size());

                NormalizedRecords filtered = stage("filter", () -> applyFilters(normalized, request.filters()));

                EncodedTransactionSet transactions = stage("encode", () -> encoder.encode(
                    filtered, request.sessionKeyField(), request.actionField()));
                metrics.sessionsEncoded(transactions.size());

                List<Rule> rules = stage("mine", () -> mine(transactions, parameters));

                DecomposedRuleTable table = stage("decompose", () -> decomposer.decompose(rules));
                metrics.rulesDecomposed(table.size(), table.malformedCount());

                if (request.sink() != null) {
                    stage("persist", () -> {
                        request.sink().write(table);
                        return null;
                    });
                    log.info("Wrote {} rules to {}", table.size(), request.sink().describe());
                }

                DecomposedRuleTable top = decomposer.topK(table, RuleMetric.LIFT, reportTopK);
                logReport(top);

                Duration elapsed = Duration.between(started, Instant.now());
                metrics.runFinished("success");
                log.info("Pipeline run {} finished in {} ms", runId, elapsed.toMillis());
                return new PipelineResult(runId, filtered, transactions, rules, table, top, elapsed);
            } catch (SeqMineException e) {
                metrics.runFinished("failure");
                log.error("Pipeline run {} failed [{}]: {}", runId, e.getErrorCode(), e.getMessage());
                throw e;
            }
        }
    }

    private List<Rule> mine(EncodedTransactionSet transactions, MiningParameters parameters) {
        log.info("Mining {} transactions with engine {}", transactions.size(), engine.name());
        List<Rule> rules;
        try {
            rules = engine.mine(transactions, parameters);
        } catch (SeqMineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MiningEngineException(engine.name(), e);
        }
        if (rules == null) {
            throw new MiningEngineException(engine.name(), "returned no rule list");
        }
        log.info("Engine {} returned {} rules", engine.name(), rules.size());
        return List.copyOf(rules);
    }

    private static NormalizedRecords applyFilters(
            NormalizedRecords records, List<RecordFilter> filters) {
        NormalizedRecords current = records;
        for (RecordFilter filter : filters) {
            int before = current.size();
            current = current.where(filter.field(), filter.value());
            log.info("Filter {} = '{}' kept {} of {} records",
                filter.field(), filter.value(), current.size(), before);
        }
        return current;
    }

    private <T> T stage(String name, Supplier<T> body) {
        Instant start = Instant.now();
        try (var stage = LoggingContext.forStage(name)) {
            return body.get();
        } finally {
            metrics.stageDuration(name, Duration.between(start, Instant.now()));
        }
    }

    private static void logReport(DecomposedRuleTable top) {
        if (top.isEmpty()) {
            log.info("No rules to report");
            return;
        }
        log.info("Top {} rules by lift:", top.size());
        for (DecomposedRule rule : top.rows()) {
            log.info("  {} => {}  support={} confidence={} lift={}",
                rule.lhs(), rule.rhs(),
                String.format("%.4f", rule.support()),
                String.format("%.4f", rule.confidence()),
                String.format("%.4f", rule.lift()));
        }
    }

    private static void validateRequest(PipelineRequest request) {
        if (request.source() == null) {
            throw new ConfigurationException("A record source is required");
        }
        if (request.sessionKeyField() == null || request.actionField() == null
                || request.timestampField() == null) {
            throw new ConfigurationException(
                "Session key, action and timestamp field names are required");
        }
        if (request.reportTopK() != null && request.reportTopK() < 0) {
            throw new ConfigurationException("reportTopK must be >= 0: " + request.reportTopK());
        }
    }
}
