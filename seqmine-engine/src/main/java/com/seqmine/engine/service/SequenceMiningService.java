package com.seqmine.engine.service;

import com.seqmine.core.model.DecomposedRuleTable;
import com.seqmine.core.model.EncodedTransactionSet;
import com.seqmine.core.model.MiningParameters;
import com.seqmine.core.model.NormalizedRecords;
import com.seqmine.core.model.Rule;
import com.seqmine.core.spi.RecordSource;
import com.seqmine.core.spi.RuleTableSink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the full preparation and post-processing pipeline around an external miner:
 * read, normalize, filter, encode, mine, decompose, persist, rank.
 */
public interface SequenceMiningService {

    /**
     * Run the pipeline once.
     * 
     * @param request Source, field names, filter, mining parameters and optional sink
     * @return Every intermediate collection plus the ranked report
     * @throws com.seqmine.core.exception.ConfigurationException if a field does not resolve
     * @throws com.seqmine.core.exception.TimestampParseException if a timestamp is unparseable
     * @throws com.seqmine.core.exception.MiningEngineException if the engine fails
     */
    PipelineResult run(PipelineRequest request);

    /**
     * Keep only records whose field equals the value, e.g. a study condition.
     */
    record RecordFilter(String field, Object value) {}

    /**
     * Request to run the pipeline.
     */
    record PipelineRequest(
        String runId,
        RecordSource source,
        String sessionKeyField,
        String actionField,
        String timestampField,
        List<RecordFilter> filters,
        MiningParameters parameters,
        RuleTableSink sink,
        // Rules listed in the report; null uses the service default
        Integer reportTopK
    ) {
        public static final int DEFAULT_REPORT_TOP_K = 5;

        public PipelineRequest {
            filters = filters == null ? List.of() : List.copyOf(filters);
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private String runId;
            private RecordSource source;
            private String sessionKeyField;
            private String actionField;
            private String timestampField;
            private final List<RecordFilter> filters = new ArrayList<>();
            private MiningParameters parameters;
            private RuleTableSink sink;
            private Integer reportTopK;

            public Builder runId(String runId) {
                this.runId = runId;
                return this;
            }

            public Builder source(RecordSource source) {
                this.source = source;
                return this;
            }

            public Builder sessionKeyField(String sessionKeyField) {
                this.sessionKeyField = sessionKeyField;
                return this;
            }

            public Builder actionField(String actionField) {
                this.actionField = actionField;
                return this;
            }

            public Builder timestampField(String timestampField) {
                this.timestampField = timestampField;
                return this;
            }

            public Builder filter(String field, Object value) {
                this.filters.add(new RecordFilter(field, value));
                return this;
            }

            public Builder parameters(MiningParameters parameters) {
                this.parameters = parameters;
                return this;
            }

            public Builder sink(RuleTableSink sink) {
                this.sink = sink;
                return this;
            }

            public Builder reportTopK(Integer reportTopK) {
                this.reportTopK = reportTopK;
                return this;
            }

            public PipelineRequest build() {
                return new PipelineRequest(
                    runId, source, sessionKeyField, actionField, timestampField,
                    filters, parameters, sink, reportTopK
                );
            }
        }
    }

    /**
     * Outcome of one run.
     */
    record PipelineResult(
        String runId,
        NormalizedRecords normalized,
        EncodedTransactionSet transactions,
        List<Rule> rules,
        DecomposedRuleTable table,
        DecomposedRuleTable topRules,
        Duration elapsed
    ) {}
}
