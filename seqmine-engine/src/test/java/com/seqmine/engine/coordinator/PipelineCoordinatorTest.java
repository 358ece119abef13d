package com.seqmine.engine.coordinator;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.seqmine.core.exception.ConfigurationException;
import com.seqmine.core.exception.MiningEngineException;
import com.seqmine.core.exception.TimestampParseException;
import com.seqmine.core.model.DecomposedRule;
import com.seqmine.core.model.EncodedTransactionSet;
import com.seqmine.core.model.MiningParameters;
import com.seqmine.core.model.Rule;
import com.seqmine.core.spi.SequenceMiningEngine;
import com.seqmine.engine.Fixtures;
import com.seqmine.engine.encode.SequenceEncoder;
import com.seqmine.engine.logging.LoggingContext;
import com.seqmine.engine.metrics.PipelineMetrics;
import com.seqmine.engine.normalize.TemporalNormalizer;
import com.seqmine.engine.persistence.InMemoryRecordSource;
import com.seqmine.engine.persistence.InMemoryRuleTableSink;
import com.seqmine.engine.rules.RuleDecomposer;
import com.seqmine.engine.service.SequenceMiningService.PipelineRequest;
import com.seqmine.engine.service.SequenceMiningService.PipelineResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.seqmine.engine.Fixtures.row;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end pipeline runs against a scripted mining engine.
 */
@DisplayName("Pipeline coordinator")
class PipelineCoordinatorTest {

    private static final List<String> STUDY_COLUMNS = List.of("Username", "UI", "Action", "DateTime");

    private ScriptedEngine engine;
    private PipelineMetrics metrics;
    private PipelineCoordinator coordinator;

    @BeforeEach
    void setUp() {
        engine = new ScriptedEngine();
        metrics = new PipelineMetrics();
        coordinator = new PipelineCoordinator(
            new TemporalNormalizer(),
            new SequenceEncoder(),
            new RuleDecomposer(),
            engine,
            MiningParameters.defaults(),
            metrics);
    }

    private static InMemoryRecordSource studySource() {
        return InMemoryRecordSource.of(STUDY_COLUMNS, List.of(
            row("u1", "CAI", "open file", "2024-03-01 09:00:00"),
            row("u1", "CAI", "save file", "2024-03-01 09:00:05"),
            row("u2", "GUI", "open file", "2024-03-01 09:10:00"),
            row("u3", "CAI", "close", "2024-03-01 09:20:03"),
            row("u3", "CAI", "open file", "2024-03-01 09:20:00")
        ));
    }

    private static PipelineRequest.Builder studyRequest() {
        return PipelineRequest.builder()
            .runId("run-1")
            .source(studySource())
            .sessionKeyField("Username")
            .actionField("Action")
            .timestampField("DateTime");
    }

    @Test
    @DisplayName("Runs every stage and reports the top rules by lift")
    void testFullRun() {
        engine.rules = List.of(
            new Rule("<{open_file}> => <{save_file}>", 0.3, 0.5, 0.9),
            new Rule("<{open_file}> => <{close}>", 0.3, 0.5, 1.5),
            new Rule("broken", 0.1, 0.1, 0.1),
            new Rule("<{close}> => <{open_file}>", 0.3, 0.5, 1.2));
        InMemoryRuleTableSink sink = new InMemoryRuleTableSink();

        PipelineResult result = coordinator.run(studyRequest().sink(sink).reportTopK(2).build());

        assertThat(result.runId()).isEqualTo("run-1");
        assertThat(result.normalized().size()).isEqualTo(5);
        assertThat(result.transactions().size()).isEqualTo(3);
        assertThat(result.table().size()).isEqualTo(4);
        assertThat(result.table().malformedPositions()).containsExactly(2);
        assertThat(result.topRules().rows()).extracting(DecomposedRule::lift).containsExactly(1.5, 1.2);
        assertThat(sink.lastWritten()).contains(result.table());
        assertThat(result.elapsed().isNegative()).isFalse();
    }

    @Test
    @DisplayName("Hands the encoded sessions and parameters to the engine untouched")
    void testEngineInput() {
        MiningParameters parameters = MiningParameters.builder().minSupport(0.5).maxGap(null).build();

        coordinator.run(studyRequest().parameters(parameters).build());

        assertThat(engine.parameters).isSameAs(parameters);
        EncodedTransactionSet seen = engine.transactions;
        assertThat(seen.sequenceIdOf("u3")).contains(3);
        assertThat(seen.get(3).orElseThrow().symbols()).containsExactly("open_file", "close");
        assertThat(seen.symbols().symbols()).containsExactly("close", "open_file", "save_file");
    }

    @Test
    @DisplayName("Filters records on a canonicalized field before encoding")
    void testFilter() {
        PipelineResult result = coordinator.run(studyRequest().filter("ui", "CAI").build());

        assertThat(result.normalized().size()).isEqualTo(4);
        assertThat(engine.transactions.size()).isEqualTo(2);
        assertThat(engine.transactions.sequenceIdOf("u2")).isEmpty();
        assertThat(engine.transactions.sequenceIdOf("u3")).contains(2);
    }

    @Test
    @DisplayName("Uses default parameters and report size when the request leaves them unset")
    void testDefaults() {
        List<Rule> rules = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            rules.add(new Rule("<{a" + i + "}> => <{b}>", 0.2, 0.5, i));
        }
        engine.rules = rules;

        PipelineResult result = coordinator.run(studyRequest().runId(null).build());

        assertThat(engine.parameters).isEqualTo(MiningParameters.defaults());
        assertThat(result.topRules().size()).isEqualTo(PipelineRequest.DEFAULT_REPORT_TOP_K);
        assertThat(result.topRules().get(0).lift()).isEqualTo(7.0);
        assertThat(result.runId()).isNotBlank();
    }

    @Test
    @DisplayName("Wraps engine runtime failures")
    void testEngineFailure() {
        engine.failure = new IllegalStateException("out of memory");

        assertThatThrownBy(() -> coordinator.run(studyRequest().build()))
            .isInstanceOf(MiningEngineException.class)
            .hasMessageContaining("scripted")
            .hasMessageContaining("out of memory")
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(metrics.registry().get(PipelineMetrics.RUNS).tag("outcome", "failure").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Logs the failure while the run's logging context is still open")
    void testFailureLoggedWithRunContext() {
        engine.failure = new IllegalStateException("out of memory");
        Logger logger = (Logger) LoggerFactory.getLogger(PipelineCoordinator.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                // capture the MDC at logging time
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        appender.start();
        logger.addAppender(appender);
        try {
            assertThatThrownBy(() -> coordinator.run(studyRequest().build()))
                .isInstanceOf(MiningEngineException.class);
        } finally {
            logger.detachAppender(appender);
        }

        ILoggingEvent failure = appender.list.stream()
            .filter(event -> event.getLevel() == Level.ERROR)
            .findFirst()
            .orElseThrow();
        assertThat(failure.getMDCPropertyMap())
            .containsEntry(LoggingContext.RUN_ID, "run-1")
            .containsKey(LoggingContext.SOURCE);
        assertThat(LoggingContext.getRunId()).isNull();
    }

    @Test
    @DisplayName("A null rule list from the engine is a failure")
    void testNullRules() {
        engine.rules = null;

        assertThatThrownBy(() -> coordinator.run(studyRequest().build()))
            .isInstanceOf(MiningEngineException.class);
    }

    @Test
    @DisplayName("Parse errors abort the run before mining")
    void testParseErrorAborts() {
        InMemoryRecordSource source = InMemoryRecordSource.of(Fixtures.COLUMNS, List.of(
            row("S1", "click", "2024-01-15 10:00:00"),
            row("S1", "click", "yesterday")));

        assertThatThrownBy(() -> coordinator.run(studyRequest().source(source).build()))
            .isInstanceOf(TimestampParseException.class);
        assertThat(engine.transactions).isNull();
    }

    @Test
    @DisplayName("Rejects incomplete requests")
    void testValidation() {
        assertThatThrownBy(() -> coordinator.run(studyRequest().source(null).build()))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> coordinator.run(studyRequest().actionField(null).build()))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> coordinator.run(studyRequest().reportTopK(-1).build()))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> coordinator.run(studyRequest().actionField("verb").build()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("verb");
    }

    @Test
    @DisplayName("Records stage metrics for a successful run")
    void testMetrics() {
        engine.rules = List.of(new Rule("<a> => <b>", 0.1, 0.1, 0.1), new Rule("bad", 0.1, 0.1, 0.1));

        coordinator.run(studyRequest().build());

        assertThat(metrics.registry().get(PipelineMetrics.RECORDS_NORMALIZED).counter().count()).isEqualTo(5.0);
        assertThat(metrics.registry().get(PipelineMetrics.SESSIONS_ENCODED).counter().count()).isEqualTo(3.0);
        assertThat(metrics.registry().get(PipelineMetrics.RULES_DECOMPOSED).counter().count()).isEqualTo(2.0);
        assertThat(metrics.registry().get(PipelineMetrics.RULES_MALFORMED).counter().count()).isEqualTo(1.0);
        assertThat(metrics.registry().get(PipelineMetrics.STAGE_DURATION).tag("stage", "mine").timer().count())
            .isEqualTo(1L);
        assertThat(metrics.registry().get(PipelineMetrics.RUNS).tag("outcome", "success").counter().count())
            .isEqualTo(1.0);
    }

    static class ScriptedEngine implements SequenceMiningEngine {
        List<Rule> rules = List.of();
        RuntimeException failure;
        EncodedTransactionSet transactions;
        MiningParameters parameters;

        @Override
        public List<Rule> mine(EncodedTransactionSet transactions, MiningParameters parameters) {
            this.transactions = transactions;
            this.parameters = parameters;
            if (failure != null) {
                throw failure;
            }
            return rules;
        }

        @Override
        public String name() {
            return "scripted";
        }
    }
}
