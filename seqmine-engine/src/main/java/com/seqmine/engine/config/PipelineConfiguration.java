package com.seqmine.engine.config;

import com.seqmine.core.model.MiningParameters;
import com.seqmine.core.model.NormalizerOptions;
import com.seqmine.core.spi.SequenceMiningEngine;
import com.seqmine.engine.coordinator.PipelineCoordinator;
import com.seqmine.engine.encode.SequenceEncoder;
import com.seqmine.engine.encode.SymbolSanitizer;
import com.seqmine.engine.metrics.MetricsConfiguration;
import com.seqmine.engine.metrics.PipelineMetrics;
import com.seqmine.engine.normalize.TemporalNormalizer;
import com.seqmine.engine.rules.RuleDecomposer;
import com.seqmine.engine.service.SequenceMiningService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.env.Environment;

import java.time.ZoneId;

/**
 * Spring wiring for the pipeline stages.
 * 
 * Defaults come from {@code classpath:seqmine.properties}; any key can be overridden
 * through system properties or environment variables. The application must
 * contribute a {@link SequenceMiningEngine} bean.
 */
@Configuration
@Import(MetricsConfiguration.class)
@PropertySource("classpath:seqmine.properties")
public class PipelineConfiguration {

    public static final String PREFIX = "seqmine.";

    @Bean
    public NormalizerOptions normalizerOptions(Environment env) {
        return new NormalizerOptions(
            env.getProperty(PREFIX + "normalizer.sub-second-digits", Integer.class,
                NormalizerOptions.DEFAULT_SUB_SECOND_DIGITS),
            ZoneId.of(env.getProperty(PREFIX + "normalizer.zone", "UTC"))
        );
    }

    @Bean
    public MiningParameters miningParameters(Environment env) {
        MiningParameters defaults = MiningParameters.defaults();
        String maxGap = env.getProperty(PREFIX + "mining.max-gap", "");
        return MiningParameters.builder()
            .minSupport(env.getProperty(PREFIX + "mining.min-support", Double.class, defaults.minSupport()))
            .maxLength(env.getProperty(PREFIX + "mining.max-length", Integer.class, defaults.maxLength()))
            .minGap(env.getProperty(PREFIX + "mining.min-gap", Integer.class, defaults.minGap()))
            .maxGap(maxGap.isBlank() ? null : Integer.valueOf(maxGap.trim()))
            .minConfidence(env.getProperty(PREFIX + "mining.min-confidence", Double.class, defaults.minConfidence()))
            .build();
    }

    @Bean
    public TemporalNormalizer temporalNormalizer(NormalizerOptions normalizerOptions) {
        return new TemporalNormalizer(normalizerOptions);
    }

    @Bean
    public SequenceEncoder sequenceEncoder(Environment env) {
        String joiner = env.getProperty(PREFIX + "encoder.joiner", "_");
        if (joiner.length() != 1) {
            throw new IllegalStateException(PREFIX + "encoder.joiner must be a single character: '" + joiner + "'");
        }
        return new SequenceEncoder(new SymbolSanitizer(joiner.charAt(0)));
    }

    @Bean
    public RuleDecomposer ruleDecomposer() {
        return new RuleDecomposer();
    }

    @Bean
    public SequenceMiningService sequenceMiningService(
            TemporalNormalizer temporalNormalizer,
            SequenceEncoder sequenceEncoder,
            RuleDecomposer ruleDecomposer,
            SequenceMiningEngine sequenceMiningEngine,
            MiningParameters miningParameters,
            PipelineMetrics pipelineMetrics,
            Environment env) {
        return new PipelineCoordinator(
            temporalNormalizer, sequenceEncoder, ruleDecomposer,
            sequenceMiningEngine, miningParameters, pipelineMetrics,
            env.getProperty(PREFIX + "report.top-k", Integer.class,
                SequenceMiningService.PipelineRequest.DEFAULT_REPORT_TOP_K));
    }
}
