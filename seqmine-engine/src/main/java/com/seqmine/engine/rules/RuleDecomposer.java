package com.seqmine.engine.rules;

import com.seqmine.core.model.DecomposedRule;
import com.seqmine.core.model.DecomposedRuleTable;
import com.seqmine.core.model.Rule;
import com.seqmine.core.model.RuleMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits engine rules into antecedent and consequent columns and ranks them.
 * 
 * A rule string that does not contain {@code " => "} exactly once is kept with
 * the whole string as LHS and a null RHS. It is logged as a warning and never
 * aborts the run.
 */
public class RuleDecomposer {

    private static final Logger log = LoggerFactory.getLogger(RuleDecomposer.class);

    /**
     * Decompose engine rules in input order.
     */
    public DecomposedRuleTable decompose(List<Rule> rules) {
        List<DecomposedRule> rows = new ArrayList<>(rules.size());
        List<Integer> malformed = new ArrayList<>();
        for (int position = 0; position < rules.size(); position++) {
            Rule rule = rules.get(position);
            DecomposedRule row = split(rule);
            if (row.isMalformed()) {
                log.warn("Malformed rule at position {}: '{}' does not contain '{}' exactly once",
                    position, rule.rule(), DecomposedRule.SEPARATOR);
                malformed.add(position);
            }
            rows.add(row);
        }
        log.info("Decomposed {} rules ({} malformed)", rows.size(), malformed.size());
        return new DecomposedRuleTable(rows, malformed);
    }

    /**
     * Decompose a single rule.
     */
    public DecomposedRule split(Rule rule) {
        String text = rule.rule() == null ? "" : rule.rule();
        int first = text.indexOf(DecomposedRule.SEPARATOR);
        boolean exactlyOnce = first >= 0
            && text.indexOf(DecomposedRule.SEPARATOR, first + DecomposedRule.SEPARATOR.length()) < 0;
        if (!exactlyOnce) {
            return new DecomposedRule(text, null, rule.support(), rule.confidence(), rule.lift());
        }
        return new DecomposedRule(
            text.substring(0, first),
            text.substring(first + DecomposedRule.SEPARATOR.length()),
            rule.support(),
            rule.confidence(),
            rule.lift()
        );
    }

    /**
     * First k rows ranked by the metric, descending.
     * Ties keep their table order; NaN values rank last.
     * 
     * @throws IllegalArgumentException if k is negative
     */
    public DecomposedRuleTable topK(DecomposedRuleTable table, RuleMetric metric, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0: " + k);
        }
        List<DecomposedRule> ranked = new ArrayList<>(table.rows());
        ranked.sort(descending(metric));
        return DecomposedRuleTable.of(ranked.subList(0, Math.min(k, ranked.size())));
    }

    /**
     * Convenience overload taking the metric name, e.g. {@code "lift"}.
     */
    public DecomposedRuleTable topK(DecomposedRuleTable table, String metric, int k) {
        return topK(table, RuleMetric.fromName(metric), k);
    }

    static Comparator<DecomposedRule> descending(RuleMetric metric) {
        return (a, b) -> {
            double x = metric.valueOf(a);
            double y = metric.valueOf(b);
            boolean xNaN = Double.isNaN(x);
            boolean yNaN = Double.isNaN(y);
            if (xNaN || yNaN) {
                return Boolean.compare(xNaN, yNaN);
            }
            return Double.compare(y, x);
        };
    }
}
