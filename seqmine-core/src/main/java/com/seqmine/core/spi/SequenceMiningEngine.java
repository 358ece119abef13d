package com.seqmine.core.spi;

import com.seqmine.core.model.EncodedTransactionSet;
import com.seqmine.core.model.MiningParameters;
import com.seqmine.core.model.Rule;

import java.util.List;

/**
 * External frequent-sequence miner with rule induction.
 * 
 * Implementations discover frequent sequences over the transaction set and derive
 * rules formatted as {@code <antecedent> => <consequent>}. The call is blocking and
 * synchronous; cancellation and timeouts are the implementation's concern.
 */
public interface SequenceMiningEngine {

    /**
     * Mine rules from the encoded transactions.
     * 
     * @param transactions The encoded sessions
     * @param parameters Support, length, gap and confidence thresholds
     * @return Induced rules with support, confidence and lift, never null
     */
    List<Rule> mine(EncodedTransactionSet transactions, MiningParameters parameters);

    /**
     * Short name used in logs and error messages.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
