package org.calista.flowsight.train.synth;

import org.calista.flowsight.train.knowledge.Fact;
import org.calista.flowsight.train.knowledge.FactKind;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.util.List;

/**
 * Expands one fact of a single kind into its training records.
 *
 * @param <F> the fact variant handled
 */
public interface SampleGenerator<F extends Fact> {

    FactKind kind();

    Class<F> factType();

    /** Records for one fact, in a fixed order. Must be deterministic. */
    List<TrainingRecord> generate(F fact);
}
