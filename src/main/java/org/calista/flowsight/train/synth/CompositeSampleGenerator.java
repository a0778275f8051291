package org.calista.flowsight.train.synth;

import org.calista.flowsight.train.format.AnswerFormatter;
import org.calista.flowsight.train.knowledge.CompositeScenario;
import org.calista.flowsight.train.knowledge.FactKind;
import org.calista.flowsight.train.sample.MetadataKeys;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.util.List;
import java.util.Objects;

/** Exactly one record per composite scenario. */
public final class CompositeSampleGenerator implements SampleGenerator<CompositeScenario> {

    private final AnswerFormatter formatter;

    public CompositeSampleGenerator(AnswerFormatter formatter) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    @Override
    public FactKind kind() {
        return FactKind.COMPOSITE;
    }

    @Override
    public Class<CompositeScenario> factType() {
        return CompositeScenario.class;
    }

    @Override
    public List<TrainingRecord> generate(CompositeScenario scenario) {
        return List.of(TrainingRecord.builder(TaskKind.COMPOSITE_SCENARIO)
                .instruction(scenario.question)
                .input(scenario.code)
                .output(formatter.renderComposite(scenario))
                .meta(MetadataKeys.SCENARIO, scenario.scenario)
                .build());
    }
}
