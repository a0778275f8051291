package org.calista.flowsight.train.synth;

import org.calista.flowsight.train.format.AnswerFormatter;
import org.calista.flowsight.train.knowledge.FactKind;
import org.calista.flowsight.train.knowledge.ScenarioFact;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.util.List;
import java.util.Objects;

/** One call-chain record per flat scenario; wording and chain style come from its category. */
public final class ScenarioSampleGenerator implements SampleGenerator<ScenarioFact> {

    private final AnswerFormatter formatter;
    private final CodeSkeletons skeletons;

    public ScenarioSampleGenerator(AnswerFormatter formatter, CodeSkeletons skeletons) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.skeletons = Objects.requireNonNull(skeletons, "skeletons");
    }

    @Override
    public FactKind kind() {
        return FactKind.SCENARIO;
    }

    @Override
    public Class<ScenarioFact> factType() {
        return ScenarioFact.class;
    }

    @Override
    public List<TrainingRecord> generate(ScenarioFact fact) {
        return List.of(TrainingRecord.builder(TaskKind.CALL_CHAIN)
                .instruction(fact.category.instruction(fact.scenario))
                .input(skeletons.scenario(fact))
                .output(formatter.renderFact(fact))
                .meta(fact.category.metadataKey, fact.scenario)
                .build());
    }
}
