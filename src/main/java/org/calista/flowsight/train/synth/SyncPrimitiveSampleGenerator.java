package org.calista.flowsight.train.synth;

import org.calista.flowsight.train.format.AnswerFormatter;
import org.calista.flowsight.train.knowledge.FactKind;
import org.calista.flowsight.train.knowledge.SyncPrimitiveFact;
import org.calista.flowsight.train.sample.MetadataKeys;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.util.List;
import java.util.Objects;

/** One synchronization record per primitive, with its lock and unlock operations. */
public final class SyncPrimitiveSampleGenerator implements SampleGenerator<SyncPrimitiveFact> {

    private final AnswerFormatter formatter;
    private final CodeSkeletons skeletons;

    public SyncPrimitiveSampleGenerator(AnswerFormatter formatter, CodeSkeletons skeletons) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.skeletons = Objects.requireNonNull(skeletons, "skeletons");
    }

    @Override
    public FactKind kind() {
        return FactKind.SYNC_PRIMITIVE;
    }

    @Override
    public Class<SyncPrimitiveFact> factType() {
        return SyncPrimitiveFact.class;
    }

    @Override
    public List<TrainingRecord> generate(SyncPrimitiveFact fact) {
        String output = formatter.compose(
                formatter.renderFact(fact),
                formatter.contextSection("加锁操作", String.join(", ", fact.lockOps)),
                formatter.contextSection("解锁操作", String.join(", ", fact.unlockOps)));

        return List.of(TrainingRecord.builder(TaskKind.SYNC_MECHANISM)
                .instruction("分析 " + fact.primitive + " 同步机制的使用方式和注意事项")
                .input(skeletons.sync(fact))
                .output(output)
                .meta(MetadataKeys.MECHANISM, fact.primitive)
                .build());
    }
}
