package org.calista.flowsight.train.synth;

import org.calista.flowsight.train.format.AnswerFormatter;
import org.calista.flowsight.train.format.ChainStyle;
import org.calista.flowsight.train.knowledge.AsyncMechanismFact;
import org.calista.flowsight.train.knowledge.FactKind;
import org.calista.flowsight.train.sample.MetadataKeys;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One pattern/flow record per mechanism: the rendered fact, then the numbered execution
 * flow, the timeline when authored, and typical uses.
 */
public final class AsyncPatternSampleGenerator implements SampleGenerator<AsyncMechanismFact> {

    static final String INSTRUCTION = "识别以下代码中的异步模式，并解释执行流程";

    private final AnswerFormatter formatter;
    private final CodeSkeletons skeletons;

    public AsyncPatternSampleGenerator(AnswerFormatter formatter, CodeSkeletons skeletons) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.skeletons = Objects.requireNonNull(skeletons, "skeletons");
    }

    @Override
    public FactKind kind() {
        return FactKind.ASYNC_MECHANISM;
    }

    @Override
    public Class<AsyncMechanismFact> factType() {
        return AsyncMechanismFact.class;
    }

    @Override
    public List<TrainingRecord> generate(AsyncMechanismFact fact) {
        String output = formatter.compose(
                formatter.renderFact(fact),
                formatter.chainSection("执行流程", flowSteps(fact), ChainStyle.NUMBERED),
                formatter.textSection(AnswerFormatter.TIMELINE_LABEL, fact.timeline),
                formatter.contextSection("典型用途", fact.typicalUse));

        return List.of(TrainingRecord.builder(TaskKind.ASYNC_PATTERN)
                .instruction(INSTRUCTION)
                .input(skeletons.async(fact))
                .output(output)
                .meta(MetadataKeys.PATTERN, fact.mechanism)
                .build());
    }

    /** Authored steps, or steps derived from the bind/trigger/wait operations. */
    static List<String> flowSteps(AsyncMechanismFact fact) {
        if (!fact.flowSteps.isEmpty()) return fact.flowSteps;

        List<String> out = new ArrayList<>(4);
        if (!fact.bindOps.isEmpty()) {
            out.add("调用 " + fact.bindOps.get(0) + " 绑定处理函数");
        }
        if (fact.hardwareTriggered()) {
            out.add("硬件事件发生时，内核调用处理函数");
        } else {
            out.add("调用 " + fact.triggerOps.get(0) + " 触发执行，调用方立即返回");
        }
        if (!fact.waitOps.isEmpty()) {
            out.add("等待方调用 " + fact.waitOps.get(0) + " 阻塞，直到被唤醒");
        }
        if (fact.context != null) {
            out.add("处理函数在" + fact.context + "中执行");
        }
        return out;
    }
}
