package org.calista.flowsight.train.synth;

import org.calista.flowsight.train.format.AnswerFormatter;
import org.calista.flowsight.train.knowledge.CallbackFact;
import org.calista.flowsight.train.knowledge.FactKind;
import org.calista.flowsight.train.sample.MetadataKeys;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.util.List;
import java.util.Objects;

/**
 * Two records per callback: when the handler fires, and which function the field points to.
 * Both share the same skeleton as input.
 */
public final class CallbackSampleGenerator implements SampleGenerator<CallbackFact> {

    private final AnswerFormatter formatter;
    private final CodeSkeletons skeletons;

    public CallbackSampleGenerator(AnswerFormatter formatter, CodeSkeletons skeletons) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.skeletons = Objects.requireNonNull(skeletons, "skeletons");
    }

    @Override
    public FactKind kind() {
        return FactKind.CALLBACK;
    }

    @Override
    public Class<CallbackFact> factType() {
        return CallbackFact.class;
    }

    @Override
    public List<TrainingRecord> generate(CallbackFact fact) {
        String code = skeletons.callback(fact);
        String handler = fact.handlerName();

        TrainingRecord timing = TrainingRecord.builder(TaskKind.CALLBACK_TIMING)
                .instruction("分析以下代码中 " + handler + " 函数何时被调用")
                .input(code)
                .output(formatter.compose(handler + " 函数的触发时机：", formatter.renderFact(fact)))
                .meta(MetadataKeys.FRAMEWORK, fact.framework)
                .meta(MetadataKeys.CALLBACK, fact.callback)
                .build();

        TrainingRecord target = TrainingRecord.builder(TaskKind.FUNCTION_POINTER_TARGET)
                .instruction("分析 " + fact.framework + " 结构体中 ." + fact.callback + " 字段指向哪个函数")
                .input(code)
                .output(fieldTarget(fact.callback, handler))
                .meta(MetadataKeys.FRAMEWORK, fact.framework)
                .meta(MetadataKeys.CALLBACK, fact.callback)
                .build();

        return List.of(timing, target);
    }

    static String fieldTarget(String field, String handler) {
        return "." + field + " 字段指向 " + handler + " 函数。\n\n"
                + "这是在结构体初始化时通过 ." + field + " = " + handler + " 赋值的。";
    }
}
