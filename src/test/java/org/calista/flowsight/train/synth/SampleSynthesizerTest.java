package org.calista.flowsight.train.synth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.flowsight.train.format.AnswerFormatter;
import org.calista.flowsight.train.knowledge.AsyncMechanismFact;
import org.calista.flowsight.train.knowledge.CallbackFact;
import org.calista.flowsight.train.knowledge.CompositeScenario;
import org.calista.flowsight.train.knowledge.FactKind;
import org.calista.flowsight.train.knowledge.FactSchema;
import org.calista.flowsight.train.knowledge.ScenarioFact;
import org.calista.flowsight.train.knowledge.SyncPrimitiveFact;
import org.calista.flowsight.train.knowledge.kernel.LinuxKernelKnowledge;
import org.calista.flowsight.train.sample.MetadataKeys;
import org.calista.flowsight.train.sample.RecordCodec;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleSynthesizerTest {

    private static final CallbackFact SAMPLE_PROBE = new CallbackFact("sample_driver", "probe",
            "device match", "process context", List.of("register_device", "match_driver", "call_probe"), null);

    @Test
    void callbackYieldsTimingThenFieldTarget() {
        SampleSynthesizer synth = SampleSynthesizer.withDefaults(FactSchema.builder().add(SAMPLE_PROBE).build());
        List<TrainingRecord> records = synth.synthesize();

        assertThat(records).extracting(r -> r.task)
                .containsExactly(TaskKind.CALLBACK_TIMING, TaskKind.FUNCTION_POINTER_TARGET);

        TrainingRecord timing = records.get(0);
        assertThat(timing.instruction).contains("my_probe");
        assertThat(timing.output).contains("device match").contains("process context");
        assertThat(timing.output).endsWith("├── register_device\n    ├── match_driver\n        └── call_probe");
        assertThat(timing.input).contains(".probe = my_probe").contains("struct sample_driver");
        assertThat(timing.metadata).containsEntry(MetadataKeys.FRAMEWORK, "sample_driver")
                .containsEntry(MetadataKeys.CALLBACK, "probe");

        TrainingRecord target = records.get(1);
        assertThat(target.output).isEqualTo(
                ".probe 字段指向 my_probe 函数。\n\n这是在结构体初始化时通过 .probe = my_probe 赋值的。");
        assertThat(target.input).isEqualTo(timing.input);
    }

    @Test
    void kernelSchemaCoverage() {
        FactSchema schema = LinuxKernelKnowledge.schema();
        List<TrainingRecord> records = SampleSynthesizer.withDefaults(schema).synthesize();

        int callbacks = schema.facts(CallbackFact.class).size();
        int expected = callbacks * 2
                + schema.facts(AsyncMechanismFact.class).size()
                + schema.facts(ScenarioFact.class).size()
                + schema.facts(SyncPrimitiveFact.class).size()
                + schema.facts(CompositeScenario.class).size();
        assertThat(records).hasSize(expected);

        assertThat(records.stream().filter(r -> r.task == TaskKind.CALLBACK_TIMING).count()).isEqualTo(callbacks);
        assertThat(records.stream().filter(r -> r.task == TaskKind.FUNCTION_POINTER_TARGET).count()).isEqualTo(callbacks);
        assertThat(records.stream().filter(r -> r.task == TaskKind.COMPOSITE_SCENARIO).count()).isEqualTo(4);
        assertThat(records).allSatisfy(r -> {
            assertThat(r.instruction).isNotBlank();
            assertThat(r.output).isNotBlank();
        });
        assertThat(records.stream().filter(r -> r.task == TaskKind.CALLBACK_TIMING))
                .allSatisfy(r -> assertThat(r.input).isNotBlank());
    }

    @Test
    void synthesisIsDeterministic() throws Exception {
        RecordCodec codec = new RecordCodec(new ObjectMapper());
        List<String> a = encodeAll(codec, SampleSynthesizer.withDefaults(LinuxKernelKnowledge.schema()).synthesize());
        List<String> b = encodeAll(codec, SampleSynthesizer.withDefaults(LinuxKernelKnowledge.schema()).synthesize());

        assertThat(a).hasSize(94);
        assertThat(String.join("\n", a).getBytes(StandardCharsets.UTF_8))
                .isEqualTo(String.join("\n", b).getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> encodeAll(RecordCodec codec, List<TrainingRecord> records) throws Exception {
        List<String> out = new ArrayList<>(records.size());
        for (TrainingRecord r : records) out.add(codec.encodeWithTask(r));
        return out;
    }

    @Test
    void asyncRecordCarriesFlowTimelineAndUse() {
        FactSchema schema = LinuxKernelKnowledge.schema();
        AsyncMechanismFact wq = (AsyncMechanismFact) schema.find("async:workqueue").orElseThrow();
        TrainingRecord r = SampleSynthesizer.withDefaults(schema).synthesize(wq).get(0);

        assertThat(r.task).isEqualTo(TaskKind.ASYNC_PATTERN);
        assertThat(r.output).startsWith("**异步模式**：WORKQUEUE (");
        assertThat(r.output).contains("**执行流程**：\n  1. probe 中调用 INIT_WORK 绑定处理函数");
        assertThat(r.output).contains("**时间线**：\n中断发生 → schedule_work");
        assertThat(r.output).contains("**典型用途**：");
        assertThat(r.metadata).containsEntry(MetadataKeys.PATTERN, "workqueue");
        assertThat(r.input).contains("INIT_WORK");
    }

    @Test
    void derivedFlowForMechanismsWithoutAuthoredSteps() {
        AsyncMechanismFact irq = AsyncMechanismFact.builder("irq")
                .bindOps("request_irq")
                .context("中断上下文")
                .description("硬中断")
                .callChain("do_IRQ", "handler()")
                .build();
        assertThat(AsyncPatternSampleGenerator.flowSteps(irq)).containsExactly(
                "调用 request_irq 绑定处理函数",
                "硬件事件发生时，内核调用处理函数",
                "处理函数在中断上下文中执行");

        AsyncMechanismFact completion = AsyncMechanismFact.builder("completion")
                .bindOps("init_completion")
                .triggerOps("complete")
                .waitOps("wait_for_completion")
                .description("完成量")
                .callChain("complete", "wake_up")
                .build();
        assertThat(AsyncPatternSampleGenerator.flowSteps(completion)).containsExactly(
                "调用 init_completion 绑定处理函数",
                "调用 complete 触发执行，调用方立即返回",
                "等待方调用 wait_for_completion 阻塞，直到被唤醒");
    }

    @Test
    void scenarioRecordsUseTheCategoryMetadataKey() {
        FactSchema schema = LinuxKernelKnowledge.schema();
        List<TrainingRecord> chains = SampleSynthesizer.withDefaults(schema).synthesize().stream()
                .filter(r -> r.task == TaskKind.CALL_CHAIN)
                .collect(Collectors.toList());

        assertThat(chains).anySatisfy(r -> assertThat(r.metadata).containsEntry(MetadataKeys.FLOW, "napi_poll"));
        assertThat(chains).anySatisfy(r -> assertThat(r.metadata).containsEntry(MetadataKeys.OPERATION, "insmod"));
        assertThat(chains).filteredOn(r -> "voluntary_schedule".equals(r.metadata.get(MetadataKeys.OPERATION)))
                .hasSize(1)
                .allSatisfy(r -> assertThat(r.input).isEqualTo(CodeSkeletons.SCHEDULER_PLACEHOLDER));
    }

    @Test
    void missingGeneratorFailsAtConstruction() {
        FactSchema schema = LinuxKernelKnowledge.schema();
        AnswerFormatter fmt = new AnswerFormatter();
        CodeSkeletons sk = new CodeSkeletons();
        List<SampleGenerator<?>> withoutComposite = List.of(
                new CallbackSampleGenerator(fmt, sk),
                new AsyncPatternSampleGenerator(fmt, sk),
                new ScenarioSampleGenerator(fmt, sk),
                new SyncPrimitiveSampleGenerator(fmt, sk));

        assertThatThrownBy(() -> new SampleSynthesizer(schema, withoutComposite))
                .isInstanceOfSatisfying(SchemaConsistencyException.class,
                        e -> assertThat(e.kind()).isEqualTo(FactKind.COMPOSITE));
    }

    @Test
    void duplicateGeneratorIsRejected() {
        AnswerFormatter fmt = new AnswerFormatter();
        CodeSkeletons sk = new CodeSkeletons();
        FactSchema schema = FactSchema.builder().add(SAMPLE_PROBE).build();
        assertThatThrownBy(() -> new SampleSynthesizer(schema, List.of(
                new CallbackSampleGenerator(fmt, sk), new CallbackSampleGenerator(fmt, sk))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void factOfAnUncoveredKindFailsFast() {
        AnswerFormatter fmt = new AnswerFormatter();
        SampleSynthesizer synth = new SampleSynthesizer(FactSchema.builder().add(SAMPLE_PROBE).build(),
                List.of(new CallbackSampleGenerator(fmt, new CodeSkeletons())));
        CompositeScenario stray = CompositeScenario.builder("stray").question("q").title("t")
                .phase("p", "b", null).build();

        assertThatThrownBy(() -> synth.synthesize(stray)).isInstanceOf(SchemaConsistencyException.class);
    }
}
