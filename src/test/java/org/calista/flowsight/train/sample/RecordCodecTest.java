package org.calista.flowsight.train.sample;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.flowsight.train.knowledge.kernel.LinuxKernelKnowledge;
import org.calista.flowsight.train.provider.CuratedReasoningProvider;
import org.calista.flowsight.train.synth.SampleSynthesizer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RecordCodec codec = new RecordCodec(mapper);

    private static TrainingRecord reasoned() {
        return TrainingRecord.builder(TaskKind.ASYNC_PATTERN)
                .instruction("识别异步模式")
                .input("INIT_WORK(&w, fn);")
                .reasoning("第一步\n第二步")
                .output("WORKQUEUE")
                .meta(MetadataKeys.ID, "async_001")
                .meta(MetadataKeys.CONCEPTS, List.of("workqueue", "kworker"))
                .build();
    }

    @Test
    void mergedLineHasNoTaskAndKeepsFieldOrder() throws Exception {
        JsonNode n = mapper.readTree(codec.encode(reasoned()));

        Iterator<String> names = n.fieldNames();
        assertThat(names.next()).isEqualTo("instruction");
        assertThat(names.next()).isEqualTo("input");
        assertThat(names.next()).isEqualTo("output");
        assertThat(names.next()).isEqualTo("metadata");
        assertThat(names.hasNext()).isFalse();

        assertThat(n.get("output").asText()).isEqualTo("<thinking>\n第一步\n第二步\n</thinking>\n\nWORKQUEUE");
    }

    @Test
    void partitionLineStartsWithTheTask() throws Exception {
        JsonNode n = mapper.readTree(codec.encodeWithTask(reasoned()));
        assertThat(n.fieldNames().next()).isEqualTo("task");
        assertThat(n.get("task").asText()).isEqualTo("async_pattern");
    }

    @Test
    void decodingSplitsTheReasoningBackOut() throws Exception {
        TrainingRecord original = reasoned();
        TrainingRecord back = codec.decode(codec.encodeWithTask(original));

        assertThat(back).isEqualTo(original);
        assertThat(back.reasoning).isEqualTo("第一步\n第二步");
        assertThat(back.output).isEqualTo("WORKQUEUE");
    }

    @Test
    void everyProducedRecordSurvivesBothLineForms() throws Exception {
        List<TrainingRecord> all = new ArrayList<>(SampleSynthesizer.withDefaults(LinuxKernelKnowledge.schema()).synthesize());
        all.addAll(new CuratedReasoningProvider(mapper, "corpus/reasoning_samples.jsonl", true).provide());
        assertThat(all).hasSizeGreaterThan(100);

        for (TrainingRecord r : all) {
            String merged = codec.encode(r);
            assertThat(merged).doesNotContain("\n");
            assertThat(codec.decode(merged, r.task)).as(merged).isEqualTo(r);
            assertThat(codec.decode(codec.encodeWithTask(r))).as(r.toString()).isEqualTo(r);
        }
    }

    @Test
    void emptyMetadataIsOmitted() throws Exception {
        TrainingRecord r = TrainingRecord.builder(TaskKind.CALL_CHAIN).instruction("i").output("o").build();
        String line = codec.encode(r);

        assertThat(mapper.readTree(line).has("metadata")).isFalse();
        assertThat(mapper.readTree(line).get("input").asText()).isEmpty();
        assertThat(codec.decode(line, TaskKind.CALL_CHAIN)).isEqualTo(r);
    }

    @Test
    void badLinesAreReported() {
        assertThatThrownBy(() -> codec.decode("{not json")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> codec.decode("[1,2]")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode("{\"instruction\":\"i\",\"output\":\"o\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("task");
        assertThatThrownBy(() -> codec.decode("{\"task\":\"nope\",\"instruction\":\"i\",\"output\":\"o\"}"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode("{\"task\":\"call_chain\",\"instruction\":\"i\"}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recordRejectsBlankInstructionOrOutput() {
        assertThatThrownBy(() -> TrainingRecord.builder(TaskKind.CALL_CHAIN).instruction(" ").output("o").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TrainingRecord.builder(TaskKind.CALL_CHAIN).instruction("i").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void taskTagsResolve() {
        for (TaskKind k : TaskKind.values()) {
            assertThat(TaskKind.fromTag(k.tag)).contains(k);
            assertThat(k.fileName()).isEqualTo(k.tag + ".jsonl");
        }
        assertThat(TaskKind.fromTag("unknown")).isEmpty();
    }
}
