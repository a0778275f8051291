package org.calista.flowsight.train.sample;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.flowsight.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SampleStoreTest {

    @TempDir
    Path tmp;

    private final RecordCodec codec = new RecordCodec(new ObjectMapper());

    private SampleStore store() {
        return new SampleStore(new FileIO(tmp), codec, tmp);
    }

    private static TrainingRecord record(TaskKind task, String instruction, String category) {
        return TrainingRecord.builder(task)
                .instruction(instruction)
                .output("answer to " + instruction)
                .meta(MetadataKeys.CATEGORY, category)
                .build();
    }

    private static List<TrainingRecord> sample() {
        return List.of(
                record(TaskKind.CALL_CHAIN, "q1", "call_chain"),
                record(TaskKind.CALLBACK_TIMING, "q2", null),
                record(TaskKind.CALL_CHAIN, "q3", "diverse_question"),
                record(TaskKind.ASYNC_PATTERN, "q4", "async_flow"));
    }

    @Test
    void countsAreSorted() {
        SampleStore s = store();
        s.add(sample());

        assertThat(s.size()).isEqualTo(4);
        assertThat(s.countsByTask()).containsExactly(
                Map.entry("async_pattern", 1), Map.entry("call_chain", 2), Map.entry("callback_timing", 1));
        assertThat(s.countsBy(MetadataKeys.CATEGORY)).containsExactly(
                Map.entry("async_flow", 1), Map.entry("call_chain", 1), Map.entry("diverse_question", 1));
        assertThat(s.countsBy(MetadataKeys.DIFFICULTY)).isEmpty();
    }

    @Test
    void mergedFileKeepsInsertionOrderAndPartitionsSplitByTask() throws Exception {
        SampleStore s = store();
        s.add(sample());

        Path merged = s.save("train.jsonl");
        List<String> lines = Files.readAllLines(merged, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(4);
        assertThat(lines.get(0)).contains("\"q1\"").doesNotContain("\"task\"");
        assertThat(lines.get(3)).contains("\"q4\"");

        Map<TaskKind, Path> parts = s.saveByTask();
        assertThat(parts).containsOnlyKeys(TaskKind.CALL_CHAIN, TaskKind.CALLBACK_TIMING, TaskKind.ASYNC_PATTERN);
        assertThat(parts.get(TaskKind.CALL_CHAIN)).hasFileName("call_chain.jsonl");
        List<String> chain = Files.readAllLines(parts.get(TaskKind.CALL_CHAIN), StandardCharsets.UTF_8);
        assertThat(chain).hasSize(2).allSatisfy(l -> assertThat(l).startsWith("{\"task\":\"call_chain\""));
        try (Stream<Path> files = Files.list(tmp)) {
            assertThat(files.filter(p -> p.toString().endsWith(".tmp"))).isEmpty();
        }
    }

    @Test
    void partitionsLoadBackAndBadLinesAreSkipped() throws Exception {
        SampleStore first = store();
        first.add(sample());
        first.saveByTask();

        Path chain = tmp.resolve(TaskKind.CALL_CHAIN.fileName());
        Files.writeString(chain, Files.readString(chain, StandardCharsets.UTF_8) + "{broken\n\n", StandardCharsets.UTF_8);

        SampleStore second = store();
        int loaded = second.loadPartitions();

        assertThat(loaded).isEqualTo(4);
        assertThat(second.records()).containsExactlyInAnyOrderElementsOf(first.records());
    }

    @Test
    void undecodablePartitionLineIsSkipped() throws Exception {
        SampleStore first = store();
        first.add(sample());
        first.saveByTask();

        Path chain = tmp.resolve(TaskKind.CALL_CHAIN.fileName());
        Files.write(chain, new byte[]{'{', (byte) 0xC3, (byte) 0x28, '}', '\n'}, StandardOpenOption.APPEND);

        SampleStore second = store();
        assertThat(second.loadPartitions()).isEqualTo(4);
        assertThat(second.countsByTask()).containsEntry(TaskKind.CALL_CHAIN.tag, 2);
    }

    @Test
    void loadingFromAnEmptyDirectoryAddsNothing() throws Exception {
        SampleStore s = store();
        assertThat(s.loadPartitions()).isZero();
        assertThat(s.size()).isZero();
    }

    @Test
    void summaryReportsTotalsAndCategories() {
        SampleStore s = store();
        s.add(sample());
        String summary = s.summary();

        assertThat(summary).contains("Training data statistics").contains("total").contains("call_chain")
                .contains("diverse_question");
        assertThat(summary).doesNotContain("by difficulty");
    }
}
