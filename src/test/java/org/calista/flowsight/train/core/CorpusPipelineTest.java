package org.calista.flowsight.train.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.flowsight.io.FileIO;
import org.calista.flowsight.train.knowledge.FactKind;
import org.calista.flowsight.train.provider.SampleProvider;
import org.calista.flowsight.train.sample.RecordCodec;
import org.calista.flowsight.train.sample.SampleStore;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;
import org.calista.flowsight.train.synth.SchemaConsistencyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusPipelineTest {

    @TempDir
    Path tmp;

    private interface Body {
        List<TrainingRecord> get() throws IOException;
    }

    private static SampleProvider stage(String name, Body body) {
        return new SampleProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<TrainingRecord> provide() throws IOException {
                return body.get();
            }
        };
    }

    private static List<TrainingRecord> records(int n) {
        TrainingRecord[] out = new TrainingRecord[n];
        for (int i = 0; i < n; i++) {
            out[i] = TrainingRecord.builder(TaskKind.CALL_CHAIN).instruction("q" + i).output("a" + i).build();
        }
        return List.of(out);
    }

    private SampleStore store() {
        return new SampleStore(new FileIO(tmp), new RecordCodec(new ObjectMapper()), tmp);
    }

    @Test
    void failingStageDoesNotStopTheOthers() {
        SampleStore store = store();
        CorpusPipeline.Report report = new CorpusPipeline(store).run(List.of(
                stage("one", () -> records(2)),
                stage("io", () -> { throw new IOException("disk gone"); }),
                stage("boom", () -> { throw new IllegalStateException("bad"); }),
                stage("two", () -> records(3))));

        assertThat(store.size()).isEqualTo(5);
        assertThat(report.added).containsExactly(
                Map.entry("one", 2), Map.entry("two", 3));
        assertThat(report.failed).containsExactly("io", "boom");
        assertThat(report.total()).isEqualTo(5);
    }

    @Test
    void consistencyErrorAbortsTheRun() {
        SampleStore store = store();
        CorpusPipeline pipeline = new CorpusPipeline(store);

        assertThatThrownBy(() -> pipeline.run(List.of(
                stage("kb", () -> { throw new SchemaConsistencyException(FactKind.COMPOSITE); }),
                stage("later", () -> records(1)))))
                .isInstanceOf(SchemaConsistencyException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void emptyStagesAreReportedWithZero() {
        CorpusPipeline.Report report = new CorpusPipeline(store()).run(List.of(stage("none", List::of)));
        assertThat(report.added).containsEntry("none", 0);
        assertThat(report.failed).isEmpty();
    }
}
