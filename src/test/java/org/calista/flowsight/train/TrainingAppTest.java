package org.calista.flowsight.train;

import org.calista.flowsight.train.knowledge.kernel.LinuxKernelKnowledge;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.synth.SampleSynthesizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TrainingAppTest {

    @TempDir
    Path tmp;

    private final StringWriter out = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new TrainingApp());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    private String[] base(String... more) {
        String[] common = {"--output", tmp.resolve("data").toString(), "--config", tmp.resolve("train.json").toString()};
        String[] all = new String[common.length + more.length];
        System.arraycopy(common, 0, all, 0, common.length);
        System.arraycopy(more, 0, all, common.length, more.length);
        return all;
    }

    @Test
    void knowledgeBaseRunWritesMergedFileAndPartitions() throws Exception {
        int code = run(base("--source", "knowledge-base"));

        assertThat(code).isZero();
        Path data = tmp.resolve("data");
        assertThat(data.resolve("train.jsonl")).exists();
        assertThat(data.resolve(TaskKind.CALLBACK_TIMING.fileName())).exists();
        assertThat(data.resolve(TaskKind.COMPOSITE_SCENARIO.fileName())).exists();
        assertThat(tmp.resolve("train.json")).exists();
        assertThat(out.toString()).contains("Training data statistics").contains("callback_timing");
    }

    @Test
    void sourceTreeStageMinesTheGivenTree() throws Exception {
        Path linux = tmp.resolve("linux");
        Path driver = linux.resolve("drivers/demo/demo.c");
        Files.createDirectories(driver.getParent());
        Files.writeString(driver, "static struct demo_ops cfg = { .read = demo_read, .write = __internal_write };\n",
                StandardCharsets.UTF_8);

        int code = run(base("--source", "kernel", "--kernel-path", linux.toString(), "--max-files", "5"));

        assertThat(code).isZero();
        List<String> lines = Files.readAllLines(tmp.resolve("data/train.jsonl"), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).contains("cfg.read").contains("demo_read");
    }

    @Test
    void missingSourceTreeIsNotFatal() {
        int code = run(base("--source", "source-tree"));
        assertThat(code).isZero();
        assertThat(tmp.resolve("data/train.jsonl")).exists();
    }

    @Test
    void mergeAccumulatesAcrossRuns() throws Exception {
        assertThat(run(base("--source", "curated"))).isZero();
        assertThat(run(base("--source", "curated", "--merge"))).isZero();

        List<String> lines = Files.readAllLines(tmp.resolve("data/train.jsonl"), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(22);
    }

    @Test
    void withoutMergeTheOutputIsReplaced() throws Exception {
        assertThat(run(base("--source", "curated"))).isZero();
        assertThat(run(base("--source", "curated"))).isZero();
        assertThat(Files.readAllLines(tmp.resolve("data/train.jsonl"), StandardCharsets.UTF_8)).hasSize(11);
    }

    @Test
    void defaultSourceIsTheKnowledgeBase() throws Exception {
        TrainingApp app = new TrainingApp();
        assertThat(new CommandLine(app).getCommandSpec().findOption("--source").defaultValue())
                .isEqualTo("knowledge-base");

        assertThat(run(base())).isZero();

        int synthesized = SampleSynthesizer.withDefaults(LinuxKernelKnowledge.schema()).synthesize().size();
        List<String> lines = Files.readAllLines(tmp.resolve("data/train.jsonl"), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(synthesized).noneMatch(l -> l.contains("<thinking>"));
    }

    @Test
    void mergeSkipsUndecodablePartitionLines() throws Exception {
        assertThat(run(base("--source", "curated"))).isZero();
        Path chain = tmp.resolve("data").resolve(TaskKind.CALL_CHAIN.fileName());
        Files.write(chain, new byte[]{'{', (byte) 0xC3, (byte) 0x28, '}', '\n'}, StandardOpenOption.APPEND);

        assertThat(run(base("--source", "curated", "--merge"))).isZero();
        assertThat(Files.readAllLines(tmp.resolve("data/train.jsonl"), StandardCharsets.UTF_8)).hasSize(22);
    }

    @Test
    void unwritableOutputIsFatal() throws Exception {
        Path blocker = tmp.resolve("blocker");
        Files.writeString(blocker, "not a directory", StandardCharsets.UTF_8);

        CommandLine cmd = new CommandLine(new TrainingApp());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(new StringWriter()));
        int code = cmd.execute("--output", blocker.resolve("data").toString(),
                "--config", tmp.resolve("train.json").toString());

        assertThat(code).isEqualTo(TrainingApp.EXIT_FATAL);
        assertThat(out.toString()).doesNotContain("Training data statistics");
    }

    @Test
    void unknownSourceIsAUsageError() {
        int code = run(base("--source", "web"));
        assertThat(code).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
