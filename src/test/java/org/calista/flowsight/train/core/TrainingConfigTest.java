package org.calista.flowsight.train.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.flowsight.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TrainingConfigTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        Path file = tmp.resolve("config/train.json");
        TrainingConfig cfg = TrainingConfig.loadOrCreate(new FileIO(tmp), file, mapper);

        assertThat(file).exists();
        assertThat(cfg.export.dir).isEqualTo("data");
        assertThat(cfg.export.mergedFile).isEqualTo("train.jsonl");
        assertThat(cfg.export.partitionByTask).isTrue();
        assertThat(cfg.mining.subdir).isEqualTo("drivers");
        assertThat(cfg.mining.maxFiles).isEqualTo(100);
        assertThat(cfg.mining.structSuffixes).containsExactly("_operations", "_operation", "_ops");
        assertThat(cfg.mining.excludedPrefixes).containsExactly("__");
        assertThat(cfg.mining.excludedTargets).containsExactly("NULL");
        assertThat(cfg.curated.resource).isEqualTo("corpus/reasoning_samples.jsonl");

        TrainingConfig reread = mapper.readValue(Files.readString(file, StandardCharsets.UTF_8), TrainingConfig.class);
        assertThat(reread.mining.maxFiles).isEqualTo(100);
    }

    @Test
    void blankFileIsRecreated() throws Exception {
        Path file = tmp.resolve("train.json");
        Files.writeString(file, "   \n");
        TrainingConfig.loadOrCreate(new FileIO(tmp), file, mapper);
        assertThat(Files.readString(file)).contains("\"mining\"");
    }

    @Test
    void partialFileKeepsDefaultsAndIgnoresUnknownKeys() throws Exception {
        Path file = tmp.resolve("train.json");
        Files.writeString(file, "{\"mining\":{\"maxFiles\":7,\"someday\":true},\"extra\":1}");
        TrainingConfig cfg = TrainingConfig.loadOrCreate(new FileIO(tmp), file, mapper);

        assertThat(cfg.mining.maxFiles).isEqualTo(7);
        assertThat(cfg.mining.extensions).containsExactly(".c");
        assertThat(cfg.export.dir).isEqualTo("data");
    }

    @Test
    void validateNormalizes() {
        TrainingConfig cfg = new TrainingConfig();
        cfg.export = null;
        cfg.mining.maxFiles = -3;
        cfg.mining.parallelism = -1;
        cfg.mining.subdir = null;
        cfg.mining.extensions = Arrays.asList(" .c ", "", null);
        cfg.mining.structSuffixes = null;
        cfg.curated.resource = " ";
        cfg.assisted.samplesPerPrompt = -5;

        cfg.validate();

        assertThat(cfg.export.dir).isEqualTo("data");
        assertThat(cfg.mining.maxFiles).isEqualTo(1);
        assertThat(cfg.mining.parallelism).isZero();
        assertThat(cfg.mining.subdir).isEmpty();
        assertThat(cfg.mining.extensions).containsExactly(".c");
        assertThat(cfg.mining.structSuffixes).containsExactly("_operations", "_operation", "_ops");
        assertThat(cfg.curated.resource).isEqualTo("corpus/reasoning_samples.jsonl");
        assertThat(cfg.assisted.samplesPerPrompt).isZero();
    }

    @Test
    void viewsCarryTheMiningSettings() {
        TrainingConfig cfg = new TrainingConfig();
        cfg.mining.maxFiles = 5;
        cfg.mining.excludedPrefixes = List.of("__", "_x");
        cfg.mining.excludedTargets = List.of("NULL", "ERR_PTR");

        assertThat(cfg.treeConfig().maxFiles).isEqualTo(5);
        assertThat(cfg.treeConfig().subdir).isEqualTo("drivers");
        assertThat(cfg.minerConfig().excludedPrefixes).containsExactly("__", "_x");
        assertThat(cfg.minerConfig().excludedTargets).containsExactly("NULL", "ERR_PTR");
        assertThat(cfg.ioOptions().atomicWrites).isTrue();
    }
}
