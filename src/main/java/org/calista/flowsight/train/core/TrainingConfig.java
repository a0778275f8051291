package org.calista.flowsight.train.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.flowsight.io.FileIO;
import org.calista.flowsight.train.mine.SourceTreeMiner;
import org.calista.flowsight.train.mine.StructuralSourceMiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TrainingConfig — plain POJO config:
 * - defaults in fields
 * - loadOrCreate() writes the defaults when the file is missing or blank
 * - validate() normalizes values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TrainingConfig {

    private static final Logger log = LoggerFactory.getLogger(TrainingConfig.class);

    public Export export = new Export();
    public Mining mining = new Mining();
    public Curated curated = new Curated();
    public Assisted assisted = new Assisted();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Export {
        public String dir = "data";
        public String mergedFile = "train.jsonl";
        public boolean partitionByTask = true;
        public boolean atomicWrites = true;
        public boolean fsyncOnCommit = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Mining {
        /** Scanned below the source-tree root; blank = the root itself. */
        public String subdir = "drivers";
        public int maxFiles = 100;
        public List<String> extensions = List.of(".c");
        public List<String> structSuffixes = List.of("_operations", "_operation", "_ops");
        public List<String> excludedPrefixes = List.of("__");
        public List<String> excludedTargets = List.of("NULL");
        /** 0 or 1 = sequential. */
        public int parallelism = 0;
        public String threadNamePrefix = "miner-";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Curated {
        public String resource = "corpus/reasoning_samples.jsonl";
        public boolean failFast = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Assisted {
        /** Backend calls per prompt family. */
        public int samplesPerPrompt = 10;
    }

    // -------------------- Load / Create --------------------

    public static TrainingConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            TrainingConfig created = new TrainingConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            TrainingConfig created = new TrainingConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        TrainingConfig cfg = mapper.readValue(json, TrainingConfig.class);
        if (cfg == null) cfg = new TrainingConfig();

        cfg.validate();
        return cfg;
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, TrainingConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (export == null) export = new Export();
        if (export.dir == null || export.dir.isBlank()) export.dir = "data";
        if (export.mergedFile == null || export.mergedFile.isBlank()) export.mergedFile = "train.jsonl";

        if (mining == null) mining = new Mining();
        if (mining.subdir == null) mining.subdir = "";
        mining.subdir = mining.subdir.trim();
        if (mining.maxFiles < 1) mining.maxFiles = 1;
        mining.extensions = clean(mining.extensions, List.of(".c"));
        mining.structSuffixes = clean(mining.structSuffixes, List.of("_operations", "_operation", "_ops"));
        mining.excludedPrefixes = clean(mining.excludedPrefixes, List.of());
        mining.excludedTargets = clean(mining.excludedTargets, List.of());
        if (mining.parallelism < 0) mining.parallelism = 0;
        if (mining.threadNamePrefix == null || mining.threadNamePrefix.isBlank()) mining.threadNamePrefix = "miner-";

        if (curated == null) curated = new Curated();
        if (curated.resource == null || curated.resource.isBlank()) curated.resource = "corpus/reasoning_samples.jsonl";

        if (assisted == null) assisted = new Assisted();
        if (assisted.samplesPerPrompt < 0) assisted.samplesPerPrompt = 0;
    }

    // -------------------- Views --------------------

    public StructuralSourceMiner.Config minerConfig() {
        StructuralSourceMiner.Config c = new StructuralSourceMiner.Config();
        c.structSuffixes = mining.structSuffixes;
        c.excludedPrefixes = mining.excludedPrefixes;
        c.excludedTargets = mining.excludedTargets;
        return c;
    }

    public SourceTreeMiner.Config treeConfig() {
        SourceTreeMiner.Config c = new SourceTreeMiner.Config();
        c.subdir = mining.subdir;
        c.maxFiles = mining.maxFiles;
        c.extensions = mining.extensions;
        c.parallelism = mining.parallelism;
        c.threadNamePrefix = mining.threadNamePrefix;
        return c;
    }

    public FileIO.Options ioOptions() {
        return FileIO.Options.builder()
                .atomicWrites(export.atomicWrites)
                .fsyncOnCommit(export.fsyncOnCommit)
                .build();
    }

    /** Trimmed, blank entries dropped; {@code fallback} when null. */
    private static List<String> clean(List<String> values, List<String> fallback) {
        if (values == null) return fallback;
        List<String> out = new ArrayList<>(values.size());
        for (String v : values) {
            if (v == null || v.isBlank()) continue;
            out.add(v.trim());
        }
        return List.copyOf(out);
    }
}
