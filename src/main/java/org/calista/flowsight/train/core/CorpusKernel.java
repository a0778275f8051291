package org.calista.flowsight.train.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.flowsight.io.FileIO;
import org.calista.flowsight.train.knowledge.FactSchema;
import org.calista.flowsight.train.knowledge.kernel.LinuxKernelKnowledge;
import org.calista.flowsight.train.mine.SourceTreeMiner;
import org.calista.flowsight.train.mine.StructuralSourceMiner;
import org.calista.flowsight.train.provider.AssistedSampleProvider;
import org.calista.flowsight.train.provider.CuratedReasoningProvider;
import org.calista.flowsight.train.provider.KnowledgeBaseProvider;
import org.calista.flowsight.train.provider.SampleProvider;
import org.calista.flowsight.train.provider.Source;
import org.calista.flowsight.train.provider.SourceTreeProvider;
import org.calista.flowsight.train.provider.TextGenerationBackend;
import org.calista.flowsight.train.sample.RecordCodec;
import org.calista.flowsight.train.sample.SampleStore;
import org.calista.flowsight.train.synth.SampleSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CorpusKernel — instance-owned runtime container of one corpus build.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config, apply overrides, wire schema/synthesizer/miners/store
 *   2) providers(source, tree) -> the stages selected for this run
 *   3) pipeline().run(...) -> fill the store; the caller saves it
 *
 * No static singletons: everything hangs off the instance.
 */
public final class CorpusKernel {

    private static final Logger log = LoggerFactory.getLogger(CorpusKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final TrainingConfig cfg;

    private final FactSchema schema;
    private final SampleSynthesizer synthesizer;
    private final StructuralSourceMiner miner;
    private final SourceTreeMiner treeMiner;
    private final RecordCodec codec;
    private final SampleStore store;

    private final TextGenerationBackend backend;

    private CorpusKernel(FileIO io,
                         ObjectMapper mapper,
                         TrainingConfig cfg,
                         FactSchema schema,
                         SampleSynthesizer synthesizer,
                         StructuralSourceMiner miner,
                         SourceTreeMiner treeMiner,
                         RecordCodec codec,
                         SampleStore store,
                         TextGenerationBackend backend) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.miner = Objects.requireNonNull(miner, "miner");
        this.treeMiner = Objects.requireNonNull(treeMiner, "treeMiner");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.store = Objects.requireNonNull(store, "store");
        this.backend = backend; // nullable: assisted stage then yields nothing
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        /** Relative config paths resolve against this directory. */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private FactSchema schema;
        private TextGenerationBackend backend;

        // CLI overrides; null = keep config value
        private Path outputDir;
        private Integer maxFiles;

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder schema(FactSchema schema) {
            this.schema = Objects.requireNonNull(schema, "schema");
            return this;
        }

        public Builder backend(TextGenerationBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder maxFiles(Integer maxFiles) {
            this.maxFiles = maxFiles;
            return this;
        }

        /**
         * Loads or creates the config, applies overrides and wires the components.
         * Runs nothing.
         *
         * @throws org.calista.flowsight.train.synth.SchemaConsistencyException when a fact kind has no generator
         */
        public CorpusKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // config lives outside the output dir
            FileIO external = openIO(configRoot, FileIO.Options.builder().build());
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            TrainingConfig cfg = TrainingConfig.loadOrCreate(external, cfgPath, om);
            if (outputDir != null) cfg.export.dir = outputDir.toString();
            if (maxFiles != null) cfg.mining.maxFiles = maxFiles;
            cfg.validate();

            FileIO io = openIO(Path.of(cfg.export.dir), cfg.ioOptions());

            FactSchema fs = (this.schema != null) ? this.schema : LinuxKernelKnowledge.schema();
            SampleSynthesizer synth = SampleSynthesizer.withDefaults(fs);

            StructuralSourceMiner miner = new StructuralSourceMiner(cfg.minerConfig());
            SourceTreeMiner treeMiner = new SourceTreeMiner(io, miner, cfg.treeConfig());

            RecordCodec codec = new RecordCodec(om);
            SampleStore store = new SampleStore(io, codec, io.baseDir());

            CorpusKernel k = new CorpusKernel(io, om, cfg, fs, synth, miner, treeMiner, codec, store, backend);
            k.logCreated(cfgPath);
            return k;
        }

        /** FileIO creates its base dir eagerly; a failure surfaces here as the checked IOException. */
        private static FileIO openIO(Path dir, FileIO.Options options) throws IOException {
            try {
                return new FileIO(dir, options);
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("CorpusKernel created: config={}, outputDir={}, facts={}, maxFiles={}, assistedBackend={}",
                cfgPath, io.baseDir(), schema.size(), cfg.mining.maxFiles, backend != null);
    }

    // ---------------------------------------------------------------------
    // Stages
    // ---------------------------------------------------------------------

    /**
     * Providers selected by {@code source}, in stage order:
     * knowledge-base, source-tree, assisted, curated.
     *
     * @param sourceTree root of the source tree; null makes the source-tree stage warn and yield nothing
     */
    public List<SampleProvider> providers(Source source, Path sourceTree) {
        Objects.requireNonNull(source, "source");
        List<SampleProvider> out = new ArrayList<>(4);
        if (source.includes(Source.KNOWLEDGE_BASE)) out.add(new KnowledgeBaseProvider(synthesizer));
        if (source.includes(Source.SOURCE_TREE)) out.add(new SourceTreeProvider(treeMiner, miner, sourceTree));
        if (source.includes(Source.ASSISTED)) {
            out.add(new AssistedSampleProvider(backend, mapper, cfg.assisted.samplesPerPrompt));
        }
        if (source.includes(Source.CURATED)) {
            out.add(new CuratedReasoningProvider(mapper, cfg.curated.resource, cfg.curated.failFast));
        }
        return out;
    }

    public CorpusPipeline pipeline() {
        return new CorpusPipeline(store);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }

    public ObjectMapper mapper() { return mapper; }

    public TrainingConfig config() { return cfg; }

    public FactSchema schema() { return schema; }

    public SampleSynthesizer synthesizer() { return synthesizer; }

    public StructuralSourceMiner miner() { return miner; }

    public SourceTreeMiner treeMiner() { return treeMiner; }

    public RecordCodec codec() { return codec; }

    public SampleStore store() { return store; }
}
