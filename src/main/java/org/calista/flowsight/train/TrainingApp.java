package org.calista.flowsight.train;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.flowsight.train.core.CorpusKernel;
import org.calista.flowsight.train.core.CorpusPipeline;
import org.calista.flowsight.train.core.TrainingConfig;
import org.calista.flowsight.train.provider.Source;
import org.calista.flowsight.train.provider.TextGenerationBackend;
import org.calista.flowsight.train.sample.SampleStore;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.synth.SchemaConsistencyException;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Builds the training corpus: runs the selected stages, writes the merged file and the
 * per-task partitions, prints a summary.
 */
@CommandLine.Command(name = "flowsight-train",
        mixinStandardHelpOptions = true,
        version = "flowsight-train 1.0.0",
        header = "Generate kernel callback/async training data",
        description = "Synthesizes records from the kernel knowledge base, mines ops-table bindings "
                + "from a source tree and loads the curated reasoning corpus.",
        exitCodeListHeading = "Exit Codes:%n",
        exitCodeList = {
                "0: corpus written (stages may have been skipped with warnings)",
                "2: bad arguments, knowledge base out of sync with the generators, or output not writable"
        })
public class TrainingApp implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(TrainingApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"--source"},
            description = "Stages to run: knowledge-base, source-tree, assisted, curated, all (default: ${DEFAULT-VALUE})",
            defaultValue = "knowledge-base",
            converter = SourceConverter.class)
    private Source source;

    @CommandLine.Option(names = {"--source-tree", "--kernel-path"},
            description = "Root of a kernel source tree for the source-tree stage")
    private Path sourceTree;

    @CommandLine.Option(names = {"--output"},
            description = "Output directory (overrides export.dir)")
    private Path output;

    @CommandLine.Option(names = {"--merge"},
            description = "Fold records already present in the output partitions into this run")
    private boolean merge;

    @CommandLine.Option(names = {"--config"},
            description = "Config file, created with defaults when missing (default: ${DEFAULT-VALUE})",
            defaultValue = "config/train.json")
    private Path config;

    @CommandLine.Option(names = {"--max-files"},
            description = "Maximum number of source files to mine (overrides mining.maxFiles)")
    private Integer maxFiles;

    private final TextGenerationBackend backend;

    public TrainingApp() {
        this(null);
    }

    /** @param backend text generation backend of the assisted stage; null disables it */
    public TrainingApp(TextGenerationBackend backend) {
        this.backend = backend;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TrainingApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CorpusKernel kernel;
        try {
            kernel = CorpusKernel.builder()
                    .outputDir(output)
                    .maxFiles(maxFiles)
                    .backend(backend)
                    .build(config);
        } catch (SchemaConsistencyException e) {
            logger.error("Knowledge base and generators are out of sync: {}", e.getMessage());
            return EXIT_FATAL;
        } catch (IOException e) {
            logger.error("Cannot set up config {} or output {}: {}", config, output, e.toString());
            return EXIT_FATAL;
        }

        SampleStore store = kernel.store();
        TrainingConfig.Export export = kernel.config().export;

        try {
            if (merge) store.loadPartitions();

            CorpusPipeline.Report report = kernel.pipeline().run(kernel.providers(source, sourceTree));
            logger.info("Run finished: {} new samples, stages={}, failed={}",
                    report.total(), report.added, report.failed);

            Path merged = store.save(export.mergedFile);
            logger.info("Merged corpus: {}", merged);
            if (export.partitionByTask) {
                Map<TaskKind, Path> parts = store.saveByTask();
                logger.info("Wrote {} task partitions", parts.size());
            }
        } catch (SchemaConsistencyException e) {
            logger.error("Knowledge base and generators are out of sync: {}", e.getMessage());
            return EXIT_FATAL;
        } catch (IOException e) {
            logger.error("Cannot write corpus to {}: {}", store.outputDir(), e.toString());
            return EXIT_FATAL;
        }

        spec.commandLine().getOut().println(store.summary());
        spec.commandLine().getOut().flush();
        return EXIT_OK;
    }

    /** Maps the --source value, aliases included. */
    static final class SourceConverter implements CommandLine.ITypeConverter<Source> {
        @Override
        public Source convert(String value) {
            try {
                return Source.fromValue(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
