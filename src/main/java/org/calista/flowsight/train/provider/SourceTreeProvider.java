package org.calista.flowsight.train.provider;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.flowsight.train.mine.Binding;
import org.calista.flowsight.train.mine.SourceTreeMiner;
import org.calista.flowsight.train.mine.StructuralSourceMiner;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Field-target records mined from a source tree. Without a root the stage is skipped. */
public final class SourceTreeProvider implements SampleProvider {
    private static final Logger log = LogManager.getLogger(SourceTreeProvider.class);

    private final SourceTreeMiner treeMiner;
    private final StructuralSourceMiner miner;
    private final Path root;

    /** @param root source tree root; null when none was given */
    public SourceTreeProvider(SourceTreeMiner treeMiner, StructuralSourceMiner miner, Path root) {
        this.treeMiner = Objects.requireNonNull(treeMiner, "treeMiner");
        this.miner = Objects.requireNonNull(miner, "miner");
        this.root = root;
    }

    @Override
    public String name() {
        return Source.SOURCE_TREE.value;
    }

    @Override
    public List<TrainingRecord> provide() throws IOException {
        if (root == null) {
            log.warn("No source tree path given (--source-tree); skipping source mining");
            return List.of();
        }
        SourceTreeMiner.Report report = treeMiner.scan(root);
        List<TrainingRecord> out = new ArrayList<>(report.bindings.size());
        for (Binding b : report.bindings) out.add(miner.toRecord(b));
        return out;
    }
}
