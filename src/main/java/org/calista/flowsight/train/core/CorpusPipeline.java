package org.calista.flowsight.train.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.flowsight.train.provider.SampleProvider;
import org.calista.flowsight.train.sample.SampleStore;
import org.calista.flowsight.train.sample.TrainingRecord;
import org.calista.flowsight.train.synth.SchemaConsistencyException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs providers in order and feeds their records into the store.
 *
 * <p>
 * A stage that fails with an I/O or runtime error is logged and skipped; later stages
 * still run. {@link SchemaConsistencyException} is not a stage failure and propagates.
 * </p>
 */
public final class CorpusPipeline {
    private static final Logger log = LogManager.getLogger(CorpusPipeline.class);

    /** Per-stage outcome of one run. */
    public static final class Report {
        /** Records added per stage name, run order. Failed stages are absent. */
        public final Map<String, Integer> added;
        public final List<String> failed;

        Report(Map<String, Integer> added, List<String> failed) {
            this.added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
            this.failed = List.copyOf(failed);
        }

        public int total() {
            int n = 0;
            for (int v : added.values()) n += v;
            return n;
        }
    }

    private final SampleStore store;

    public CorpusPipeline(SampleStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public Report run(List<? extends SampleProvider> providers) {
        Objects.requireNonNull(providers, "providers");

        Map<String, Integer> added = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();

        for (SampleProvider p : providers) {
            String stage = p.name();
            log.info("Stage {}: start", stage);

            List<TrainingRecord> batch;
            try {
                batch = p.provide();
            } catch (SchemaConsistencyException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                failed.add(stage);
                log.warn("Stage {} failed, skipping: {}", stage, e.toString());
                continue;
            }

            store.add(batch);
            added.put(stage, batch.size());
            log.info("Stage {}: {} samples", stage, batch.size());
        }

        if (!failed.isEmpty()) log.warn("Finished with failed stages: {}", failed);
        return new Report(added, failed);
    }
}
