package org.calista.flowsight.train.provider;

import org.calista.flowsight.train.sample.TrainingRecord;

import java.io.IOException;
import java.util.List;

/**
 * One stage of corpus building: a self-contained stream of records.
 * Stages do not see each other's output; the pipeline merges them into the store.
 */
public interface SampleProvider {

    /** Stage name used in logs and summaries. */
    String name();

    List<TrainingRecord> provide() throws IOException;
}
