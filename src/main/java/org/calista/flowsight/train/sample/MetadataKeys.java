package org.calista.flowsight.train.sample;

/**
 * MetadataKeys — canonical keys for TrainingRecord.metadata.
 *
 * Rules:
 * - Keys are stable; downstream filters select on them.
 * - Values are strings, except {@link #CONCEPTS} (list of strings).
 */
public final class MetadataKeys {
    private MetadataKeys() {}

    // ---- synthesized from the schema ----
    public static final String FRAMEWORK = "framework";
    public static final String CALLBACK = "callback";
    public static final String PATTERN = "pattern";
    public static final String OPERATION = "operation";
    public static final String FLOW = "flow";
    public static final String MECHANISM = "mechanism";
    public static final String SCENARIO = "scenario";

    // ---- mined from source ----
    public static final String FILE = "file";
    public static final String STRUCT = "struct";

    // ---- curated corpus ----
    public static final String ID = "id";
    public static final String CATEGORY = "category";
    public static final String DIFFICULTY = "difficulty";
    public static final String SOURCE = "source";
    public static final String CONCEPTS = "concepts";
}
