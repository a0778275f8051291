package org.calista.flowsight.train.sample;

import java.util.*;

/**
 * TrainingRecord — one instruction/input/output sample.
 *
 * <p>
 * Immutable once built. Instruction and output must be non-blank; input may be empty.
 * An optional reasoning text is kept apart from the answer and only merged into the
 * serialized output by {@link #renderedOutput()}.
 * Metadata keeps insertion order (see {@link MetadataKeys}).
 * </p>
 */
public final class TrainingRecord {

    static final String THINKING_OPEN = "<thinking>\n";
    static final String THINKING_CLOSE = "\n</thinking>\n\n";

    public final TaskKind task;
    public final String instruction;
    public final String input;
    /** The answer, without reasoning. */
    public final String output;
    /** May be null. */
    public final String reasoning;
    public final Map<String, Object> metadata;

    private TrainingRecord(Builder b) {
        this.task = Objects.requireNonNull(b.task, "task");
        if (b.instruction == null || b.instruction.isBlank()) {
            throw new IllegalArgumentException("TrainingRecord.instruction is required");
        }
        if (b.output == null || b.output.isBlank()) {
            throw new IllegalArgumentException("TrainingRecord.output is required");
        }
        this.instruction = b.instruction;
        this.input = b.input == null ? "" : b.input;
        this.output = b.output;
        this.reasoning = (b.reasoning == null || b.reasoning.isBlank()) ? null : b.reasoning;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder(TaskKind task) {
        return new Builder(task);
    }

    /** Output as written to disk: the answer, preceded by the reasoning block when present. */
    public String renderedOutput() {
        if (reasoning == null) return output;
        return THINKING_OPEN + reasoning + THINKING_CLOSE + output;
    }

    public Optional<Object> meta(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrainingRecord)) return false;
        TrainingRecord r = (TrainingRecord) o;
        return task == r.task
                && instruction.equals(r.instruction)
                && input.equals(r.input)
                && output.equals(r.output)
                && Objects.equals(reasoning, r.reasoning)
                && metadata.equals(r.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(task, instruction, input, output, reasoning, metadata);
    }

    @Override
    public String toString() {
        return "TrainingRecord{" + task.tag + ", instruction=" + instruction + ", meta=" + metadata + '}';
    }

    public static final class Builder {
        private final TaskKind task;
        private String instruction;
        private String input;
        private String output;
        private String reasoning;
        private final LinkedHashMap<String, Object> metadata = new LinkedHashMap<>();

        private Builder(TaskKind task) {
            this.task = task;
        }

        public Builder instruction(String v) {
            this.instruction = v;
            return this;
        }

        public Builder input(String v) {
            this.input = v;
            return this;
        }

        public Builder output(String v) {
            this.output = v;
            return this;
        }

        public Builder reasoning(String v) {
            this.reasoning = v;
            return this;
        }

        /** Null values are skipped. */
        public Builder meta(String key, Object value) {
            Objects.requireNonNull(key, "key");
            if (value != null) metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, ?> values) {
            if (values == null) return this;
            for (Map.Entry<String, ?> e : values.entrySet()) meta(e.getKey(), e.getValue());
            return this;
        }

        public TrainingRecord build() {
            return new TrainingRecord(this);
        }
    }
}
