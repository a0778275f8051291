package org.calista.flowsight.train.sample;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * RecordCodec — one TrainingRecord per JSONL line.
 *
 * <p>
 * Wire shape: {@code {"instruction","input","output"[,"metadata"]}}; the per-task
 * partition lines carry a leading {@code "task"} key as well. Empty metadata is omitted.
 * A reasoning block is merged into "output" and split back out when decoding.
 * </p>
 */
public final class RecordCodec {

    public static final String TASK = "task";
    public static final String INSTRUCTION = "instruction";
    public static final String INPUT = "input";
    public static final String OUTPUT = "output";
    public static final String METADATA = "metadata";

    private static final TypeReference<LinkedHashMap<String, Object>> META_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public RecordCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(TrainingRecord record) throws JsonProcessingException {
        return mapper.writeValueAsString(toNode(record, false));
    }

    public String encodeWithTask(TrainingRecord record) throws JsonProcessingException {
        return mapper.writeValueAsString(toNode(record, true));
    }

    /** Decodes a line that names its own task. */
    public TrainingRecord decode(String line) throws IOException {
        return decode(line, null);
    }

    /**
     * Decodes a line; {@code defaultTask} applies when the line carries no "task" key.
     *
     * @throws IOException on malformed JSON
     * @throws IllegalArgumentException when the task is unknown or missing, or a required field is blank
     */
    public TrainingRecord decode(String line, TaskKind defaultTask) throws IOException {
        Objects.requireNonNull(line, "line");
        JsonNode root = mapper.readTree(line);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Record line is not a JSON object");
        }

        TaskKind task = defaultTask;
        JsonNode taskNode = root.get(TASK);
        if (taskNode != null && !taskNode.isNull()) {
            task = TaskKind.fromTag(taskNode.asText())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskNode.asText()));
        }
        if (task == null) throw new IllegalArgumentException("Record has no task");

        TrainingRecord.Builder b = TrainingRecord.builder(task)
                .instruction(text(root, INSTRUCTION))
                .input(text(root, INPUT));
        splitOutput(text(root, OUTPUT), b);

        JsonNode meta = root.get(METADATA);
        if (meta != null && meta.isObject()) {
            Map<String, Object> values = mapper.convertValue(meta, META_TYPE);
            b.metadata(values);
        }
        return b.build();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private ObjectNode toNode(TrainingRecord r, boolean withTask) {
        ObjectNode n = mapper.createObjectNode();
        if (withTask) n.put(TASK, r.task.tag);
        n.put(INSTRUCTION, r.instruction);
        n.put(INPUT, r.input);
        n.put(OUTPUT, r.renderedOutput());
        if (!r.metadata.isEmpty()) n.set(METADATA, mapper.valueToTree(r.metadata));
        return n;
    }

    private static String text(JsonNode root, String field) {
        JsonNode v = root.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private static void splitOutput(String output, TrainingRecord.Builder b) {
        if (output != null && output.startsWith(TrainingRecord.THINKING_OPEN)) {
            int close = output.indexOf(TrainingRecord.THINKING_CLOSE, TrainingRecord.THINKING_OPEN.length());
            if (close >= 0) {
                b.reasoning(output.substring(TrainingRecord.THINKING_OPEN.length(), close));
                b.output(output.substring(close + TrainingRecord.THINKING_CLOSE.length()));
                return;
            }
        }
        b.output(output);
    }
}
