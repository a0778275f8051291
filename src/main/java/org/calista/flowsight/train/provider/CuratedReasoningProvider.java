package org.calista.flowsight.train.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.flowsight.train.sample.MetadataKeys;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CuratedReasoningProvider — hand-written multi-step reasoning samples shipped as a
 * JSONL classpath resource.
 *
 * <p>
 * Each line becomes one record whose output carries the reasoning block ahead of the
 * answer. Broken lines are skipped with a warning, or abort the stage when failFast is set.
 * </p>
 */
public final class CuratedReasoningProvider implements SampleProvider {
    private static final Logger log = LogManager.getLogger(CuratedReasoningProvider.class);

    /** One line of the corpus. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CuratedSample {
        public String id;
        public String category;
        public String difficulty = "medium";
        public String code = "";
        public String question;
        public String thinking;
        public String answer;
        public String source = "";
        public List<String> concepts = List.of();

        public void validate() {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("CuratedSample.id is required");
            if (question == null || question.isBlank()) throw new IllegalArgumentException("CuratedSample.question is required: " + id);
            if (answer == null || answer.isBlank()) throw new IllegalArgumentException("CuratedSample.answer is required: " + id);
            if (category == null || category.isBlank()) category = "diverse_question";
            if (code == null) code = "";
            if (source == null) source = "";
            if (concepts == null) concepts = List.of();
        }
    }

    private final ObjectMapper mapper;
    private final String resource;
    private final boolean failFast;

    public CuratedReasoningProvider(ObjectMapper mapper, String resource, boolean failFast) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.failFast = failFast;
    }

    @Override
    public String name() {
        return Source.CURATED.value;
    }

    @Override
    public List<TrainingRecord> provide() throws IOException {
        InputStream in = CuratedReasoningProvider.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.warn("Curated corpus not found on classpath: {}", resource);
            return List.of();
        }

        List<TrainingRecord> out = new ArrayList<>();
        int bad = 0;
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                try {
                    CuratedSample s = mapper.readValue(line, CuratedSample.class);
                    s.validate();
                    out.add(toRecord(s));
                } catch (IOException | IllegalArgumentException e) {
                    bad++;
                    log.warn("Bad curated line in {}: {}", resource, e.toString());
                    if (failFast) throw new IOException("Bad curated line in " + resource + ": " + e, e);
                }
            }
        }

        log.info("Curated corpus loaded: {} (ok={}, bad={})", resource, out.size(), bad);
        return out;
    }

    static TrainingRecord toRecord(CuratedSample s) {
        return TrainingRecord.builder(taskFor(s.category))
                .instruction(s.question)
                .input(s.code)
                .reasoning(s.thinking)
                .output(s.answer)
                .meta(MetadataKeys.ID, s.id)
                .meta(MetadataKeys.CATEGORY, s.category)
                .meta(MetadataKeys.DIFFICULTY, s.difficulty)
                .meta(MetadataKeys.SOURCE, s.source)
                .meta(MetadataKeys.CONCEPTS, List.copyOf(s.concepts))
                .build();
    }

    static TaskKind taskFor(String category) {
        if (category == null) return TaskKind.CALL_CHAIN;
        return switch (category) {
            case "pointer_analysis" -> TaskKind.FUNCTION_POINTER_TARGET;
            case "async_flow", "pattern_recognition" -> TaskKind.ASYNC_PATTERN;
            default -> TaskKind.CALL_CHAIN;
        };
    }
}
