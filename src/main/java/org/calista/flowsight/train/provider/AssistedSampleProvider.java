package org.calista.flowsight.train.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.flowsight.train.sample.MetadataKeys;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AssistedSampleProvider — records drafted by an external text-generation backend.
 *
 * <p>
 * Each prompt asks for one JSON object {@code {"code","question","answer"[,"pattern"]}}.
 * Replies that do not parse or miss a field are logged and dropped.
 * No backend configured: the stage logs a warning and yields nothing.
 * </p>
 */
public final class AssistedSampleProvider implements SampleProvider {
    private static final Logger log = LogManager.getLogger(AssistedSampleProvider.class);

    /** One prompt family and the task its replies are filed under. */
    public enum Prompt {
        FUNCTION_POINTER(TaskKind.FUNCTION_POINTER_TARGET, """
                生成一个 C 语言代码片段，包含函数指针的使用，以及对应的分析问答。

                要求：
                1. 代码要真实、有意义
                2. 包含函数指针的定义、赋值、调用
                3. 答案要详细解释函数指针指向谁

                输出 JSON 格式：
                {
                  "code": "...",
                  "question": "...",
                  "answer": "..."
                }"""),
        ASYNC_PATTERN(TaskKind.ASYNC_PATTERN, """
                生成一个 Linux 内核异步编程的代码片段，以及对应的分析问答。

                异步模式可以是：workqueue, timer, tasklet, completion, waitqueue

                要求：
                1. 代码要符合内核编程规范
                2. 展示完整的绑定和触发过程
                3. 答案要解释执行流程和时间线

                输出 JSON 格式：
                {
                  "code": "...",
                  "pattern": "workqueue|timer|tasklet|...",
                  "question": "...",
                  "answer": "..."
                }""");

        public final TaskKind task;
        public final String text;

        Prompt(TaskKind task, String text) {
            this.task = task;
            this.text = text;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Reply {
        public String code;
        public String pattern;
        public String question;
        public String answer;
    }

    private final TextGenerationBackend backend;
    private final ObjectMapper mapper;
    private final int perPrompt;

    /** @param backend may be null: the stage then does nothing */
    public AssistedSampleProvider(TextGenerationBackend backend, ObjectMapper mapper, int perPrompt) {
        this.backend = backend;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.perPrompt = Math.max(0, perPrompt);
    }

    @Override
    public String name() {
        return Source.ASSISTED.value;
    }

    @Override
    public List<TrainingRecord> provide() throws IOException {
        if (backend == null) {
            log.warn("Assisted generation needs a text-generation backend; none configured, skipping");
            return List.of();
        }

        List<TrainingRecord> out = new ArrayList<>();
        int dropped = 0;
        for (Prompt p : Prompt.values()) {
            for (int i = 0; i < perPrompt; i++) {
                String reply = backend.complete(p.text);
                try {
                    out.add(toRecord(p, reply));
                } catch (IOException | IllegalArgumentException e) {
                    dropped++;
                    log.warn("Dropping {} reply #{}: {}", p, i + 1, e.toString());
                }
            }
        }
        log.info("Assisted generation: {} samples ({} dropped)", out.size(), dropped);
        return out;
    }

    private TrainingRecord toRecord(Prompt prompt, String reply) throws IOException {
        if (reply == null || reply.isBlank()) throw new IllegalArgumentException("empty reply");
        Reply r = mapper.readValue(reply.trim(), Reply.class);
        return TrainingRecord.builder(prompt.task)
                .instruction(r.question)
                .input(r.code)
                .output(r.answer)
                .meta(MetadataKeys.PATTERN, r.pattern == null || r.pattern.isBlank() ? null : r.pattern)
                .meta(MetadataKeys.SOURCE, Source.ASSISTED.value)
                .build();
    }
}
