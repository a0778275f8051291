package org.calista.flowsight.train.sample;

import java.util.Locale;
import java.util.Optional;

/**
 * Task/category of a training record. The tag is the serialized "task" value and the
 * stem of the per-task partition file.
 */
public enum TaskKind {
    CALLBACK_TIMING("callback_timing"),
    FUNCTION_POINTER_TARGET("function_pointer_target"),
    ASYNC_PATTERN("async_pattern"),
    CALL_CHAIN("call_chain"),
    SYNC_MECHANISM("sync_mechanism"),
    COMPOSITE_SCENARIO("composite_scenario");

    public final String tag;

    TaskKind(String tag) {
        this.tag = tag;
    }

    public String fileName() {
        return tag + ".jsonl";
    }

    public static Optional<TaskKind> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (TaskKind k : values()) {
            if (k.tag.equals(t)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
