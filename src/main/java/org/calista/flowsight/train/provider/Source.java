package org.calista.flowsight.train.provider;

import java.util.List;
import java.util.Locale;

/** Which stages a run executes. Accepts the legacy aliases on the command line. */
public enum Source {
    KNOWLEDGE_BASE("knowledge-base", "knowledge"),
    SOURCE_TREE("source-tree", "kernel"),
    ASSISTED("assisted", "llm"),
    CURATED("curated"),
    ALL("all");

    public final String value;
    private final List<String> aliases;

    Source(String value, String... aliases) {
        this.value = value;
        this.aliases = List.of(aliases);
    }

    /** True when a run selected with this value executes {@code stage}. */
    public boolean includes(Source stage) {
        return this == ALL || this == stage;
    }

    /** @throws IllegalArgumentException for an unknown value */
    public static Source fromValue(String v) {
        if (v != null) {
            String s = v.trim().toLowerCase(Locale.ROOT);
            for (Source src : values()) {
                if (src.value.equals(s) || src.aliases.contains(s)) return src;
            }
        }
        throw new IllegalArgumentException("Unknown source '" + v + "', expected one of "
                + "knowledge-base, source-tree, assisted, curated, all");
    }

    @Override
    public String toString() {
        return value;
    }
}
