package org.calista.flowsight.train.mine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.flowsight.train.sample.MetadataKeys;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * StructuralSourceMiner — finds ops-table literals in C text and extracts their
 * {@code .field = function} bindings.
 *
 * <p>
 * Pipeline per text:
 * 1) mask comments and literals (offsets preserved)
 * 2) match {@code [qualifiers] struct <type> <name> [__attr...] = {}
 * 3) keep types ending in a configured suffix
 * 4) find the closing brace by depth tracking
 * 5) extract top-level {@code .field = identifier} pairs, drop excluded prefixes and targets
 * </p>
 *
 * <p>Pure: no I/O, no shared state. One instance may serve several threads.</p>
 */
public final class StructuralSourceMiner {
    private static final Logger log = LogManager.getLogger(StructuralSourceMiner.class);

    public static final class Config {
        /** Struct type name suffixes that mark an ops table. */
        public List<String> structSuffixes = List.of("_operations", "_operation", "_ops");

        /** Target identifiers starting with one of these are dropped. */
        public List<String> excludedPrefixes = List.of("__");

        /** Target identifiers dropped on exact match (macros that are not functions). */
        public List<String> excludedTargets = List.of("NULL");
    }

    private static final Pattern HEADER = Pattern.compile(
            "\\b(?:(?:static|const|extern|volatile)\\s+)*"
                    + "struct\\s+(\\w+)\\s+(\\w+)"
                    + "(?:\\s+__\\w+)*"
                    + "\\s*=\\s*\\{");

    private static final Pattern FIELD = Pattern.compile(
            "\\.\\s*(\\w+)\\s*=\\s*([A-Za-z_]\\w*)\\s*(?=,|$)");

    /** A located ops-table literal. Offsets are into the original text; end is exclusive. */
    public record OpsTable(String structType, String variable, int start, int bodyStart, int bodyEnd, int end) {}

    private final List<String> suffixes;
    private final List<String> excluded;
    private final Set<String> excludedTargets;

    public StructuralSourceMiner() {
        this(new Config());
    }

    public StructuralSourceMiner(Config cfg) {
        Objects.requireNonNull(cfg, "cfg");
        this.suffixes = List.copyOf(cfg.structSuffixes == null ? List.of() : cfg.structSuffixes);
        this.excluded = List.copyOf(cfg.excludedPrefixes == null ? List.of() : cfg.excludedPrefixes);
        this.excludedTargets = Set.copyOf(cfg.excludedTargets == null ? List.of() : cfg.excludedTargets);
    }

    // ---------------------------------------------------------------------
    // Tables
    // ---------------------------------------------------------------------

    public List<OpsTable> findTables(String text) {
        Objects.requireNonNull(text, "text");
        return findTables(text, SourceMask.mask(text));
    }

    private List<OpsTable> findTables(String text, String masked) {
        List<OpsTable> out = new ArrayList<>();
        Matcher m = HEADER.matcher(masked);
        int from = 0;
        while (from < masked.length() && m.find(from)) {
            String type = m.group(1);
            String var = m.group(2);
            int open = m.end() - 1;
            from = m.end();

            if (!isOpsType(type)) continue;

            int close = matchingBrace(masked, open);
            if (close < 0) {
                log.debug("Unterminated initializer for {} {} at offset {}", type, var, m.start());
                continue;
            }
            out.add(new OpsTable(type, var, m.start(), open + 1, close, close + 1));
            from = close + 1;
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Bindings
    // ---------------------------------------------------------------------

    /**
     * Bindings of every ops table in the text, table order then field order.
     *
     * @param file originating path recorded on each binding; may be null
     */
    public List<Binding> mine(String text, String file) {
        Objects.requireNonNull(text, "text");
        String masked = SourceMask.mask(text);

        List<Binding> out = new ArrayList<>();
        for (OpsTable t : findTables(text, masked)) {
            String snippet = text.substring(t.start(), t.end());
            String body = topLevel(masked.substring(t.bodyStart(), t.bodyEnd()));

            Matcher f = FIELD.matcher(body);
            while (f.find()) {
                String target = f.group(2);
                if (isExcluded(target)) continue;
                out.add(new Binding(t.variable(), t.structType(), f.group(1), target, snippet, file));
            }
        }
        return out;
    }

    public TrainingRecord toRecord(Binding b) {
        Objects.requireNonNull(b, "binding");
        String ref = b.variable + "." + b.field;
        return TrainingRecord.builder(TaskKind.FUNCTION_POINTER_TARGET)
                .instruction("分析 " + ref + " 指向哪个函数")
                .input(b.snippet)
                .output(ref + " 指向 " + b.target + " 函数。\n\n"
                        + "这是通过结构体初始化 ." + b.field + " = " + b.target + " 赋值的。")
                .meta(MetadataKeys.FILE, b.file)
                .meta(MetadataKeys.STRUCT, b.structType)
                .build();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private boolean isOpsType(String type) {
        for (String s : suffixes) {
            if (type.endsWith(s)) return true;
        }
        return false;
    }

    private boolean isExcluded(String target) {
        if (excludedTargets.contains(target)) return true;
        for (String p : excluded) {
            if (!p.isEmpty() && target.startsWith(p)) return true;
        }
        return false;
    }

    /** Index of the brace closing the one at {@code open}, or -1. */
    static int matchingBrace(String masked, int open) {
        int depth = 0;
        for (int i = open; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /** Blanks nested brace groups (braces included) so only top-level fields remain. */
    static String topLevel(String body) {
        char[] out = body.toCharArray();
        int depth = 0;
        for (int i = 0; i < out.length; i++) {
            char c = out[i];
            if (c == '{') {
                depth++;
                out[i] = ' ';
            } else if (c == '}') {
                if (depth > 0) depth--;
                out[i] = ' ';
            } else if (depth > 0 && c != '\n') {
                out[i] = ' ';
            }
        }
        return new String(out);
    }
}
