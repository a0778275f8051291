package org.calista.flowsight.train.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * SummaryFmt — box rendering for run summaries and statistics.
 *
 * <p>Wide (CJK) characters count as two columns so the right border stays aligned.</p>
 */
public final class SummaryFmt {

    private SummaryFmt() {}

    public static String box(String title, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        BoxBuilder b = new BoxBuilder();
        fill.accept(b);
        return renderBox(title, b.lines);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class BoxBuilder {
        private final List<String> lines = new ArrayList<>(32);

        public BoxBuilder kv(String key, Object value) {
            String k = (key == null) ? "" : key;
            lines.add(k + ": " + value);
            return this;
        }

        /** One indented line per entry, map iteration order. */
        public BoxBuilder counts(Map<String, ? extends Number> counts) {
            if (counts == null) return this;
            for (Map.Entry<String, ? extends Number> e : counts.entrySet()) {
                lines.add("  " + e.getKey() + ": " + e.getValue());
            }
            return this;
        }

        public BoxBuilder line(String text) {
            lines.add(text == null ? "" : text);
            return this;
        }

        public BoxBuilder sep() {
            lines.add("--");
            return this;
        }
    }

    // ---------------------------------------------------------------------
    // Rendering
    // ---------------------------------------------------------------------

    private static String renderBox(String title, List<String> lines) {
        int contentWidth = displayWidth(title);
        for (String l : lines) {
            if ("--".equals(l)) continue;
            contentWidth = Math.max(contentWidth, displayWidth(l));
        }

        int w = Math.max(24, contentWidth + 2);

        StringBuilder out = new StringBuilder((lines.size() + 5) * (w + 8));

        out.append("┌").append("─".repeat(w)).append("┐\n");
        out.append("│ ").append(padRight(title, w - 1)).append("│\n");
        out.append("├").append("─".repeat(w)).append("┤\n");

        for (String l : lines) {
            if ("--".equals(l)) {
                out.append("│").append("─".repeat(w)).append("│\n");
                continue;
            }
            out.append("│ ").append(padRight(l, w - 1)).append("│\n");
        }

        out.append("└").append("─".repeat(w)).append("┘");
        return out.toString();
    }

    private static String padRight(String s, int width) {
        int pad = width - displayWidth(s);
        return pad <= 0 ? s : s + " ".repeat(pad);
    }

    static int displayWidth(String s) {
        int w = 0;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            w += isWide(cp) ? 2 : 1;
            i += Character.charCount(cp);
        }
        return w;
    }

    private static boolean isWide(int cp) {
        Character.UnicodeBlock block = Character.UnicodeBlock.of(cp);
        return block == Character.UnicodeBlock.CJK_UNIFIED_IDEOGRAPHS
                || block == Character.UnicodeBlock.CJK_SYMBOLS_AND_PUNCTUATION
                || block == Character.UnicodeBlock.HALFWIDTH_AND_FULLWIDTH_FORMS;
    }
}
