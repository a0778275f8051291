package org.calista.flowsight.train.mine;

/**
 * Blanks C comments, string literals and character literals with spaces.
 * Line breaks are kept and the result has the input's length, so offsets into the
 * masked text are valid offsets into the original.
 */
final class SourceMask {
    private SourceMask() {}

    static String mask(String src) {
        char[] out = src.toCharArray();
        int n = out.length;
        int i = 0;
        while (i < n) {
            char c = out[i];
            char next = i + 1 < n ? out[i + 1] : '\0';

            if (c == '/' && next == '/') {
                while (i < n && out[i] != '\n') out[i++] = ' ';
            } else if (c == '/' && next == '*') {
                out[i++] = ' ';
                out[i++] = ' ';
                while (i < n && !(out[i] == '*' && i + 1 < n && out[i + 1] == '/')) blank(out, i++);
                if (i < n) {
                    out[i++] = ' ';
                    out[i++] = ' ';
                }
            } else if (c == '"' || c == '\'') {
                out[i++] = ' ';
                while (i < n && out[i] != c && out[i] != '\n') {
                    if (out[i] == '\\' && i + 1 < n) blank(out, i++);
                    blank(out, i++);
                }
                if (i < n && out[i] == c) out[i++] = ' ';
            } else {
                i++;
            }
        }
        return new String(out);
    }

    private static void blank(char[] out, int i) {
        if (out[i] != '\n') out[i] = ' ';
    }
}
