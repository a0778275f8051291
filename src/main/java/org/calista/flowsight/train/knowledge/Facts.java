package org.calista.flowsight.train.knowledge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Validation helpers shared by the fact constructors. */
final class Facts {
    private Facts() {}

    static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }

    static String optional(String value) {
        if (value == null) return null;
        String v = value.trim();
        return v.isEmpty() ? null : v;
    }

    /** Copies into an unmodifiable list, dropping null/blank entries, keeping order. */
    static List<String> steps(Collection<String> steps) {
        if (steps == null || steps.isEmpty()) return List.of();
        ArrayList<String> out = new ArrayList<>(steps.size());
        for (String s : steps) {
            if (s == null || s.isBlank()) continue;
            out.add(s.trim());
        }
        return List.copyOf(out);
    }

    static List<String> nonEmptySteps(Collection<String> steps, String field) {
        List<String> out = steps(steps);
        if (out.isEmpty()) throw new IllegalArgumentException(field + " must not be empty");
        return out;
    }
}
