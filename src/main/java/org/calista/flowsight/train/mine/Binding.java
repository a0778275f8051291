package org.calista.flowsight.train.mine;

import java.util.Objects;

/**
 * Binding — one {@code .field = function} pair mined from an ops-table literal.
 * Transient: converted into a record right after mining.
 */
public final class Binding {

    /** Variable the literal initializes, e.g. "my_fops". */
    public final String variable;
    /** Struct type, e.g. "file_operations". */
    public final String structType;
    public final String field;
    public final String target;
    /** Original text of the whole declaration. */
    public final String snippet;
    /** Originating file; may be null for in-memory text. */
    public final String file;

    public Binding(String variable, String structType, String field, String target, String snippet, String file) {
        this.variable = Objects.requireNonNull(variable, "variable");
        this.structType = Objects.requireNonNull(structType, "structType");
        this.field = Objects.requireNonNull(field, "field");
        this.target = Objects.requireNonNull(target, "target");
        this.snippet = Objects.requireNonNull(snippet, "snippet");
        this.file = file;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Binding)) return false;
        Binding b = (Binding) o;
        return variable.equals(b.variable) && structType.equals(b.structType)
                && field.equals(b.field) && target.equals(b.target)
                && snippet.equals(b.snippet) && Objects.equals(file, b.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, structType, field, target, snippet, file);
    }

    @Override
    public String toString() {
        return variable + "." + field + " = " + target + " (" + structType + (file == null ? "" : ", " + file) + ")";
    }
}
