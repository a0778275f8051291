package org.calista.flowsight.train.synth;

import org.calista.flowsight.train.knowledge.FactKind;

/**
 * A fact kind present in the schema has no registered generator.
 * Fatal: the schema and the synthesizer are out of sync.
 */
public final class SchemaConsistencyException extends IllegalStateException {

    private final FactKind kind;

    public SchemaConsistencyException(FactKind kind) {
        super("No sample generator registered for fact kind " + kind);
        this.kind = kind;
    }

    public FactKind kind() {
        return kind;
    }
}
