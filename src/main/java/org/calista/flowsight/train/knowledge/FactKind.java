package org.calista.flowsight.train.knowledge;

/**
 * Closed set of fact kinds held by {@link FactSchema}.
 * Every kind needs a generator in the synthesizer and a branch in the formatter.
 */
public enum FactKind {
    CALLBACK,
    ASYNC_MECHANISM,
    SCENARIO,
    SYNC_PRIMITIVE,
    COMPOSITE
}
