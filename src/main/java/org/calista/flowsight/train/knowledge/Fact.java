package org.calista.flowsight.train.knowledge;

/**
 * Fact — one immutable node of the {@link FactSchema}.
 *
 * <p>The hierarchy is closed: consumers switch over {@link #kind()} and the compiler
 * rejects a switch expression that forgets one.</p>
 */
public sealed interface Fact
        permits CallbackFact, AsyncMechanismFact, ScenarioFact, SyncPrimitiveFact, CompositeScenario {

    /** Stable id, unique within a schema ("callback:usb_driver.probe", "async:timer", ...). */
    String id();

    FactKind kind();

    /** Short name used in instructions and metadata. */
    String name();
}
