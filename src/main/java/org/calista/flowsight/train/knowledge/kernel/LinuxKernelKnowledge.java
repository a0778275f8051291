package org.calista.flowsight.train.knowledge.kernel;

import org.calista.flowsight.train.knowledge.FactSchema;

/**
 * The curated Linux kernel schema: driver framework callbacks, deferred-execution
 * mechanisms, flat scenario tables and the composite narratives, in that order.
 */
public final class LinuxKernelKnowledge {
    private LinuxKernelKnowledge() {}

    public static FactSchema schema() {
        FactSchema.Builder b = FactSchema.builder();
        DriverFrameworkFacts.register(b);
        AsyncMechanismFacts.register(b);
        KernelScenarioFacts.register(b);
        CompositeScenarios.register(b);
        return b.build();
    }
}
