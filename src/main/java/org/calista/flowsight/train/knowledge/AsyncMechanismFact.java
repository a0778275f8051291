package org.calista.flowsight.train.knowledge;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * AsyncMechanismFact — a deferred-execution mechanism (workqueue, timer, tasklet, irq, ...):
 * how a handler is bound, what triggers it, where it runs and the kernel path to it.
 *
 * <p>Flow steps, flow note and timeline are optional authored text; when absent the
 * synthesizer derives the flow from the bind/trigger/wait operations.</p>
 */
public final class AsyncMechanismFact implements Fact {

    public final String mechanism;
    public final List<String> bindOps;
    /** Empty for hardware-triggered mechanisms. */
    public final List<String> triggerOps;
    public final List<String> waitOps;
    public final String context;
    public final String description;
    public final List<String> callChain;
    public final String typicalUse;

    public final List<String> flowSteps;
    public final String flowNote;
    /** Arrow-separated timeline, e.g. "中断发生 → schedule_work → ...". */
    public final String timeline;

    private AsyncMechanismFact(Builder b) {
        this.mechanism = Facts.required(b.mechanism, "AsyncMechanismFact.mechanism");
        this.bindOps = Facts.nonEmptySteps(b.bindOps, "AsyncMechanismFact.bindOps");
        this.triggerOps = Facts.steps(b.triggerOps);
        this.waitOps = Facts.steps(b.waitOps);
        this.context = Facts.optional(b.context);
        this.description = Facts.required(b.description, "AsyncMechanismFact.description");
        this.callChain = Facts.nonEmptySteps(b.callChain, "AsyncMechanismFact.callChain");
        this.typicalUse = Facts.optional(b.typicalUse);
        this.flowSteps = Facts.steps(b.flowSteps);
        this.flowNote = Facts.optional(b.flowNote);
        this.timeline = Facts.optional(b.timeline);
    }

    public static Builder builder(String mechanism) {
        return new Builder(mechanism);
    }

    /** Display label: "WORKQUEUE". */
    public String label() {
        return mechanism.toUpperCase(Locale.ROOT);
    }

    public boolean hardwareTriggered() {
        return triggerOps.isEmpty();
    }

    @Override
    public String id() {
        return "async:" + mechanism;
    }

    @Override
    public FactKind kind() {
        return FactKind.ASYNC_MECHANISM;
    }

    @Override
    public String name() {
        return mechanism;
    }

    @Override
    public String toString() {
        return "AsyncMechanismFact{" + mechanism + ", bind=" + bindOps + ", trigger=" + triggerOps + '}';
    }

    public static final class Builder {
        private final String mechanism;
        private List<String> bindOps = List.of();
        private List<String> triggerOps = List.of();
        private List<String> waitOps = List.of();
        private String context;
        private String description;
        private List<String> callChain = List.of();
        private String typicalUse;
        private List<String> flowSteps = List.of();
        private String flowNote;
        private String timeline;

        private Builder(String mechanism) {
            this.mechanism = mechanism;
        }

        public Builder bindOps(String... ops) {
            this.bindOps = Arrays.asList(Objects.requireNonNull(ops, "ops"));
            return this;
        }

        public Builder triggerOps(String... ops) {
            this.triggerOps = Arrays.asList(Objects.requireNonNull(ops, "ops"));
            return this;
        }

        public Builder waitOps(String... ops) {
            this.waitOps = Arrays.asList(Objects.requireNonNull(ops, "ops"));
            return this;
        }

        public Builder context(String v) {
            this.context = v;
            return this;
        }

        public Builder description(String v) {
            this.description = v;
            return this;
        }

        public Builder callChain(String... steps) {
            this.callChain = Arrays.asList(Objects.requireNonNull(steps, "steps"));
            return this;
        }

        public Builder typicalUse(String v) {
            this.typicalUse = v;
            return this;
        }

        public Builder flowSteps(String... steps) {
            this.flowSteps = Arrays.asList(Objects.requireNonNull(steps, "steps"));
            return this;
        }

        public Builder flowNote(String v) {
            this.flowNote = v;
            return this;
        }

        public Builder timeline(String v) {
            this.timeline = v;
            return this;
        }

        public AsyncMechanismFact build() {
            return new AsyncMechanismFact(this);
        }
    }
}
