package org.calista.flowsight.train.knowledge;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * SyncPrimitiveFact — a locking primitive: its lock/unlock operations, where it may be used
 * and, optionally, what happens on the contended path.
 */
public final class SyncPrimitiveFact implements Fact {

    public final String primitive;
    public final String description;
    public final List<String> lockOps;
    public final List<String> unlockOps;
    public final String context;
    /** Slow path taken when the lock is held by someone else; may be empty. */
    public final List<String> contendedChain;
    public final String note;

    private SyncPrimitiveFact(Builder b) {
        this.primitive = Facts.required(b.primitive, "SyncPrimitiveFact.primitive");
        this.description = Facts.required(b.description, "SyncPrimitiveFact.description");
        this.lockOps = Facts.nonEmptySteps(b.lockOps, "SyncPrimitiveFact.lockOps");
        this.unlockOps = Facts.nonEmptySteps(b.unlockOps, "SyncPrimitiveFact.unlockOps");
        this.context = Facts.optional(b.context);
        this.contendedChain = Facts.steps(b.contendedChain);
        this.note = Facts.optional(b.note);
    }

    public static Builder builder(String primitive) {
        return new Builder(primitive);
    }

    @Override
    public String id() {
        return "sync:" + primitive;
    }

    @Override
    public FactKind kind() {
        return FactKind.SYNC_PRIMITIVE;
    }

    @Override
    public String name() {
        return primitive;
    }

    @Override
    public String toString() {
        return "SyncPrimitiveFact{" + primitive + ", lock=" + lockOps + ", unlock=" + unlockOps + '}';
    }

    public static final class Builder {
        private final String primitive;
        private String description;
        private List<String> lockOps = List.of();
        private List<String> unlockOps = List.of();
        private String context;
        private List<String> contendedChain = List.of();
        private String note;

        private Builder(String primitive) {
            this.primitive = primitive;
        }

        public Builder description(String v) {
            this.description = v;
            return this;
        }

        public Builder lockOps(String... ops) {
            this.lockOps = Arrays.asList(Objects.requireNonNull(ops, "ops"));
            return this;
        }

        public Builder unlockOps(String... ops) {
            this.unlockOps = Arrays.asList(Objects.requireNonNull(ops, "ops"));
            return this;
        }

        public Builder context(String v) {
            this.context = v;
            return this;
        }

        public Builder contendedChain(String... steps) {
            this.contendedChain = Arrays.asList(Objects.requireNonNull(steps, "steps"));
            return this;
        }

        public Builder note(String v) {
            this.note = v;
            return this;
        }

        public SyncPrimitiveFact build() {
            return new SyncPrimitiveFact(this);
        }
    }
}
