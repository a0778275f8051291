package org.calista.flowsight.train.knowledge;

import java.util.*;
import java.util.stream.Collectors;

/**
 * FactSchema — immutable, ordered set of domain facts.
 *
 * <p>
 * Built once at startup and passed explicitly to whoever needs it.
 * Iteration order is declaration order; that order is part of the output contract
 * (the synthesized corpus is diffable run to run).
 * </p>
 */
public final class FactSchema {

    private final List<Fact> facts;
    private final Map<String, Fact> byId;

    private FactSchema(List<Fact> facts) {
        this.facts = List.copyOf(facts);
        LinkedHashMap<String, Fact> idx = new LinkedHashMap<>();
        for (Fact f : this.facts) idx.put(f.id(), f);
        this.byId = Collections.unmodifiableMap(idx);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** All facts, declaration order. */
    public List<Fact> facts() {
        return facts;
    }

    public List<Fact> facts(FactKind kind) {
        Objects.requireNonNull(kind, "kind");
        return facts.stream().filter(f -> f.kind() == kind).collect(Collectors.toUnmodifiableList());
    }

    /** Facts of one variant, declaration order. */
    public <T extends Fact> List<T> facts(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return facts.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toUnmodifiableList());
    }

    public Optional<Fact> find(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    /** Callback facts of one framework, declared order. */
    public List<CallbackFact> callbacks(String framework) {
        return facts(CallbackFact.class).stream()
                .filter(c -> c.framework.equals(framework))
                .collect(Collectors.toUnmodifiableList());
    }

    /** Framework names in order of first appearance. */
    public List<String> frameworks() {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (CallbackFact c : facts(CallbackFact.class)) out.add(c.framework);
        return List.copyOf(out);
    }

    /** Kinds present in this schema. */
    public Set<FactKind> kinds() {
        EnumSet<FactKind> out = EnumSet.noneOf(FactKind.class);
        for (Fact f : facts) out.add(f.kind());
        return Collections.unmodifiableSet(out);
    }

    public int size() {
        return facts.size();
    }

    @Override
    public String toString() {
        return "FactSchema{size=" + facts.size() + ", kinds=" + kinds() + '}';
    }

    public static final class Builder {
        private final List<Fact> facts = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();

        private Builder() {}

        public Builder add(Fact fact) {
            Objects.requireNonNull(fact, "fact");
            if (!ids.add(fact.id())) {
                throw new IllegalArgumentException("Duplicate fact id: " + fact.id());
            }
            facts.add(fact);
            return this;
        }

        public Builder addAll(Collection<? extends Fact> more) {
            for (Fact f : Objects.requireNonNull(more, "more")) add(f);
            return this;
        }

        public FactSchema build() {
            return new FactSchema(facts);
        }
    }
}
