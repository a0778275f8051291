package org.calista.flowsight.train.synth;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.flowsight.train.format.AnswerFormatter;
import org.calista.flowsight.train.knowledge.Fact;
import org.calista.flowsight.train.knowledge.FactKind;
import org.calista.flowsight.train.knowledge.FactSchema;
import org.calista.flowsight.train.sample.TrainingRecord;

import java.util.*;

/**
 * SampleSynthesizer — expands a FactSchema into training records.
 *
 * <p>
 * Contract:
 * - facts are visited in schema declaration order, records of one fact in generator order
 * - output is a pure function of the schema (no randomness, clock or environment)
 * - every kind present in the schema must have a generator; this is checked at construction
 * </p>
 */
public final class SampleSynthesizer {
    private static final Logger log = LogManager.getLogger(SampleSynthesizer.class);

    private final FactSchema schema;
    private final EnumMap<FactKind, SampleGenerator<?>> generators = new EnumMap<>(FactKind.class);

    /**
     * @throws SchemaConsistencyException when a kind in the schema has no generator
     * @throws IllegalArgumentException when two generators claim the same kind
     */
    public SampleSynthesizer(FactSchema schema, Collection<? extends SampleGenerator<?>> generators) {
        this.schema = Objects.requireNonNull(schema, "schema");
        for (SampleGenerator<?> g : Objects.requireNonNull(generators, "generators")) {
            if (this.generators.putIfAbsent(g.kind(), g) != null) {
                throw new IllegalArgumentException("Duplicate generator for fact kind " + g.kind());
            }
        }
        for (FactKind kind : schema.kinds()) {
            if (!this.generators.containsKey(kind)) throw new SchemaConsistencyException(kind);
        }
    }

    /** Synthesizer with one default generator per fact kind. */
    public static SampleSynthesizer withDefaults(FactSchema schema) {
        AnswerFormatter formatter = new AnswerFormatter();
        CodeSkeletons skeletons = new CodeSkeletons();
        return new SampleSynthesizer(schema, List.of(
                new CallbackSampleGenerator(formatter, skeletons),
                new AsyncPatternSampleGenerator(formatter, skeletons),
                new ScenarioSampleGenerator(formatter, skeletons),
                new SyncPrimitiveSampleGenerator(formatter, skeletons),
                new CompositeSampleGenerator(formatter)));
    }

    public FactSchema schema() {
        return schema;
    }

    public List<TrainingRecord> synthesize() {
        List<TrainingRecord> out = new ArrayList<>(schema.size() * 2);
        for (Fact fact : schema.facts()) out.addAll(synthesize(fact));
        log.info("Synthesized {} samples from {} facts", out.size(), schema.size());
        return out;
    }

    public List<TrainingRecord> synthesize(Fact fact) {
        Objects.requireNonNull(fact, "fact");
        SampleGenerator<?> g = generators.get(fact.kind());
        if (g == null) {
            log.error("No generator for {} ({})", fact.kind(), fact.id());
            throw new SchemaConsistencyException(fact.kind());
        }
        List<TrainingRecord> records = apply(g, fact);
        log.debug("{} -> {} samples", fact.id(), records.size());
        return records;
    }

    private static <F extends Fact> List<TrainingRecord> apply(SampleGenerator<F> g, Fact fact) {
        return g.generate(g.factType().cast(fact));
    }
}
