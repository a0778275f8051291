package org.calista.flowsight.train.provider;

import org.calista.flowsight.train.sample.TrainingRecord;
import org.calista.flowsight.train.synth.SampleSynthesizer;

import java.util.List;
import java.util.Objects;

/** Records synthesized from the fact schema. */
public final class KnowledgeBaseProvider implements SampleProvider {

    private final SampleSynthesizer synthesizer;

    public KnowledgeBaseProvider(SampleSynthesizer synthesizer) {
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
    }

    @Override
    public String name() {
        return Source.KNOWLEDGE_BASE.value;
    }

    @Override
    public List<TrainingRecord> provide() {
        return synthesizer.synthesize();
    }
}
