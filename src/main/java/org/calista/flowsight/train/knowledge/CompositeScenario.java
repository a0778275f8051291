package org.calista.flowsight.train.knowledge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CompositeScenario — a hand-authored multi-phase narrative spanning several facts
 * (driver lifecycle, irq → workqueue, ...). Phase bodies are pre-rendered text; only the
 * framing (rules, timeline) is produced by the formatter.
 */
public final class CompositeScenario implements Fact {

    public final String scenario;
    /** The question asked about the code. */
    public final String question;
    /** Code the question refers to. */
    public final String code;
    public final String title;
    public final List<Phase> phases;
    /** Optional closing section (conclusions, rationale). */
    public final Section closing;

    private CompositeScenario(Builder b) {
        this.scenario = Facts.required(b.scenario, "CompositeScenario.scenario");
        this.question = Facts.required(b.question, "CompositeScenario.question");
        this.code = b.code == null ? "" : b.code;
        this.title = Facts.required(b.title, "CompositeScenario.title");
        if (b.phases.isEmpty()) throw new IllegalArgumentException("CompositeScenario.phases must not be empty");
        this.phases = List.copyOf(b.phases);
        this.closing = b.closing;
    }

    public static Builder builder(String scenario) {
        return new Builder(scenario);
    }

    @Override
    public String id() {
        return "composite:" + scenario;
    }

    @Override
    public FactKind kind() {
        return FactKind.COMPOSITE;
    }

    @Override
    public String name() {
        return scenario;
    }

    @Override
    public String toString() {
        return "CompositeScenario{" + scenario + ", phases=" + phases.size() + '}';
    }

    // ---------------------------------------------------------------------
    // Parts
    // ---------------------------------------------------------------------

    /** Titled block of pre-rendered text. */
    public static class Section {
        public final String title;
        public final String body;

        public Section(String title, String body) {
            this.title = Facts.required(title, "Section.title");
            this.body = trimBlankLines(Objects.requireNonNull(body, "body"));
        }
    }

    /** Drops leading and trailing blank lines; keeps the indentation of the first text line. */
    static String trimBlankLines(String text) {
        String[] lines = text.split("\\R", -1);
        int from = 0;
        int to = lines.length;
        while (from < to && lines[from].isBlank()) from++;
        while (to > from && lines[to - 1].isBlank()) to--;
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = from; i < to; i++) {
            if (i > from) sb.append('\n');
            sb.append(lines[i].stripTrailing());
        }
        return sb.toString();
    }

    /** A phase, plus the one-line summary it contributes to the timeline (nullable). */
    public static final class Phase extends Section {
        public final String timeline;

        public Phase(String title, String body, String timeline) {
            super(title, body);
            this.timeline = Facts.optional(timeline);
        }
    }

    public static final class Builder {
        private final String scenario;
        private String question;
        private String code;
        private String title;
        private final List<Phase> phases = new ArrayList<>();
        private Section closing;

        private Builder(String scenario) {
            this.scenario = scenario;
        }

        public Builder question(String v) {
            this.question = v;
            return this;
        }

        public Builder code(String v) {
            this.code = v;
            return this;
        }

        public Builder title(String v) {
            this.title = v;
            return this;
        }

        public Builder phase(String title, String body, String timeline) {
            this.phases.add(new Phase(title, body, timeline));
            return this;
        }

        public Builder closing(String title, String body) {
            this.closing = new Section(title, body);
            return this;
        }

        public CompositeScenario build() {
            return new CompositeScenario(this);
        }
    }
}
