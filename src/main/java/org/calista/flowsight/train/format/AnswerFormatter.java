package org.calista.flowsight.train.format;

import org.calista.flowsight.train.knowledge.AsyncMechanismFact;
import org.calista.flowsight.train.knowledge.CallbackFact;
import org.calista.flowsight.train.knowledge.CompositeScenario;
import org.calista.flowsight.train.knowledge.Fact;
import org.calista.flowsight.train.knowledge.ScenarioFact;
import org.calista.flowsight.train.knowledge.SyncPrimitiveFact;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AnswerFormatter — renders facts into answer text.
 *
 * <p>
 * Every answer is a composition of small sections in a fixed order:
 * headline, context, chain, note. Absent optional fields drop their section.
 * Sections are separated by one blank line; chain lines by a single newline.
 * </p>
 *
 * <p>Stateless; one instance can be shared.</p>
 */
public final class AnswerFormatter {

    /** Separator between composite phases. */
    public static final String RULE = "═".repeat(75);

    public static final String CONTEXT_LABEL = "执行上下文";
    public static final String SYNC_CONTEXT_LABEL = "使用上下文";
    public static final String CALLBACK_CHAIN_LABEL = "调用链";
    public static final String ASYNC_CHAIN_LABEL = "内核调用链";
    public static final String CONTENDED_CHAIN_LABEL = "竞争时调用链";
    public static final String NOTE_LABEL = "注意";
    public static final String TIMELINE_LABEL = "时间线";

    private static final String TREE_INDENT = "    ";
    private static final String TREE_BRANCH = "├── ";
    private static final String TREE_LAST = "└── ";
    private static final String BODY_INDENT = "  ";

    // ---------------------------------------------------------------------
    // Chains
    // ---------------------------------------------------------------------

    public String renderChain(List<String> steps, ChainStyle style) {
        Objects.requireNonNull(style, "style");
        if (steps == null || steps.isEmpty()) return "";

        StringBuilder sb = new StringBuilder(steps.size() * 32);
        int last = steps.size() - 1;
        for (int i = 0; i <= last; i++) {
            if (i > 0) sb.append('\n');
            String step = steps.get(i);
            switch (style) {
                case NUMBERED -> sb.append("  ").append(i + 1).append(". ").append(step);
                case ARROW -> sb.append("  → ").append(step);
                case BULLET -> sb.append("  • ").append(step);
                case TREE -> sb.append(TREE_INDENT.repeat(i))
                        .append(i == last ? TREE_LAST : TREE_BRANCH)
                        .append(step);
            }
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Facts
    // ---------------------------------------------------------------------

    public String renderFact(Fact fact) {
        Objects.requireNonNull(fact, "fact");
        return switch (fact.kind()) {
            case CALLBACK -> {
                CallbackFact f = (CallbackFact) fact;
                yield compose(
                        headline(fact),
                        contextSection(CONTEXT_LABEL, f.context),
                        chainSection(CALLBACK_CHAIN_LABEL, f.callChain, ChainStyle.TREE),
                        noteSection(f.note));
            }
            case ASYNC_MECHANISM -> {
                AsyncMechanismFact f = (AsyncMechanismFact) fact;
                yield compose(
                        headline(fact),
                        contextSection(CONTEXT_LABEL, f.context),
                        chainSection(ASYNC_CHAIN_LABEL, f.callChain, ChainStyle.NUMBERED),
                        noteSection(f.flowNote));
            }
            case SCENARIO -> {
                ScenarioFact f = (ScenarioFact) fact;
                yield compose(
                        headline(fact),
                        contextSection(CONTEXT_LABEL, f.context),
                        chainSection(f.category.chainLabel, f.callChain, f.category.chainStyle),
                        noteSection(f.note));
            }
            case SYNC_PRIMITIVE -> {
                SyncPrimitiveFact f = (SyncPrimitiveFact) fact;
                yield compose(
                        headline(fact),
                        contextSection(SYNC_CONTEXT_LABEL, f.context),
                        chainSection(CONTENDED_CHAIN_LABEL, f.contendedChain, ChainStyle.ARROW),
                        noteSection(f.note));
            }
            case COMPOSITE -> renderComposite((CompositeScenario) fact);
        };
    }

    /**
     * Multi-phase narrative: title, each phase behind a rule, a timeline built from the
     * phase summaries, then the optional closing section.
     */
    public String renderComposite(CompositeScenario scenario) {
        Objects.requireNonNull(scenario, "scenario");

        List<String> blocks = new ArrayList<>();
        blocks.add(bold(scenario.title));
        for (CompositeScenario.Phase phase : scenario.phases) {
            blocks.add(RULE);
            blocks.add(bold(phase.title));
            blocks.add(indent(phase.body));
        }

        List<String> timeline = new ArrayList<>();
        for (CompositeScenario.Phase phase : scenario.phases) {
            if (phase.timeline == null) continue;
            timeline.add(BODY_INDENT + "[T" + timeline.size() + "] " + phase.timeline);
        }
        if (!timeline.isEmpty()) {
            blocks.add(RULE);
            blocks.add(label(TIMELINE_LABEL));
            blocks.add(String.join("\n", timeline));
        }

        if (scenario.closing != null) {
            blocks.add(RULE);
            blocks.add(bold(scenario.closing.title));
            blocks.add(indent(scenario.closing.body));
        }
        return compose(blocks.toArray(new String[0]));
    }

    // ---------------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------------

    public String headline(Fact fact) {
        Objects.requireNonNull(fact, "fact");
        return switch (fact.kind()) {
            case CALLBACK -> label("触发条件") + ((CallbackFact) fact).trigger;
            case ASYNC_MECHANISM -> {
                AsyncMechanismFact f = (AsyncMechanismFact) fact;
                yield label("异步模式") + f.label() + " (" + f.description + ")";
            }
            case SCENARIO -> bold(((ScenarioFact) fact).description);
            case SYNC_PRIMITIVE -> bold(((SyncPrimitiveFact) fact).description);
            case COMPOSITE -> bold(((CompositeScenario) fact).title);
        };
    }

    /** {@code **label**：value}, or null when there is no value. */
    public String contextSection(String label, String value) {
        if (value == null || value.isBlank()) return null;
        return label(label) + value;
    }

    /** Label line followed by the rendered chain, or null for an empty chain. */
    public String chainSection(String label, List<String> steps, ChainStyle style) {
        if (steps == null || steps.isEmpty()) return null;
        return label(label) + "\n" + renderChain(steps, style);
    }

    /** Label line followed by free text on its own lines, or null when there is no text. */
    public String textSection(String label, String text) {
        if (text == null || text.isBlank()) return null;
        return label(label) + "\n" + text;
    }

    public String noteSection(String note) {
        return contextSection(NOTE_LABEL, note);
    }

    /** Joins the non-blank sections with a blank line. */
    public String compose(String... sections) {
        StringBuilder sb = new StringBuilder(256);
        for (String s : sections) {
            if (s == null || s.isBlank()) continue;
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(s);
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    static String bold(String text) {
        return "**" + text + "**";
    }

    static String label(String name) {
        return "**" + name + "**：";
    }

    static String indent(String body) {
        String[] lines = body.split("\n", -1);
        StringBuilder sb = new StringBuilder(body.length() + lines.length * BODY_INDENT.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            if (!lines[i].isEmpty()) sb.append(BODY_INDENT).append(lines[i]);
        }
        return sb.toString();
    }
}
