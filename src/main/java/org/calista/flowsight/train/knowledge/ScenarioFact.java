package org.calista.flowsight.train.knowledge;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * ScenarioFact — a flat named fact from one of the {@link ScenarioCategory} tables
 * (insmod, kmalloc, napi_poll, runtime_suspend, ...).
 *
 * <p>The call chain may be empty; the chain section is then omitted when rendered.</p>
 */
public final class ScenarioFact implements Fact {

    public final ScenarioCategory category;
    public final String scenario;
    public final String description;
    /** May be null. */
    public final String context;
    public final List<String> callChain;
    /** May be null. */
    public final String note;

    public ScenarioFact(ScenarioCategory category,
                        String scenario,
                        String description,
                        String context,
                        List<String> callChain,
                        String note) {
        this.category = Objects.requireNonNull(category, "category");
        this.scenario = Facts.required(scenario, "ScenarioFact.scenario");
        this.description = Facts.required(description, "ScenarioFact.description");
        this.context = Facts.optional(context);
        this.callChain = Facts.steps(callChain);
        this.note = Facts.optional(note);
    }

    @Override
    public String id() {
        return category.name().toLowerCase(Locale.ROOT) + ":" + scenario;
    }

    @Override
    public FactKind kind() {
        return FactKind.SCENARIO;
    }

    @Override
    public String name() {
        return scenario;
    }

    @Override
    public String toString() {
        return "ScenarioFact{" + category + ":" + scenario + ", steps=" + callChain.size() + '}';
    }
}
