package org.calista.flowsight.train.format;

import org.calista.flowsight.train.knowledge.CallbackFact;
import org.calista.flowsight.train.knowledge.CompositeScenario;
import org.calista.flowsight.train.knowledge.ScenarioCategory;
import org.calista.flowsight.train.knowledge.ScenarioFact;
import org.calista.flowsight.train.knowledge.SyncPrimitiveFact;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerFormatterTest {

    private final AnswerFormatter fmt = new AnswerFormatter();

    @Test
    void treeChainIndentsOneLevelPerStepAndClosesWithTheLastBranch() {
        List<String> steps = List.of("a", "b", "c", "d");
        String[] lines = fmt.renderChain(steps, ChainStyle.TREE).split("\n");

        assertThat(lines).hasSize(steps.size());
        for (int i = 0; i < lines.length; i++) {
            String prefix = "    ".repeat(i);
            assertThat(lines[i]).startsWith(prefix);
            String rest = lines[i].substring(prefix.length());
            assertThat(rest).isEqualTo((i == lines.length - 1 ? "└── " : "├── ") + steps.get(i));
        }
        String all = String.join("\n", lines);
        assertThat(all.chars().filter(ch -> ch == '└').count()).isEqualTo(1);
        assertThat(all.chars().filter(ch -> ch == '├').count()).isEqualTo(steps.size() - 1);
    }

    @Test
    void singleStepTreeIsJustTheLastBranch() {
        assertThat(fmt.renderChain(List.of("only"), ChainStyle.TREE)).isEqualTo("└── only");
    }

    @Test
    void flatStyles() {
        List<String> steps = List.of("x", "y");
        assertThat(fmt.renderChain(steps, ChainStyle.NUMBERED)).isEqualTo("  1. x\n  2. y");
        assertThat(fmt.renderChain(steps, ChainStyle.ARROW)).isEqualTo("  → x\n  → y");
        assertThat(fmt.renderChain(steps, ChainStyle.BULLET)).isEqualTo("  • x\n  • y");
        assertThat(fmt.renderChain(List.of(), ChainStyle.NUMBERED)).isEmpty();
    }

    @Test
    void callbackRendering() {
        CallbackFact f = new CallbackFact("usb_driver", "probe", "设备插入", "进程上下文",
                List.of("usb_new_device", "drv->probe()"), "异步调用");

        assertThat(fmt.renderFact(f)).isEqualTo(
                "**触发条件**：设备插入\n\n"
                        + "**执行上下文**：进程上下文\n\n"
                        + "**调用链**：\n"
                        + "├── usb_new_device\n"
                        + "    └── drv->probe()\n\n"
                        + "**注意**：异步调用");
    }

    @Test
    void absentOptionalFieldsDropTheirSections() {
        CallbackFact f = new CallbackFact("pci_driver", "remove", "设备移除", null, List.of("drv->remove()"), null);
        String out = fmt.renderFact(f);

        assertThat(out).doesNotContain(AnswerFormatter.CONTEXT_LABEL).doesNotContain(AnswerFormatter.NOTE_LABEL);
        assertThat(out).doesNotContain("\n\n\n");
        assertThat(out).isEqualTo("**触发条件**：设备移除\n\n**调用链**：\n└── drv->remove()");
    }

    @Test
    void scenarioUsesTheCategoryLabelAndStyle() {
        ScenarioFact rx = new ScenarioFact(ScenarioCategory.NETWORK_RX, "napi_poll", "NAPI 收包", "软中断上下文",
                List.of("napi_schedule", "net_rx_action"), null);
        assertThat(fmt.renderFact(rx)).contains("**完整流程**：\n  1. napi_schedule\n  2. net_rx_action");

        ScenarioFact empty = new ScenarioFact(ScenarioCategory.SCHEDULER, "schedule", "调度", null, List.of(), null);
        assertThat(fmt.renderFact(empty)).isEqualTo("**调度**");
    }

    @Test
    void syncPrimitiveUsesUsageContextAndArrowChain() {
        SyncPrimitiveFact m = SyncPrimitiveFact.builder("mutex")
                .description("互斥锁")
                .lockOps("mutex_lock")
                .unlockOps("mutex_unlock")
                .context("进程上下文")
                .contendedChain("mutex_lock", "schedule()")
                .build();
        assertThat(fmt.renderFact(m)).isEqualTo(
                "**互斥锁**\n\n**使用上下文**：进程上下文\n\n**竞争时调用链**：\n  → mutex_lock\n  → schedule()");
    }

    @Test
    void compositeFramesPhasesAndNumbersTheTimeline() {
        CompositeScenario c = CompositeScenario.builder("demo")
                .question("q")
                .title("演示")
                .phase("阶段1", "first\n  nested", null)
                .phase("阶段2", "second", "T-two")
                .phase("阶段3", "third", "T-three")
                .closing("结论", "done")
                .build();

        String out = fmt.renderComposite(c);
        String rule = AnswerFormatter.RULE;

        assertThat(rule).hasSize(75);
        assertThat(out).startsWith("**演示**\n\n" + rule + "\n\n**阶段1**\n\n  first\n    nested");
        assertThat(out).contains("**时间线**：\n\n  [T0] T-two\n  [T1] T-three");
        assertThat(out).endsWith(rule + "\n\n**结论**\n\n  done");
        assertThat(out.split(rule, -1)).hasSize(6);
        assertThat(fmt.renderFact(c)).isEqualTo(out);
    }

    @Test
    void compositeWithoutSummariesHasNoTimeline() {
        CompositeScenario c = CompositeScenario.builder("demo")
                .question("q")
                .title("t")
                .phase("p", "body", null)
                .build();
        assertThat(fmt.renderComposite(c)).doesNotContain(AnswerFormatter.TIMELINE_LABEL);
    }

    @Test
    void composeSkipsBlankSections() {
        assertThat(fmt.compose("a", null, " ", "b")).isEqualTo("a\n\nb");
        assertThat(fmt.contextSection("x", null)).isNull();
        assertThat(fmt.chainSection("x", List.of(), ChainStyle.ARROW)).isNull();
    }
}
