package org.calista.flowsight.train.knowledge;

import org.calista.flowsight.train.format.ChainStyle;

/**
 * Flat scenario tables. Each category fixes how its facts are asked about and rendered.
 */
public enum ScenarioCategory {
    MODULE_LIFECYCLE("分析 %s 命令执行时的内核调用链", "operation", "调用链", ChainStyle.NUMBERED),
    MEMORY("分析 %s 操作的内核调用链", "operation", "调用链", ChainStyle.BULLET),
    SCHEDULER("分析 %s 场景下的调度流程", "operation", "调用链", ChainStyle.ARROW),
    NETWORK_RX("分析 %s 网络收包流程", "flow", "完整流程", ChainStyle.NUMBERED),
    POWER("分析 %s 电源管理流程", "operation", "调用链", ChainStyle.ARROW);

    /** String.format template taking the scenario name. */
    public final String instructionTemplate;
    /** Metadata key the scenario name is recorded under. */
    public final String metadataKey;
    public final String chainLabel;
    public final ChainStyle chainStyle;

    ScenarioCategory(String instructionTemplate, String metadataKey, String chainLabel, ChainStyle chainStyle) {
        this.instructionTemplate = instructionTemplate;
        this.metadataKey = metadataKey;
        this.chainLabel = chainLabel;
        this.chainStyle = chainStyle;
    }

    public String instruction(String name) {
        return String.format(instructionTemplate, name);
    }
}
