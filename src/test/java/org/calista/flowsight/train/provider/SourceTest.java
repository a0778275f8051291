package org.calista.flowsight.train.provider;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceTest {

    @Test
    void valuesAndAliases() {
        assertThat(Source.fromValue("knowledge-base")).isEqualTo(Source.KNOWLEDGE_BASE);
        assertThat(Source.fromValue("knowledge")).isEqualTo(Source.KNOWLEDGE_BASE);
        assertThat(Source.fromValue("kernel")).isEqualTo(Source.SOURCE_TREE);
        assertThat(Source.fromValue(" LLM ")).isEqualTo(Source.ASSISTED);
        assertThat(Source.fromValue("curated")).isEqualTo(Source.CURATED);
        assertThat(Source.fromValue("all")).isEqualTo(Source.ALL);
        assertThat(Source.SOURCE_TREE).hasToString("source-tree");
    }

    @Test
    void unknownValueIsRejected() {
        assertThatThrownBy(() -> Source.fromValue("web")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("web");
        assertThatThrownBy(() -> Source.fromValue(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void allIncludesEveryStage() {
        for (Source s : Source.values()) assertThat(Source.ALL.includes(s)).isTrue();
        assertThat(Source.CURATED.includes(Source.CURATED)).isTrue();
        assertThat(Source.CURATED.includes(Source.KNOWLEDGE_BASE)).isFalse();
    }
}
