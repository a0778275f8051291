package org.calista.flowsight.train.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.flowsight.train.sample.MetadataKeys;
import org.calista.flowsight.train.sample.TaskKind;
import org.calista.flowsight.train.sample.TrainingRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssistedSampleProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void noBackendMeansNoRecords() throws Exception {
        assertThat(new AssistedSampleProvider(null, mapper, 5).provide()).isEmpty();
    }

    @Test
    void repliesBecomeRecordsPerPromptFamily() throws Exception {
        List<String> prompts = new ArrayList<>();
        TextGenerationBackend backend = prompt -> {
            prompts.add(prompt);
            if (prompt.equals(AssistedSampleProvider.Prompt.ASYNC_PATTERN.text)) {
                return "{\"code\":\"INIT_WORK(&w, f);\",\"pattern\":\"workqueue\",\"question\":\"q\",\"answer\":\"a\"}";
            }
            return "{\"code\":\"int (*fp)(void) = f;\",\"question\":\"fp 指向谁？\",\"answer\":\"f\"}";
        };

        List<TrainingRecord> out = new AssistedSampleProvider(backend, mapper, 2).provide();

        assertThat(prompts).hasSize(4);
        assertThat(out).extracting(r -> r.task).containsExactly(
                TaskKind.FUNCTION_POINTER_TARGET, TaskKind.FUNCTION_POINTER_TARGET,
                TaskKind.ASYNC_PATTERN, TaskKind.ASYNC_PATTERN);
        assertThat(out.get(0).metadata).containsEntry(MetadataKeys.SOURCE, "assisted")
                .doesNotContainKey(MetadataKeys.PATTERN);
        assertThat(out.get(2).metadata).containsEntry(MetadataKeys.PATTERN, "workqueue");
    }

    @Test
    void unusableRepliesAreDropped() throws Exception {
        String[] replies = {"not json", "{\"question\":\"q\"}", "", "{\"question\":\"q\",\"answer\":\"a\"}"};
        int[] i = {0};
        TextGenerationBackend backend = prompt -> replies[i[0]++ % replies.length];

        List<TrainingRecord> out = new AssistedSampleProvider(backend, mapper, 2).provide();
        assertThat(out).hasSize(1);
        assertThat(out.get(0).task).isEqualTo(TaskKind.ASYNC_PATTERN);
    }

    @Test
    void backendFailurePropagates() {
        TextGenerationBackend backend = prompt -> {
            throw new IOException("endpoint down");
        };
        assertThatThrownBy(() -> new AssistedSampleProvider(backend, mapper, 1).provide())
                .isInstanceOf(IOException.class);
    }
}
