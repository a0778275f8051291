package org.calista.flowsight.train.provider;

import java.io.IOException;

/** External text-generation service used by the assisted stage. */
@FunctionalInterface
public interface TextGenerationBackend {

    /** Completion for one prompt; expected to be a single JSON object. */
    String complete(String prompt) throws IOException;
}
