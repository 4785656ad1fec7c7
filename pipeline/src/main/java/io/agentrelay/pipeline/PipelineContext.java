package io.agentrelay.pipeline;

import io.agentrelay.util.Assert;

/**
 * The text flowing between stages, and the index of the stage about to consume it.
 */
public record PipelineContext(int stageIndex, String text) {

    public PipelineContext {
        Assert.checkNotNullParam("text", text);
    }

    public static PipelineContext initial(String text) {
        return new PipelineContext(0, text);
    }

    public PipelineContext advance(String output) {
        return new PipelineContext(stageIndex + 1, output);
    }
}
