package io.agentrelay.pipeline;

import java.util.List;

import io.agentrelay.util.Assert;

/**
 * The final output of a pipeline run together with the outcome of every stage.
 */
public record PipelineResult(String output, List<StageOutcome> stages) {

    public PipelineResult {
        Assert.checkNotNullParam("output", output);
        stages = List.copyOf(Assert.checkNotNullParam("stages", stages));
    }
}
