package io.agentrelay.pipeline;

import io.agentrelay.client.TextRelay;
import io.agentrelay.util.Assert;

/**
 * A named step of a pipeline.
 *
 * @param name the stage name used in logs and errors
 * @param relay the agent invoked by this stage
 */
public record PipelineStage(String name, TextRelay relay) {

    public PipelineStage {
        Assert.checkNotNullParam("name", name);
        Assert.checkNotNullParam("relay", relay);
    }
}
