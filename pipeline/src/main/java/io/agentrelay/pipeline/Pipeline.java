package io.agentrelay.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed sequence of stages, ready to run.
 */
public class Pipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);

    private final PipelineOrchestrator orchestrator;
    private final List<PipelineStage> stages;
    private final @Nullable Duration deadline;

    public Pipeline(PipelineOrchestrator orchestrator, List<PipelineStage> stages, @Nullable Duration deadline) {
        Assert.checkNotNullParam("orchestrator", orchestrator);
        Assert.checkNotNullParam("stages", stages);
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("Parameter 'stages' may not be empty");
        }
        this.orchestrator = orchestrator;
        this.stages = List.copyOf(stages);
        this.deadline = deadline;
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    /**
     * Probes every stage's agent, in order.
     *
     * @return the names of the stages whose agent did not answer its health check
     */
    public List<String> unhealthyStages() {
        List<String> unhealthy = new ArrayList<>();
        for (PipelineStage stage : stages) {
            if (!stage.relay().isHealthy()) {
                LOGGER.warn("Agent of stage '{}' is not healthy", stage.name());
                unhealthy.add(stage.name());
            }
        }
        return unhealthy;
    }

    public PipelineResult execute(String input) throws StageFailedException {
        return orchestrator.execute(stages, input, deadline);
    }

    public String run(String input) throws StageFailedException {
        return execute(input).output();
    }
}
