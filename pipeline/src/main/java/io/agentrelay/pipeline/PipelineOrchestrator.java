package io.agentrelay.pipeline;

import static io.agentrelay.common.RelayErrorMessages.INVOCATION_TIMED_OUT;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.agentrelay.client.RelayFutures;
import io.agentrelay.client.extraction.ConcatenatedEnvelopeSplitter;
import io.agentrelay.spec.AgentCard;
import io.agentrelay.spec.RelayCancelledException;
import io.agentrelay.spec.RelayException;
import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs stages one after the other, feeding each stage's output to the next.
 * <p>
 * The first failing stage ends the run with a {@link StageFailedException}; later stages are
 * never started. Output that still carries raw stream envelopes is recovered to plain text
 * before it is handed to the next stage.
 */
public class PipelineOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final ConcatenatedEnvelopeSplitter splitter;
    private final boolean discoverAgents;

    public PipelineOrchestrator() {
        this(new ConcatenatedEnvelopeSplitter(), false);
    }

    /**
     * @param splitter recovers text from forwarded envelopes between stages
     * @param discoverAgents whether to look up each stage's agent card before invoking it
     */
    public PipelineOrchestrator(ConcatenatedEnvelopeSplitter splitter, boolean discoverAgents) {
        Assert.checkNotNullParam("splitter", splitter);
        this.splitter = splitter;
        this.discoverAgents = discoverAgents;
    }

    public String run(List<PipelineStage> stages, String input) throws StageFailedException {
        return execute(stages, input, null).output();
    }

    public String run(List<PipelineStage> stages, String input, Duration deadline) throws StageFailedException {
        Assert.checkPositiveParam("deadline", deadline);
        return execute(stages, input, deadline).output();
    }

    /**
     * Runs the stages and reports the outcome of each one.
     *
     * @param stages the stages, in order; must not be empty
     * @param input the input of the first stage
     * @param deadline optional bound on the whole run; the time left is applied to every stage
     * @return the output of the last stage and the per-stage outcomes
     * @throws StageFailedException if a stage fails, naming the stage
     */
    public PipelineResult execute(List<PipelineStage> stages, String input, @Nullable Duration deadline)
            throws StageFailedException {
        Assert.checkNotNullParam("stages", stages);
        Assert.checkNotNullParam("input", input);
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("Parameter 'stages' may not be empty");
        }

        long deadlineNanos = deadline == null ? 0 : System.nanoTime() + deadline.toNanos();
        List<StageOutcome> outcomes = new ArrayList<>(stages.size());
        PipelineContext context = PipelineContext.initial(input);

        for (PipelineStage stage : stages) {
            int index = context.stageIndex();
            String stageInput = context.text();
            if (index > 0 && ConcatenatedEnvelopeSplitter.containsEnvelopes(stageInput)) {
                LOGGER.warn("Output of stage {} still carries raw envelopes, recovering text", index - 1);
                stageInput = splitter.recoverText(stageInput);
            }

            if (discoverAgents) {
                discover(stage, index, deadline, deadlineNanos).ifPresent(card ->
                        LOGGER.info("Stage {} ({}) uses agent '{}'", index, stage.name(), card.name()));
            }

            LOGGER.info("Starting stage {} ({}) with {} characters of input", index, stage.name(), stageInput.length());
            long started = System.nanoTime();
            String output;
            try {
                output = invoke(stage, stageInput, deadline, deadlineNanos);
            } catch (RelayException e) {
                LOGGER.error("Stage {} ({}) failed: {}", index, stage.name(), e.getMessage());
                throw new StageFailedException(index, stage.name(), e);
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            String preview = TextPreview.of(output);
            LOGGER.info("Stage {} ({}) completed with {} characters in {} ms",
                    index, stage.name(), output.length(), elapsed.toMillis());
            LOGGER.debug("Stage {} ({}) output preview: {}", index, stage.name(), preview);

            outcomes.add(new StageOutcome(index, stage.name(), output.length(), preview, elapsed));
            context = context.advance(output);
        }
        return new PipelineResult(context.text(), outcomes);
    }

    private static Optional<AgentCard> discover(PipelineStage stage, int index, @Nullable Duration deadline,
                                                long deadlineNanos) {
        if (deadline == null) {
            return stage.relay().discover();
        }
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            LOGGER.debug("Skipping discovery for stage {} ({}), pipeline deadline expired", index, stage.name());
            return Optional.empty();
        }
        return stage.relay().discover(Duration.ofNanos(remaining));
    }

    private static String invoke(PipelineStage stage, String input, @Nullable Duration deadline, long deadlineNanos)
            throws RelayException {
        if (deadline == null) {
            return stage.relay().invoke(input);
        }
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new RelayCancelledException(INVOCATION_TIMED_OUT + ": pipeline deadline of " + deadline + " expired");
        }
        return RelayFutures.await(stage.relay().invokeAsync(input), Duration.ofNanos(remaining));
    }
}
