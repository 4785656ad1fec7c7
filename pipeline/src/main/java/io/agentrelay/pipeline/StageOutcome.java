package io.agentrelay.pipeline;

import java.time.Duration;

/**
 * What one stage produced.
 *
 * @param stageIndex zero-based position of the stage
 * @param stageName the stage name
 * @param outputLength number of characters the stage returned
 * @param preview the start of the output, as produced by {@link TextPreview#of(String)}
 * @param elapsed time spent in the stage
 */
public record StageOutcome(int stageIndex, String stageName, int outputLength, String preview, Duration elapsed) {
}
