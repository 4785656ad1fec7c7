package io.agentrelay.pipeline;

import io.agentrelay.spec.RelayException;

/**
 * A pipeline stage failed; the stages after it were not started.
 * <p>
 * The cause is the {@link RelayException} raised by the stage's relay.
 */
public class StageFailedException extends RelayException {

    private final int stageIndex;
    private final String stageName;

    public StageFailedException(final int stageIndex, final String stageName, final RelayException cause) {
        super("Stage " + stageIndex + " (" + stageName + ") failed: " + cause.getMessage(), cause);
        this.stageIndex = stageIndex;
        this.stageName = stageName;
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public String getStageName() {
        return stageName;
    }

    @Override
    public synchronized RelayException getCause() {
        return (RelayException) super.getCause();
    }
}
