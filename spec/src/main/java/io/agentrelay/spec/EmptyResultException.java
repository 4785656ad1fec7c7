package io.agentrelay.spec;

import io.agentrelay.common.RelayErrorMessages;

/**
 * A stream completed without producing any non-blank text.
 */
public class EmptyResultException extends RelayException {

    public EmptyResultException() {
        super(RelayErrorMessages.NO_CONTENT_RECEIVED);
    }

    public EmptyResultException(final String msg) {
        super(msg);
    }
}
