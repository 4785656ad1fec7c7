package io.agentrelay.client.extraction;

import java.util.ArrayList;
import java.util.List;

import io.agentrelay.spec.EmptyResultException;
import io.agentrelay.util.Assert;

/**
 * Collects the fragments of one invocation in delivery order.
 * <p>
 * Owned by a single invocation and fed from its stream callbacks, which never run concurrently.
 * It is not safe to share between invocations.
 */
public class ResultAccumulator {

    private final List<TextFragment> fragments = new ArrayList<>();
    private boolean finished;

    /**
     * Appends a fragment. Blank fragments are dropped.
     *
     * @param fragment the fragment
     * @return whether the fragment was kept
     * @throws IllegalStateException if the result was already finished
     */
    public boolean add(TextFragment fragment) {
        Assert.checkNotNullParam("fragment", fragment);
        if (finished) {
            throw new IllegalStateException("Result already finished");
        }
        if (fragment.text().isBlank()) {
            return false;
        }
        fragments.add(fragment);
        return true;
    }

    public boolean hasFragments() {
        return !fragments.isEmpty();
    }

    public int fragmentCount() {
        return fragments.size();
    }

    /**
     * Joins all fragments with no separator and trims the result. Can be called once.
     *
     * @return the non-empty result text
     * @throws EmptyResultException if no fragment was kept or the joined text is blank
     * @throws IllegalStateException if the result was already finished
     */
    public String finish() throws EmptyResultException {
        if (finished) {
            throw new IllegalStateException("Result already finished");
        }
        finished = true;

        StringBuilder text = new StringBuilder();
        for (TextFragment fragment : fragments) {
            text.append(fragment.text());
        }
        String result = text.toString().trim();
        if (result.isEmpty()) {
            throw new EmptyResultException();
        }
        return result;
    }
}
