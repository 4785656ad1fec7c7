package io.agentrelay.server.message;

import io.agentrelay.client.extraction.ConcatenatedEnvelopeSplitter;
import io.agentrelay.spec.InboundMessage;
import io.agentrelay.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the input text of a downstream agent.
 * <p>
 * An upstream agent may forward its raw stream envelopes instead of their text. When the
 * message text still carries envelopes it is passed through
 * {@link ConcatenatedEnvelopeSplitter#recoverText(String)}.
 */
public class InboundTextResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(InboundTextResolver.class);

    private final ConcatenatedEnvelopeSplitter splitter;

    public InboundTextResolver() {
        this(new ConcatenatedEnvelopeSplitter());
    }

    public InboundTextResolver(ConcatenatedEnvelopeSplitter splitter) {
        Assert.checkNotNullParam("splitter", splitter);
        this.splitter = splitter;
    }

    public String resolve(InboundMessage message) {
        String text = MessageTextExtractor.extractText(message);
        if (!ConcatenatedEnvelopeSplitter.containsEnvelopes(text)) {
            return text;
        }
        LOGGER.info("Inbound message of {} characters carries raw envelopes, recovering text", text.length());
        return splitter.recoverText(text);
    }
}
