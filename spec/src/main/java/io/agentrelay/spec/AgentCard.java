package io.agentrelay.spec;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Capability document served by an agent at {@code /.well-known/agent.json}.
 * <p>
 * Only the fields the relay reports on are modelled; everything else an agent publishes
 * is ignored on deserialization.
 *
 * @param name the human-readable agent name (required)
 * @param description what the agent does (required)
 * @param version the agent version, if published
 * @param url the agent's primary endpoint, if published
 * @param defaultInputModes the input media types the agent accepts, if published
 * @param defaultOutputModes the output media types the agent produces, if published
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentCard(@JsonProperty("name") String name,
                        @JsonProperty("description") String description,
                        @JsonProperty("version") @Nullable String version,
                        @JsonProperty("url") @Nullable String url,
                        @JsonProperty("defaultInputModes") @Nullable List<String> defaultInputModes,
                        @JsonProperty("defaultOutputModes") @Nullable List<String> defaultOutputModes) {

    @JsonCreator
    public AgentCard {
        Assert.checkNotNullParam("name", name);
        Assert.checkNotNullParam("description", description);
        defaultInputModes = defaultInputModes != null ? List.copyOf(defaultInputModes) : null;
        defaultOutputModes = defaultOutputModes != null ? List.copyOf(defaultOutputModes) : null;
    }

    public AgentCard(String name, String description) {
        this(name, description, null, null, null, null);
    }
}
