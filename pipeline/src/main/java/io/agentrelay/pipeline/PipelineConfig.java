package io.agentrelay.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import io.agentrelay.client.RelayClientConfig;
import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Settings of the research to content pipeline.
 * <p>
 * Values are read from {@value #PROPERTIES_RESOURCE} on the classpath, and each of them can be
 * overridden by an environment variable:
 * <table>
 *   <caption>Configuration keys</caption>
 *   <tr><th>Property</th><th>Environment variable</th><th>Default</th></tr>
 *   <tr><td>{@value #RESEARCH_URL_PROPERTY}</td><td>{@value #RESEARCH_URL_ENV}</td><td>{@value #DEFAULT_RESEARCH_URL}</td></tr>
 *   <tr><td>{@value #CONTENT_URL_PROPERTY}</td><td>{@value #CONTENT_URL_ENV}</td><td>{@value #DEFAULT_CONTENT_URL}</td></tr>
 *   <tr><td>{@value #TIMEOUT_PROPERTY}</td><td>{@value #TIMEOUT_ENV}</td><td>300</td></tr>
 *   <tr><td>{@value #DEADLINE_PROPERTY}</td><td></td><td>none</td></tr>
 *   <tr><td>{@value #DISCOVER_PROPERTY}</td><td></td><td>true</td></tr>
 * </table>
 */
public class PipelineConfig {

    public static final String PROPERTIES_RESOURCE = "agent-relay.properties";

    public static final String RESEARCH_URL_PROPERTY = "agent-relay.research.url";
    public static final String CONTENT_URL_PROPERTY = "agent-relay.content.url";
    public static final String TIMEOUT_PROPERTY = "agent-relay.timeout.seconds";
    public static final String DEADLINE_PROPERTY = "agent-relay.deadline.seconds";
    public static final String DISCOVER_PROPERTY = "agent-relay.discover";

    public static final String RESEARCH_URL_ENV = "AGENT_RELAY_RESEARCH_URL";
    public static final String CONTENT_URL_ENV = "AGENT_RELAY_CONTENT_URL";
    public static final String TIMEOUT_ENV = "AGENT_RELAY_TIMEOUT_SECONDS";

    public static final String DEFAULT_RESEARCH_URL = "http://localhost:8003";
    public static final String DEFAULT_CONTENT_URL = "http://localhost:8004";

    private final String researchUrl;
    private final String contentUrl;
    private final Duration requestTimeout;
    private final @Nullable Duration deadline;
    private final boolean discoverAgents;

    private PipelineConfig(Builder builder) {
        this.researchUrl = builder.researchUrl;
        this.contentUrl = builder.contentUrl;
        this.requestTimeout = builder.requestTimeout;
        this.deadline = builder.deadline;
        this.discoverAgents = builder.discoverAgents;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@value #PROPERTIES_RESOURCE} from the classpath, if present, and applies the
     * environment overrides.
     */
    public static PipelineConfig load() {
        Properties properties = new Properties();
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = PipelineConfig.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PROPERTIES_RESOURCE, e);
        }
        return fromProperties(properties);
    }

    public static PipelineConfig fromProperties(Properties properties) {
        return fromProperties(properties, System::getenv);
    }

    static PipelineConfig fromProperties(Properties properties, Function<String, @Nullable String> environment) {
        Assert.checkNotNullParam("properties", properties);
        Builder builder = builder()
                .researchUrl(getEnvOrDefault(environment, RESEARCH_URL_ENV,
                        properties.getProperty(RESEARCH_URL_PROPERTY, DEFAULT_RESEARCH_URL)))
                .contentUrl(getEnvOrDefault(environment, CONTENT_URL_ENV,
                        properties.getProperty(CONTENT_URL_PROPERTY, DEFAULT_CONTENT_URL)));

        String timeout = getEnvOrDefault(environment, TIMEOUT_ENV, properties.getProperty(TIMEOUT_PROPERTY));
        if (timeout != null) {
            builder.requestTimeout(Duration.ofSeconds(parseSeconds(TIMEOUT_PROPERTY, timeout)));
        }
        String deadline = properties.getProperty(DEADLINE_PROPERTY);
        if (deadline != null && !deadline.isBlank()) {
            builder.deadline(Duration.ofSeconds(parseSeconds(DEADLINE_PROPERTY, deadline)));
        }
        String discover = properties.getProperty(DISCOVER_PROPERTY);
        if (discover != null && !discover.isBlank()) {
            builder.discoverAgents(Boolean.parseBoolean(discover.trim()));
        }
        return builder.build();
    }

    private static @Nullable String getEnvOrDefault(Function<String, @Nullable String> environment, String envVar,
                                                    @Nullable String defaultValue) {
        String value = environment.apply(envVar);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static long parseSeconds(String name, String value) {
        long seconds;
        try {
            seconds = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + name + "': " + value, e);
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException("Value of '" + name + "' must be positive, was " + seconds);
        }
        return seconds;
    }

    public String getResearchUrl() {
        return researchUrl;
    }

    public String getContentUrl() {
        return contentUrl;
    }

    /**
     * Bound on each agent invocation.
     */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Bound on a whole pipeline run, if any.
     */
    public Optional<Duration> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isDiscoverAgents() {
        return discoverAgents;
    }

    public static class Builder {
        private String researchUrl = DEFAULT_RESEARCH_URL;
        private String contentUrl = DEFAULT_CONTENT_URL;
        private Duration requestTimeout = RelayClientConfig.DEFAULT_REQUEST_TIMEOUT;
        private @Nullable Duration deadline;
        private boolean discoverAgents = true;

        private Builder() {
        }

        public Builder researchUrl(String researchUrl) {
            this.researchUrl = Assert.checkNotNullParam("researchUrl", researchUrl);
            return this;
        }

        public Builder contentUrl(String contentUrl) {
            this.contentUrl = Assert.checkNotNullParam("contentUrl", contentUrl);
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = Assert.checkPositiveParam("requestTimeout", requestTimeout);
            return this;
        }

        public Builder deadline(@Nullable Duration deadline) {
            this.deadline = deadline == null ? null : Assert.checkPositiveParam("deadline", deadline);
            return this;
        }

        public Builder discoverAgents(boolean discoverAgents) {
            this.discoverAgents = discoverAgents;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
