package io.agentrelay.pipeline;

import java.util.List;

import io.agentrelay.client.HttpClientManager;
import io.agentrelay.client.RelayClient;
import io.agentrelay.client.RelayClientConfigBuilder;
import io.agentrelay.client.extraction.ConcatenatedEnvelopeSplitter;
import io.agentrelay.client.extraction.ExtractionListener;
import io.agentrelay.util.Assert;

/**
 * Builds pipelines from configuration.
 */
public final class PipelineFactory {

    public static final String RESEARCH_STAGE = "research";
    public static final String CONTENT_STAGE = "content";

    private PipelineFactory() {
    }

    /**
     * The two-stage pipeline: a research agent, whose output feeds a content agent.
     */
    public static Pipeline researchToContent(PipelineConfig config) {
        return researchToContent(config, new HttpClientManager(), ExtractionListener.NO_OP);
    }

    public static Pipeline researchToContent(PipelineConfig config, HttpClientManager clientManager,
                                             ExtractionListener listener) {
        Assert.checkNotNullParam("config", config);
        Assert.checkNotNullParam("clientManager", clientManager);
        Assert.checkNotNullParam("listener", listener);

        List<PipelineStage> stages = List.of(
                new PipelineStage(RESEARCH_STAGE, relay(config, config.getResearchUrl(), clientManager, listener)),
                new PipelineStage(CONTENT_STAGE, relay(config, config.getContentUrl(), clientManager, listener)));
        PipelineOrchestrator orchestrator =
                new PipelineOrchestrator(new ConcatenatedEnvelopeSplitter(listener), config.isDiscoverAgents());
        return new Pipeline(orchestrator, stages, config.getDeadline().orElse(null));
    }

    private static RelayClient relay(PipelineConfig config, String agentUrl, HttpClientManager clientManager,
                                     ExtractionListener listener) {
        return new RelayClient(clientManager.getOrCreate(agentUrl), new RelayClientConfigBuilder()
                .agentUrl(agentUrl)
                .requestTimeout(config.getRequestTimeout())
                .extractionListener(listener)
                .build());
    }
}
