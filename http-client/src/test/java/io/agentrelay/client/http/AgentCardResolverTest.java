package io.agentrelay.client.http;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.agentrelay.spec.AgentCard;
import io.agentrelay.spec.AgentCardResolutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AgentCardResolverTest {

    private static final String AGENT_CARD_PATH = "/.well-known/agent.json";

    private static final String AGENT_CARD = """
            {
              "name": "Research Agent",
              "description": "Researches a topic and returns a summary",
              "version": "1.0.0",
              "url": "http://localhost:8003/",
              "defaultInputModes": ["text"],
              "defaultOutputModes": ["text"],
              "capabilities": {"streaming": true},
              "skills": [{"id": "research", "name": "Research"}]
            }""";

    private WireMockServer server;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    public void testConstructorStripsSlashes() throws Exception {
        String baseUrl = "http://localhost:" + server.port();
        HttpClient client = HttpClient.createHttpClient(baseUrl);

        assertEquals(AGENT_CARD_PATH, new AgentCardResolver(client, null, null).getAgentCardPath());
        assertEquals(AGENT_CARD_PATH, new AgentCardResolver(client, AGENT_CARD_PATH, null).getAgentCardPath());
        assertEquals(AGENT_CARD_PATH, new AgentCardResolver(baseUrl).getAgentCardPath());
        assertEquals(AGENT_CARD_PATH, new AgentCardResolver(baseUrl + "/").getAgentCardPath());
        assertEquals(AGENT_CARD_PATH, new AgentCardResolver(baseUrl + AGENT_CARD_PATH).getAgentCardPath());
        assertEquals("/subpath" + AGENT_CARD_PATH, new AgentCardResolver(baseUrl + "/subpath").getAgentCardPath());
        assertEquals("/subpath" + AGENT_CARD_PATH, new AgentCardResolver(baseUrl + "/subpath/").getAgentCardPath());
        assertEquals("/subpath" + AGENT_CARD_PATH, new AgentCardResolver(client, "/subpath/", null).getAgentCardPath());
    }

    @Test
    public void testGetAgentCardSuccess() throws Exception {
        givenThat(get(urlPathEqualTo(AGENT_CARD_PATH))
                .willReturn(okForContentType("application/json", AGENT_CARD)));

        AgentCardResolver resolver = new AgentCardResolver("http://localhost:" + server.port());
        AgentCard card = resolver.getAgentCard();

        assertEquals("Research Agent", card.name());
        assertEquals("Researches a topic and returns a summary", card.description());
        assertEquals("1.0.0", card.version());
        assertEquals(List.of("text"), card.defaultOutputModes());

        verify(getRequestedFor(urlEqualTo(AGENT_CARD_PATH))
                .withHeader("Content-Type", equalTo("application/json")));
    }

    @Test
    public void testGetAgentCardFromSubpath() throws Exception {
        givenThat(get(urlPathEqualTo("/agents/research" + AGENT_CARD_PATH))
                .willReturn(okForContentType("application/json", AGENT_CARD)));

        AgentCardResolver resolver = new AgentCardResolver("http://localhost:" + server.port() + "/agents/research");
        AgentCard card = resolver.getAgentCard();

        assertEquals("Research Agent", card.name());
        verify(getRequestedFor(urlEqualTo("/agents/research" + AGENT_CARD_PATH)));
    }

    @Test
    public void testGetAgentCardSendsAuthHeaders() throws Exception {
        givenThat(get(urlPathEqualTo(AGENT_CARD_PATH))
                .willReturn(okForContentType("application/json", AGENT_CARD)));

        HttpClient client = HttpClient.createHttpClient("http://localhost:" + server.port());
        AgentCardResolver resolver = new AgentCardResolver(client, null, Map.of("Authorization", "Bearer token"));
        resolver.getAgentCard();

        verify(getRequestedFor(urlEqualTo(AGENT_CARD_PATH))
                .withHeader("Authorization", equalTo("Bearer token")));
    }

    @Test
    public void testGetAgentCardJsonDecodeError() {
        givenThat(get(urlPathEqualTo(AGENT_CARD_PATH))
                .willReturn(okForContentType("application/json", "{invalid")));

        AgentCardResolver resolver = new AgentCardResolver(
                HttpClient.createHttpClient("http://localhost:" + server.port()), null, null);

        AgentCardResolutionException exception = assertThrows(AgentCardResolutionException.class,
                resolver::getAgentCard);
        assertEquals("Could not unmarshal agent card response", exception.getMessage());
    }

    @Test
    public void testGetAgentCardMissingRequiredField() {
        givenThat(get(urlPathEqualTo(AGENT_CARD_PATH))
                .willReturn(okForContentType("application/json", "{\"description\":\"no name\"}")));

        AgentCardResolver resolver = new AgentCardResolver(
                HttpClient.createHttpClient("http://localhost:" + server.port()), null, null);

        assertThrows(AgentCardResolutionException.class, resolver::getAgentCard);
    }

    @Test
    public void testGetAgentCardRequestError() {
        givenThat(get(urlPathEqualTo(AGENT_CARD_PATH))
                .willReturn(status(503)));

        AgentCardResolver resolver = new AgentCardResolver(
                HttpClient.createHttpClient("http://localhost:" + server.port()), null, null);

        AgentCardResolutionException exception = assertThrows(AgentCardResolutionException.class,
                resolver::getAgentCard);
        assertTrue(exception.getMessage().contains("503"));
    }
}
