package io.fleethive.commander.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleethive.controlplane.agent.AgentObservation;
import io.fleethive.controlplane.agent.InMemoryAgentInventory;
import io.fleethive.controlplane.connection.ConcurrentConnectionRegistry;
import io.fleethive.controlplane.connection.TransportType;
import io.fleethive.controlplane.pagination.ContinueTokenCodec;
import io.fleethive.controlplane.pagination.Paginator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AgentControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper mapper = new JacksonConfiguration().objectMapper();
    private InMemoryAgentInventory inventory;
    private ConcurrentConnectionRegistry registry;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        Paginator paginator = new Paginator(ContinueTokenCodec.withRandomKey());
        inventory = new InMemoryAgentInventory(paginator);
        registry = new ConcurrentConnectionRegistry(Duration.ofSeconds(60), paginator);
        AgentController controller = new AgentController(inventory, new AgentViews(registry, clock));
        mvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(mapper))
            .build();
    }

    @Test
    void showsOneAgentWithItsConnectivity() throws Exception {
        inventory.observe(new AgentObservation("agent-1", "c-1", Map.of("env", "prod"), Map.of("host", "n1"),
            "abc123", "prod", NOW.minusSeconds(30)));
        registry.register("c-1", TransportType.WEBSOCKET, NOW.minusSeconds(90));
        registry.bindInstance("c-1", "agent-1");

        mvc.perform(get("/api/v1/agents/{uid}", "agent-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.instanceUid").value("agent-1"))
            .andExpect(jsonPath("$.identifyingAttributes.env").value("prod"))
            .andExpect(jsonPath("$.nonIdentifyingAttributes.host").value("n1"))
            .andExpect(jsonPath("$.reportedConfigHash").value("abc123"))
            .andExpect(jsonPath("$.effectiveGroup").value("prod"))
            .andExpect(jsonPath("$.connected").value(false));

        mvc.perform(get("/api/v1/agents/{uid}", "nobody")).andExpect(status().isNotFound());
    }

    @Test
    void pagesThroughAllAgentsInUidOrder() throws Exception {
        for (String uid : List.of("c", "a", "e", "b", "d")) {
            inventory.observe(new AgentObservation(uid, null, Map.of(), null, null, null, NOW));
        }

        List<String> seen = new ArrayList<>();
        String token = "";
        do {
            JsonNode page = mapper.readTree(mvc.perform(get("/api/v1/agents")
                    .param("limit", "2")
                    .param("continue", token))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());
            page.path("items").forEach(item -> seen.add(item.path("instanceUid").asText()));
            token = page.path("continue").asText();
        } while (!token.isEmpty());

        assertThat(seen).containsExactly("a", "b", "c", "d", "e");
    }

    @Test
    void tamperedTokenIsABadRequest() throws Exception {
        mvc.perform(get("/api/v1/agents").param("continue", "not-a-token"))
            .andExpect(status().isBadRequest());
    }
}
