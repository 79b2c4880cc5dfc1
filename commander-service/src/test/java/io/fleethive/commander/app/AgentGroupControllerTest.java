package io.fleethive.commander.app;

import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleethive.controlplane.agent.AgentObservation;
import io.fleethive.controlplane.agent.InMemoryAgentInventory;
import io.fleethive.controlplane.connection.ConcurrentConnectionRegistry;
import io.fleethive.controlplane.connection.TransportType;
import io.fleethive.controlplane.group.InMemoryAgentGroupStore;
import io.fleethive.controlplane.group.PrioritySelectorResolver;
import io.fleethive.controlplane.pagination.ContinueTokenCodec;
import io.fleethive.controlplane.pagination.Paginator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AgentGroupControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper mapper = new JacksonConfiguration().objectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private InMemoryAgentInventory inventory;
    private ConcurrentConnectionRegistry registry;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        Paginator paginator = new Paginator(ContinueTokenCodec.withRandomKey());
        InMemoryAgentGroupStore store = new InMemoryAgentGroupStore(clock, paginator);
        inventory = new InMemoryAgentInventory(paginator);
        registry = new ConcurrentConnectionRegistry(Duration.ofSeconds(60), paginator);
        AgentGroupController controller = new AgentGroupController(store, new PrioritySelectorResolver(),
            inventory, new AgentViews(registry, clock));
        mvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(mapper))
            .build();
    }

    @Test
    void createsAndReadsGroups() throws Exception {
        create("prod", 10, "prod", "alice")
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.name").value("prod"))
            .andExpect(jsonPath("$.createdBy").value("alice"))
            .andExpect(jsonPath("$.remoteConfig.hash").isNotEmpty())
            .andExpect(jsonPath("$.conditions[0].type").value("Created"))
            .andExpect(jsonPath("$.deleted").value(false));

        mvc.perform(get("/api/v1/agentgroups/{name}", "prod"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.priority").value(10));
    }

    @Test
    void defaultsActingUserToAnonymous() throws Exception {
        mvc.perform(post("/api/v1/agentgroups")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"anon\",\"priority\":1}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.createdBy").value(ActingUser.ANONYMOUS));
    }

    @Test
    void duplicateAndInvalidNamesAreRejected() throws Exception {
        create("prod", 1, "prod", "alice").andExpect(status().isCreated());

        create("prod", 1, "prod", "bob").andExpect(status().isConflict());
        create("Bad_Name", 1, "prod", "bob").andExpect(status().isBadRequest());
        mvc.perform(get("/api/v1/agentgroups/{name}", "missing")).andExpect(status().isNotFound());
    }

    @Test
    void updateRecordsTheActor() throws Exception {
        create("prod", 1, "prod", "alice");

        mvc.perform(put("/api/v1/agentgroups/{name}", "prod")
                .contentType(MediaType.APPLICATION_JSON)
                .header(ActingUser.HEADER, "bob")
                .content("{\"priority\":5,\"selector\":{\"identifyingAttributes\":{\"env\":\"prod\"}}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.priority").value(5))
            .andExpect(jsonPath("$.conditions[1].type").value("Updated"))
            .andExpect(jsonPath("$.conditions[1].reason").value("bob"));

        mvc.perform(put("/api/v1/agentgroups/{name}", "prod")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"renamed\",\"priority\":5}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void deleteTombstonesAndHidesFromDefaultListing() throws Exception {
        create("a", 1, "prod", "alice");
        create("b", 1, "prod", "alice");

        mvc.perform(delete("/api/v1/agentgroups/{name}", "a").header(ActingUser.HEADER, "carol"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(true))
            .andExpect(jsonPath("$.deletedBy").value("carol"));

        mvc.perform(get("/api/v1/agentgroups"))
            .andExpect(jsonPath("$.items.length()").value(1))
            .andExpect(jsonPath("$.items[0].name").value("b"));
        mvc.perform(get("/api/v1/agentgroups").param("includeDeleted", "true"))
            .andExpect(jsonPath("$.items.length()").value(2));
        mvc.perform(get("/api/v1/agentgroups/{name}", "a"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(true));
    }

    @Test
    void resolvesTheEffectiveGroup() throws Exception {
        create("zeta", 5, "prod", "alice");
        create("alpha", 5, "prod", "alice");
        create("dev", 50, "dev", "alice");

        mvc.perform(post("/api/v1/agentgroups/resolve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"identifyingAttributes\":{\"env\":\"prod\",\"host\":\"n1\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.matched").value(true))
            .andExpect(jsonPath("$.agentGroup.name").value("alpha"));

        mvc.perform(post("/api/v1/agentgroups/resolve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"identifyingAttributes\":{\"env\":\"staging\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.matched").value(false))
            .andExpect(jsonPath("$.agentGroup").doesNotExist());
    }

    @Test
    void listsTheAgentsAGroupSelects() throws Exception {
        create("prod", 1, "prod", "alice");
        observe("agent-2", "prod");
        observe("agent-1", "prod");
        observe("agent-3", "dev");
        registry.register("c-1", TransportType.WEBSOCKET, NOW);
        registry.bindInstance("c-1", "agent-1");

        mvc.perform(get("/api/v1/agentgroups/{name}/agents", "prod").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items.length()").value(1))
            .andExpect(jsonPath("$.items[0].instanceUid").value("agent-1"))
            .andExpect(jsonPath("$.items[0].connected").value(true))
            .andExpect(jsonPath("$.remainingItemCount").value(1))
            .andExpect(jsonPath("$.continue").isNotEmpty());
        mvc.perform(get("/api/v1/agentgroups/{name}/agents", "prod"))
            .andExpect(jsonPath("$.items[*].instanceUid").value(contains("agent-1", "agent-2")))
            .andExpect(jsonPath("$.items[1].connected").value(false));
    }

    @Test
    void deletedOrUnknownGroupsSelectNoAgents() throws Exception {
        create("prod", 1, "prod", "alice");
        observe("agent-1", "prod");
        mvc.perform(delete("/api/v1/agentgroups/{name}", "prod"));

        mvc.perform(get("/api/v1/agentgroups/{name}/agents", "prod"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items.length()").value(0));
        mvc.perform(get("/api/v1/agentgroups/{name}/agents", "missing"))
            .andExpect(status().isNotFound());
    }

    private void observe(String instanceUid, String env) {
        inventory.observe(new AgentObservation(instanceUid, null, Map.of("env", env), null, null, null, NOW));
    }

    private ResultActions create(String name, int priority, String env, String user) throws Exception {
        String body = """
            {"name":"%s","priority":%d,
             "selector":{"identifyingAttributes":{"env":"%s"}},
             "remoteConfig":{"contentType":"application/yaml","body":"exporters: {}"}}
            """.formatted(name, priority, env);
        return mvc.perform(post("/api/v1/agentgroups")
            .contentType(MediaType.APPLICATION_JSON)
            .header(ActingUser.HEADER, user)
            .content(body));
    }
}
