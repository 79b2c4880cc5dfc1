package io.fleethive.fleet.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class FleetModelSerializationTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void listEnvelopeUsesContinueProperty() throws Exception {
        ListResponse<String> response = new ListResponse<>(List.of("a", "b"), "token", 3);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(response));

        assertThat(json.path("items").size()).isEqualTo(2);
        assertThat(json.path("continue").asText()).isEqualTo("token");
        assertThat(json.path("remainingItemCount").asLong()).isEqualTo(3);
    }

    @Test
    void listOptionsTreatBlankTokenAsFirstPage() throws Exception {
        ListOptions options = mapper.readValue("{\"limit\":10,\"continue\":\"  \"}", ListOptions.class);

        assertThat(options.limit()).isEqualTo(10);
        assertThat(options.hasContinueToken()).isFalse();
    }

    @Test
    void commandKindUsesWireNames() throws Exception {
        Command command = new Command(UUID.randomUUID(), CommandKind.UPDATE_AGENT_CONFIG, "agent-1",
            Map.of("remoteConfig", "x"), Instant.parse("2025-01-01T00:00:00Z"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(command));

        assertThat(json.path("kind").asText()).isEqualTo("UpdateAgentConfig");
        assertThat(CommandKind.fromWireName("restart")).isEqualTo(CommandKind.RESTART);
        assertThat(CommandKind.fromWireName("REPORT_FULL_STATE")).isEqualTo(CommandKind.REPORT_FULL_STATE);
    }

    @Test
    void conditionsSerializeAsOrderedList() throws Exception {
        Instant at = Instant.parse("2025-01-01T00:00:00Z");
        Conditions conditions = Conditions.none()
            .upsert(Condition.isTrue(ConditionType.DELETED, at, "bob", "gone"))
            .upsert(Condition.isTrue(ConditionType.CREATED, at, "alice", "made"));

        String json = mapper.writeValueAsString(conditions);
        Conditions restored = mapper.readValue(json, Conditions.class);

        assertThat(mapper.readTree(json).get(0).path("type").asText()).isEqualTo("Created");
        assertThat(restored).isEqualTo(conditions);
    }
}
