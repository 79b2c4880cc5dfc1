package io.fleethive.commander.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleethive.commander.config.CommanderProperties;
import io.fleethive.controlplane.agent.AgentInventory;
import io.fleethive.controlplane.agent.InMemoryAgentInventory;
import io.fleethive.controlplane.command.CommandAuditLog;
import io.fleethive.controlplane.command.CommandDeliveryTracker;
import io.fleethive.controlplane.command.InMemoryCommandAuditLog;
import io.fleethive.controlplane.connection.ConcurrentConnectionRegistry;
import io.fleethive.controlplane.connection.ConnectionRegistry;
import io.fleethive.controlplane.group.AgentGroupStore;
import io.fleethive.controlplane.group.InMemoryAgentGroupStore;
import io.fleethive.controlplane.group.PrioritySelectorResolver;
import io.fleethive.controlplane.group.SelectorResolver;
import io.fleethive.controlplane.pagination.ContinueTokenCodec;
import io.fleethive.controlplane.pagination.Paginator;
import io.fleethive.controlplane.protocol.AgentMessageCodec;
import io.fleethive.controlplane.session.SessionHandler;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free control-plane core into the application context.
 */
@Configuration
public class FleetConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FleetConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ContinueTokenCodec continueTokenCodec(CommanderProperties properties, ObjectMapper objectMapper) {
        CommanderProperties.Pagination pagination = properties.getPagination();
        if (!pagination.hasSecret()) {
            log.warn("No fleethive.commander.pagination.secret configured; continue tokens will not survive a restart");
            return ContinueTokenCodec.withRandomKey();
        }
        return new ContinueTokenCodec(pagination.getSecret().getBytes(StandardCharsets.UTF_8), objectMapper);
    }

    @Bean
    public Paginator paginator(ContinueTokenCodec codec, CommanderProperties properties) {
        CommanderProperties.Pagination pagination = properties.getPagination();
        return new Paginator(codec, pagination.getDefaultLimit(), pagination.getMaxLimit());
    }

    @Bean
    public ConnectionRegistry connectionRegistry(CommanderProperties properties, Paginator paginator) {
        return new ConcurrentConnectionRegistry(properties.getConnections().getLivenessThreshold(), paginator);
    }

    @Bean
    @ConditionalOnProperty(name = "fleethive.commander.storage.sink", havingValue = CommanderProperties.SINK_MEMORY,
        matchIfMissing = true)
    public CommandAuditLog inMemoryCommandAuditLog(Clock clock, Paginator paginator) {
        log.info("[CTRL] command audit log sink=memory");
        return new InMemoryCommandAuditLog(clock, paginator);
    }

    @Bean
    public CommandDeliveryTracker commandDeliveryTracker() {
        return new CommandDeliveryTracker();
    }

    @Bean
    public AgentGroupStore agentGroupStore(Clock clock, Paginator paginator) {
        return new InMemoryAgentGroupStore(clock, paginator);
    }

    @Bean
    public AgentInventory agentInventory(Paginator paginator) {
        return new InMemoryAgentInventory(paginator);
    }

    @Bean
    public SelectorResolver selectorResolver() {
        return new PrioritySelectorResolver();
    }

    @Bean
    public AgentMessageCodec agentMessageCodec(ObjectMapper objectMapper) {
        return new AgentMessageCodec(objectMapper);
    }

    @Bean
    public SessionHandler sessionHandler(ConnectionRegistry registry,
                                         CommandAuditLog commandLog,
                                         CommandDeliveryTracker deliveryTracker,
                                         AgentGroupStore groupStore,
                                         SelectorResolver resolver,
                                         AgentMessageCodec codec,
                                         AgentInventory inventory,
                                         Clock clock,
                                         CommanderProperties properties) {
        return SessionHandler.builder()
            .registry(registry)
            .commandLog(commandLog)
            .deliveryTracker(deliveryTracker)
            .groupStore(groupStore)
            .resolver(resolver)
            .codec(codec)
            .inventory(inventory)
            .clock(clock)
            .maxCommandsPerReply(properties.getSession().getMaxCommandsPerReply())
            .build();
    }
}
