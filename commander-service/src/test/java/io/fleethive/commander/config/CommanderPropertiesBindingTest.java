package io.fleethive.commander.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.ConfigurationPropertiesBindException;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class CommanderPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(TestConfiguration.class);

    @Test
    void bindsCommanderTree() {
        contextRunner
            .withPropertyValues(
                "fleethive.commander.connections.liveness-threshold=PT90S",
                "fleethive.commander.connections.reaper-interval=PT5S",
                "fleethive.commander.pagination.secret=0123456789abcdef0123",
                "fleethive.commander.pagination.default-limit=50",
                "fleethive.commander.pagination.max-limit=500",
                "fleethive.commander.session.max-commands-per-reply=8",
                "fleethive.commander.storage.sink=Postgres")
            .run(context -> {
                assertThat(context).hasNotFailed();
                CommanderProperties properties = context.getBean(CommanderProperties.class);
                assertThat(properties.getConnections().getLivenessThreshold()).isEqualTo(Duration.ofSeconds(90));
                assertThat(properties.getConnections().getReaperInterval()).isEqualTo(Duration.ofSeconds(5));
                assertThat(properties.getPagination().hasSecret()).isTrue();
                assertThat(properties.getPagination().getDefaultLimit()).isEqualTo(50);
                assertThat(properties.getPagination().getMaxLimit()).isEqualTo(500);
                assertThat(properties.getSession().getMaxCommandsPerReply()).isEqualTo(8);
                assertThat(properties.getStorage().getSink()).isEqualTo(CommanderProperties.SINK_POSTGRES);
            });
    }

    @Test
    void blankSecretMeansRandomKey() {
        contextRunner
            .withPropertyValues(
                "fleethive.commander.connections.liveness-threshold=PT60S",
                "fleethive.commander.connections.reaper-interval=PT15S",
                "fleethive.commander.pagination.secret=",
                "fleethive.commander.pagination.default-limit=100",
                "fleethive.commander.pagination.max-limit=1000",
                "fleethive.commander.session.max-commands-per-reply=16",
                "fleethive.commander.storage.sink=memory")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context.getBean(CommanderProperties.class).getPagination().hasSecret()).isFalse();
            });
    }

    @Test
    void failsOnUnknownSink() {
        contextRunner
            .withPropertyValues(
                "fleethive.commander.connections.liveness-threshold=PT60S",
                "fleethive.commander.connections.reaper-interval=PT15S",
                "fleethive.commander.pagination.default-limit=100",
                "fleethive.commander.pagination.max-limit=1000",
                "fleethive.commander.session.max-commands-per-reply=16",
                "fleethive.commander.storage.sink=cassandra")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .isInstanceOf(ConfigurationPropertiesBindException.class)
                    .hasRootCauseInstanceOf(IllegalArgumentException.class);
            });
    }

    @Test
    void failsWhenLivenessThresholdMissing() {
        contextRunner
            .withPropertyValues(
                "fleethive.commander.connections.reaper-interval=PT15S",
                "fleethive.commander.pagination.default-limit=100",
                "fleethive.commander.pagination.max-limit=1000",
                "fleethive.commander.session.max-commands-per-reply=16",
                "fleethive.commander.storage.sink=memory")
            .run(context -> {
                assertThat(context).hasFailed();
                Throwable root = context.getStartupFailure();
                while (root.getCause() != null) {
                    root = root.getCause();
                }
                assertThat(root.getMessage()).contains("livenessThreshold");
            });
    }

    @EnableConfigurationProperties(CommanderProperties.class)
    static class TestConfiguration {
    }
}
