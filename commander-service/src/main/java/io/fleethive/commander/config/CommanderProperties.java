package io.fleethive.commander.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "fleethive.commander")
public class CommanderProperties {

    public static final String SINK_MEMORY = "memory";
    public static final String SINK_POSTGRES = "postgres";

    private final Connections connections;
    private final Pagination pagination;
    private final Session session;
    private final Storage storage;

    public CommanderProperties(@Valid Connections connections,
                               @Valid Pagination pagination,
                               @Valid Session session,
                               @Valid Storage storage) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.pagination = Objects.requireNonNull(pagination, "pagination");
        this.session = Objects.requireNonNull(session, "session");
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    public Connections getConnections() {
        return connections;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public Session getSession() {
        return session;
    }

    public Storage getStorage() {
        return storage;
    }

    @Validated
    public static final class Connections {

        private final Duration livenessThreshold;
        private final Duration reaperInterval;

        public Connections(@NotNull Duration livenessThreshold, @NotNull Duration reaperInterval) {
            this.livenessThreshold = requirePositive(livenessThreshold, "livenessThreshold");
            this.reaperInterval = requirePositive(reaperInterval, "reaperInterval");
        }

        public Duration getLivenessThreshold() {
            return livenessThreshold;
        }

        public Duration getReaperInterval() {
            return reaperInterval;
        }
    }

    /**
     * Continue-token signing and page sizes. Without a secret every restart invalidates
     * outstanding tokens.
     */
    @Validated
    public static final class Pagination {

        private static final int MIN_SECRET_BYTES = 16;

        private final String secret;
        private final int defaultLimit;
        private final int maxLimit;

        public Pagination(String secret, @NotNull Integer defaultLimit, @NotNull Integer maxLimit) {
            if (secret != null && !secret.isBlank()
                && secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
                throw new IllegalArgumentException("secret must be at least " + MIN_SECRET_BYTES + " bytes");
            }
            this.secret = secret == null || secret.isBlank() ? null : secret;
            this.defaultLimit = Objects.requireNonNull(defaultLimit, "defaultLimit");
            this.maxLimit = Objects.requireNonNull(maxLimit, "maxLimit");
            if (this.defaultLimit < 1 || this.maxLimit < this.defaultLimit) {
                throw new IllegalArgumentException("defaultLimit must be >= 1 and <= maxLimit");
            }
        }

        public String getSecret() {
            return secret;
        }

        public boolean hasSecret() {
            return secret != null;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }
    }

    @Validated
    public static final class Session {

        private final int maxCommandsPerReply;

        public Session(@NotNull Integer maxCommandsPerReply) {
            this.maxCommandsPerReply = Objects.requireNonNull(maxCommandsPerReply, "maxCommandsPerReply");
            if (this.maxCommandsPerReply < 1) {
                throw new IllegalArgumentException("maxCommandsPerReply must be >= 1");
            }
        }

        public int getMaxCommandsPerReply() {
            return maxCommandsPerReply;
        }
    }

    @Validated
    public static final class Storage {

        private final String sink;

        public Storage(@NotBlank String sink) {
            if (sink == null || sink.isBlank()) {
                throw new IllegalArgumentException("sink must not be blank");
            }
            String normalized = sink.trim().toLowerCase(Locale.ROOT);
            if (!SINK_MEMORY.equals(normalized) && !SINK_POSTGRES.equals(normalized)) {
                throw new IllegalArgumentException("sink must be '" + SINK_MEMORY + "' or '" + SINK_POSTGRES + "'");
            }
            this.sink = normalized;
        }

        public String getSink() {
            return sink;
        }
    }

    private static Duration requirePositive(Duration value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return value;
    }
}
