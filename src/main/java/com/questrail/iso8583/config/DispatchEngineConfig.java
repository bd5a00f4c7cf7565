package com.questrail.iso8583.config;

import com.questrail.iso8583.schema.FieldSchema;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Listener and routing configuration for the dispatch engine.
 *
 * @param bindHost      local interface to listen on
 * @param port          TCP port; {@code 0} selects an ephemeral port
 * @param idleTimeout   maximum read inactivity before a connection is closed
 * @param routingFields field numbers whose values, in order, form the routing key
 */
public record DispatchEngineConfig(
    String bindHost,
    int port,
    Duration idleTimeout,
    List<Integer> routingFields
) {
    public static final String ANY_HOST = "0.0.0.0";
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(30);

    public DispatchEngineConfig {
        Objects.requireNonNull(bindHost, "bindHost");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(routingFields, "routingFields");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be 0-65535 (was " + port + ")");
        }
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("Idle timeout must be positive (was " + idleTimeout + ")");
        }
        for (Integer field : routingFields) {
            if (field == null || field < FieldSchema.MTI_FIELD || field > FieldSchema.MAX_FIELD) {
                throw new IllegalArgumentException("Routing field must be 0-128 (was " + field + ")");
            }
        }
        routingFields = List.copyOf(routingFields);
    }

    public InetSocketAddress bindAddress() {
        return new InetSocketAddress(bindHost, port);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String bindHost = ANY_HOST;
        private Integer port;
        private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
        private List<Integer> routingFields = List.of(FieldSchema.MTI_FIELD);

        public Builder withBindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder withIdleTimeoutSeconds(long seconds) {
            this.idleTimeout = Duration.ofSeconds(seconds);
            return this;
        }

        public Builder withRoutingFields(int... fields) {
            this.routingFields = Arrays.stream(fields).boxed().toList();
            return this;
        }

        public DispatchEngineConfig build() {
            if (port == null) {
                throw new IllegalStateException("Listening port is required");
            }
            return new DispatchEngineConfig(bindHost, port, idleTimeout, routingFields);
        }
    }
}
