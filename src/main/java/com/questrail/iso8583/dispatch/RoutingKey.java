package com.questrail.iso8583.dispatch;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered tuple of field values used to select a handler.
 *
 * <p>Two keys are equal only if they hold the same values in the same
 * positions, so {@code ("1", "23")} and {@code ("12", "3")} never collide.</p>
 */
public record RoutingKey(List<String> parts) {

    public RoutingKey {
        Objects.requireNonNull(parts, "parts");
        for (String part : parts) {
            Objects.requireNonNull(part, "routing key part");
        }
        parts = List.copyOf(parts);
    }

    public static RoutingKey of(String... parts) {
        return new RoutingKey(Arrays.asList(parts));
    }

    public int size() {
        return parts.size();
    }

    @Override
    public String toString() {
        return "RoutingKey" + parts;
    }
}
