package com.questrail.iso8583.dispatch;

import com.questrail.iso8583.api.IsoHandler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class HandlerRegistryTest {

    private static final IsoHandler AUTH = message -> message.setMti("0210");
    private static final IsoHandler ECHO = message -> message.setMti("0810");
    private static final IsoHandler FALLBACK = message -> message.setField(39, "12");

    @Test
    void resolvesSpecificHandler() {
        HandlerRegistry registry = new HandlerRegistry(1);
        registry.addHandler(AUTH, "0200");
        registry.addHandler(ECHO, "0800");

        HandlerRegistry.Resolution resolution = registry.resolve(RoutingKey.of("0800"));

        assertSame(ECHO, resolution.handler());
        assertFalse(resolution.usedDefault());
    }

    @Test
    void fallsBackToDefaultHandler() {
        HandlerRegistry registry = new HandlerRegistry(1);
        registry.addHandler(AUTH, "0200");
        registry.setDefaultHandler(FALLBACK);

        HandlerRegistry.Resolution resolution = registry.resolve(RoutingKey.of("0400"));

        assertSame(FALLBACK, resolution.handler());
        assertTrue(resolution.usedDefault());
    }

    @Test
    void unmatchedKeyWithoutDefaultFails() {
        HandlerRegistry registry = new HandlerRegistry(1);
        registry.addHandler(AUTH, "0200");

        HandlerNotFoundException e = assertThrows(HandlerNotFoundException.class,
                () -> registry.resolve(RoutingKey.of("0400")));
        assertEquals(RoutingKey.of("0400"), e.key());
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        HandlerRegistry registry = new HandlerRegistry(1);
        registry.addHandler(AUTH, "0200");
        registry.addHandler(ECHO, "0200");

        assertSame(ECHO, registry.resolve(RoutingKey.of("0200")).handler());
    }

    @Test
    void multiFieldKeysDoNotCollide() {
        HandlerRegistry registry = new HandlerRegistry(2);
        registry.addHandler(AUTH, "1", "23");
        registry.addHandler(ECHO, "12", "3");

        assertSame(AUTH, registry.resolve(RoutingKey.of("1", "23")).handler());
        assertSame(ECHO, registry.resolve(RoutingKey.of("12", "3")).handler());
    }

    @Test
    void keyPartCountMustMatchRoutingFields() {
        HandlerRegistry registry = new HandlerRegistry(2);

        assertThrows(IllegalArgumentException.class, () -> registry.addHandler(AUTH, "0200"));
        assertThrows(IllegalArgumentException.class, () -> registry.addHandler(AUTH, "0200", "00", "x"));
    }

    @Test
    void keySizeMustNotBeNegative() {
        assertThrows(IllegalArgumentException.class, () -> new HandlerRegistry(-1));
    }

    @Test
    void zeroSizeKeyRoutesEveryRequestToOneHandler() {
        HandlerRegistry registry = new HandlerRegistry(0);
        registry.addHandler(AUTH);

        HandlerRegistry.Resolution resolution = registry.resolve(RoutingKey.of());

        assertSame(AUTH, resolution.handler());
        assertFalse(resolution.usedDefault());
        assertThrows(IllegalArgumentException.class, () -> registry.addHandler(ECHO, "0800"));
    }
}
