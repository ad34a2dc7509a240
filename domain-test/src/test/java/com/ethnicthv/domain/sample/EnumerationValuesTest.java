package com.ethnicthv.domain.sample;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EnumerationValuesTest {

    @Test
    @DisplayName("getAll is ordered by value and holds each constant once")
    void getAll() {
        assertEquals(List.of(OrderStatus.CANCELLED, OrderStatus.PENDING, OrderStatus.PAID, OrderStatus.SHIPPED),
                new ArrayList<>(OrderStatusValues.getAll()));
        assertThrows(UnsupportedOperationException.class, () -> OrderStatusValues.getAll().clear());
    }

    @Test
    @DisplayName("Lookups by value and by name")
    void lookups() {
        assertSame(OrderStatus.PAID, OrderStatusValues.fromValue(2));
        assertSame(OrderStatus.CANCELLED, OrderStatusValues.fromValue(-1));
        assertSame(OrderStatus.SHIPPED, OrderStatusValues.fromName("Shipped"));
        assertEquals(Optional.of(OrderStatus.PENDING), OrderStatusValues.tryFromValue(1));
        assertEquals(Optional.of(OrderStatus.PENDING), OrderStatusValues.tryFromName("Pending"));
    }

    @Test
    @DisplayName("Missing keys")
    void missing() {
        assertThrows(NoSuchElementException.class, () -> OrderStatusValues.fromValue(42));
        assertThrows(NoSuchElementException.class, () -> OrderStatusValues.fromName("shipped"));
        assertEquals(Optional.empty(), OrderStatusValues.tryFromValue(42));
        assertEquals(Optional.empty(), OrderStatusValues.tryFromName(null));
    }

    @Test
    @DisplayName("Private constants are not listed")
    void privateConstants() {
        assertEquals(Optional.empty(), OrderStatusValues.tryFromValue(9));
        assertEquals(Optional.empty(), OrderStatusValues.tryFromName("Archived"));
    }

    @Test
    @DisplayName("Computed constants are part of the table")
    void computedConstants() {
        assertEquals(3, PlanetValues.getAll().size());
        assertSame(Planet.JUPITER, PlanetValues.fromValue(105));
        assertEquals(2.53, PlanetValues.fromName("Jupiter").getGravity());
    }

    @Test
    @DisplayName("A duplicate only visible at runtime fails table initialization")
    void runtimeDuplicate() {
        ExceptionInInitializerError error = assertThrows(ExceptionInInitializerError.class, LegacyCodeValues::getAll);

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("Duplicate value 1"), error.getCause().getMessage());
    }
}
