package com.ethnicthv.domain.sample;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaggedTest {

    @Test
    @DisplayName("Generic host compares its type-parameter member by value")
    void genericHost() {
        Tagged<Integer> a = Tagged.of(7, "seven");

        assertEquals(a, Tagged.of(7, "seven"));
        assertEquals(a.hashCode(), Tagged.of(7, "seven").hashCode());
        assertNotEquals(a, Tagged.of(8, "seven"));
        assertNotEquals(a, Tagged.of(7, "SEVEN"));
        assertNotEquals(Tagged.of("7", "seven"), a);
    }
}
