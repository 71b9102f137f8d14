package com.purchasingpower.forksync.git;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Run Id Generator Tests")
class RunIdGeneratorTest {

    private final RunIdGenerator generator =
            new RunIdGenerator(Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("Uses the start time to the second")
    void timestampId() {
        assertEquals("20260301-101530", generator.next(id -> false));
    }

    @Test
    @DisplayName("Appends a sequence until the id is free")
    void collisionSuffix() {
        // Given: two runs already happened within the same second
        Set<String> taken = Set.of("20260301-101530", "20260301-101530-2");

        // When
        String id = generator.next(taken::contains);

        // Then
        assertEquals("20260301-101530-3", id);
    }
}
