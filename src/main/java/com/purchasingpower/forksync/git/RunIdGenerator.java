package com.purchasingpower.forksync.git;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Predicate;

/**
 * Produces run identifiers used to name backup and update branches.
 *
 * <p>The identifier is the run's start time to the second. When a branch derived from that
 * identifier already exists, a numeric suffix is appended until the name is free, so an earlier
 * backup is never reused or overwritten.
 */
@Component
public class RunIdGenerator {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Clock clock;

    public RunIdGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param taken returns true when a run id is already in use
     */
    public String next(Predicate<String> taken) {
        String base = LocalDateTime.now(clock).format(FORMAT);
        if (!taken.test(base)) {
            return base;
        }
        for (int sequence = 2; ; sequence++) {
            String candidate = base + "-" + sequence;
            if (!taken.test(candidate)) {
                return candidate;
            }
        }
    }
}
