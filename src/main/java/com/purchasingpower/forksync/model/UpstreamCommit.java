package com.purchasingpower.forksync.model;

import java.time.Instant;

public record UpstreamCommit(
        String id,
        String shortMessage,
        String author,
        Instant committedAt
) {
}
