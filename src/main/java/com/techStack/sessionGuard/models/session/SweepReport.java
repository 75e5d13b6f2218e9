package com.techStack.sessionGuard.models.session;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class SweepReport {
    long indexEntriesPruned;
    long ledgerEntriesPurged;
    Instant completedAt;
    Duration duration;
}
