package com.techStack.sessionGuard.models.attempt;

import lombok.Value;

/**
 * Failure counts within a window, partitioned by identifier and by IP.
 */
@Value
public class AttemptCounts {
    long identifierFailures;
    long ipFailures;

    public static AttemptCounts empty() {
        return new AttemptCounts(0, 0);
    }
}
