package com.techStack.sessionGuard.models.security;

import lombok.Value;

import java.util.List;

@Value
public class SuspicionScore {

    boolean suspicious;
    List<String> reasons;
    int riskScore;

    public static SuspicionScore clean() {
        return new SuspicionScore(false, List.of(), 0);
    }

    public static SuspicionScore of(List<String> reasons, int riskScore) {
        return new SuspicionScore(riskScore > 0, List.copyOf(reasons), riskScore);
    }
}
