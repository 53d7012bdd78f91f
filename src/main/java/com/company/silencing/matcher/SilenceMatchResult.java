package com.company.silencing.matcher;

import lombok.Value;

import java.util.List;

@Value
public class SilenceMatchResult {

    private static final SilenceMatchResult NOT_SILENCED = new SilenceMatchResult(false, List.of());

    boolean silenced;
    List<String> matchedSilenceIds;

    public static SilenceMatchResult notSilenced() {
        return NOT_SILENCED;
    }

    public static SilenceMatchResult of(List<String> matchedSilenceIds) {
        if (matchedSilenceIds.isEmpty()) {
            return NOT_SILENCED;
        }
        return new SilenceMatchResult(true, List.copyOf(matchedSilenceIds));
    }
}
