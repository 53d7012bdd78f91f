package com.company.silencing.matcher;

import com.company.silencing.domain.Matcher;
import com.company.silencing.domain.Silence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.regex.Pattern;

/**
 * Label matching engine. Evaluates alert label sets against silence matchers.
 *
 * <p>Operator semantics:
 * <ul>
 *   <li>{@code =}  label present and equal</li>
 *   <li>{@code !=} label missing or different</li>
 *   <li>{@code =~} label present and the pattern is found in the value</li>
 *   <li>{@code !~} label missing or the pattern is not found</li>
 * </ul>
 *
 * <p>Never throws and never logs on the hot path. Thread-safe.
 */
public class SilenceMatcher {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final RegexCache regexCache;

    public SilenceMatcher(RegexCache regexCache) {
        this.regexCache = regexCache;
    }

    /**
     * @return true iff every matcher holds for the labels (AND semantics)
     */
    public boolean matches(Map<String, String> labels, List<Matcher> matchers) {
        if (matchers == null || matchers.isEmpty()) {
            return false;
        }
        Map<String, String> safeLabels = labels != null ? labels : Map.of();
        for (Matcher matcher : matchers) {
            if (!matchSingle(safeLabels, matcher)) {
                return false;
            }
        }
        return true;
    }

    public SilenceMatchResult isSilenced(Map<String, String> labels, Collection<Silence> silences) {
        return isSilenced(labels, silences, NEVER_CANCELLED);
    }

    /**
     * Evaluates every silence and reports all matching IDs.
     * Cancellation (or thread interruption) is checked between silences; the IDs
     * matched before cancellation are returned.
     */
    public SilenceMatchResult isSilenced(Map<String, String> labels,
                                         Collection<Silence> silences,
                                         BooleanSupplier cancelled) {
        if (silences == null || silences.isEmpty()) {
            return SilenceMatchResult.notSilenced();
        }

        List<String> matchedIds = new ArrayList<>(2);
        for (Silence silence : silences) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                break;
            }
            if (silence != null && matches(labels, silence.getMatchers())) {
                matchedIds.add(silence.getId());
            }
        }
        return SilenceMatchResult.of(matchedIds);
    }

    private boolean matchSingle(Map<String, String> labels, Matcher matcher) {
        if (matcher == null || matcher.getType() == null) {
            return false;
        }
        String labelValue = labels.get(matcher.getName());

        switch (matcher.getType()) {
            case EQUAL:
                return labelValue != null && labelValue.equals(matcher.getValue());
            case NOT_EQUAL:
                return labelValue == null || !labelValue.equals(matcher.getValue());
            case REGEX: {
                if (labelValue == null) {
                    return false;
                }
                Pattern pattern = regexCache.get(matcher.getValue());
                return pattern != null && pattern.matcher(labelValue).find();
            }
            case NOT_REGEX: {
                if (labelValue == null) {
                    return true;
                }
                Pattern pattern = regexCache.get(matcher.getValue());
                return pattern != null && !pattern.matcher(labelValue).find();
            }
            default:
                return false;
        }
    }
}
