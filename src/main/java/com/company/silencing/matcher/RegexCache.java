package com.company.silencing.matcher;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled pattern cache keyed by pattern text.
 * Reads are lock-free; a pattern is compiled once on first sight.
 * When maxSize is reached the whole cache is cleared.
 */
@Slf4j
public class RegexCache {

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();
    private final int maxSize;

    /**
     * @param maxSize maximum number of cached patterns, 0 for unbounded
     */
    public RegexCache(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be >= 0: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * @return compiled pattern, or null if the text is not a valid regex
     */
    public Pattern get(String regex) {
        Pattern cached = patterns.get(regex);
        if (cached != null) {
            return cached;
        }

        Pattern compiled;
        try {
            compiled = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            log.debug("Rejecting invalid regex pattern {}: {}", regex, e.getDescription());
            return null;
        }

        if (maxSize > 0 && patterns.size() >= maxSize) {
            log.debug("Regex cache reached {} patterns, clearing", maxSize);
            patterns.clear();
        }

        Pattern existing = patterns.putIfAbsent(regex, compiled);
        return existing != null ? existing : compiled;
    }

    public int size() {
        return patterns.size();
    }

}
