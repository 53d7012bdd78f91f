package com.company.silencing.domain;

import com.company.silencing.domain.enums.MatcherType;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * Single label-matching rule. All matchers of a silence are AND-combined.
 */
@Value
@Builder
@AllArgsConstructor
public class Matcher implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String LABEL_NAME_PATTERN = "^[a-zA-Z_][a-zA-Z0-9_]*$";
    public static final int MAX_VALUE_LENGTH = 1024;

    @NotNull(message = "Matcher name is required")
    @Pattern(regexp = LABEL_NAME_PATTERN, message = "Matcher name must be a valid label name")
    String name;

    @NotEmpty(message = "Matcher value is required")
    @Size(max = MAX_VALUE_LENGTH, message = "Matcher value must be at most 1024 characters")
    String value;

    @NotNull(message = "Matcher type is required")
    MatcherType type;

    public static Matcher equal(String name, String value) {
        return new Matcher(name, value, MatcherType.EQUAL);
    }

    public static Matcher notEqual(String name, String value) {
        return new Matcher(name, value, MatcherType.NOT_EQUAL);
    }

    public static Matcher regex(String name, String pattern) {
        return new Matcher(name, pattern, MatcherType.REGEX);
    }

    public static Matcher notRegex(String name, String pattern) {
        return new Matcher(name, pattern, MatcherType.NOT_REGEX);
    }

    public boolean isRegex() {
        return type != null && type.isRegex();
    }
}
