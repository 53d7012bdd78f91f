package com.company.silencing.validation;

import com.company.silencing.domain.Matcher;
import com.company.silencing.domain.Silence;
import com.company.silencing.exception.SilenceValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Bean Validation constraints on the silence plus the cross-field rules annotations can't express.
 * Runs before any storage interaction.
 */
@Component
@RequiredArgsConstructor
public class SilenceValidator {

    private final Validator validator;

    public void validate(Silence silence) {
        if (silence == null) {
            throw new SilenceValidationException("silence", "Silence is required");
        }

        Map<String, String> errors = new LinkedHashMap<>();

        for (ConstraintViolation<Silence> violation : validator.validate(silence)) {
            errors.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage());
        }

        if (silence.getId() != null && !silence.getId().isEmpty() && !isUuid(silence.getId())) {
            errors.putIfAbsent("id", "Silence ID must be a valid UUID");
        }

        if (silence.getStartsAt() != null && silence.getEndsAt() != null
                && !silence.getEndsAt().isAfter(silence.getStartsAt())) {
            errors.putIfAbsent("endsAt", "End time must be after start time");
        }

        List<Matcher> matchers = silence.getMatchers();
        if (matchers != null) {
            for (int i = 0; i < matchers.size(); i++) {
                Matcher matcher = matchers.get(i);
                if (matcher != null && matcher.isRegex() && matcher.getValue() != null) {
                    String error = regexError(matcher.getValue());
                    if (error != null) {
                        errors.putIfAbsent("matchers[" + i + "].value", "Invalid regex: " + error);
                    }
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new SilenceValidationException(errors);
        }
    }

    static boolean isUuid(String value) {
        try {
            return UUID.fromString(value).toString().equalsIgnoreCase(value);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String regexError(String pattern) {
        try {
            Pattern.compile(pattern);
            return null;
        } catch (PatternSyntaxException e) {
            return e.getDescription();
        }
    }
}
