package com.adobe.nthprime.model;

import com.adobe.nthprime.exception.InvalidInputException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How a prediction was produced.
 * 
 * <p>{@link #CLOSED_FORM} and {@link #NEWTON} are selectable estimators;
 * {@link #LOOKUP} only ever appears on results answered from the known-value
 * table.</p>
 */
public enum PredictionMethod {

    LOOKUP("lookup"),
    CLOSED_FORM("closed_form"),
    NEWTON("newton");

    private final String wireName;

    PredictionMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a user-supplied estimator name.
     * 
     * @param name {@code closed_form} or {@code newton}, case-insensitive
     * @return the matching estimator method
     * @throws InvalidInputException if the name is unknown or names the lookup path
     */
    public static PredictionMethod fromEstimatorName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (PredictionMethod method : values()) {
            if (method != LOOKUP && method.wireName.equals(normalized)) {
                return method;
            }
        }
        String allowed = Arrays.stream(values())
            .filter(m -> m != LOOKUP)
            .map(PredictionMethod::wireName)
            .collect(Collectors.joining(", "));
        throw new InvalidInputException(
            String.format("Unknown method '%s'. Supported methods: %s", name, allowed));
    }
}
