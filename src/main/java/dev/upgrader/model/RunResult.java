package dev.upgrader.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one coordinated run, keyed by catalog wire name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResult(boolean ok, String error, Map<String, CycleOutcome> cycles) {

    public static RunResult ok(Map<String, CycleOutcome> cycles) {
        return new RunResult(true, null, ordered(cycles));
    }

    public static RunResult failed(String error, Map<String, CycleOutcome> cycles) {
        return new RunResult(false, error, ordered(cycles));
    }

    private static Map<String, CycleOutcome> ordered(Map<String, CycleOutcome> cycles) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(cycles));
    }
}
