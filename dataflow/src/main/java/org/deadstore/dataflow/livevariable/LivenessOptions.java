package org.deadstore.dataflow.livevariable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.checkerframework.javacutil.UserError;
import org.deadstore.dataflow.analysis.AbstractAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options of the dead store analysis, parsed from key/value pairs such as the {@code -Akey=value}
 * options of an annotation processor.
 *
 * <ul>
 *   <li>{@value #WIDEN_AFTER}: merges into a block before widening is used (default {@value
 *       AbstractAnalysis#DEFAULT_MAX_COUNT_BEFORE_WIDENING});
 *   <li>{@value #MAX_ITERATIONS}: merges into a block before the analysis gives up (default
 *       {@value AbstractAnalysis#DEFAULT_MAX_ITERATIONS});
 *   <li>{@value #NO_RETURN_FUNCTIONS}: comma-separated names of additional functions that never
 *       return.
 * </ul>
 */
public final class LivenessOptions {

    private static final Logger LOGGER = LoggerFactory.getLogger(LivenessOptions.class);

    public static final String WIDEN_AFTER = "widenAfter";
    public static final String MAX_ITERATIONS = "maxIterations";
    public static final String NO_RETURN_FUNCTIONS = "noReturnFunctions";

    /** The options used when none are given. */
    public static final LivenessOptions DEFAULT =
            new LivenessOptions(
                    AbstractAnalysis.DEFAULT_MAX_COUNT_BEFORE_WIDENING,
                    AbstractAnalysis.DEFAULT_MAX_ITERATIONS,
                    Collections.<String>emptyList());

    private final int widenAfter;
    private final int maxIterations;
    private final List<String> noReturnFunctions;

    private LivenessOptions(int widenAfter, int maxIterations, List<String> noReturnFunctions) {
        this.widenAfter = widenAfter;
        this.maxIterations = maxIterations;
        this.noReturnFunctions = Collections.unmodifiableList(noReturnFunctions);
    }

    /**
     * Parse options. Missing options take their defaults; unknown keys are ignored with a
     * warning.
     *
     * @param options the option values by key
     * @return the parsed options
     * @throws UserError if a numeric option is not a positive integer
     */
    public static LivenessOptions fromMap(Map<String, String> options) {
        for (String key : options.keySet()) {
            if (!key.equals(WIDEN_AFTER)
                    && !key.equals(MAX_ITERATIONS)
                    && !key.equals(NO_RETURN_FUNCTIONS)) {
                LOGGER.warn("Ignoring unknown option {}", key);
            }
        }
        int widenAfter = positiveInt(options, WIDEN_AFTER, DEFAULT.widenAfter);
        int maxIterations = positiveInt(options, MAX_ITERATIONS, DEFAULT.maxIterations);
        List<String> noReturnFunctions = new ArrayList<>();
        String names = options.get(NO_RETURN_FUNCTIONS);
        if (names != null) {
            for (String name : names.split(",")) {
                String trimmed = name.trim();
                if (!trimmed.isEmpty()) {
                    noReturnFunctions.add(trimmed);
                }
            }
        }
        return new LivenessOptions(widenAfter, maxIterations, noReturnFunctions);
    }

    private static int positiveInt(Map<String, String> options, String key, int defaultValue) {
        String value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UserError("Option %s must be an integer, but was \"%s\"", key, value);
        }
        if (parsed <= 0) {
            throw new UserError("Option %s must be positive, but was %d", key, parsed);
        }
        return parsed;
    }

    /** @return merges into a block before widening is used */
    public int getWidenAfter() {
        return widenAfter;
    }

    /** @return merges into a block before the analysis gives up */
    public int getMaxIterations() {
        return maxIterations;
    }

    /** @return additional never-returning function names, in the order given */
    public List<String> getNoReturnFunctions() {
        return noReturnFunctions;
    }

    @Override
    public String toString() {
        return "LivenessOptions{widenAfter=" + widenAfter + ", maxIterations=" + maxIterations
                + ", noReturnFunctions=" + noReturnFunctions + "}";
    }
}
