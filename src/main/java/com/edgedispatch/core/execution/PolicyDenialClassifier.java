package com.edgedispatch.core.execution;

import java.util.Locale;

/**
 * Decides whether a failed primary-transport attempt was rejected by the overlay
 * network's access policy, in which case the overlay-native shell is tried instead.
 */
@FunctionalInterface
public interface PolicyDenialClassifier {

    String DEFAULT_PATTERN = "policy does not permit";

    boolean isPolicyDenial(String combinedOutput);

    /**
     * Case-insensitive substring match on the combined output.
     */
    static PolicyDenialClassifier containing(String pattern) {
        String needle = pattern.toLowerCase(Locale.ROOT);
        return output -> output != null && output.toLowerCase(Locale.ROOT).contains(needle);
    }

    static PolicyDenialClassifier defaultClassifier() {
        return containing(DEFAULT_PATTERN);
    }
}
