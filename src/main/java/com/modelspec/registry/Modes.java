package com.modelspec.registry;

/**
 * Well-known mode names.
 */
public final class Modes {

    /**
     * Placeholder for specifications of multi-mode models whose mode is not yet chosen.
     * Every model accepts it at creation time; it is never a valid mode for fitting.
     */
    public static final String UNKNOWN = "unknown";

    public static final String CLASSIFICATION = "classification";
    public static final String REGRESSION = "regression";
    public static final String CENSORED_REGRESSION = "censored regression";

    private Modes() {
        // Constants
    }
}
