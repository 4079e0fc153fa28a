package org.netcoord.runtime.environment;

import java.util.Locale;

/**
 * What a delegate does when its simulator throws during {@code step}.
 */
public enum DelegateFailurePolicy {
    /** Propagate a {@link DelegateStepException}; the run aborts. */
    FAIL,
    /** Log the failure and replay the last good transition for the rest of the episode. */
    SKIP;

    /**
     * @param text {@code "fail"} or {@code "skip"}, case-insensitive.
     * @throws IllegalArgumentException for any other value.
     */
    public static DelegateFailurePolicy parse(String text) {
        return valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
