package work.cellium.kernel.api;

import java.util.Locale;

/**
 * What the loader does when a configured cell cannot be constructed.
 */
public enum LoadPolicy {
    /** Abort startup, tearing down cells already loaded. */
    STRICT,
    /** Log the failure and continue with the remaining cells. */
    LENIENT;

    public static LoadPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return STRICT;
        }
        try {
            return LoadPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported load policy: " + value + " (expected strict or lenient)");
        }
    }
}
