package gk.java.engine;

/**
 * How the remaining quota of several passing rules is reported. Admission is the same under
 * both: every BLOCK rule must allow.
 */
public enum MergeStrategy {
    /** The tightest rule wins. */
    MOST_RESTRICTIVE,

    /** Weight-averaged remaining over rules with a positive weight. */
    WEIGHTED
}
