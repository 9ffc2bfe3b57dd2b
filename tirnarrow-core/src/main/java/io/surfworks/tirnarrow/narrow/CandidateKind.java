package io.surfworks.tirnarrow.narrow;

/**
 * How a narrowing candidate was declared.
 */
public enum CandidateKind {
    /** Loop variable of a {@code For}, whatever its execution kind. */
    LOOP,
    /** Variable bound to a parallel hardware axis. */
    THREAD,
    /** Block iteration variable. */
    BLOCK_ITER
}
