package io.surfworks.tirnarrow.narrow;

/**
 * Why a candidate variable got the type it did.
 */
public enum DecisionReason {
    /** Narrowed to the target width. */
    NARROWED,
    /** Already no wider than the target. */
    ALREADY_NARROW,
    /** Not a signed integer; left alone. */
    NOT_SIGNED_INTEGER,
    /** Domain is not a constant range. */
    UNBOUNDED,
    /** Declared range or extent does not fit the target width. */
    DECLARED_RANGE_OVERFLOW,
    /** An expression derived from the variable does not fit the target width. */
    DERIVED_INDEX_OVERFLOW;

    public boolean isNarrowed() {
        return this == NARROWED;
    }
}
