package io.surfworks.tirnarrow.narrow;

/**
 * Where an expression root sits in the function body.
 */
public enum SiteKind {
    /** One index of a buffer load or store. */
    INDEX,
    /** A stored value or an evaluated expression. */
    VALUE,
    /** Condition of an {@code IfThenElse}. */
    CONDITION,
    /** Non-constant loop bound, thread extent, or block domain. */
    LOOP_BOUND,
    /** Value bound to a block iteration variable. */
    BINDING
}
