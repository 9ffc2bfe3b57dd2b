package io.surfworks.tirnarrow.narrow;

import io.surfworks.tirnarrow.tir.TirAst.PrimFunc;

/**
 * A rewritten function and the decisions that produced it.
 */
public record NarrowingResult(PrimFunc function, NarrowingReport report) {

    /**
     * True when the rewrite changed nothing and returned the input.
     */
    public boolean unchanged(PrimFunc input) {
        return function == input;
    }
}
