package io.surfworks.tirnarrow.narrow;

import java.util.OptionalLong;

import io.surfworks.tirnarrow.arith.Interval;
import io.surfworks.tirnarrow.tir.TirAst.Var;

/**
 * A declared variable that may be narrowed.
 *
 * @param var the declared variable
 * @param kind how it was declared
 * @param declared the values it can take, unbounded unless its domain is constant
 * @param extent the constant extent of its domain, if there is one
 */
public record Candidate(Var var, CandidateKind kind, Interval declared, OptionalLong extent) {

    /**
     * Merges a second declaration of the same variable.
     */
    Candidate merge(Candidate other) {
        if (declared.isUnbounded() || other.declared.isUnbounded()) {
            return new Candidate(var, kind, Interval.unbounded(), OptionalLong.empty());
        }
        long widest = Math.max(extent.orElse(0), other.extent.orElse(0));
        return new Candidate(var, kind, declared.union(other.declared), OptionalLong.of(widest));
    }
}
