package io.surfworks.tirnarrow.narrow;

import io.surfworks.tirnarrow.arith.Interval;
import io.surfworks.tirnarrow.tir.TirAst.DataType;
import io.surfworks.tirnarrow.tir.TirAst.Var;

/**
 * The resolved type of one candidate variable.
 *
 * @param var the variable as declared in the input
 * @param kind how it was declared
 * @param originalType its declared type
 * @param resolvedType the type the rewriter gives it
 * @param declaredRange the interval its domain declares
 * @param reason why {@code resolvedType} was chosen
 * @param detail the expression or range that decided it, empty when there is none
 */
public record VariableDecision(
        Var var,
        CandidateKind kind,
        DataType originalType,
        DataType resolvedType,
        Interval declaredRange,
        DecisionReason reason,
        String detail
) {
    public boolean isNarrowed() {
        return !originalType.equals(resolvedType);
    }
}
