package io.surfworks.tirnarrow.narrow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.surfworks.tirnarrow.tir.TirAst.DataType;
import io.surfworks.tirnarrow.tir.TirAst.Var;

/**
 * Resolved type of every candidate variable of one function, keyed by
 * variable identity. A variable absent from the map keeps its type.
 */
public final class DecisionMap {

    private final int targetBits;
    private final Map<Var, VariableDecision> decisions = new IdentityHashMap<>();

    DecisionMap(int targetBits, Collection<VariableDecision> decisions) {
        this.targetBits = targetBits;
        for (VariableDecision d : decisions) {
            this.decisions.put(d.var(), d);
        }
    }

    /**
     * A map that narrows nothing.
     */
    public static DecisionMap empty(int targetBits) {
        return new DecisionMap(targetBits, List.of());
    }

    public int targetBits() {
        return targetBits;
    }

    public Optional<VariableDecision> get(Var var) {
        return Optional.ofNullable(decisions.get(var));
    }

    /**
     * Type {@code var} has after rewriting.
     */
    public DataType resolvedType(Var var) {
        VariableDecision d = decisions.get(var);
        return d == null ? var.dtype() : d.resolvedType();
    }

    public boolean isNarrowed(Var var) {
        VariableDecision d = decisions.get(var);
        return d != null && d.isNarrowed();
    }

    public boolean anyNarrowed() {
        for (VariableDecision d : decisions.values()) {
            if (d.isNarrowed()) {
                return true;
            }
        }
        return false;
    }

    public int narrowedCount() {
        int count = 0;
        for (VariableDecision d : decisions.values()) {
            if (d.isNarrowed()) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return decisions.size();
    }

    /**
     * All decisions in variable creation order.
     */
    public List<VariableDecision> decisions() {
        List<VariableDecision> ordered = new ArrayList<>(decisions.values());
        ordered.sort(Comparator.comparingLong(d -> d.var().id()));
        return ordered;
    }
}
