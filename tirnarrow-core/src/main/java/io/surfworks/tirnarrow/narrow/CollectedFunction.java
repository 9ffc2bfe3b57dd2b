package io.surfworks.tirnarrow.narrow;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.surfworks.tirnarrow.arith.Interval;
import io.surfworks.tirnarrow.tir.TirAst.PrimFunc;
import io.surfworks.tirnarrow.tir.TirAst.Var;

/**
 * Everything the decision engine needs to know about one function: its
 * candidate variables in declaration order and every expression root that
 * may reference them.
 */
public record CollectedFunction(PrimFunc function, List<Candidate> candidates, List<UseSite> sites) {

    public CollectedFunction {
        candidates = List.copyOf(candidates);
        sites = List.copyOf(sites);
    }

    public Optional<Candidate> candidate(Var var) {
        for (Candidate c : candidates) {
            if (c.var() == var) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Declared interval of every candidate, keyed by variable identity.
     */
    public Map<Var, Interval> candidateIntervals() {
        Map<Var, Interval> intervals = new IdentityHashMap<>();
        for (Candidate c : candidates) {
            intervals.put(c.var(), c.declared());
        }
        return intervals;
    }

    /**
     * Sites whose root references {@code var}.
     */
    public List<UseSite> sitesReferencing(Var var) {
        List<UseSite> result = new ArrayList<>();
        for (UseSite site : sites) {
            if (site.references(var)) {
                result.add(site);
            }
        }
        return result;
    }
}
