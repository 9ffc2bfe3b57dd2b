package io.surfworks.tirnarrow.narrow;

import java.util.Set;

import io.surfworks.tirnarrow.tir.TirAst.Expr;
import io.surfworks.tirnarrow.tir.TirAst.Var;

/**
 * An expression root in a function body together with the candidate
 * variables it references.
 *
 * <p>A root stops at nested buffer loads: the indices of a load inside this
 * expression are sites of their own. {@code referenced} only lists
 * variables reachable without crossing such a load.
 *
 * @param kind where the root sits
 * @param root the expression
 * @param owner buffer or variable name the root belongs to, for diagnostics
 * @param referenced candidate variables referenced by the root
 */
public record UseSite(SiteKind kind, Expr root, String owner, Set<Var> referenced) {

    public UseSite {
        referenced = Set.copyOf(referenced);
    }

    public boolean references(Var var) {
        return referenced.contains(var);
    }
}
