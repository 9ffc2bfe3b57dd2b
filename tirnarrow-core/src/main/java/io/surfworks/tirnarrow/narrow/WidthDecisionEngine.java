package io.surfworks.tirnarrow.narrow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.surfworks.tirnarrow.arith.BoundAnalyzer;
import io.surfworks.tirnarrow.arith.Interval;
import io.surfworks.tirnarrow.tir.ExprVisitor;
import io.surfworks.tirnarrow.tir.TirAst.Add;
import io.surfworks.tirnarrow.tir.TirAst.And;
import io.surfworks.tirnarrow.tir.TirAst.BinaryOp;
import io.surfworks.tirnarrow.tir.TirAst.Broadcast;
import io.surfworks.tirnarrow.tir.TirAst.BufferLoad;
import io.surfworks.tirnarrow.tir.TirAst.Call;
import io.surfworks.tirnarrow.tir.TirAst.Cast;
import io.surfworks.tirnarrow.tir.TirAst.Compare;
import io.surfworks.tirnarrow.tir.TirAst.DataType;
import io.surfworks.tirnarrow.tir.TirAst.Div;
import io.surfworks.tirnarrow.tir.TirAst.Expr;
import io.surfworks.tirnarrow.tir.TirAst.FloatImm;
import io.surfworks.tirnarrow.tir.TirAst.FloorDiv;
import io.surfworks.tirnarrow.tir.TirAst.FloorMod;
import io.surfworks.tirnarrow.tir.TirAst.IntImm;
import io.surfworks.tirnarrow.tir.TirAst.Kind;
import io.surfworks.tirnarrow.tir.TirAst.Max;
import io.surfworks.tirnarrow.tir.TirAst.Min;
import io.surfworks.tirnarrow.tir.TirAst.Mod;
import io.surfworks.tirnarrow.tir.TirAst.Mul;
import io.surfworks.tirnarrow.tir.TirAst.Not;
import io.surfworks.tirnarrow.tir.TirAst.Or;
import io.surfworks.tirnarrow.tir.TirAst.Ramp;
import io.surfworks.tirnarrow.tir.TirAst.Select;
import io.surfworks.tirnarrow.tir.TirAst.Sub;
import io.surfworks.tirnarrow.tir.TirAst.Var;
import io.surfworks.tirnarrow.tir.TirPrinter;

/**
 * Decides which candidate variables can be computed at a narrower width.
 *
 * <p>A candidate wider than the target is narrowed when three things hold:
 * <ol>
 *   <li>its domain is a constant range, and both that range and its extent
 *       fit the signed target width;</li>
 *   <li>every integer expression between a use-site root and the variable
 *       that is wider than the target has a bound that fits the signed
 *       target width;</li>
 *   <li>every integer cast between a root and the variable can hold the
 *       bound of its operand.</li>
 * </ol>
 *
 * <p>The second check is done per node, not per root: a node that does not
 * fit keeps every candidate beneath it wide, even when the root as a whole
 * would fit. Paths stop at buffer loads and opaque calls, whose indices and
 * arguments keep their original types after rewriting, and at non-integer
 * nodes, whose values are unaffected by the width of their integer inputs.
 *
 * <p>Each variable gets exactly one resolution, applied to all of its uses.
 */
public final class WidthDecisionEngine {

    private static final Logger LOG = Logger.getLogger(WidthDecisionEngine.class.getName());

    public static final int MIN_TARGET_BITS = 8;
    public static final int MAX_TARGET_BITS = 64;

    /** Longest expression text quoted in a decision detail */
    private static final int DETAIL_LENGTH = 160;

    private WidthDecisionEngine() {}

    /**
     * Resolves a type for every candidate of {@code collected}.
     *
     * @param targetBits the width to narrow to, between 8 and 64
     * @throws IllegalArgumentException if {@code targetBits} is out of range
     */
    public static DecisionMap decide(CollectedFunction collected, int targetBits) {
        requireTargetBits(targetBits);
        String funcName = collected.function().name();

        Map<Var, VariableDecision> rejected = new IdentityHashMap<>();
        Set<Var> eligible = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Candidate c : collected.candidates()) {
            VariableDecision early = checkDeclaration(c, targetBits);
            if (early != null) {
                rejected.put(c.var(), early);
            } else {
                eligible.add(c.var());
            }
        }

        BoundAnalyzer analyzer = new BoundAnalyzer(collected.candidateIntervals());
        Map<Var, String> blocked = new IdentityHashMap<>();
        for (UseSite site : collected.sites()) {
            if (Collections.disjoint(site.referenced(), eligible)) {
                continue;
            }
            new PathChecker(analyzer, targetBits, eligible, site, blocked).visit(site.root());
        }

        List<VariableDecision> decisions = new ArrayList<>();
        for (Candidate c : collected.candidates()) {
            Var v = c.var();
            VariableDecision d = rejected.get(v);
            if (d == null) {
                String why = blocked.get(v);
                d = why != null
                        ? keep(c, DecisionReason.DERIVED_INDEX_OVERFLOW, why)
                        : new VariableDecision(v, c.kind(), v.dtype(),
                                DataType.intOf(targetBits).withLanes(v.dtype().lanes()),
                                c.declared(), DecisionReason.NARROWED, "");
            }
            decisions.add(d);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(String.format("[%s] %s %s -> %s (%s%s)", funcName, v.name(),
                        d.originalType(), d.resolvedType(), d.reason(),
                        d.detail().isEmpty() ? "" : ": " + d.detail()));
            }
        }

        DecisionMap map = new DecisionMap(targetBits, decisions);
        LOG.fine(() -> String.format("[%s] narrowed %d of %d candidates to %d bits",
                funcName, map.narrowedCount(), map.size(), targetBits));
        return map;
    }

    static void requireTargetBits(int targetBits) {
        if (targetBits < MIN_TARGET_BITS || targetBits > MAX_TARGET_BITS) {
            throw new IllegalArgumentException(String.format(
                    "Target width must be between %d and %d bits, got %d",
                    MIN_TARGET_BITS, MAX_TARGET_BITS, targetBits));
        }
    }

    /**
     * Returns the final decision for a candidate that cannot be narrowed
     * whatever its uses, or null when its uses decide.
     */
    private static VariableDecision checkDeclaration(Candidate c, int targetBits) {
        DataType type = c.var().dtype();
        if (type.kind() != Kind.INT) {
            return keep(c, DecisionReason.NOT_SIGNED_INTEGER, "");
        }
        if (type.bits() <= targetBits) {
            return keep(c, DecisionReason.ALREADY_NARROW, "");
        }
        if (c.declared().isUnbounded()) {
            return keep(c, DecisionReason.UNBOUNDED, "");
        }
        long extent = c.extent().orElse(Long.MAX_VALUE);
        if (!c.declared().fitsSignedBits(targetBits) || !Interval.point(extent).fitsSignedBits(targetBits)) {
            return keep(c, DecisionReason.DECLARED_RANGE_OVERFLOW,
                    "range " + c.declared() + ", extent " + extent);
        }
        return null;
    }

    private static VariableDecision keep(Candidate c, DecisionReason reason, String detail) {
        DataType type = c.var().dtype();
        return new VariableDecision(c.var(), c.kind(), type, type, c.declared(), reason, detail);
    }

    /**
     * Walks one root bottom-up. Each visit returns the eligible variables
     * reachable from that node through integer nodes only. Results are
     * memoized per node, so a shared subexpression is checked once.
     */
    private static final class PathChecker implements ExprVisitor<Set<Var>> {
        private final BoundAnalyzer analyzer;
        private final int targetBits;
        private final Set<Var> eligible;
        private final UseSite site;
        private final Map<Var, String> blocked;
        private final Map<Expr, Set<Var>> memo = new IdentityHashMap<>();

        PathChecker(BoundAnalyzer analyzer, int targetBits, Set<Var> eligible,
                    UseSite site, Map<Var, String> blocked) {
            this.analyzer = analyzer;
            this.targetBits = targetBits;
            this.eligible = eligible;
            this.site = site;
            this.blocked = blocked;
        }

        Set<Var> visit(Expr node) {
            Set<Var> cached = memo.get(node);
            if (cached == null) {
                cached = node.accept(this);
                memo.put(node, cached);
            }
            return cached;
        }

        private Set<Var> check(Expr node, Set<Var> below) {
            if (below.isEmpty()) {
                return below;
            }
            DataType type = node.dtype();
            if (!type.isIntegral()) {
                return Set.of();
            }
            if (type.bits() > targetBits) {
                Interval b = analyzer.bound(node);
                if (!b.fitsSignedBits(targetBits)) {
                    block(below, node, b);
                }
            }
            return below;
        }

        private void block(Set<Var> vars, Expr node, Interval bound) {
            String why = String.format("%s %s: %s in %s",
                    site.kind().name().toLowerCase(Locale.ROOT), site.owner(),
                    TirPrinter.print(node, DETAIL_LENGTH), bound);
            for (Var v : vars) {
                blocked.putIfAbsent(v, why);
            }
        }

        private static Set<Var> union(Set<Var> a, Set<Var> b) {
            if (a.isEmpty() || a == b) {
                return b;
            }
            if (b.isEmpty()) {
                return a;
            }
            Set<Var> merged = new LinkedHashSet<>(a);
            merged.addAll(b);
            return merged;
        }

        private Set<Var> binary(BinaryOp op) {
            return check(op, union(visit(op.a()), visit(op.b())));
        }

        @Override
        public Set<Var> visitVar(Var op) {
            return eligible.contains(op) ? Set.of(op) : Set.of();
        }

        @Override
        public Set<Var> visitIntImm(IntImm op) {
            return Set.of();
        }

        @Override
        public Set<Var> visitFloatImm(FloatImm op) {
            return Set.of();
        }

        @Override
        public Set<Var> visitAdd(Add op) {
            return binary(op);
        }

        @Override
        public Set<Var> visitSub(Sub op) {
            return binary(op);
        }

        @Override
        public Set<Var> visitMul(Mul op) {
            return binary(op);
        }

        @Override
        public Set<Var> visitDiv(Div op) {
            return binary(op);
        }

        @Override
        public Set<Var> visitMod(Mod op) {
            return binary(op);
        }

        @Override
        public Set<Var> visitFloorDiv(FloorDiv op) {
            return binary(op);
        }

        @Override
        public Set<Var> visitFloorMod(FloorMod op) {
            return binary(op);
        }

        @Override
        public Set<Var> visitMin(Min op) {
            return binary(op);
        }

        @Override
        public Set<Var> visitMax(Max op) {
            return binary(op);
        }

        @Override
        public Set<Var> visitCompare(Compare op) {
            visit(op.a());
            visit(op.b());
            return Set.of();
        }

        @Override
        public Set<Var> visitAnd(And op) {
            visit(op.a());
            visit(op.b());
            return Set.of();
        }

        @Override
        public Set<Var> visitOr(Or op) {
            visit(op.a());
            visit(op.b());
            return Set.of();
        }

        @Override
        public Set<Var> visitNot(Not op) {
            visit(op.a());
            return Set.of();
        }

        @Override
        public Set<Var> visitCast(Cast op) {
            Set<Var> below = visit(op.value());
            DataType from = op.value().dtype();
            if (!below.isEmpty() && from.isIntegral() && op.dtype().isIntegral()) {
                Interval inner = analyzer.bound(op.value());
                if (!inner.fitsIn(op.dtype().elementOf())) {
                    block(below, op, inner);
                }
            }
            return check(op, below);
        }

        @Override
        public Set<Var> visitSelect(Select op) {
            visit(op.condition());
            return check(op, union(visit(op.trueValue()), visit(op.falseValue())));
        }

        @Override
        public Set<Var> visitBufferLoad(BufferLoad op) {
            return Set.of();
        }

        @Override
        public Set<Var> visitRamp(Ramp op) {
            return check(op, union(visit(op.base()), visit(op.stride())));
        }

        @Override
        public Set<Var> visitBroadcast(Broadcast op) {
            return check(op, visit(op.value()));
        }

        @Override
        public Set<Var> visitCall(Call op) {
            for (Expr arg : op.args()) {
                visit(arg);
            }
            return Set.of();
        }
    }
}
