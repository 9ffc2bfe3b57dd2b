package io.surfworks.tirnarrow.arith;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.OptionalLong;

import io.surfworks.tirnarrow.tir.ExprVisitor;
import io.surfworks.tirnarrow.tir.TirAst.Add;
import io.surfworks.tirnarrow.tir.TirAst.And;
import io.surfworks.tirnarrow.tir.TirAst.Broadcast;
import io.surfworks.tirnarrow.tir.TirAst.BufferLoad;
import io.surfworks.tirnarrow.tir.TirAst.Call;
import io.surfworks.tirnarrow.tir.TirAst.Cast;
import io.surfworks.tirnarrow.tir.TirAst.Compare;
import io.surfworks.tirnarrow.tir.TirAst.Div;
import io.surfworks.tirnarrow.tir.TirAst.Expr;
import io.surfworks.tirnarrow.tir.TirAst.FloatImm;
import io.surfworks.tirnarrow.tir.TirAst.FloorDiv;
import io.surfworks.tirnarrow.tir.TirAst.FloorMod;
import io.surfworks.tirnarrow.tir.TirAst.IntImm;
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

/**
 * Computes a provable integer interval for an expression.
 *
 * <p>Bounds are derived structurally from the intervals of the variables
 * the analyzer was created with. Anything the analyzer cannot reason about
 * (buffer contents, opaque calls, floating point, a non-constant divisor)
 * is unbounded, and an unbounded operand makes its parent unbounded on that
 * side. The result is therefore always a superset of the runtime values.
 *
 * <p>Results are memoized per node identity, not per structural value:
 * a subexpression shared by reference is analyzed once, while two
 * separately built but equal subtrees each get their own entry. This keeps
 * the analysis linear in the number of distinct nodes.
 *
 * <p>Instances are single-use per function and not thread-safe.
 *
 * <pre>{@code
 * BoundAnalyzer analyzer = new BoundAnalyzer(Map.of(i, Interval.of(0, 15)));
 * Interval b = analyzer.bound(Ops.add(Ops.mul(i, Ops.i64(8)), Ops.i64(7)));  // [7, 127]
 * }</pre>
 */
public final class BoundAnalyzer implements ExprVisitor<Interval> {

    private final Map<Var, Interval> varBounds;
    private final Map<Expr, Interval> memo = new IdentityHashMap<>();

    /**
     * Creates an analyzer with no known variables.
     */
    public BoundAnalyzer() {
        this(Map.of());
    }

    /**
     * Creates an analyzer that knows the given variable intervals.
     *
     * @param varBounds intervals keyed by variable identity
     */
    public BoundAnalyzer(Map<Var, Interval> varBounds) {
        this.varBounds = new IdentityHashMap<>(varBounds);
    }

    /**
     * Returns the interval of every value {@code expr} can take.
     */
    public Interval bound(Expr expr) {
        Interval cached = memo.get(expr);
        if (cached != null) {
            return cached;
        }
        Interval result = expr.accept(this);
        memo.put(expr, result);
        return result;
    }

    /**
     * Returns the value of {@code expr} if its bound is a single point.
     */
    public OptionalLong constantValue(Expr expr) {
        Interval b = bound(expr);
        return b.isPoint() ? OptionalLong.of(b.lo()) : OptionalLong.empty();
    }

    /**
     * Number of distinct nodes analyzed so far.
     */
    public int memoSize() {
        return memo.size();
    }

    // ==================== Leaves ====================

    @Override
    public Interval visitVar(Var op) {
        return varBounds.getOrDefault(op, Interval.unbounded());
    }

    @Override
    public Interval visitIntImm(IntImm op) {
        return Interval.point(op.value());
    }

    @Override
    public Interval visitFloatImm(FloatImm op) {
        return Interval.unbounded();
    }

    // ==================== Arithmetic ====================

    @Override
    public Interval visitAdd(Add op) {
        return bound(op.a()).add(bound(op.b()));
    }

    @Override
    public Interval visitSub(Sub op) {
        return bound(op.a()).sub(bound(op.b()));
    }

    @Override
    public Interval visitMul(Mul op) {
        return bound(op.a()).mul(bound(op.b()));
    }

    @Override
    public Interval visitDiv(Div op) {
        Interval dividend = bound(op.a());
        OptionalLong divisor = positiveConstant(op.b());
        return divisor.isPresent() ? dividend.truncDiv(divisor.getAsLong()) : Interval.unbounded();
    }

    @Override
    public Interval visitMod(Mod op) {
        Interval dividend = bound(op.a());
        OptionalLong modulus = positiveConstant(op.b());
        return modulus.isPresent() ? dividend.truncMod(modulus.getAsLong()) : Interval.unbounded();
    }

    @Override
    public Interval visitFloorDiv(FloorDiv op) {
        Interval dividend = bound(op.a());
        OptionalLong divisor = positiveConstant(op.b());
        return divisor.isPresent() ? dividend.floorDiv(divisor.getAsLong()) : Interval.unbounded();
    }

    @Override
    public Interval visitFloorMod(FloorMod op) {
        Interval dividend = bound(op.a());
        OptionalLong modulus = positiveConstant(op.b());
        return modulus.isPresent() ? dividend.floorMod(modulus.getAsLong()) : Interval.unbounded();
    }

    @Override
    public Interval visitMin(Min op) {
        return bound(op.a()).min(bound(op.b()));
    }

    @Override
    public Interval visitMax(Max op) {
        return bound(op.a()).max(bound(op.b()));
    }

    // ==================== Logic ====================

    @Override
    public Interval visitCompare(Compare op) {
        return Interval.of(0, 1);
    }

    @Override
    public Interval visitAnd(And op) {
        return Interval.of(0, 1);
    }

    @Override
    public Interval visitOr(Or op) {
        return Interval.of(0, 1);
    }

    @Override
    public Interval visitNot(Not op) {
        return Interval.of(0, 1);
    }

    // ==================== Everything Else ====================

    /**
     * The value of a cast is the value of its operand. Whether the target
     * type can hold that value is a legality question for the caller.
     */
    @Override
    public Interval visitCast(Cast op) {
        if (!op.value().dtype().isIntegral() && !op.value().dtype().isBool()) {
            return Interval.unbounded();
        }
        return bound(op.value());
    }

    @Override
    public Interval visitSelect(Select op) {
        return bound(op.trueValue()).union(bound(op.falseValue()));
    }

    @Override
    public Interval visitBufferLoad(BufferLoad op) {
        return Interval.unbounded();
    }

    @Override
    public Interval visitRamp(Ramp op) {
        Interval base = bound(op.base());
        Interval stride = bound(op.stride());
        return base.add(stride.mul(Interval.of(0, op.lanes() - 1)));
    }

    @Override
    public Interval visitBroadcast(Broadcast op) {
        return bound(op.value());
    }

    @Override
    public Interval visitCall(Call op) {
        return Interval.unbounded();
    }

    private OptionalLong positiveConstant(Expr e) {
        Interval b = bound(e);
        if (b.isPoint() && b.lo() > 0) {
            return OptionalLong.of(b.lo());
        }
        return OptionalLong.empty();
    }
}
