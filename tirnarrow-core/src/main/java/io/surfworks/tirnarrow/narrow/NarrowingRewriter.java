package io.surfworks.tirnarrow.narrow;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.surfworks.tirnarrow.tir.ExprVisitor;
import io.surfworks.tirnarrow.tir.StmtVisitor;
import io.surfworks.tirnarrow.tir.TirAst.Add;
import io.surfworks.tirnarrow.tir.TirAst.And;
import io.surfworks.tirnarrow.tir.TirAst.BinaryOp;
import io.surfworks.tirnarrow.tir.TirAst.Block;
import io.surfworks.tirnarrow.tir.TirAst.Broadcast;
import io.surfworks.tirnarrow.tir.TirAst.BufferLoad;
import io.surfworks.tirnarrow.tir.TirAst.BufferStore;
import io.surfworks.tirnarrow.tir.TirAst.Call;
import io.surfworks.tirnarrow.tir.TirAst.Cast;
import io.surfworks.tirnarrow.tir.TirAst.Compare;
import io.surfworks.tirnarrow.tir.TirAst.DataType;
import io.surfworks.tirnarrow.tir.TirAst.Div;
import io.surfworks.tirnarrow.tir.TirAst.Evaluate;
import io.surfworks.tirnarrow.tir.TirAst.Expr;
import io.surfworks.tirnarrow.tir.TirAst.FloatImm;
import io.surfworks.tirnarrow.tir.TirAst.FloorDiv;
import io.surfworks.tirnarrow.tir.TirAst.FloorMod;
import io.surfworks.tirnarrow.tir.TirAst.For;
import io.surfworks.tirnarrow.tir.TirAst.IfThenElse;
import io.surfworks.tirnarrow.tir.TirAst.IntImm;
import io.surfworks.tirnarrow.tir.TirAst.IterVar;
import io.surfworks.tirnarrow.tir.TirAst.Max;
import io.surfworks.tirnarrow.tir.TirAst.Min;
import io.surfworks.tirnarrow.tir.TirAst.Mod;
import io.surfworks.tirnarrow.tir.TirAst.Mul;
import io.surfworks.tirnarrow.tir.TirAst.Not;
import io.surfworks.tirnarrow.tir.TirAst.Or;
import io.surfworks.tirnarrow.tir.TirAst.PrimFunc;
import io.surfworks.tirnarrow.tir.TirAst.Ramp;
import io.surfworks.tirnarrow.tir.TirAst.Select;
import io.surfworks.tirnarrow.tir.TirAst.SeqStmt;
import io.surfworks.tirnarrow.tir.TirAst.Stmt;
import io.surfworks.tirnarrow.tir.TirAst.Sub;
import io.surfworks.tirnarrow.tir.TirAst.ThreadBinding;
import io.surfworks.tirnarrow.tir.TirAst.Var;

/**
 * Rebuilds a function with every narrowed variable retyped.
 *
 * <p>Each narrowed variable is replaced by one new {@link Var} of its
 * resolved type, at its declaration and at every use. Types are then made
 * consistent bottom-up:
 * <ul>
 *   <li>operands of arithmetic, comparisons, selects and ramps that end up
 *       with different widths are unified: a literal that fits is re-emitted
 *       at the other operand's type, otherwise the narrower operand is cast
 *       up to the wider one;</li>
 *   <li>a cast whose operand originally had the cast's own type follows its
 *       operand and disappears, as does a cast whose new operand already has
 *       the target type;</li>
 *   <li>loop bounds, thread extents and block domains and bindings take the
 *       type of the variable they declare;</li>
 *   <li>stored values and call arguments are brought back to their original
 *       types.</li>
 * </ul>
 *
 * <p>Nothing is simplified. Subtrees without a narrowed variable are returned
 * as the same objects, and a function with nothing narrowed is returned as is.
 */
public final class NarrowingRewriter implements ExprVisitor<Expr>, StmtVisitor<Stmt> {

    private static final Logger LOG = Logger.getLogger(NarrowingRewriter.class.getName());

    private final DecisionMap decisions;
    private final Map<Var, Var> substitutions = new IdentityHashMap<>();
    private final Map<Expr, Expr> memo = new IdentityHashMap<>();

    public NarrowingRewriter(DecisionMap decisions) {
        this.decisions = decisions;
    }

    /**
     * Returns {@code function} with the decisions applied.
     */
    public PrimFunc rewrite(PrimFunc function) {
        if (!decisions.anyNarrowed()) {
            return function;
        }
        Stmt body = function.body().accept(this);
        LOG.fine(() -> String.format("[%s] retyped %d variables", function.name(), substitutions.size()));
        return body == function.body() ? function : function.withBody(body);
    }

    private Expr rewrite(Expr expr) {
        Expr cached = memo.get(expr);
        if (cached != null) {
            return cached;
        }
        Expr result = expr.accept(this);
        memo.put(expr, result);
        return result;
    }

    private Var substitute(Var var) {
        if (!decisions.isNarrowed(var)) {
            return var;
        }
        return substitutions.computeIfAbsent(var, v -> v.copyWithDtype(decisions.resolvedType(v)));
    }

    // ==================== Type Helpers ====================

    /**
     * Brings {@code expr} to exactly {@code type}.
     */
    static Expr coerce(Expr expr, DataType type) {
        if (expr.dtype().equals(type)) {
            return expr;
        }
        Expr literal = retypeLiteral(expr, type);
        return literal != null ? literal : new Cast(type, expr);
    }

    /**
     * Gives two operands a common type; returns them in order.
     */
    static Expr[] unify(Expr a, Expr b) {
        DataType ta = a.dtype();
        DataType tb = b.dtype();
        if (ta.equals(tb)) {
            return new Expr[] {a, b};
        }
        Expr literalA = retypeLiteral(a, tb);
        if (literalA != null) {
            return new Expr[] {literalA, b};
        }
        Expr literalB = retypeLiteral(b, ta);
        if (literalB != null) {
            return new Expr[] {a, literalB};
        }
        if (ta.bits() >= tb.bits()) {
            return new Expr[] {a, new Cast(ta, b)};
        }
        return new Expr[] {new Cast(tb, a), b};
    }

    /**
     * Re-emits an integer literal, or a broadcast of one, at {@code type}.
     * Returns null when {@code expr} is neither or its value does not fit.
     */
    private static Expr retypeLiteral(Expr expr, DataType type) {
        if (!type.isIntegral()) {
            return null;
        }
        if (expr instanceof IntImm imm) {
            return type.lanes() == 1 && type.canRepresent(imm.value()) ? new IntImm(type, imm.value()) : null;
        }
        if (expr instanceof Broadcast broadcast && broadcast.value() instanceof IntImm imm
                && broadcast.lanes() == type.lanes() && type.elementOf().canRepresent(imm.value())) {
            return new Broadcast(new IntImm(type.elementOf(), imm.value()), broadcast.lanes());
        }
        return null;
    }

    // ==================== Statements ====================

    @Override
    public Stmt visitFor(For op) {
        Var v = substitute(op.loopVar());
        Expr min = coerce(rewrite(op.min()), v.dtype());
        Expr extent = coerce(rewrite(op.extent()), v.dtype());
        Stmt body = op.body().accept(this);
        if (v == op.loopVar() && min == op.min() && extent == op.extent() && body == op.body()) {
            return op;
        }
        return new For(v, min, extent, op.kind(), body);
    }

    @Override
    public Stmt visitThreadBinding(ThreadBinding op) {
        Var v = substitute(op.var());
        Expr extent = coerce(rewrite(op.extent()), v.dtype());
        Stmt body = op.body().accept(this);
        if (v == op.var() && extent == op.extent() && body == op.body()) {
            return op;
        }
        return new ThreadBinding(v, extent, op.threadTag(), body);
    }

    @Override
    public Stmt visitBlock(Block op) {
        boolean changed = false;
        List<IterVar> iterVars = new ArrayList<>(op.iterVars().size());
        for (IterVar iv : op.iterVars()) {
            Var v = substitute(iv.var());
            Expr min = coerce(rewrite(iv.min()), v.dtype());
            Expr extent = coerce(rewrite(iv.extent()), v.dtype());
            Expr binding = coerce(rewrite(iv.binding()), v.dtype());
            if (v == iv.var() && min == iv.min() && extent == iv.extent() && binding == iv.binding()) {
                iterVars.add(iv);
            } else {
                iterVars.add(new IterVar(v, min, extent, binding));
                changed = true;
            }
        }
        Stmt body = op.body().accept(this);
        if (!changed && body == op.body()) {
            return op;
        }
        return new Block(op.name(), iterVars, body);
    }

    @Override
    public Stmt visitIfThenElse(IfThenElse op) {
        Expr condition = rewrite(op.condition());
        Stmt thenCase = op.thenCase().accept(this);
        Stmt elseCase = op.elseCase() == null ? null : op.elseCase().accept(this);
        if (condition == op.condition() && thenCase == op.thenCase() && elseCase == op.elseCase()) {
            return op;
        }
        return new IfThenElse(condition, thenCase, elseCase);
    }

    @Override
    public Stmt visitBufferStore(BufferStore op) {
        List<Expr> indices = rewriteAll(op.indices());
        Expr value = coerce(rewrite(op.value()), op.value().dtype());
        if (indices == op.indices() && value == op.value()) {
            return op;
        }
        return new BufferStore(op.buffer(), indices, value);
    }

    @Override
    public Stmt visitSeqStmt(SeqStmt op) {
        boolean changed = false;
        List<Stmt> stmts = new ArrayList<>(op.stmts().size());
        for (Stmt stmt : op.stmts()) {
            Stmt rewritten = stmt.accept(this);
            changed |= rewritten != stmt;
            stmts.add(rewritten);
        }
        return changed ? new SeqStmt(stmts) : op;
    }

    @Override
    public Stmt visitEvaluate(Evaluate op) {
        Expr value = rewrite(op.value());
        return value == op.value() ? op : new Evaluate(value);
    }

    // ==================== Expressions ====================

    @Override
    public Expr visitVar(Var op) {
        return substitute(op);
    }

    @Override
    public Expr visitIntImm(IntImm op) {
        return op;
    }

    @Override
    public Expr visitFloatImm(FloatImm op) {
        return op;
    }

    @Override
    public Expr visitAdd(Add op) {
        return binary(op);
    }

    @Override
    public Expr visitSub(Sub op) {
        return binary(op);
    }

    @Override
    public Expr visitMul(Mul op) {
        return binary(op);
    }

    @Override
    public Expr visitDiv(Div op) {
        return binary(op);
    }

    @Override
    public Expr visitMod(Mod op) {
        return binary(op);
    }

    @Override
    public Expr visitFloorDiv(FloorDiv op) {
        return binary(op);
    }

    @Override
    public Expr visitFloorMod(FloorMod op) {
        return binary(op);
    }

    @Override
    public Expr visitMin(Min op) {
        return binary(op);
    }

    @Override
    public Expr visitMax(Max op) {
        return binary(op);
    }

    private Expr binary(BinaryOp op) {
        Expr a = rewrite(op.a());
        Expr b = rewrite(op.b());
        if (a == op.a() && b == op.b()) {
            return op;
        }
        Expr[] unified = unify(a, b);
        return op.with(unified[0], unified[1]);
    }

    @Override
    public Expr visitCompare(Compare op) {
        Expr a = rewrite(op.a());
        Expr b = rewrite(op.b());
        if (a == op.a() && b == op.b()) {
            return op;
        }
        Expr[] unified = unify(a, b);
        return op.with(unified[0], unified[1]);
    }

    @Override
    public Expr visitAnd(And op) {
        Expr a = rewrite(op.a());
        Expr b = rewrite(op.b());
        return a == op.a() && b == op.b() ? op : new And(a, b);
    }

    @Override
    public Expr visitOr(Or op) {
        Expr a = rewrite(op.a());
        Expr b = rewrite(op.b());
        return a == op.a() && b == op.b() ? op : new Or(a, b);
    }

    @Override
    public Expr visitNot(Not op) {
        Expr a = rewrite(op.a());
        return a == op.a() ? op : new Not(a);
    }

    @Override
    public Expr visitCast(Cast op) {
        Expr value = rewrite(op.value());
        if (value == op.value()) {
            return op;
        }
        if (op.value().dtype().equals(op.dtype()) || value.dtype().equals(op.dtype())) {
            return value;
        }
        return new Cast(op.dtype(), value);
    }

    @Override
    public Expr visitSelect(Select op) {
        Expr condition = rewrite(op.condition());
        Expr t = rewrite(op.trueValue());
        Expr f = rewrite(op.falseValue());
        if (condition == op.condition() && t == op.trueValue() && f == op.falseValue()) {
            return op;
        }
        Expr[] unified = unify(t, f);
        return new Select(condition, unified[0], unified[1]);
    }

    @Override
    public Expr visitBufferLoad(BufferLoad op) {
        List<Expr> indices = rewriteAll(op.indices());
        return indices == op.indices() ? op : new BufferLoad(op.buffer(), indices);
    }

    @Override
    public Expr visitRamp(Ramp op) {
        Expr base = rewrite(op.base());
        Expr stride = rewrite(op.stride());
        if (base == op.base() && stride == op.stride()) {
            return op;
        }
        Expr[] unified = unify(base, stride);
        return new Ramp(unified[0], unified[1], op.lanes());
    }

    @Override
    public Expr visitBroadcast(Broadcast op) {
        Expr value = rewrite(op.value());
        return value == op.value() ? op : new Broadcast(value, op.lanes());
    }

    @Override
    public Expr visitCall(Call op) {
        boolean changed = false;
        List<Expr> args = new ArrayList<>(op.args().size());
        for (Expr arg : op.args()) {
            Expr rewritten = coerce(rewrite(arg), arg.dtype());
            changed |= rewritten != arg;
            args.add(rewritten);
        }
        return changed ? new Call(op.dtype(), op.name(), args) : op;
    }

    private List<Expr> rewriteAll(List<Expr> exprs) {
        boolean changed = false;
        List<Expr> result = new ArrayList<>(exprs.size());
        for (Expr e : exprs) {
            Expr rewritten = rewrite(e);
            changed |= rewritten != e;
            result.add(rewritten);
        }
        return changed ? result : exprs;
    }
}
