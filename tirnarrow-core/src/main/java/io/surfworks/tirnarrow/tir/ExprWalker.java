package io.surfworks.tirnarrow.tir;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import io.surfworks.tirnarrow.tir.TirAst.Add;
import io.surfworks.tirnarrow.tir.TirAst.And;
import io.surfworks.tirnarrow.tir.TirAst.BinaryOp;
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
 * Visits every distinct node of an expression DAG once.
 *
 * <p>Subclasses override the nodes they care about and call
 * {@link #walk(Expr)} or the {@code super} method to keep descending.
 * Nodes are told apart by identity, so a subexpression shared by several
 * parents is visited on the first path that reaches it only.
 */
public abstract class ExprWalker implements ExprVisitor<Void> {

    private final Set<Expr> visited = Collections.newSetFromMap(new IdentityHashMap<>());

    public void walk(Expr expr) {
        if (visited.add(expr)) {
            expr.accept(this);
        }
    }

    protected Void visitBinary(BinaryOp op) {
        walk(op.a());
        walk(op.b());
        return null;
    }

    @Override
    public Void visitVar(Var op) {
        return null;
    }

    @Override
    public Void visitIntImm(IntImm op) {
        return null;
    }

    @Override
    public Void visitFloatImm(FloatImm op) {
        return null;
    }

    @Override
    public Void visitAdd(Add op) {
        return visitBinary(op);
    }

    @Override
    public Void visitSub(Sub op) {
        return visitBinary(op);
    }

    @Override
    public Void visitMul(Mul op) {
        return visitBinary(op);
    }

    @Override
    public Void visitDiv(Div op) {
        return visitBinary(op);
    }

    @Override
    public Void visitMod(Mod op) {
        return visitBinary(op);
    }

    @Override
    public Void visitFloorDiv(FloorDiv op) {
        return visitBinary(op);
    }

    @Override
    public Void visitFloorMod(FloorMod op) {
        return visitBinary(op);
    }

    @Override
    public Void visitMin(Min op) {
        return visitBinary(op);
    }

    @Override
    public Void visitMax(Max op) {
        return visitBinary(op);
    }

    @Override
    public Void visitCompare(Compare op) {
        walk(op.a());
        walk(op.b());
        return null;
    }

    @Override
    public Void visitAnd(And op) {
        walk(op.a());
        walk(op.b());
        return null;
    }

    @Override
    public Void visitOr(Or op) {
        walk(op.a());
        walk(op.b());
        return null;
    }

    @Override
    public Void visitNot(Not op) {
        walk(op.a());
        return null;
    }

    @Override
    public Void visitCast(Cast op) {
        walk(op.value());
        return null;
    }

    @Override
    public Void visitSelect(Select op) {
        walk(op.condition());
        walk(op.trueValue());
        walk(op.falseValue());
        return null;
    }

    @Override
    public Void visitBufferLoad(BufferLoad op) {
        for (Expr index : op.indices()) {
            walk(index);
        }
        return null;
    }

    @Override
    public Void visitRamp(Ramp op) {
        walk(op.base());
        walk(op.stride());
        return null;
    }

    @Override
    public Void visitBroadcast(Broadcast op) {
        walk(op.value());
        return null;
    }

    @Override
    public Void visitCall(Call op) {
        for (Expr arg : op.args()) {
            walk(arg);
        }
        return null;
    }
}
