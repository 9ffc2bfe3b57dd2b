package io.surfworks.tirnarrow.tir;

import io.surfworks.tirnarrow.tir.TirAst.Add;
import io.surfworks.tirnarrow.tir.TirAst.And;
import io.surfworks.tirnarrow.tir.TirAst.Broadcast;
import io.surfworks.tirnarrow.tir.TirAst.BufferLoad;
import io.surfworks.tirnarrow.tir.TirAst.Call;
import io.surfworks.tirnarrow.tir.TirAst.Cast;
import io.surfworks.tirnarrow.tir.TirAst.Compare;
import io.surfworks.tirnarrow.tir.TirAst.Div;
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
 * Visitor over every expression kind.
 *
 * <p>One method per node: adding a node to {@link TirAst.Expr} means every
 * analysis, the printer and the rewriter stop compiling until they handle it.
 *
 * @param <R> the result type
 */
public interface ExprVisitor<R> {

    R visitVar(Var op);

    R visitIntImm(IntImm op);

    R visitFloatImm(FloatImm op);

    R visitAdd(Add op);

    R visitSub(Sub op);

    R visitMul(Mul op);

    R visitDiv(Div op);

    R visitMod(Mod op);

    R visitFloorDiv(FloorDiv op);

    R visitFloorMod(FloorMod op);

    R visitMin(Min op);

    R visitMax(Max op);

    R visitCompare(Compare op);

    R visitAnd(And op);

    R visitOr(Or op);

    R visitNot(Not op);

    R visitCast(Cast op);

    R visitSelect(Select op);

    R visitBufferLoad(BufferLoad op);

    R visitRamp(Ramp op);

    R visitBroadcast(Broadcast op);

    R visitCall(Call op);
}
