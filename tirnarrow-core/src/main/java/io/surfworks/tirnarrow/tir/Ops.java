package io.surfworks.tirnarrow.tir;

import java.util.List;

import io.surfworks.tirnarrow.tir.TirAst.Add;
import io.surfworks.tirnarrow.tir.TirAst.And;
import io.surfworks.tirnarrow.tir.TirAst.Block;
import io.surfworks.tirnarrow.tir.TirAst.Buffer;
import io.surfworks.tirnarrow.tir.TirAst.BufferLoad;
import io.surfworks.tirnarrow.tir.TirAst.BufferStore;
import io.surfworks.tirnarrow.tir.TirAst.Call;
import io.surfworks.tirnarrow.tir.TirAst.Cast;
import io.surfworks.tirnarrow.tir.TirAst.Compare;
import io.surfworks.tirnarrow.tir.TirAst.CompareOp;
import io.surfworks.tirnarrow.tir.TirAst.DataType;
import io.surfworks.tirnarrow.tir.TirAst.Div;
import io.surfworks.tirnarrow.tir.TirAst.Expr;
import io.surfworks.tirnarrow.tir.TirAst.FloatImm;
import io.surfworks.tirnarrow.tir.TirAst.FloorDiv;
import io.surfworks.tirnarrow.tir.TirAst.FloorMod;
import io.surfworks.tirnarrow.tir.TirAst.For;
import io.surfworks.tirnarrow.tir.TirAst.ForKind;
import io.surfworks.tirnarrow.tir.TirAst.IfThenElse;
import io.surfworks.tirnarrow.tir.TirAst.IntImm;
import io.surfworks.tirnarrow.tir.TirAst.IterVar;
import io.surfworks.tirnarrow.tir.TirAst.Max;
import io.surfworks.tirnarrow.tir.TirAst.Min;
import io.surfworks.tirnarrow.tir.TirAst.Mod;
import io.surfworks.tirnarrow.tir.TirAst.Mul;
import io.surfworks.tirnarrow.tir.TirAst.Not;
import io.surfworks.tirnarrow.tir.TirAst.Or;
import io.surfworks.tirnarrow.tir.TirAst.Ramp;
import io.surfworks.tirnarrow.tir.TirAst.Select;
import io.surfworks.tirnarrow.tir.TirAst.SeqStmt;
import io.surfworks.tirnarrow.tir.TirAst.Stmt;
import io.surfworks.tirnarrow.tir.TirAst.Sub;
import io.surfworks.tirnarrow.tir.TirAst.ThreadBinding;
import io.surfworks.tirnarrow.tir.TirAst.Var;

/**
 * Checked factory methods for building IR.
 *
 * <p>The AST records accept any operands so that malformed input can be
 * represented and reported by {@link TirTypeChecker}. These helpers reject
 * mismatched operand types up front and are what builders and passes use.
 *
 * <p>Example:
 * <pre>{@code
 * Var i = Ops.var("i", DataType.INT64);
 * Var j = Ops.var("j", DataType.INT64);
 * Expr index = Ops.add(Ops.mul(i, Ops.i64(16)), j);
 * Stmt body = Ops.serial(i, 0, 16, Ops.serial(j, 0, 16,
 *         Ops.store(b, List.of(index), Ops.load(a, List.of(index)))));
 * }</pre>
 */
public final class Ops {

    private Ops() {}

    // ==================== Leaves ====================

    public static Var var(String name, DataType dtype) {
        return new Var(name, dtype);
    }

    public static IntImm imm(DataType dtype, long value) {
        return new IntImm(dtype, value);
    }

    public static IntImm i32(long value) {
        return new IntImm(DataType.INT32, value);
    }

    public static IntImm i64(long value) {
        return new IntImm(DataType.INT64, value);
    }

    public static FloatImm f32(double value) {
        return new FloatImm(DataType.FLOAT32, value);
    }

    // ==================== Arithmetic ====================

    public static Expr add(Expr a, Expr b) {
        requireSameType("+", a, b);
        return new Add(a, b);
    }

    public static Expr sub(Expr a, Expr b) {
        requireSameType("-", a, b);
        return new Sub(a, b);
    }

    public static Expr mul(Expr a, Expr b) {
        requireSameType("*", a, b);
        return new Mul(a, b);
    }

    public static Expr div(Expr a, Expr b) {
        requireSameType("div", a, b);
        return new Div(a, b);
    }

    public static Expr mod(Expr a, Expr b) {
        requireSameType("truncmod", a, b);
        return new Mod(a, b);
    }

    public static Expr floorDiv(Expr a, Expr b) {
        requireSameType("floordiv", a, b);
        return new FloorDiv(a, b);
    }

    public static Expr floorMod(Expr a, Expr b) {
        requireSameType("floormod", a, b);
        return new FloorMod(a, b);
    }

    public static Expr min(Expr a, Expr b) {
        requireSameType("min", a, b);
        return new Min(a, b);
    }

    public static Expr max(Expr a, Expr b) {
        requireSameType("max", a, b);
        return new Max(a, b);
    }

    // ==================== Logic ====================

    public static Expr cmp(CompareOp op, Expr a, Expr b) {
        requireSameType(op.symbol(), a, b);
        return new Compare(op, a, b);
    }

    public static Expr lt(Expr a, Expr b) {
        return cmp(CompareOp.LT, a, b);
    }

    public static Expr le(Expr a, Expr b) {
        return cmp(CompareOp.LE, a, b);
    }

    public static Expr gt(Expr a, Expr b) {
        return cmp(CompareOp.GT, a, b);
    }

    public static Expr ge(Expr a, Expr b) {
        return cmp(CompareOp.GE, a, b);
    }

    public static Expr eq(Expr a, Expr b) {
        return cmp(CompareOp.EQ, a, b);
    }

    public static Expr and(Expr a, Expr b) {
        requireBool("&&", a);
        requireBool("&&", b);
        return new And(a, b);
    }

    public static Expr or(Expr a, Expr b) {
        requireBool("||", a);
        requireBool("||", b);
        return new Or(a, b);
    }

    public static Expr not(Expr a) {
        requireBool("!", a);
        return new Not(a);
    }

    // ==================== Conversions and Access ====================

    public static Expr cast(DataType dtype, Expr value) {
        return new Cast(dtype, value);
    }

    public static Expr select(Expr condition, Expr trueValue, Expr falseValue) {
        requireBool("select", condition);
        requireSameType("select", trueValue, falseValue);
        return new Select(condition, trueValue, falseValue);
    }

    public static Expr load(Buffer buffer, List<Expr> indices) {
        requireIndices(buffer, indices);
        return new BufferLoad(buffer, indices);
    }

    public static Expr ramp(Expr base, Expr stride, int lanes) {
        requireSameType("ramp", base, stride);
        return new Ramp(base, stride, lanes);
    }

    public static Expr call(DataType dtype, String name, List<Expr> args) {
        return new Call(dtype, name, args);
    }

    // ==================== Statements ====================

    public static Stmt store(Buffer buffer, List<Expr> indices, Expr value) {
        requireIndices(buffer, indices);
        return new BufferStore(buffer, indices, value);
    }

    public static Stmt loop(Var loopVar, long min, long extent, ForKind kind, Stmt body) {
        return new For(loopVar, imm(loopVar.dtype(), min), imm(loopVar.dtype(), extent), kind, body);
    }

    public static Stmt serial(Var loopVar, long min, long extent, Stmt body) {
        return loop(loopVar, min, extent, ForKind.SERIAL, body);
    }

    public static Stmt parallel(Var loopVar, long min, long extent, Stmt body) {
        return loop(loopVar, min, extent, ForKind.PARALLEL, body);
    }

    public static Stmt vectorized(Var loopVar, long min, long extent, Stmt body) {
        return loop(loopVar, min, extent, ForKind.VECTORIZED, body);
    }

    public static Stmt threadBinding(Var var, long extent, String threadTag, Stmt body) {
        return new ThreadBinding(var, imm(var.dtype(), extent), threadTag, body);
    }

    public static IterVar iterVar(Var var, long min, long extent, Expr binding) {
        return new IterVar(var, imm(var.dtype(), min), imm(var.dtype(), extent), binding);
    }

    public static Stmt block(String name, List<IterVar> iterVars, Stmt body) {
        return new Block(name, iterVars, body);
    }

    public static Stmt ifThen(Expr condition, Stmt thenCase) {
        requireBool("if", condition);
        return new IfThenElse(condition, thenCase, null);
    }

    public static Stmt ifThenElse(Expr condition, Stmt thenCase, Stmt elseCase) {
        requireBool("if", condition);
        return new IfThenElse(condition, thenCase, elseCase);
    }

    public static Stmt seq(Stmt... stmts) {
        return new SeqStmt(List.of(stmts));
    }

    // ==================== Checks ====================

    private static void requireSameType(String op, Expr a, Expr b) {
        if (!a.dtype().equals(b.dtype())) {
            throw new TirValidationException(String.format(
                    "%s operand types must match: %s vs %s", op, a.dtype(), b.dtype()));
        }
    }

    private static void requireBool(String op, Expr e) {
        if (!e.dtype().isBool()) {
            throw new TirValidationException(String.format(
                    "%s requires a bool operand, got %s", op, e.dtype()));
        }
    }

    private static void requireIndices(Buffer buffer, List<Expr> indices) {
        for (Expr index : indices) {
            if (!index.dtype().isIntegral()) {
                throw new TirValidationException(String.format(
                        "Index into %s must be an integer, got %s", buffer.name(), index.dtype()));
            }
        }
    }
}
