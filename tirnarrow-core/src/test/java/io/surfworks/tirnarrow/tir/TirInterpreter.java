package io.surfworks.tirnarrow.tir;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.tirnarrow.tir.TirAst.Add;
import io.surfworks.tirnarrow.tir.TirAst.And;
import io.surfworks.tirnarrow.tir.TirAst.BinaryOp;
import io.surfworks.tirnarrow.tir.TirAst.Block;
import io.surfworks.tirnarrow.tir.TirAst.Broadcast;
import io.surfworks.tirnarrow.tir.TirAst.Buffer;
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
import io.surfworks.tirnarrow.tir.TirAst.Kind;
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
 * Executes scalar IR for tests.
 *
 * <p>Integer arithmetic wraps at the width of its type, so a program that
 * overflows a narrowed type computes a different result than its wide
 * original. Integer buffers are backed by {@code long[]}, float buffers by
 * {@code double[]}; multi-dimensional buffers are row-major. Thread axes run
 * sequentially. Vector nodes and calls are not supported.
 */
public final class TirInterpreter implements StmtVisitor<Void>, ExprVisitor<Number> {

    private final Map<Buffer, long[]> intBuffers = new IdentityHashMap<>();
    private final Map<Buffer, double[]> floatBuffers = new IdentityHashMap<>();
    private final Map<Var, Long> env = new IdentityHashMap<>();
    private long evaluated;

    public TirInterpreter bind(Var param, long value) {
        env.put(param, wrap(value, param.dtype()));
        return this;
    }

    public TirInterpreter buffer(Buffer buffer, long[] data) {
        intBuffers.put(buffer, data.clone());
        return this;
    }

    public TirInterpreter buffer(Buffer buffer, double[] data) {
        floatBuffers.put(buffer, data.clone());
        return this;
    }

    public long[] ints(Buffer buffer) {
        return intBuffers.get(buffer);
    }

    public double[] floats(Buffer buffer) {
        return floatBuffers.get(buffer);
    }

    /**
     * Number of expression nodes evaluated so far.
     */
    public long evaluatedNodes() {
        return evaluated;
    }

    public TirInterpreter run(PrimFunc function) {
        function.body().accept(this);
        return this;
    }

    /**
     * Wraps {@code value} to the range of an integer type.
     */
    public static long wrap(long value, DataType type) {
        if (type.isBool()) {
            return value != 0 ? 1 : 0;
        }
        int bits = type.bits();
        if (bits == 64) {
            return value;
        }
        if (type.kind() == Kind.UINT) {
            return value & ((1L << bits) - 1);
        }
        return (value << (64 - bits)) >> (64 - bits);
    }

    // ==================== Statements ====================

    @Override
    public Void visitFor(For op) {
        long min = evalInt(op.min());
        long extent = evalInt(op.extent());
        for (long k = 0; k < extent; k++) {
            env.put(op.loopVar(), wrap(min + k, op.loopVar().dtype()));
            op.body().accept(this);
        }
        env.remove(op.loopVar());
        return null;
    }

    @Override
    public Void visitThreadBinding(ThreadBinding op) {
        long extent = evalInt(op.extent());
        for (long k = 0; k < extent; k++) {
            env.put(op.var(), k);
            op.body().accept(this);
        }
        env.remove(op.var());
        return null;
    }

    @Override
    public Void visitBlock(Block op) {
        for (IterVar iv : op.iterVars()) {
            env.put(iv.var(), wrap(evalInt(iv.binding()), iv.var().dtype()));
        }
        op.body().accept(this);
        for (IterVar iv : op.iterVars()) {
            env.remove(iv.var());
        }
        return null;
    }

    @Override
    public Void visitIfThenElse(IfThenElse op) {
        if (evalInt(op.condition()) != 0) {
            op.thenCase().accept(this);
        } else if (op.elseCase() != null) {
            op.elseCase().accept(this);
        }
        return null;
    }

    @Override
    public Void visitBufferStore(BufferStore op) {
        int offset = offset(op.buffer(), op.indices());
        if (op.buffer().dtype().isFloat()) {
            floatBuffer(op.buffer())[offset] = evalFloat(op.value());
        } else {
            intBuffer(op.buffer())[offset] = wrap(evalInt(op.value()), op.buffer().dtype());
        }
        return null;
    }

    @Override
    public Void visitSeqStmt(SeqStmt op) {
        for (Stmt stmt : op.stmts()) {
            stmt.accept(this);
        }
        return null;
    }

    @Override
    public Void visitEvaluate(Evaluate op) {
        op.value().accept(this);
        return null;
    }

    // ==================== Expressions ====================

    private long evalInt(Expr e) {
        return e.accept(this).longValue();
    }

    private double evalFloat(Expr e) {
        return e.accept(this).doubleValue();
    }

    @Override
    public Number visitVar(Var op) {
        evaluated++;
        Long value = env.get(op);
        if (value == null) {
            throw new IllegalStateException("Unbound variable " + op.name());
        }
        return value;
    }

    @Override
    public Number visitIntImm(IntImm op) {
        evaluated++;
        return op.value();
    }

    @Override
    public Number visitFloatImm(FloatImm op) {
        evaluated++;
        return op.value();
    }

    private interface IntOp {
        long apply(long a, long b);
    }

    private interface FloatOp {
        double apply(double a, double b);
    }

    private Number arith(BinaryOp op, IntOp ints, FloatOp floats) {
        evaluated++;
        if (op.dtype().isFloat()) {
            return floats.apply(evalFloat(op.a()), evalFloat(op.b()));
        }
        return wrap(ints.apply(evalInt(op.a()), evalInt(op.b())), op.dtype());
    }

    @Override
    public Number visitAdd(Add op) {
        return arith(op, (a, b) -> a + b, (a, b) -> a + b);
    }

    @Override
    public Number visitSub(Sub op) {
        return arith(op, (a, b) -> a - b, (a, b) -> a - b);
    }

    @Override
    public Number visitMul(Mul op) {
        return arith(op, (a, b) -> a * b, (a, b) -> a * b);
    }

    @Override
    public Number visitDiv(Div op) {
        return arith(op, (a, b) -> a / b, (a, b) -> a / b);
    }

    @Override
    public Number visitMod(Mod op) {
        return arith(op, (a, b) -> a % b, (a, b) -> a % b);
    }

    @Override
    public Number visitFloorDiv(FloorDiv op) {
        return arith(op, Math::floorDiv, (a, b) -> Math.floor(a / b));
    }

    @Override
    public Number visitFloorMod(FloorMod op) {
        return arith(op, Math::floorMod, (a, b) -> a - Math.floor(a / b) * b);
    }

    @Override
    public Number visitMin(Min op) {
        return arith(op, Math::min, Math::min);
    }

    @Override
    public Number visitMax(Max op) {
        return arith(op, Math::max, Math::max);
    }

    @Override
    public Number visitCompare(Compare op) {
        evaluated++;
        boolean result;
        if (op.a().dtype().isFloat()) {
            int c = Double.compare(evalFloat(op.a()), evalFloat(op.b()));
            result = op.op().test(c, 0);
        } else {
            result = op.op().test(evalInt(op.a()), evalInt(op.b()));
        }
        return result ? 1L : 0L;
    }

    @Override
    public Number visitAnd(And op) {
        evaluated++;
        return evalInt(op.a()) != 0 && evalInt(op.b()) != 0 ? 1L : 0L;
    }

    @Override
    public Number visitOr(Or op) {
        evaluated++;
        return evalInt(op.a()) != 0 || evalInt(op.b()) != 0 ? 1L : 0L;
    }

    @Override
    public Number visitNot(Not op) {
        evaluated++;
        return evalInt(op.a()) == 0 ? 1L : 0L;
    }

    @Override
    public Number visitCast(Cast op) {
        evaluated++;
        DataType to = op.dtype();
        if (to.isFloat()) {
            return evalFloat(op.value());
        }
        if (op.value().dtype().isFloat()) {
            return wrap((long) evalFloat(op.value()), to);
        }
        return wrap(evalInt(op.value()), to);
    }

    @Override
    public Number visitSelect(Select op) {
        evaluated++;
        return evalInt(op.condition()) != 0 ? op.trueValue().accept(this) : op.falseValue().accept(this);
    }

    @Override
    public Number visitBufferLoad(BufferLoad op) {
        evaluated++;
        int offset = offset(op.buffer(), op.indices());
        if (op.buffer().dtype().isFloat()) {
            return floatBuffer(op.buffer())[offset];
        }
        return intBuffer(op.buffer())[offset];
    }

    @Override
    public Number visitRamp(Ramp op) {
        throw new UnsupportedOperationException("vector ramp");
    }

    @Override
    public Number visitBroadcast(Broadcast op) {
        throw new UnsupportedOperationException("vector broadcast");
    }

    @Override
    public Number visitCall(Call op) {
        throw new UnsupportedOperationException("call to " + op.name());
    }

    // ==================== Buffers ====================

    private int offset(Buffer buffer, List<Expr> indices) {
        long offset = 0;
        for (int d = 0; d < indices.size(); d++) {
            long dim = evalInt(buffer.shape().get(d));
            long index = evalInt(indices.get(d));
            if (index < 0 || index >= dim) {
                throw new IndexOutOfBoundsException(String.format(
                        "%s index %d out of bounds for dimension %d of extent %d",
                        buffer.name(), index, d, dim));
            }
            offset = offset * dim + index;
        }
        return Math.toIntExact(offset);
    }

    private long[] intBuffer(Buffer buffer) {
        long[] data = intBuffers.get(buffer);
        if (data == null) {
            throw new IllegalStateException("No data bound for buffer " + buffer.name());
        }
        return data;
    }

    private double[] floatBuffer(Buffer buffer) {
        double[] data = floatBuffers.get(buffer);
        if (data == null) {
            throw new IllegalStateException("No data bound for buffer " + buffer.name());
        }
        return data;
    }
}
