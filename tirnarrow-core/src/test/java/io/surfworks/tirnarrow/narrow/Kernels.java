package io.surfworks.tirnarrow.narrow;

import io.surfworks.tirnarrow.tir.Ops;
import io.surfworks.tirnarrow.tir.TirAst.Buffer;
import io.surfworks.tirnarrow.tir.TirAst.DataType;
import io.surfworks.tirnarrow.tir.TirAst.Expr;
import io.surfworks.tirnarrow.tir.TirAst.IntImm;
import io.surfworks.tirnarrow.tir.TirAst.PrimFunc;
import io.surfworks.tirnarrow.tir.TirAst.Stmt;
import io.surfworks.tirnarrow.tir.TirAst.Var;

import java.util.List;

/**
 * Test kernels shared by the narrowing tests.
 */
final class Kernels {

    private Kernels() {}

    static Buffer buffer(String name, DataType dtype, long size) {
        return new Buffer(name, dtype, List.of(Ops.imm(DataType.INT64, size)));
    }

    static IntImm lit(DataType type, long value) {
        return Ops.imm(type, value);
    }

    /**
     * {@code B[i * n + j] = A[i * n + j]} over an {@code m x n} nest with
     * loop variables of {@code type}.
     */
    static PrimFunc copy2d(String name, DataType type, long m, long n) {
        Var i = Ops.var("i", type);
        Var j = Ops.var("j", type);
        Buffer a = buffer("A", DataType.FLOAT32, m * n);
        Buffer b = buffer("B", DataType.FLOAT32, m * n);
        Expr index = Ops.add(Ops.mul(i, lit(type, n)), j);
        Stmt body = Ops.serial(i, 0, m, Ops.serial(j, 0, n,
                Ops.store(b, List.of(index), Ops.load(a, List.of(index)))));
        return new PrimFunc(name, List.of(), List.of(a, b), body);
    }

    /**
     * {@code A[i * n + j] = B[i * 2 * n + 2 * j] + 1} with 64-bit loops.
     */
    static PrimFunc slice(long m, long n) {
        DataType t = DataType.INT64;
        Var i = Ops.var("i", t);
        Var j = Ops.var("j", t);
        Buffer a = buffer("A", DataType.FLOAT32, m * n);
        Buffer b = buffer("B", DataType.FLOAT32, m * n * 2);
        Expr aIndex = Ops.add(Ops.mul(i, lit(t, n)), j);
        Expr bIndex = Ops.add(Ops.mul(Ops.mul(i, lit(t, 2)), lit(t, n)), Ops.mul(lit(t, 2), j));
        Stmt body = Ops.serial(i, 0, m, Ops.serial(j, 0, n,
                Ops.store(a, List.of(aIndex), Ops.add(Ops.load(b, List.of(bIndex)), Ops.f32(1.0)))));
        return new PrimFunc("slice", List.of(), List.of(a, b), body);
    }

    /**
     * Two thread axes over a serial inner loop:
     * {@code C[bx * (tn * 4) + tx * 4 + k] = A[...] * 2}.
     */
    static PrimFunc threaded(long blocks, long threads) {
        DataType t = DataType.INT64;
        Var bx = Ops.var("bx", t);
        Var tx = Ops.var("tx", t);
        Var k = Ops.var("k", t);
        Buffer a = buffer("A", DataType.FLOAT32, blocks * threads * 4);
        Buffer c = buffer("C", DataType.FLOAT32, blocks * threads * 4);
        Expr index = Ops.add(Ops.add(Ops.mul(bx, lit(t, threads * 4)), Ops.mul(tx, lit(t, 4))), k);
        Stmt body = Ops.threadBinding(bx, blocks, "blockIdx.x",
                Ops.threadBinding(tx, threads, "threadIdx.x",
                        Ops.serial(k, 0, 4,
                                Ops.store(c, List.of(index), Ops.mul(Ops.load(a, List.of(index)), Ops.f32(2.0))))));
        return new PrimFunc("threaded", List.of(), List.of(a, c), body);
    }

    /**
     * One-dimensional pooling with a clamped window and a wrapped
     * neighbour: {@code B[i] = B[i] + A[min(max(i + k - 1, 0), n - 1)] + A[floormod(i * 3 + k, n)]}.
     */
    static PrimFunc pool(long n, long window) {
        DataType t = DataType.INT64;
        Var i = Ops.var("i", t);
        Var k = Ops.var("k", t);
        Buffer a = buffer("A", DataType.FLOAT32, n);
        Buffer b = buffer("B", DataType.FLOAT32, n);
        Expr clamped = Ops.min(Ops.max(Ops.sub(Ops.add(i, k), lit(t, 1)), lit(t, 0)), lit(t, n - 1));
        Expr wrapped = Ops.floorMod(Ops.add(Ops.mul(i, lit(t, 3)), k), lit(t, n));
        Expr value = Ops.add(Ops.add(Ops.load(b, List.of(i)), Ops.load(a, List.of(clamped))),
                Ops.load(a, List.of(wrapped)));
        Stmt body = Ops.serial(i, 0, n, Ops.serial(k, 0, window, Ops.store(b, List.of(i), value)));
        return new PrimFunc("pool", List.of(), List.of(a, b), body);
    }
}
