package io.surfworks.tirnarrow.tir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AST classes for the tensor loop IR.
 *
 * These classes capture loops, thread bindings, blocks, buffer accesses and
 * the integer index arithmetic between them. Every expression carries an
 * explicit {@link DataType}. All nodes are immutable; passes build new trees.
 *
 * Variables and buffers have identity semantics: two {@link Var}s with the
 * same name are different variables unless they are the same object.
 * Every other node is a record and compares structurally.
 */
public final class TirAst {

    private TirAst() {}

    // ==================== Types ====================

    /**
     * Element kind of a {@link DataType}.
     */
    public enum Kind {
        INT("int"),
        UINT("uint"),
        FLOAT("float"),
        BOOL("bool"),
        HANDLE("handle");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    /**
     * Scalar or vector data type: int64, int32x4, float32, bool.
     */
    public record DataType(Kind kind, int bits, int lanes) {
        public static final DataType INT8 = new DataType(Kind.INT, 8, 1);
        public static final DataType INT16 = new DataType(Kind.INT, 16, 1);
        public static final DataType INT32 = new DataType(Kind.INT, 32, 1);
        public static final DataType INT64 = new DataType(Kind.INT, 64, 1);
        public static final DataType FLOAT32 = new DataType(Kind.FLOAT, 32, 1);
        public static final DataType FLOAT64 = new DataType(Kind.FLOAT, 64, 1);
        public static final DataType BOOL = new DataType(Kind.BOOL, 1, 1);

        public DataType {
            Objects.requireNonNull(kind, "kind");
            if (bits <= 0 || bits > 64) {
                throw new TirValidationException("Unsupported bit width " + bits);
            }
            if (lanes <= 0) {
                throw new TirValidationException("Lane count must be positive, got " + lanes);
            }
        }

        public static DataType intOf(int bits) {
            return switch (bits) {
                case 8 -> INT8;
                case 16 -> INT16;
                case 32 -> INT32;
                case 64 -> INT64;
                default -> new DataType(Kind.INT, bits, 1);
            };
        }

        public static DataType boolOf(int lanes) {
            return lanes == 1 ? BOOL : new DataType(Kind.BOOL, 1, lanes);
        }

        public boolean isInt() {
            return kind == Kind.INT;
        }

        public boolean isUInt() {
            return kind == Kind.UINT;
        }

        public boolean isIntegral() {
            return kind == Kind.INT || kind == Kind.UINT;
        }

        public boolean isFloat() {
            return kind == Kind.FLOAT;
        }

        public boolean isBool() {
            return kind == Kind.BOOL;
        }

        public boolean isScalar() {
            return lanes == 1;
        }

        public DataType withBits(int newBits) {
            return newBits == bits ? this : new DataType(kind, newBits, lanes);
        }

        public DataType withLanes(int newLanes) {
            return newLanes == lanes ? this : new DataType(kind, bits, newLanes);
        }

        public DataType elementOf() {
            return withLanes(1);
        }

        /**
         * Smallest value representable by this integral type.
         */
        public long minValue() {
            requireIntegral();
            if (kind == Kind.UINT) {
                return 0;
            }
            return bits == 64 ? Long.MIN_VALUE : -(1L << (bits - 1));
        }

        /**
         * Largest value representable by this integral type. Unsigned 64-bit
         * values are clamped to {@link Long#MAX_VALUE}.
         */
        public long maxValue() {
            requireIntegral();
            if (kind == Kind.UINT) {
                return bits == 64 ? Long.MAX_VALUE : (1L << bits) - 1;
            }
            return bits == 64 ? Long.MAX_VALUE : (1L << (bits - 1)) - 1;
        }

        public boolean canRepresent(long value) {
            if (kind == Kind.BOOL) {
                return value == 0 || value == 1;
            }
            return value >= minValue() && value <= maxValue();
        }

        private void requireIntegral() {
            if (!isIntegral()) {
                throw new TirValidationException("Type " + this + " has no integer range");
            }
        }

        @Override
        public String toString() {
            String base = kind == Kind.BOOL || kind == Kind.HANDLE ? kind.prefix() : kind.prefix() + bits;
            return lanes == 1 ? base : base + "x" + lanes;
        }
    }

    // ==================== Variables and Buffers ====================

    /**
     * A declared variable. Identity-based: equality is object identity.
     *
     * <p>A variable is declared exactly once (function parameter, loop,
     * thread binding or block iteration variable). Every reference to it
     * is the same object, so retyping a variable means building a new
     * {@code Var} and substituting it everywhere.
     */
    public static final class Var implements Expr {
        private static final AtomicLong NEXT_ID = new AtomicLong();

        private final String name;
        private final DataType dtype;
        private final long id;

        public Var(String name, DataType dtype) {
            this.name = Objects.requireNonNull(name, "name");
            this.dtype = Objects.requireNonNull(dtype, "dtype");
            this.id = NEXT_ID.getAndIncrement();
        }

        public String name() {
            return name;
        }

        @Override
        public DataType dtype() {
            return dtype;
        }

        /**
         * Creation order, used only to make diagnostics deterministic.
         */
        public long id() {
            return id;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVar(this);
        }

        /**
         * Returns a new variable with the same name and a different type.
         */
        public Var copyWithDtype(DataType newType) {
            return new Var(name, newType);
        }

        @Override
        public String toString() {
            return name + ": " + dtype;
        }
    }

    /**
     * A buffer with an element type and a shape. Identity-based.
     */
    public static final class Buffer {
        private final String name;
        private final DataType dtype;
        private final List<Expr> shape;

        public Buffer(String name, DataType dtype, List<Expr> shape) {
            this.name = Objects.requireNonNull(name, "name");
            this.dtype = Objects.requireNonNull(dtype, "dtype");
            this.shape = List.copyOf(shape);
        }

        public String name() {
            return name;
        }

        public DataType dtype() {
            return dtype;
        }

        public List<Expr> shape() {
            return shape;
        }

        @Override
        public String toString() {
            return name + "<" + dtype + ">";
        }
    }

    // ==================== Expressions ====================

    /**
     * Base interface for all expressions.
     */
    public sealed interface Expr permits
            Var, IntImm, FloatImm, BinaryOp, Compare, And, Or, Not,
            Cast, Select, BufferLoad, Ramp, Broadcast, Call {

        DataType dtype();

        <R> R accept(ExprVisitor<R> visitor);
    }

    public record IntImm(DataType dtype, long value) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIntImm(this);
        }

        public IntImm {
            Objects.requireNonNull(dtype, "dtype");
            if (!dtype.isIntegral() && !dtype.isBool()) {
                throw new TirValidationException("Integer literal cannot have type " + dtype);
            }
            if (!dtype.canRepresent(value)) {
                throw new TirValidationException(
                        String.format("Literal %d does not fit in %s", value, dtype));
            }
        }
    }

    public record FloatImm(DataType dtype, double value) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFloatImm(this);
        }

        public FloatImm {
            if (!dtype.isFloat()) {
                throw new TirValidationException("Float literal cannot have type " + dtype);
            }
        }
    }

    /**
     * Two-operand arithmetic. The result type is the type of {@code a};
     * well-formed IR has {@code a.dtype().equals(b.dtype())}.
     */
    public sealed interface BinaryOp extends Expr permits
            Add, Sub, Mul, Div, Mod, FloorDiv, FloorMod, Min, Max {

        Expr a();

        Expr b();

        /**
         * Short operator name used by the printer and diagnostics.
         */
        String opName();

        /**
         * Returns the same operator applied to new operands.
         */
        BinaryOp with(Expr a, Expr b);

        @Override
        default DataType dtype() {
            return a().dtype();
        }
    }

    public record Add(Expr a, Expr b) implements BinaryOp {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAdd(this);
        }

        @Override
        public String opName() { return "+"; }

        @Override
        public BinaryOp with(Expr a, Expr b) { return new Add(a, b); }
    }

    public record Sub(Expr a, Expr b) implements BinaryOp {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSub(this);
        }

        @Override
        public String opName() { return "-"; }

        @Override
        public BinaryOp with(Expr a, Expr b) { return new Sub(a, b); }
    }

    public record Mul(Expr a, Expr b) implements BinaryOp {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMul(this);
        }

        @Override
        public String opName() { return "*"; }

        @Override
        public BinaryOp with(Expr a, Expr b) { return new Mul(a, b); }
    }

    /**
     * Division rounding toward zero.
     */
    public record Div(Expr a, Expr b) implements BinaryOp {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDiv(this);
        }

        @Override
        public String opName() { return "div"; }

        @Override
        public BinaryOp with(Expr a, Expr b) { return new Div(a, b); }
    }

    /**
     * Remainder of {@link Div}; takes the sign of the dividend.
     */
    public record Mod(Expr a, Expr b) implements BinaryOp {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMod(this);
        }

        @Override
        public String opName() { return "truncmod"; }

        @Override
        public BinaryOp with(Expr a, Expr b) { return new Mod(a, b); }
    }

    public record FloorDiv(Expr a, Expr b) implements BinaryOp {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFloorDiv(this);
        }

        @Override
        public String opName() { return "floordiv"; }

        @Override
        public BinaryOp with(Expr a, Expr b) { return new FloorDiv(a, b); }
    }

    public record FloorMod(Expr a, Expr b) implements BinaryOp {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFloorMod(this);
        }

        @Override
        public String opName() { return "floormod"; }

        @Override
        public BinaryOp with(Expr a, Expr b) { return new FloorMod(a, b); }
    }

    public record Min(Expr a, Expr b) implements BinaryOp {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMin(this);
        }

        @Override
        public String opName() { return "min"; }

        @Override
        public BinaryOp with(Expr a, Expr b) { return new Min(a, b); }
    }

    public record Max(Expr a, Expr b) implements BinaryOp {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMax(this);
        }

        @Override
        public String opName() { return "max"; }

        @Override
        public BinaryOp with(Expr a, Expr b) { return new Max(a, b); }
    }

    public enum CompareOp {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        CompareOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(long lhs, long rhs) {
            return switch (this) {
                case EQ -> lhs == rhs;
                case NE -> lhs != rhs;
                case LT -> lhs < rhs;
                case LE -> lhs <= rhs;
                case GT -> lhs > rhs;
                case GE -> lhs >= rhs;
            };
        }
    }

    public record Compare(CompareOp op, Expr a, Expr b) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCompare(this);
        }

        @Override
        public DataType dtype() {
            return DataType.boolOf(a.dtype().lanes());
        }

        public Compare with(Expr a, Expr b) {
            return new Compare(op, a, b);
        }
    }

    public record And(Expr a, Expr b) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public DataType dtype() {
            return DataType.boolOf(a.dtype().lanes());
        }
    }

    public record Or(Expr a, Expr b) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitOr(this);
        }

        @Override
        public DataType dtype() {
            return DataType.boolOf(a.dtype().lanes());
        }
    }

    public record Not(Expr a) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public DataType dtype() {
            return a.dtype();
        }
    }

    public record Cast(DataType dtype, Expr value) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCast(this);
        }
    }

    public record Select(Expr condition, Expr trueValue, Expr falseValue) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSelect(this);
        }

        @Override
        public DataType dtype() {
            return trueValue.dtype();
        }
    }

    public record BufferLoad(Buffer buffer, List<Expr> indices) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBufferLoad(this);
        }

        public BufferLoad {
            Objects.requireNonNull(buffer, "buffer");
            indices = List.copyOf(indices);
        }

        @Override
        public DataType dtype() {
            int lanes = buffer.dtype().lanes();
            for (Expr index : indices) {
                lanes = Math.max(lanes, index.dtype().lanes());
            }
            return buffer.dtype().withLanes(lanes);
        }
    }

    /**
     * Vector of {@code lanes} values {@code base + k * stride}.
     */
    public record Ramp(Expr base, Expr stride, int lanes) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRamp(this);
        }

        @Override
        public DataType dtype() {
            return base.dtype().withLanes(lanes);
        }
    }

    public record Broadcast(Expr value, int lanes) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBroadcast(this);
        }

        @Override
        public DataType dtype() {
            return value.dtype().withLanes(lanes);
        }
    }

    /**
     * Opaque intrinsic or extern call.
     */
    public record Call(DataType dtype, String name, List<Expr> args) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        public Call {
            args = List.copyOf(args);
        }
    }

    // ==================== Statements ====================

    /**
     * Base interface for all statements.
     */
    public sealed interface Stmt permits
            For, ThreadBinding, Block, IfThenElse, BufferStore, SeqStmt, Evaluate {

        <R> R accept(StmtVisitor<R> visitor);
    }

    public enum ForKind {
        SERIAL,
        PARALLEL,
        VECTORIZED,
        UNROLLED;

        public String scriptName() {
            return name().toLowerCase();
        }
    }

    /**
     * Loop over {@code [min, min + extent)}.
     */
    public record For(Var loopVar, Expr min, Expr extent, ForKind kind, Stmt body) implements Stmt {
        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    /**
     * Binds a parallel hardware axis such as {@code blockIdx.x} over
     * {@code [0, extent)}.
     */
    public record ThreadBinding(Var var, Expr extent, String threadTag, Stmt body) implements Stmt {
        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitThreadBinding(this);
        }
    }

    /**
     * Block iteration variable over {@code [min, min + extent)} bound to
     * the value of {@code binding}.
     */
    public record IterVar(Var var, Expr min, Expr extent, Expr binding) {}

    public record Block(String name, List<IterVar> iterVars, Stmt body) implements Stmt {
        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitBlock(this);
        }

        public Block {
            iterVars = List.copyOf(iterVars);
        }
    }

    public record IfThenElse(Expr condition, Stmt thenCase, Stmt elseCase) implements Stmt {
        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitIfThenElse(this);
        }

        public Optional<Stmt> elseBranch() {
            return Optional.ofNullable(elseCase);
        }
    }

    public record BufferStore(Buffer buffer, List<Expr> indices, Expr value) implements Stmt {
        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitBufferStore(this);
        }

        public BufferStore {
            Objects.requireNonNull(buffer, "buffer");
            indices = List.copyOf(indices);
        }
    }

    public record SeqStmt(List<Stmt> stmts) implements Stmt {
        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitSeqStmt(this);
        }

        public SeqStmt {
            stmts = List.copyOf(stmts);
        }
    }

    public record Evaluate(Expr value) implements Stmt {
        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitEvaluate(this);
        }
    }

    // ==================== Function and Module ====================

    /**
     * A loop-level function: scalar parameters, buffers and a body.
     */
    public record PrimFunc(
            String name,
            List<Var> params,
            List<Buffer> buffers,
            Stmt body
    ) {
        public PrimFunc {
            Objects.requireNonNull(name, "name");
            params = List.copyOf(params);
            buffers = List.copyOf(buffers);
            Objects.requireNonNull(body, "body");
        }

        public PrimFunc withBody(Stmt newBody) {
            return new PrimFunc(name, params, buffers, newBody);
        }
    }

    /**
     * A module of uniquely named functions, kept in declaration order.
     */
    public record IrModule(
            String name,
            List<PrimFunc> functions
    ) {
        public IrModule {
            functions = List.copyOf(functions);
            Set<String> seen = new HashSet<>();
            for (PrimFunc func : functions) {
                if (!seen.add(func.name())) {
                    throw new TirValidationException(
                            "Duplicate function '" + func.name() + "' in module '" + name + "'");
                }
            }
        }

        public Optional<PrimFunc> getFunction(String name) {
            return functions.stream()
                    .filter(f -> f.name().equals(name))
                    .findFirst();
        }

        public List<String> functionNames() {
            List<String> names = new ArrayList<>();
            for (PrimFunc func : functions) {
                names.add(func.name());
            }
            return names;
        }

        public IrModule withFunction(PrimFunc func) {
            List<PrimFunc> updated = new ArrayList<>();
            boolean replaced = false;
            for (PrimFunc existing : functions) {
                if (existing.name().equals(func.name())) {
                    updated.add(func);
                    replaced = true;
                } else {
                    updated.add(existing);
                }
            }
            if (!replaced) {
                updated.add(func);
            }
            return new IrModule(name, updated);
        }
    }
}
