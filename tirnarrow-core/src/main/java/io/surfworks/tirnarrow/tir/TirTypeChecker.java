package io.surfworks.tirnarrow.tir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

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
import io.surfworks.tirnarrow.tir.TirAst.IrModule;
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
 * Type checker for the loop IR.
 *
 * Performs semantic validation including:
 * - Scoping: variables must be declared (parameter, loop, thread binding or
 *   block iteration variable) and in scope where they are used
 * - Width consistency: operands of arithmetic, comparisons, selects and
 *   ramps must have identical types, so no mixed-width arithmetic exists
 * - Declarations: loop bounds, thread extents and block domains must have
 *   the type of the variable they declare
 * - Accesses: indices must be integers and stored values must match the
 *   buffer element type
 */
public final class TirTypeChecker implements StmtVisitor<Void>, ExprVisitor<Void> {

    private final List<String> errors = new ArrayList<>();
    private final Set<Var> inScope = Collections.newSetFromMap(new IdentityHashMap<>());
    /** Expressions already checked under the current scope */
    private final Set<Expr> checked = Collections.newSetFromMap(new IdentityHashMap<>());
    private String functionName = "";

    public TirTypeChecker() {}

    /**
     * Validates a module and returns a list of errors.
     * Returns empty list if validation passes.
     */
    public List<String> validate(IrModule module) {
        errors.clear();
        for (PrimFunc function : module.functions()) {
            validateFunction(function);
        }
        return new ArrayList<>(errors);
    }

    /**
     * Validates a single function and returns a list of errors.
     */
    public List<String> validate(PrimFunc function) {
        errors.clear();
        validateFunction(function);
        return new ArrayList<>(errors);
    }

    /**
     * Validates a module and throws if any errors are found.
     */
    public void check(IrModule module) {
        throwIfInvalid(validate(module));
    }

    /**
     * Validates a function and throws if any errors are found.
     */
    public void check(PrimFunc function) {
        throwIfInvalid(validate(function));
    }

    private static void throwIfInvalid(List<String> validationErrors) {
        if (!validationErrors.isEmpty()) {
            StringBuilder sb = new StringBuilder("IR validation failed:\n");
            for (String error : validationErrors) {
                sb.append("  - ").append(error).append("\n");
            }
            throw new TirValidationException(sb.toString(), validationErrors);
        }
    }

    private void validateFunction(PrimFunc function) {
        inScope.clear();
        checked.clear();
        functionName = function.name();

        for (Var param : function.params()) {
            inScope.add(param);
        }
        for (TirAst.Buffer buffer : function.buffers()) {
            for (Expr dim : buffer.shape()) {
                checkExpr(dim);
            }
        }

        function.body().accept(this);
    }

    // ==================== Statements ====================

    @Override
    public Void visitFor(For op) {
        checkExpr(op.min());
        checkExpr(op.extent());
        requireDeclaredType("loop min", op.loopVar(), op.min());
        requireDeclaredType("loop extent", op.loopVar(), op.extent());
        declare(op.loopVar());
        op.body().accept(this);
        undeclare(op.loopVar());
        return null;
    }

    @Override
    public Void visitThreadBinding(ThreadBinding op) {
        checkExpr(op.extent());
        requireDeclaredType("thread extent", op.var(), op.extent());
        declare(op.var());
        op.body().accept(this);
        undeclare(op.var());
        return null;
    }

    @Override
    public Void visitBlock(Block op) {
        for (IterVar iv : op.iterVars()) {
            checkExpr(iv.min());
            checkExpr(iv.extent());
            checkExpr(iv.binding());
            requireDeclaredType("block domain min", iv.var(), iv.min());
            requireDeclaredType("block domain extent", iv.var(), iv.extent());
            requireDeclaredType("block binding", iv.var(), iv.binding());
        }
        for (IterVar iv : op.iterVars()) {
            declare(iv.var());
        }
        op.body().accept(this);
        for (IterVar iv : op.iterVars()) {
            undeclare(iv.var());
        }
        return null;
    }

    @Override
    public Void visitIfThenElse(IfThenElse op) {
        checkExpr(op.condition());
        if (!op.condition().dtype().isBool()) {
            error("if condition must be bool, got %s", op.condition().dtype());
        }
        op.thenCase().accept(this);
        if (op.elseCase() != null) {
            op.elseCase().accept(this);
        }
        return null;
    }

    @Override
    public Void visitBufferStore(BufferStore op) {
        for (Expr index : op.indices()) {
            checkExpr(index);
            requireIndex(op.buffer().name(), index);
        }
        checkExpr(op.value());
        DataType expected = op.buffer().dtype();
        DataType actual = op.value().dtype();
        if (!expected.elementOf().equals(actual.elementOf())) {
            error("store into %s has value type %s but buffer holds %s",
                    op.buffer().name(), actual, expected);
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
        checkExpr(op.value());
        return null;
    }

    private void declare(Var var) {
        if (!inScope.add(var)) {
            error("variable '%s' declared twice in nested scopes", var.name());
        }
        checked.clear();
    }

    private void undeclare(Var var) {
        inScope.remove(var);
        checked.clear();
    }

    private void checkExpr(Expr expr) {
        if (checked.add(expr)) {
            expr.accept(this);
        }
    }

    // ==================== Expressions ====================

    @Override
    public Void visitVar(Var op) {
        if (!inScope.contains(op)) {
            error("variable '%s' used outside the scope of its declaration", op.name());
        }
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
        return binary(op);
    }

    @Override
    public Void visitSub(Sub op) {
        return binary(op);
    }

    @Override
    public Void visitMul(Mul op) {
        return binary(op);
    }

    @Override
    public Void visitDiv(Div op) {
        return binary(op);
    }

    @Override
    public Void visitMod(Mod op) {
        return binary(op);
    }

    @Override
    public Void visitFloorDiv(FloorDiv op) {
        return binary(op);
    }

    @Override
    public Void visitFloorMod(FloorMod op) {
        return binary(op);
    }

    @Override
    public Void visitMin(Min op) {
        return binary(op);
    }

    @Override
    public Void visitMax(Max op) {
        return binary(op);
    }

    @Override
    public Void visitCompare(Compare op) {
        checkExpr(op.a());
        checkExpr(op.b());
        requireSameType(op.op().symbol(), op.a(), op.b());
        return null;
    }

    @Override
    public Void visitAnd(And op) {
        checkExpr(op.a());
        checkExpr(op.b());
        requireBool("&&", op.a());
        requireBool("&&", op.b());
        return null;
    }

    @Override
    public Void visitOr(Or op) {
        checkExpr(op.a());
        checkExpr(op.b());
        requireBool("||", op.a());
        requireBool("||", op.b());
        return null;
    }

    @Override
    public Void visitNot(Not op) {
        checkExpr(op.a());
        requireBool("!", op.a());
        return null;
    }

    @Override
    public Void visitCast(Cast op) {
        checkExpr(op.value());
        if (op.dtype().lanes() != op.value().dtype().lanes()) {
            error("cast to %s changes lane count of %s", op.dtype(), op.value().dtype());
        }
        return null;
    }

    @Override
    public Void visitSelect(Select op) {
        checkExpr(op.condition());
        checkExpr(op.trueValue());
        checkExpr(op.falseValue());
        requireBool("select", op.condition());
        requireSameType("select", op.trueValue(), op.falseValue());
        return null;
    }

    @Override
    public Void visitBufferLoad(BufferLoad op) {
        for (Expr index : op.indices()) {
            checkExpr(index);
            requireIndex(op.buffer().name(), index);
        }
        return null;
    }

    @Override
    public Void visitRamp(Ramp op) {
        checkExpr(op.base());
        checkExpr(op.stride());
        requireSameType("ramp", op.base(), op.stride());
        if (!op.base().dtype().isScalar()) {
            error("ramp base must be scalar, got %s", op.base().dtype());
        }
        return null;
    }

    @Override
    public Void visitBroadcast(Broadcast op) {
        checkExpr(op.value());
        if (!op.value().dtype().isScalar()) {
            error("broadcast value must be scalar, got %s", op.value().dtype());
        }
        return null;
    }

    @Override
    public Void visitCall(Call op) {
        for (Expr arg : op.args()) {
            checkExpr(arg);
        }
        return null;
    }

    private Void binary(BinaryOp op) {
        checkExpr(op.a());
        checkExpr(op.b());
        requireSameType(op.opName(), op.a(), op.b());
        return null;
    }

    // ==================== Checks ====================

    private void requireSameType(String op, Expr a, Expr b) {
        if (!a.dtype().equals(b.dtype())) {
            error("%s operand types must match: %s vs %s (%s, %s)",
                    op, a.dtype(), b.dtype(), TirPrinter.print(a, 80), TirPrinter.print(b, 80));
        }
    }

    private void requireBool(String op, Expr e) {
        if (!e.dtype().isBool()) {
            error("%s requires a bool operand, got %s", op, e.dtype());
        }
    }

    private void requireIndex(String bufferName, Expr index) {
        if (!index.dtype().isIntegral()) {
            error("index into %s must be an integer, got %s", bufferName, index.dtype());
        }
    }

    private void requireDeclaredType(String what, Var var, Expr e) {
        if (!e.dtype().equals(var.dtype())) {
            error("%s of '%s' has type %s but the variable is %s",
                    what, var.name(), e.dtype(), var.dtype());
        }
    }

    private void error(String format, Object... args) {
        errors.add("[" + functionName + "] " + String.format(format, args));
    }
}
