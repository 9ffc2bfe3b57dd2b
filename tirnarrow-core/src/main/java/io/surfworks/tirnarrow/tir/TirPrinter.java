package io.surfworks.tirnarrow.tir;

import java.util.List;

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
 * Renders IR as indented script text.
 *
 * <p>Integer literals print bare when they are {@code int32} and with a type
 * suffix otherwise ({@code 16i64}, {@code 3i16}), so two printed trees are
 * equal exactly when their structure and every data type agree. Variables
 * print by name; declarations also show their type.
 *
 * <pre>
 * func main(A: float32[128], B: float32[128]) {
 *   for (i: int32 = 0; extent 128; serial) {
 *     B[i] = (A[i] + 1.0f32)
 *   }
 * }
 * </pre>
 */
public final class TirPrinter implements ExprVisitor<String>, StmtVisitor<Void> {

    private static final String INDENT = "  ";
    private static final String ELLIPSIS = "...";

    private final StringBuilder out = new StringBuilder();
    private int depth;
    private long budget = Long.MAX_VALUE;

    private TirPrinter() {}

    public static String print(PrimFunc func) {
        TirPrinter printer = new TirPrinter();
        printer.printFunction(func);
        return printer.out.toString();
    }

    public static String print(Stmt stmt) {
        TirPrinter printer = new TirPrinter();
        stmt.accept(printer);
        return printer.out.toString();
    }

    public static String print(Expr expr) {
        return expr.accept(new TirPrinter());
    }

    /**
     * Renders {@code expr} cut to {@code maxLength} characters plus an
     * ellipsis. Work is bounded by the limit and the depth of the
     * expression, not by its unshared size.
     */
    public static String print(Expr expr, int maxLength) {
        TirPrinter printer = new TirPrinter();
        printer.budget = maxLength;
        String text = printer.expr(expr);
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + ELLIPSIS;
    }

    // ==================== Functions ====================

    private void printFunction(PrimFunc func) {
        out.append("func ").append(func.name()).append("(");
        boolean first = true;
        for (Var param : func.params()) {
            if (!first) out.append(", ");
            out.append(param.name()).append(": ").append(param.dtype());
            first = false;
        }
        for (Buffer buffer : func.buffers()) {
            if (!first) out.append(", ");
            out.append(buffer.name()).append(": ").append(buffer.dtype())
                    .append(joinExprs(buffer.shape(), "[", "]"));
            first = false;
        }
        out.append(") {\n");
        depth++;
        func.body().accept(this);
        depth--;
        out.append("}\n");
    }

    // ==================== Statements ====================

    @Override
    public Void visitFor(For op) {
        Var v = op.loopVar();
        line(String.format("for (%s: %s = %s; extent %s; %s) {",
                v.name(), v.dtype(), expr(op.min()), expr(op.extent()),
                op.kind().scriptName()));
        nested(op.body());
        line("}");
        return null;
    }

    @Override
    public Void visitThreadBinding(ThreadBinding op) {
        Var v = op.var();
        line(String.format("launch_thread(%s: %s, \"%s\", %s) {",
                v.name(), v.dtype(), op.threadTag(), expr(op.extent())));
        nested(op.body());
        line("}");
        return null;
    }

    @Override
    public Void visitBlock(Block op) {
        line("block " + op.name() + " {");
        depth++;
        for (IterVar iv : op.iterVars()) {
            line(String.format("%s: %s = axis(%s, %s, %s)",
                    iv.var().name(), iv.var().dtype(), expr(iv.min()),
                    expr(iv.extent()), expr(iv.binding())));
        }
        op.body().accept(this);
        depth--;
        line("}");
        return null;
    }

    @Override
    public Void visitIfThenElse(IfThenElse op) {
        line("if " + expr(op.condition()) + " {");
        nested(op.thenCase());
        if (op.elseCase() != null) {
            line("} else {");
            nested(op.elseCase());
        }
        line("}");
        return null;
    }

    @Override
    public Void visitBufferStore(BufferStore op) {
        line(op.buffer().name() + joinExprs(op.indices(), "[", "]") + " = " + expr(op.value()));
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
        line("evaluate(" + expr(op.value()) + ")");
        return null;
    }

    private void nested(Stmt body) {
        depth++;
        body.accept(this);
        depth--;
    }

    private void line(String text) {
        out.append(INDENT.repeat(depth)).append(text).append("\n");
    }

    // ==================== Expressions ====================

    @Override
    public String visitVar(Var op) {
        return op.name();
    }

    @Override
    public String visitIntImm(IntImm op) {
        DataType t = op.dtype();
        if (t.isBool()) {
            return op.value() != 0 ? "true" : "false";
        }
        if (t.equals(DataType.INT32)) {
            return Long.toString(op.value());
        }
        String suffix = (t.kind() == Kind.UINT ? "u" : "i") + t.bits();
        return op.value() + suffix;
    }

    @Override
    public String visitFloatImm(FloatImm op) {
        return op.value() + "f" + op.dtype().bits();
    }

    @Override
    public String visitAdd(Add op) {
        return infix(op);
    }

    @Override
    public String visitSub(Sub op) {
        return infix(op);
    }

    @Override
    public String visitMul(Mul op) {
        return infix(op);
    }

    @Override
    public String visitDiv(Div op) {
        return prefix(op);
    }

    @Override
    public String visitMod(Mod op) {
        return prefix(op);
    }

    @Override
    public String visitFloorDiv(FloorDiv op) {
        return prefix(op);
    }

    @Override
    public String visitFloorMod(FloorMod op) {
        return prefix(op);
    }

    @Override
    public String visitMin(Min op) {
        return prefix(op);
    }

    @Override
    public String visitMax(Max op) {
        return prefix(op);
    }

    @Override
    public String visitCompare(Compare op) {
        return "(" + expr(op.a()) + " " + op.op().symbol() + " " + expr(op.b()) + ")";
    }

    @Override
    public String visitAnd(And op) {
        return "(" + expr(op.a()) + " && " + expr(op.b()) + ")";
    }

    @Override
    public String visitOr(Or op) {
        return "(" + expr(op.a()) + " || " + expr(op.b()) + ")";
    }

    @Override
    public String visitNot(Not op) {
        return "!" + expr(op.a());
    }

    @Override
    public String visitCast(Cast op) {
        return op.dtype() + "(" + expr(op.value()) + ")";
    }

    @Override
    public String visitSelect(Select op) {
        return "select(" + expr(op.condition()) + ", " + expr(op.trueValue())
                + ", " + expr(op.falseValue()) + ")";
    }

    @Override
    public String visitBufferLoad(BufferLoad op) {
        return op.buffer().name() + joinExprs(op.indices(), "[", "]");
    }

    @Override
    public String visitRamp(Ramp op) {
        return "ramp(" + expr(op.base()) + ", " + expr(op.stride()) + ", " + op.lanes() + ")";
    }

    @Override
    public String visitBroadcast(Broadcast op) {
        return "broadcast(" + expr(op.value()) + ", " + op.lanes() + ")";
    }

    @Override
    public String visitCall(Call op) {
        return "@" + op.name() + "<" + op.dtype() + ">" + joinExprs(op.args(), "(", ")");
    }

    private String expr(Expr e) {
        if (budget <= 0) {
            return ELLIPSIS;
        }
        String text = e.accept(this);
        budget -= text.length();
        return text;
    }

    private String infix(BinaryOp op) {
        return "(" + expr(op.a()) + " " + op.opName() + " " + expr(op.b()) + ")";
    }

    private String prefix(BinaryOp op) {
        return op.opName() + "(" + expr(op.a()) + ", " + expr(op.b()) + ")";
    }

    private String joinExprs(List<Expr> exprs, String open, String close) {
        StringBuilder sb = new StringBuilder(open);
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(expr(exprs.get(i)));
        }
        return sb.append(close).toString();
    }
}
