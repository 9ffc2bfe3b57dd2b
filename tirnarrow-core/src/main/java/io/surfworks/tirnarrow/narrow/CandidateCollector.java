package io.surfworks.tirnarrow.narrow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.tirnarrow.arith.BoundAnalyzer;
import io.surfworks.tirnarrow.arith.Interval;
import io.surfworks.tirnarrow.tir.ExprWalker;
import io.surfworks.tirnarrow.tir.StmtVisitor;
import io.surfworks.tirnarrow.tir.TirAst.Block;
import io.surfworks.tirnarrow.tir.TirAst.BufferLoad;
import io.surfworks.tirnarrow.tir.TirAst.BufferStore;
import io.surfworks.tirnarrow.tir.TirAst.Evaluate;
import io.surfworks.tirnarrow.tir.TirAst.Expr;
import io.surfworks.tirnarrow.tir.TirAst.For;
import io.surfworks.tirnarrow.tir.TirAst.IfThenElse;
import io.surfworks.tirnarrow.tir.TirAst.IterVar;
import io.surfworks.tirnarrow.tir.TirAst.PrimFunc;
import io.surfworks.tirnarrow.tir.TirAst.SeqStmt;
import io.surfworks.tirnarrow.tir.TirAst.Stmt;
import io.surfworks.tirnarrow.tir.TirAst.ThreadBinding;
import io.surfworks.tirnarrow.tir.TirAst.Var;

/**
 * Finds the variables a function declares and every expression root that
 * may use them, in one walk over the body.
 *
 * <p>Loop variables, thread axis variables and block iteration variables
 * are candidates. Their declared interval is {@code [min, min + extent - 1]}
 * when both {@code min} and {@code extent} fold to constants and the extent
 * is positive; otherwise it is unbounded. Function parameters are never
 * candidates.
 *
 * <p>Roots are store indices and values, evaluated expressions, branch
 * conditions, non-constant loop domains and block bindings. The indices of
 * every buffer load, however deeply nested, become roots of their own, and
 * a root never looks inside a load. A load shared by several roots yields
 * its index sites once.
 */
public final class CandidateCollector implements StmtVisitor<Void> {

    private static final Logger LOG = Logger.getLogger(CandidateCollector.class.getName());

    private final BoundAnalyzer constants = new BoundAnalyzer();
    private final Map<Var, Candidate> candidates = new LinkedHashMap<>();
    private final List<PendingSite> pending = new ArrayList<>();
    private final Set<BufferLoad> expandedLoads = Collections.newSetFromMap(new IdentityHashMap<>());

    private CandidateCollector() {}

    /**
     * Collects candidates and use sites of {@code function}.
     */
    public static CollectedFunction collect(PrimFunc function) {
        CandidateCollector collector = new CandidateCollector();
        function.body().accept(collector);
        CollectedFunction result = collector.finish(function);
        LOG.fine(() -> String.format("[%s] collected %d candidates and %d use sites",
                function.name(), result.candidates().size(), result.sites().size()));
        return result;
    }

    private CollectedFunction finish(PrimFunc function) {
        List<UseSite> sites = new ArrayList<>(pending.size());
        for (PendingSite p : pending) {
            Set<Var> referenced = new LinkedHashSet<>();
            for (Var v : p.vars) {
                if (candidates.containsKey(v)) {
                    referenced.add(v);
                }
            }
            sites.add(new UseSite(p.kind, p.root, p.owner, referenced));
        }
        return new CollectedFunction(function, new ArrayList<>(candidates.values()), sites);
    }

    // ==================== Declarations ====================

    @Override
    public Void visitFor(For op) {
        declare(op.loopVar(), CandidateKind.LOOP, op.min(), op.extent());
        op.body().accept(this);
        return null;
    }

    @Override
    public Void visitThreadBinding(ThreadBinding op) {
        declare(op.var(), CandidateKind.THREAD, null, op.extent());
        op.body().accept(this);
        return null;
    }

    @Override
    public Void visitBlock(Block op) {
        for (IterVar iv : op.iterVars()) {
            declare(iv.var(), CandidateKind.BLOCK_ITER, iv.min(), iv.extent());
            addSite(SiteKind.BINDING, iv.binding(), iv.var().name());
        }
        op.body().accept(this);
        return null;
    }

    /**
     * Registers a declaration; a null {@code min} means the domain starts at zero.
     */
    private void declare(Var var, CandidateKind kind, Expr min, Expr extent) {
        Candidate candidate = new Candidate(var, kind, Interval.unbounded(), OptionalLong.empty());
        OptionalLong lo = min == null ? OptionalLong.of(0) : constants.constantValue(min);
        OptionalLong n = constants.constantValue(extent);
        if (lo.isPresent() && n.isPresent() && n.getAsLong() > 0) {
            Interval declared = Interval.point(lo.getAsLong()).add(Interval.point(n.getAsLong() - 1));
            candidate = new Candidate(var, kind, declared, n);
        }
        if (lo.isEmpty()) {
            addSite(SiteKind.LOOP_BOUND, min, var.name());
        }
        if (n.isEmpty()) {
            addSite(SiteKind.LOOP_BOUND, extent, var.name());
        }
        candidates.merge(var, candidate, Candidate::merge);
    }

    // ==================== Uses ====================

    @Override
    public Void visitIfThenElse(IfThenElse op) {
        addSite(SiteKind.CONDITION, op.condition(), "if");
        op.thenCase().accept(this);
        if (op.elseCase() != null) {
            op.elseCase().accept(this);
        }
        return null;
    }

    @Override
    public Void visitBufferStore(BufferStore op) {
        for (Expr index : op.indices()) {
            addSite(SiteKind.INDEX, index, op.buffer().name());
        }
        addSite(SiteKind.VALUE, op.value(), op.buffer().name());
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
        addSite(SiteKind.VALUE, op.value(), "evaluate");
        return null;
    }

    private void addSite(SiteKind kind, Expr root, String owner) {
        PendingSite site = new PendingSite(kind, root, owner);
        pending.add(site);
        new RootScanner(site).walk(root);
    }

    private static final class PendingSite {
        final SiteKind kind;
        final Expr root;
        final String owner;
        final Set<Var> vars = new LinkedHashSet<>();

        PendingSite(SiteKind kind, Expr root, String owner) {
            this.kind = kind;
            this.root = root;
            this.owner = owner;
        }
    }

    /**
     * Records the variables of one root and turns nested load indices into
     * sites of their own.
     */
    private final class RootScanner extends ExprWalker {
        private final PendingSite site;

        RootScanner(PendingSite site) {
            this.site = site;
        }

        @Override
        public Void visitVar(Var op) {
            site.vars.add(op);
            return null;
        }

        @Override
        public Void visitBufferLoad(BufferLoad op) {
            if (expandedLoads.add(op)) {
                for (Expr index : op.indices()) {
                    addSite(SiteKind.INDEX, index, op.buffer().name());
                }
            }
            return null;
        }
    }
}
