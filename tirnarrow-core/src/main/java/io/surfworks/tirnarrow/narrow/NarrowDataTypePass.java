package io.surfworks.tirnarrow.narrow;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.surfworks.tirnarrow.config.NarrowingConfig;
import io.surfworks.tirnarrow.tir.TirAst.IrModule;
import io.surfworks.tirnarrow.tir.TirAst.PrimFunc;
import io.surfworks.tirnarrow.tir.TirPrinter;
import io.surfworks.tirnarrow.tir.TirTypeChecker;
import io.surfworks.tirnarrow.tir.TirValidationException;

/**
 * Narrows loop, thread and block variables to a smaller integer width
 * wherever every value derived from them provably fits.
 *
 * <p>Each function goes through collection, bound analysis, decision and
 * rewriting on its own; nothing is shared between functions, so a module
 * can be processed concurrently. The result is semantically equivalent to
 * the input and never wider.
 *
 * <pre>{@code
 * NarrowDataTypePass pass = new NarrowDataTypePass(32);
 * IrModule narrowed = pass.apply(module);
 * }</pre>
 */
public final class NarrowDataTypePass {

    private static final Logger LOG = Logger.getLogger(NarrowDataTypePass.class.getName());

    private final NarrowingConfig config;

    public NarrowDataTypePass(int targetBits) {
        this(NarrowingConfig.defaults().withTargetBits(targetBits));
    }

    public NarrowDataTypePass(NarrowingConfig config) {
        WidthDecisionEngine.requireTargetBits(config.targetBits());
        this.config = config;
    }

    public NarrowingConfig config() {
        return config;
    }

    public int targetBits() {
        return config.targetBits();
    }

    // ==================== Functions ====================

    /**
     * Narrows one function.
     *
     * @throws NarrowingException if validation is enabled and the rewritten
     *         function does not type check
     */
    public NarrowingResult narrowFunction(PrimFunc function) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Before narrowing:\n" + TirPrinter.print(function));
        }

        CollectedFunction collected = CandidateCollector.collect(function);
        DecisionMap decisions = WidthDecisionEngine.decide(collected, config.targetBits());
        PrimFunc rewritten = new NarrowingRewriter(decisions).rewrite(function);

        if (config.validateOutput() && rewritten != function) {
            List<String> errors = new TirTypeChecker().validate(rewritten);
            if (!errors.isEmpty()) {
                LOG.warning("Narrowed function '" + function.name() + "' failed validation: " + errors);
                throw new NarrowingException(function.name(),
                        "Narrowed function '" + function.name() + "' is not well typed",
                        new TirValidationException("IR validation failed", errors));
            }
        }

        NarrowingReport report = new NarrowingReport(function.name(), config.targetBits(), decisions.decisions());
        if (config.logSummary()) {
            LOG.info(report.summary());
        }
        if (LOG.isLoggable(Level.FINE) && rewritten != function) {
            LOG.fine("After narrowing:\n" + TirPrinter.print(rewritten));
        }
        return new NarrowingResult(rewritten, report);
    }

    // ==================== Modules ====================

    /**
     * Narrows every function of a module. Runs on a private thread pool
     * when the configured parallelism is above one.
     */
    public IrModule apply(IrModule module) {
        return toModule(module, narrowModule(module));
    }

    /**
     * Narrows every function of a module on the given executor. The
     * executor is not shut down.
     *
     * @throws NarrowingException wrapping the first failure, in function order
     */
    public IrModule apply(IrModule module, ExecutorService executor) {
        return toModule(module, narrowModule(module, executor));
    }

    /**
     * Narrows every function of a module and returns the per-function
     * results in declaration order.
     */
    public List<NarrowingResult> narrowModule(IrModule module) {
        if (config.parallelism() <= 1 || module.functions().size() <= 1) {
            List<NarrowingResult> results = new ArrayList<>();
            for (PrimFunc function : module.functions()) {
                results.add(narrowFunction(function));
            }
            return results;
        }
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(config.parallelism(), module.functions().size()));
        try {
            return narrowModule(module, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Narrows every function of a module on the given executor.
     */
    public List<NarrowingResult> narrowModule(IrModule module, ExecutorService executor) {
        List<Future<NarrowingResult>> futures = new ArrayList<>();
        for (PrimFunc function : module.functions()) {
            futures.add(executor.submit(() -> narrowFunction(function)));
        }

        List<NarrowingResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String name = module.functions().get(i).name();
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NarrowingException(name, "Interrupted while narrowing '" + name + "'", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof NarrowingException narrowing) {
                    throw narrowing;
                }
                throw new NarrowingException(name, "Failed to narrow '" + name + "': " + cause.getMessage(), cause);
            }
        }
        return results;
    }

    private static IrModule toModule(IrModule module, List<NarrowingResult> results) {
        List<PrimFunc> functions = new ArrayList<>(results.size());
        boolean changed = false;
        for (int i = 0; i < results.size(); i++) {
            PrimFunc rewritten = results.get(i).function();
            changed |= rewritten != module.functions().get(i);
            functions.add(rewritten);
        }
        return changed ? new IrModule(module.name(), functions) : module;
    }
}
