package org.deadstore.dataflow.livevariable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.deadstore.dataflow.analysis.BackwardAnalysisImpl;
import org.deadstore.dataflow.analysis.ForwardAnalysisImpl;
import org.deadstore.dataflow.cfg.CFGBuilder;
import org.deadstore.dataflow.cfg.ControlFlowGraph;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.Location;
import org.deadstore.dataflow.cfg.node.Node;
import org.deadstore.dataflow.resolution.DeclaredNoReturnOracle;
import org.deadstore.dataflow.resolution.NeverTypeOracle;
import org.deadstore.dataflow.resolution.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds dead stores: assignments whose value is never read, either because it is overwritten
 * first or because no path to the exit reads it.
 *
 * <p>A function is analyzed in two passes over its control flow graph. The forward pass tracks
 * pending stores and reports overwritten ones; the backward pass starts from the forward exit
 * store, computes liveness and reports assignments to dead identifiers. Stores still pending at
 * the end are reported as well, which covers unread parameters. Nested function definitions are
 * then analyzed the same way, each paired with the enclosing store at its definition.
 *
 * <p>Functions declared {@code NoReturn} are resolved per scope: a function sees the ones defined
 * in its own body and in the bodies around it, never those of a function analyzed before. The
 * result of analyzing a function therefore depends on nothing but the function and the options.
 *
 * <p>Findings are only taken from converged stores: during the fixpoint iteration the transfer
 * functions report into a scratch table, and the converged analyses are replayed against the real
 * one.
 *
 * <p>If no path reaches the exit, there is no backward pass; only overwritten stores are
 * reported.
 */
public class DeadStoreChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeadStoreChecker.class);

    private final LivenessOptions options;

    private final NeverTypeOracle oracle;

    /** Create a checker with the default options. */
    public DeadStoreChecker() {
        this(LivenessOptions.DEFAULT);
    }

    /**
     * Create a checker that knows never-returning functions by name.
     *
     * @param options the options
     */
    public DeadStoreChecker(LivenessOptions options) {
        this(options, new DeclaredNoReturnOracle(options.getNoReturnFunctions()));
    }

    /**
     * @param options the options
     * @param oracle decides which expressions never return
     */
    public DeadStoreChecker(LivenessOptions options, NeverTypeOracle oracle) {
        this.options = options;
        this.oracle = oracle;
    }

    /**
     * Analyze a function and, recursively, the functions defined in it.
     *
     * @param function a top-level function
     * @return the dead stores, ordered by location and identifier
     */
    public List<DeadStore> check(FunctionDefinitionNode function) {
        DiagnosticTable diagnostics = new DiagnosticTable();
        analyze(function, null, null, diagnostics);
        return diagnostics.sortedDiagnostics();
    }

    /**
     * Analyze the top level of a module as the function {@value
     * FunctionDefinitionNode#TOPLEVEL_NAME}.
     *
     * @param statements the statements of the module
     * @return the dead stores, ordered by location and identifier
     */
    public List<DeadStore> checkModule(List<Node> statements) {
        return check(FunctionDefinitionNode.toplevel(statements));
    }

    /**
     * Analyze independent functions in parallel, each into its own table.
     *
     * @param functions the functions to analyze
     * @param executor runs one analysis per function
     * @return the dead stores of all functions, ordered by location and identifier
     * @throws InterruptedException if interrupted while waiting for an analysis
     */
    public List<DeadStore> checkAll(
            Collection<FunctionDefinitionNode> functions, ExecutorService executor)
            throws InterruptedException {
        List<Future<DiagnosticTable>> futures = new ArrayList<>(functions.size());
        for (final FunctionDefinitionNode function : functions) {
            futures.add(
                    executor.submit(
                            new Callable<DiagnosticTable>() {
                                @Override
                                public DiagnosticTable call() {
                                    DiagnosticTable diagnostics = new DiagnosticTable();
                                    analyze(function, null, null, diagnostics);
                                    return diagnostics;
                                }
                            }));
        }
        DiagnosticTable merged = new DiagnosticTable();
        for (Future<DiagnosticTable> future : futures) {
            try {
                merged.putAll(future.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new BugInCF("DeadStoreChecker: analysis failed", cause);
            }
        }
        return merged.sortedDiagnostics();
    }

    /**
     * Analyze {@code function} and the functions defined in it.
     *
     * @param function the function to analyze
     * @param enclosing the store of the enclosing function at the definition, or {@code null}
     * @param enclosingScope the context of the enclosing function, or {@code null}
     * @param diagnostics where dead stores are reported
     */
    protected void analyze(
            FunctionDefinitionNode function,
            @Nullable LivenessStore enclosing,
            @Nullable ResolutionContext enclosingScope,
            DiagnosticTable diagnostics) {
        ControlFlowGraph cfg = CFGBuilder.build(function);
        ResolutionContext scope =
                (enclosingScope == null
                                ? ResolutionContext.of(function, null)
                                : enclosingScope.nested(function))
                        .withDeclaredNoReturn(
                                DeclaredNoReturnOracle.declaredNoReturn(cfg.getAllNodes()));
        DiagnosticTable scratch = new DiagnosticTable();

        ForwardAnalysisImpl<LivenessStore, ForwardLivenessTransfer> forward =
                new ForwardAnalysisImpl<>(
                        new ForwardLivenessTransfer(enclosing, oracle, scope, scratch),
                        options.getWidenAfter(),
                        options.getMaxIterations());
        forward.performAnalysis(cfg);
        forward.replay(new ForwardLivenessTransfer(enclosing, oracle, scope, diagnostics));

        LivenessStore exitStore = forward.getRegularExitStore();
        Map<Location, NestedDefine> nestedDefines;
        if (exitStore == null) {
            nestedDefines = new TreeMap<>();
            for (LivenessStore store : forward.getResult().getStores()) {
                for (Map.Entry<Location, NestedDefine> entry :
                        store.getNestedDefines().entrySet()) {
                    if (!nestedDefines.containsKey(entry.getKey())) {
                        nestedDefines.put(entry.getKey(), entry.getValue());
                    }
                }
            }
        } else {
            BackwardAnalysisImpl<LivenessStore, BackwardLivenessTransfer> backward =
                    new BackwardAnalysisImpl<>(
                            new BackwardLivenessTransfer(exitStore, scratch),
                            options.getWidenAfter(),
                            options.getMaxIterations());
            backward.performAnalysis(cfg);
            backward.replay(new BackwardLivenessTransfer(exitStore, diagnostics));
            LivenessStore entryStore = backward.getEntryStore();
            if (entryStore == null) {
                throw new BugInCF(
                        "DeadStoreChecker: the backward analysis of %s did not reach the entry",
                        function.getQualifiedName());
            }
            diagnostics.reportPending(entryStore);
            nestedDefines = entryStore.getNestedDefines();
        }
        LOGGER.debug(
                "Analyzed {}: {} blocks, exit {}, {} nested definitions, {} dead stores so far",
                function.getQualifiedName(),
                cfg.getAllBlocks().size(),
                exitStore == null ? "unreachable" : "reachable",
                nestedDefines.size(),
                diagnostics.size());

        for (NestedDefine nested : nestedDefines.values()) {
            LOGGER.debug(
                    "Analyzing {} nested in {}",
                    nested.getDefine().getQualifiedName(),
                    function.getQualifiedName());
            analyze(nested.getDefine(), nested.getState(), scope, diagnostics);
        }
    }
}
