package org.deadstore.dataflow.resolution;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.deadstore.dataflow.cfg.node.AttributeNode;
import org.deadstore.dataflow.cfg.node.CallNode;
import org.deadstore.dataflow.cfg.node.FunctionDefinitionNode;
import org.deadstore.dataflow.cfg.node.NameNode;
import org.deadstore.dataflow.cfg.node.Node;

/**
 * A {@link NeverTypeOracle} that knows never-returning functions by name. A call is never-typed
 * if its callee's dotted name is one of the configured names, or one of the {@code NoReturn}
 * functions {@link ResolutionContext#getDeclaredNoReturn declared in scope}.
 *
 * <p>The configured names are fixed at construction, so one oracle can serve any number of
 * analyses, concurrently or not. Resolution is purely syntactic: a local variable shadowing
 * {@code exit} is still treated as the builtin.
 */
public class DeclaredNoReturnOracle implements NeverTypeOracle {

    /** Callees that never return unless configured otherwise. */
    public static final List<String> DEFAULT_NO_RETURN_FUNCTIONS =
            Collections.unmodifiableList(Arrays.asList("sys.exit", "os._exit", "exit", "quit"));

    /** The annotation that marks a function as never returning. */
    public static final String NO_RETURN = "NoReturn";

    private final Set<String> noReturnFunctions;

    /** Create an oracle that knows {@link #DEFAULT_NO_RETURN_FUNCTIONS}. */
    public DeclaredNoReturnOracle() {
        this(Collections.<String>emptyList());
    }

    /**
     * Create an oracle that knows {@link #DEFAULT_NO_RETURN_FUNCTIONS} and {@code extra}.
     *
     * @param extra dotted names of additional never-returning callees
     */
    public DeclaredNoReturnOracle(Collection<String> extra) {
        TreeSet<String> names = new TreeSet<>(DEFAULT_NO_RETURN_FUNCTIONS);
        names.addAll(extra);
        this.noReturnFunctions = Collections.unmodifiableSet(names);
    }

    /**
     * Returns true if the return annotation of {@code function} is {@code NoReturn} or {@code
     * typing.NoReturn}.
     *
     * @param function a function definition
     * @return true if {@code function} is declared never returning
     */
    public static boolean isDeclaredNoReturn(FunctionDefinitionNode function) {
        String annotation = dottedName(function.getReturnAnnotation());
        return annotation != null
                && (annotation.equals(NO_RETURN) || annotation.endsWith("." + NO_RETURN));
    }

    /**
     * Returns the callee names of the never-returning function definitions among {@code nodes}. A
     * method is known only by its qualified name {@code C.m}, so it does not capture calls of an
     * unrelated function {@code m}.
     *
     * @param nodes statements, typically those of one function body
     * @return the dotted names of the declared never-returning functions, sorted
     */
    public static SortedSet<String> declaredNoReturn(Collection<? extends Node> nodes) {
        SortedSet<String> result = new TreeSet<>();
        for (Node n : nodes) {
            if (n instanceof FunctionDefinitionNode) {
                FunctionDefinitionNode function = (FunctionDefinitionNode) n;
                if (isDeclaredNoReturn(function)) {
                    result.add(function.getQualifiedName());
                }
            }
        }
        return result;
    }

    /** @return the configured never-returning callee names, sorted */
    public Set<String> getNoReturnFunctions() {
        return noReturnFunctions;
    }

    @Override
    public boolean isNoReturn(Node expression, ResolutionContext context) {
        if (!(expression instanceof CallNode)) {
            return false;
        }
        String callee = dottedName(((CallNode) expression).getCallee());
        return callee != null
                && (noReturnFunctions.contains(callee)
                        || context.getDeclaredNoReturn().contains(callee));
    }

    /**
     * Returns the dotted name of a name or attribute chain such as {@code a.b.c}.
     *
     * @param n an expression, or {@code null}
     * @return the dotted name, or {@code null} if {@code n} is not a plain name chain
     */
    static @Nullable String dottedName(@Nullable Node n) {
        if (n instanceof NameNode) {
            return ((NameNode) n).getIdentifier();
        }
        if (n instanceof AttributeNode) {
            AttributeNode attribute = (AttributeNode) n;
            String base = dottedName(attribute.getBase());
            return base == null ? null : base + "." + attribute.getAttribute();
        }
        return null;
    }
}
