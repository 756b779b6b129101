package org.pragmatica.rewrite;

import com.google.common.collect.ImmutableList;
import org.pragmatica.rewrite.error.Diagnostic;
import org.pragmatica.rewrite.tree.SyntaxNode;

import java.util.List;

/**
 * Outcome of one rule run.
 *
 * @param tree        The rewritten tree in {@link RewriteMode#FORMAT}, the input tree in {@link RewriteMode#LINT}
 * @param diagnostics Diagnostics in the order they were reported, anchored in the input tree
 * @param changed     Whether the rule rewrote anything (in lint mode: whether it would have)
 */
public record RewriteResult(
    SyntaxNode tree,
    List<Diagnostic> diagnostics,
    boolean changed
) {
    public RewriteResult {
        diagnostics = ImmutableList.copyOf(diagnostics);
    }

    public static RewriteResult unchanged(SyntaxNode tree) {
        return new RewriteResult(tree, List.of(), false);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * Count diagnostics of the given severity.
     */
    public int count(Diagnostic.Severity severity) {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == severity)
                                .count();
    }
}
