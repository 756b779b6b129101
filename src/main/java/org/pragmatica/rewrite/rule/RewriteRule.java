package org.pragmatica.rewrite.rule;

import org.jspecify.annotations.Nullable;
import org.pragmatica.rewrite.error.Diagnostic;
import org.pragmatica.rewrite.tree.SyntaxNode;

/**
 * A local rewrite applied by {@link org.pragmatica.rewrite.visitor.RewriteVisitor}.
 *
 * <p>One method per rewrite site; every method defaults to "no change", so a rule overrides only the sites it
 * cares about. Implementations must not keep per-run state: everything a run produces goes through the
 * {@link RuleContext}.
 */
public interface RewriteRule {
    /**
     * Stable identifier used in configuration and diagnostics.
     */
    String ruleId();

    /**
     * Severity used when the configuration does not override it.
     */
    default Diagnostic.Severity defaultSeverity() {
        return Diagnostic.Severity.WARNING;
    }

    /**
     * Rewrite a statement sequence ({@code CODE_BLOCK_ITEM_LIST}) owned by a source file, code block or closure.
     * Called after the statements themselves have been visited.
     *
     * @param original   the sequence as it appears in the input tree; diagnostics are anchored at its items
     * @param statements the same sequence after its items were visited, item for item in the same order
     *
     * @return the replacement for {@code statements}, or {@code null} when nothing changes
     */
    default SyntaxNode.@Nullable Node rewriteStatements(SyntaxNode.Node original,
                                                        SyntaxNode.Node statements,
                                                        RuleContext context) {
        return null;
    }
}
