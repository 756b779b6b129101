package org.pragmatica.rewrite.visitor;

import com.google.common.collect.ImmutableList;
import org.pragmatica.rewrite.rule.RewriteRule;
import org.pragmatica.rewrite.rule.RuleContext;
import org.pragmatica.rewrite.tree.SyntaxKind;
import org.pragmatica.rewrite.tree.SyntaxNode;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Depth-first, post-order traversal that rebuilds the tree bottom-up and lets a rule replace the statement
 * sequences it finds.
 *
 * <p>Children are visited first, then their parent is rebuilt from the possibly replaced children. A node whose
 * children are all unchanged is returned as is, so a subtree the rule never touches is shared with the input and
 * costs no allocation. Statement containers ({@link SyntaxKind#isStatementContainer()}) hand their already-visited
 * statement list, together with the list as it was in the input, to {@link RewriteRule#rewriteStatements}; every
 * other kind is rebuilt without rule involvement.
 *
 * <p>The visitor holds no mutable state. Diagnostics go to the sink of the given context.
 */
public final class RewriteVisitor {
    private final RewriteRule rule;
    private final RuleContext context;

    private RewriteVisitor(RewriteRule rule, RuleContext context) {
        this.rule = rule;
        this.context = context;
    }

    public static RewriteVisitor rewriteVisitor(RewriteRule rule, RuleContext context) {
        return new RewriteVisitor(checkNotNull(rule), checkNotNull(context));
    }

    /**
     * Apply the rule everywhere beneath (and at) the root.
     *
     * @return the rewritten tree, or the root itself when nothing changed
     */
    public SyntaxNode rewrite(SyntaxNode root) {
        return visit(root);
    }

    private SyntaxNode visit(SyntaxNode node) {
        if (node instanceof SyntaxNode.Token) {
            return node;
        }
        var original = (SyntaxNode.Node) node;
        var rebuilt = visitChildren(original);
        return rebuilt.kind()
                      .isStatementContainer()
               ? visitStatementContainer(original, rebuilt)
               : rebuilt;
    }

    private SyntaxNode.Node visitChildren(SyntaxNode.Node node) {
        var children = node.children();
        ImmutableList.Builder<SyntaxNode> replaced = null;
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            var visited = visit(child);
            if (replaced == null && visited != child) {
                replaced = ImmutableList.builderWithExpectedSize(children.size());
                replaced.addAll(children.subList(0, i));
            }
            if (replaced != null) {
                replaced.add(visited);
            }
        }
        return replaced == null ? node : node.withChildren(replaced.build());
    }

    /**
     * Child positions are stable across {@link #visitChildren}, so the statement list sits at the same index in the
     * original and the rebuilt container, and both lists have the same number of items.
     */
    private SyntaxNode.Node visitStatementContainer(SyntaxNode.Node original, SyntaxNode.Node container) {
        var index = container.indexOf(SyntaxKind.CODE_BLOCK_ITEM_LIST);
        checkState(index >= 0, "%s without statement list", container.kind());
        var statements = (SyntaxNode.Node) container.children()
                                                    .get(index);
        var originalStatements = (SyntaxNode.Node) original.children()
                                                           .get(index);
        var replacement = rule.rewriteStatements(originalStatements, statements, context);
        if (replacement == null) {
            return container;
        }
        checkState(replacement.is(SyntaxKind.CODE_BLOCK_ITEM_LIST),
                   "Rule %s replaced statements with %s",
                   rule.ruleId(),
                   replacement.kind());
        return container.withChild(index, replacement);
    }
}
