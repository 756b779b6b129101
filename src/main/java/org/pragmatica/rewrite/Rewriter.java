package org.pragmatica.rewrite;

import org.pragmatica.rewrite.error.DiagnosticSink;
import org.pragmatica.rewrite.rule.RewriteRule;
import org.pragmatica.rewrite.rule.RuleContext;
import org.pragmatica.rewrite.tree.SyntaxNode;
import org.pragmatica.rewrite.visitor.RewriteVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point for running a rule over a tree.
 *
 * <p>Example usage:
 * <pre>{@code
 * var rewriter = Rewriter.rewriter(OneBindingPerDeclarationRule.oneBindingPerDeclarationRule());
 *
 * var result = rewriter.format(tree);
 * }</pre>
 *
 * <p>A rewriter is immutable and may be shared between threads; every run creates its own diagnostic sink.
 */
public final class Rewriter {
    private static final Logger log = LoggerFactory.getLogger(Rewriter.class);

    private final RewriteRule rule;
    private final RewriteConfig config;

    private Rewriter(RewriteRule rule, RewriteConfig config) {
        this.rule = rule;
        this.config = config;
    }

    public static Rewriter rewriter(RewriteRule rule) {
        return rewriter(rule, RewriteConfig.DEFAULT);
    }

    public static Rewriter rewriter(RewriteRule rule, RewriteConfig config) {
        return new Rewriter(checkNotNull(rule), checkNotNull(config));
    }

    /**
     * Report without applying.
     */
    public RewriteResult lint(SyntaxNode root) {
        return run(root, RewriteMode.LINT);
    }

    /**
     * Report and apply.
     */
    public RewriteResult format(SyntaxNode root) {
        return run(root, RewriteMode.FORMAT);
    }

    public RewriteResult run(SyntaxNode root, RewriteMode mode) {
        checkNotNull(root);
        if (!config.isRuleEnabled(rule.ruleId())) {
            log.debug("Rule {} is disabled, skipping", rule.ruleId());
            return RewriteResult.unchanged(root);
        }
        var sink = DiagnosticSink.diagnosticSink();
        var context = RuleContext.ruleContext(rule.ruleId(), config.severityFor(rule), sink);
        var rewritten = RewriteVisitor.rewriteVisitor(rule, context)
                                      .rewrite(root);
        var changed = rewritten != root;

        log.debug("Rule {} finished in {} mode: {} diagnostic(s), changed: {}",
                  rule.ruleId(),
                  mode,
                  sink.size(),
                  changed);

        return new RewriteResult(mode == RewriteMode.FORMAT ? rewritten : root, sink.diagnostics(), changed);
    }
}
