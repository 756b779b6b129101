package org.pragmatica.rewrite.rule;

import org.pragmatica.rewrite.error.Diagnostic;
import org.pragmatica.rewrite.error.DiagnosticMessage;
import org.pragmatica.rewrite.error.DiagnosticSink;
import org.pragmatica.rewrite.tree.SyntaxNode;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * What a rule sees of the run it takes part in: the severity it reports at and the sink it reports to.
 */
public record RuleContext(String ruleId, Diagnostic.Severity severity, DiagnosticSink sink) {
    public RuleContext {
        checkNotNull(ruleId);
        checkNotNull(severity);
        checkNotNull(sink);
    }

    public static RuleContext ruleContext(String ruleId, Diagnostic.Severity severity, DiagnosticSink sink) {
        return new RuleContext(ruleId, severity, sink);
    }

    /**
     * Context reporting at {@link Diagnostic.Severity#WARNING}.
     */
    public static RuleContext ruleContext(String ruleId, DiagnosticSink sink) {
        return new RuleContext(ruleId, Diagnostic.Severity.WARNING, sink);
    }

    public void diagnose(DiagnosticMessage message, SyntaxNode anchor) {
        sink.record(severity, ruleId, message.text(), anchor);
    }
}
