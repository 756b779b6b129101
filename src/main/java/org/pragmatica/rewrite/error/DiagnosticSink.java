package org.pragmatica.rewrite.error;

import com.google.common.collect.ImmutableList;
import org.pragmatica.rewrite.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Append-only collector of diagnostics for one run. Keeps arrival order, never filters or deduplicates.
 * Not thread-safe: each run owns its own sink.
 */
public final class DiagnosticSink {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private DiagnosticSink() {}

    public static DiagnosticSink diagnosticSink() {
        return new DiagnosticSink();
    }

    public void record(Diagnostic.Severity severity, String ruleId, String message, SyntaxNode anchor) {
        record(Diagnostic.diagnostic(severity, ruleId, message, anchor));
    }

    public void record(Diagnostic diagnostic) {
        diagnostics.add(checkNotNull(diagnostic));
    }

    /**
     * Snapshot of everything recorded so far, in arrival order.
     */
    public ImmutableList<Diagnostic> diagnostics() {
        return ImmutableList.copyOf(diagnostics);
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
