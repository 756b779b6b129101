package org.pragmatica.rewrite.error;

/**
 * Catalog of messages reported by the built-in rules, with their default severity.
 */
public enum DiagnosticMessage {
    SPLIT_VARIABLE_BINDING(Diagnostic.Severity.WARNING, "split variable binding into multiple declarations");

    private final Diagnostic.Severity defaultSeverity;
    private final String text;

    DiagnosticMessage(Diagnostic.Severity defaultSeverity, String text) {
        this.defaultSeverity = defaultSeverity;
        this.text = text;
    }

    public Diagnostic.Severity defaultSeverity() {
        return defaultSeverity;
    }

    public String text() {
        return text;
    }
}
