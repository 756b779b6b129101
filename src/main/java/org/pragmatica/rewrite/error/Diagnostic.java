package org.pragmatica.rewrite.error;

import org.pragmatica.rewrite.tree.SourceLocationConverter;
import org.pragmatica.rewrite.tree.SyntaxNode;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Advisory report produced by a rule, anchored at the node it describes.
 *
 * <p>Example output of {@link #formatSimple(String, SourceLocationConverter)}:
 * <pre>
 * Sources/App.swift:3:5: warning: split variable binding into multiple declarations [one-binding-per-declaration]
 * </pre>
 *
 * @param severity Severity level
 * @param ruleId   Identifier of the rule that reported it
 * @param message  Message text
 * @param anchor   Node in the tree the rule was given (not in the rewritten tree)
 */
public record Diagnostic(
    Severity severity,
    String ruleId,
    String message,
    SyntaxNode anchor
) {
    public Diagnostic {
        checkNotNull(severity);
        checkNotNull(ruleId);
        checkNotNull(message);
        checkNotNull(anchor);
    }

    /**
     * Severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info"),
        HINT("hint");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic diagnostic(Severity severity, String ruleId, String message, SyntaxNode anchor) {
        return new Diagnostic(severity, ruleId, message, anchor);
    }

    /**
     * Create a warning diagnostic.
     */
    public static Diagnostic warning(String ruleId, String message, SyntaxNode anchor) {
        return new Diagnostic(Severity.WARNING, ruleId, message, anchor);
    }

    /**
     * Single-line format for console output. The converter must be built over the tree containing the anchor.
     */
    public String formatSimple(String fileName, SourceLocationConverter converter) {
        var location = converter.locationOf(anchor);
        var position = location == null ? "?:?" : location.line() + ":" + location.column();
        return String.format("%s:%s: %s: %s [%s]", fileName, position, severity.display(), message, ruleId);
    }
}
