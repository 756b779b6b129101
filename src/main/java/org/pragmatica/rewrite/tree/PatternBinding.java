package org.pragmatica.rewrite.tree;

import org.jspecify.annotations.Nullable;

import java.util.EnumSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Typed view over a {@link SyntaxKind#PATTERN_BINDING} node: a pattern with optional type annotation, initializer
 * and trailing comma.
 */
public record PatternBinding(SyntaxNode.Node node) {
    private static final Set<SyntaxKind> PATTERN_KINDS = EnumSet.of(SyntaxKind.IDENTIFIER_PATTERN,
                                                                    SyntaxKind.TUPLE_PATTERN,
                                                                    SyntaxKind.WILDCARD_PATTERN);

    public PatternBinding {
        checkArgument(node.is(SyntaxKind.PATTERN_BINDING), "Not a pattern binding: %s", node.kind());
    }

    public SyntaxNode.Node pattern() {
        return (SyntaxNode.Node) node.children()
                                     .get(patternIndex());
    }

    public SyntaxNode.@Nullable Node typeAnnotation() {
        return node.child(SyntaxKind.TYPE_ANNOTATION);
    }

    public SyntaxNode.@Nullable Node initializer() {
        return node.child(SyntaxKind.INITIALIZER_CLAUSE);
    }

    public SyntaxNode.@Nullable Token trailingComma() {
        var index = trailingCommaIndex();
        return index < 0 ? null : (SyntaxNode.Token) node.children()
                                                         .get(index);
    }

    /**
     * Binding with the given annotation placed right after the pattern, replacing any existing one.
     */
    public PatternBinding withTypeAnnotation(SyntaxNode.@Nullable Node annotation) {
        var updated = node;
        var existing = updated.indexOf(SyntaxKind.TYPE_ANNOTATION);
        if (existing >= 0) {
            updated = updated.withoutChild(existing);
        }
        if (annotation != null) {
            checkArgument(annotation.is(SyntaxKind.TYPE_ANNOTATION), "Not a type annotation: %s", annotation.kind());
            updated = updated.withChildInserted(new PatternBinding(updated).patternIndex() + 1, annotation);
        }
        return new PatternBinding(updated);
    }

    public PatternBinding withPattern(SyntaxNode.Node pattern) {
        checkArgument(PATTERN_KINDS.contains(pattern.kind()), "Not a pattern: %s", pattern.kind());
        return new PatternBinding(node.withChild(patternIndex(), pattern));
    }

    public PatternBinding withoutTrailingComma() {
        var index = trailingCommaIndex();
        return index < 0 ? this : new PatternBinding(node.withoutChild(index));
    }

    private int patternIndex() {
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof SyntaxNode.Node child && PATTERN_KINDS.contains(child.kind())) {
                return i;
            }
        }
        throw new IllegalStateException("Binding without pattern: " + node);
    }

    private int trailingCommaIndex() {
        var children = node.children();
        checkState(!children.isEmpty(), "Empty binding");
        var last = children.size() - 1;
        return children.get(last) instanceof SyntaxNode.Token token && token.is(TokenKind.PUNCTUATION, ",")
               ? last
               : -1;
    }
}
