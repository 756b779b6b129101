package org.pragmatica.rewrite.tree;

import org.jspecify.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Maps tokens of one tree to their positions in the source text that tree renders to.
 * Tokens are matched by identity, so only nodes taken from the converted tree can be located.
 */
public final class SourceLocationConverter {
    private final Map<SyntaxNode.Token, SourceLocation> locations = new IdentityHashMap<>();

    private SourceLocationConverter(SyntaxNode root) {
        collect(root, SourceLocation.START);
    }

    public static SourceLocationConverter sourceLocationConverter(SyntaxNode root) {
        return new SourceLocationConverter(root);
    }

    /**
     * Location of the first character of the node's first token, after its leading trivia.
     */
    public @Nullable SourceLocation locationOf(SyntaxNode node) {
        var token = node.firstToken();
        return token == null ? null : locations.get(token);
    }

    private SourceLocation collect(SyntaxNode node, SourceLocation start) {
        if (node instanceof SyntaxNode.Token token) {
            var location = start;
            for (var piece : token.leadingTrivia()) {
                location = location.advance(piece.text());
            }
            locations.putIfAbsent(token, location);
            location = location.advance(token.text());
            for (var piece : token.trailingTrivia()) {
                location = location.advance(piece.text());
            }
            return location;
        }
        var location = start;
        for (var child : ((SyntaxNode.Node) node).children()) {
            location = collect(child, location);
        }
        return location;
    }
}
