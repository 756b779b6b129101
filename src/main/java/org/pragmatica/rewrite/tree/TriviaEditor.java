package org.pragmatica.rewrite.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Pure helpers for moving tokens between lines without disturbing the trivia around them.
 */
public final class TriviaEditor {
    private TriviaEditor() {}

    /**
     * Drop all line breaks from the trivia, keeping spaces, tabs and comments in their original order.
     * A line comment that was terminated by a line break keeps a single one, since it extends to the end of its line.
     */
    public static ImmutableList<Trivia> withoutNewlines(List<Trivia> trivia) {
        var result = ImmutableList.<Trivia>builder();
        for (int i = 0; i < trivia.size(); i++) {
            var piece = trivia.get(i);
            if (piece.isNewline()) {
                continue;
            }
            result.add(piece);
            if (piece instanceof Trivia.LineComment && i + 1 < trivia.size() && trivia.get(i + 1).isNewline()) {
                result.add(Trivia.newlines(1));
            }
        }
        return result.build();
    }

    /**
     * Leading trivia for a token that is moved to the start of a new line: exactly one line break followed by the
     * original trivia without its line breaks.
     */
    public static ImmutableList<Trivia> onFreshLine(List<Trivia> trivia) {
        return ImmutableList.<Trivia>builder()
                            .add(Trivia.newlines(1))
                            .addAll(withoutNewlines(trivia))
                            .build();
    }

    public static boolean containsComment(List<Trivia> trivia) {
        return trivia.stream()
                     .anyMatch(Trivia::isComment);
    }

    /**
     * Replace the leading trivia of the node's first token. Only the path to that token is rebuilt.
     */
    public static SyntaxNode.Node withLeadingTrivia(SyntaxNode.Node node, List<Trivia> trivia) {
        checkArgument(node.firstToken() != null, "Node %s has no tokens", node.kind());
        return (SyntaxNode.Node) replaceFirstToken(node, token -> token.withLeadingTrivia(trivia));
    }

    /**
     * Replace the trailing trivia of the node's last token. Only the path to that token is rebuilt.
     */
    public static SyntaxNode.Node withTrailingTrivia(SyntaxNode.Node node, List<Trivia> trivia) {
        checkArgument(node.lastToken() != null, "Node %s has no tokens", node.kind());
        return (SyntaxNode.Node) replaceLastToken(node, token -> token.withTrailingTrivia(trivia));
    }

    private static SyntaxNode replaceFirstToken(SyntaxNode node, UnaryOperator<SyntaxNode.Token> replacement) {
        if (node instanceof SyntaxNode.Token token) {
            return replacement.apply(token);
        }
        var parent = (SyntaxNode.Node) node;
        var children = parent.children();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i)
                        .firstToken() != null) {
                return parent.withChild(i, replaceFirstToken(children.get(i), replacement));
            }
        }
        return parent;
    }

    private static SyntaxNode replaceLastToken(SyntaxNode node, UnaryOperator<SyntaxNode.Token> replacement) {
        if (node instanceof SyntaxNode.Token token) {
            return replacement.apply(token);
        }
        var parent = (SyntaxNode.Node) node;
        var children = parent.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i)
                        .lastToken() != null) {
                return parent.withChild(i, replaceLastToken(children.get(i), replacement));
            }
        }
        return parent;
    }

    /**
     * Concatenate trivia lists, keeping order.
     */
    public static ImmutableList<Trivia> concat(List<Trivia> first, List<Trivia> second) {
        return ImmutableList.<Trivia>builderWithExpectedSize(first.size() + second.size())
                            .addAll(first)
                            .addAll(second)
                            .build();
    }

    /**
     * The spaces and tabs at the end of the trivia: the indentation of a token that starts its line.
     */
    public static ImmutableList<Trivia> indentation(List<Trivia> trivia) {
        int start = trivia.size();
        while (start > 0 && isBlank(trivia.get(start - 1))) {
            start--;
        }
        return ImmutableList.copyOf(trivia.subList(start, trivia.size()));
    }

    /**
     * Trivia with trailing spaces and tabs removed.
     */
    public static ImmutableList<Trivia> trimEnd(List<Trivia> trivia) {
        int end = trivia.size();
        while (end > 0 && isBlank(trivia.get(end - 1))) {
            end--;
        }
        return ImmutableList.copyOf(trivia.subList(0, end));
    }

    private static boolean isBlank(Trivia piece) {
        return piece instanceof Trivia.Spaces || piece instanceof Trivia.Tabs;
    }
}
