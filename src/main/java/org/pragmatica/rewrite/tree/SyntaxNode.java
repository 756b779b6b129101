package org.pragmatica.rewrite.tree;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.jspecify.annotations.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndex;

/**
 * Lossless, immutable syntax tree node. Every source character belongs either to a token's text or to its trivia,
 * so {@link #toSource()} reproduces the original input exactly.
 *
 * <p>Nodes are persistent: every {@code with...} method returns a new node that shares all unchanged children with
 * the receiver by reference.
 */
public sealed interface SyntaxNode {
    /**
     * First token in this subtree, or {@code null} for an empty node.
     */
    @Nullable Token firstToken();

    /**
     * Last token in this subtree, or {@code null} for an empty node.
     */
    @Nullable Token lastToken();

    /**
     * Append the source text of this subtree to the builder.
     */
    void writeTo(StringBuilder sb);

    /**
     * Leading trivia of the first token in this subtree.
     */
    default List<Trivia> leadingTrivia() {
        var token = firstToken();
        return token == null ? ImmutableList.of() : token.leadingTrivia();
    }

    /**
     * Trailing trivia of the last token in this subtree.
     */
    default List<Trivia> trailingTrivia() {
        var token = lastToken();
        return token == null ? ImmutableList.of() : token.trailingTrivia();
    }

    default String toSource() {
        var sb = new StringBuilder();
        writeTo(sb);
        return sb.toString();
    }

    /**
     * Leaf node: an indivisible lexical unit with its surrounding trivia.
     * Trailing trivia never contains a line break; the break belongs to the next token's leading trivia.
     */
    record Token(
    TokenKind kind,
    String text,
    List<Trivia> leadingTrivia,
    List<Trivia> trailingTrivia) implements SyntaxNode {
        public Token {
            checkNotNull(kind);
            checkNotNull(text);
            leadingTrivia = ImmutableList.copyOf(leadingTrivia);
            trailingTrivia = ImmutableList.copyOf(trailingTrivia);
        }

        @Override
        public Token firstToken() {
            return this;
        }

        @Override
        public Token lastToken() {
            return this;
        }

        @Override
        public void writeTo(StringBuilder sb) {
            leadingTrivia.forEach(piece -> sb.append(piece.text()));
            sb.append(text);
            trailingTrivia.forEach(piece -> sb.append(piece.text()));
        }

        public Token withLeadingTrivia(List<Trivia> trivia) {
            return new Token(kind, text, trivia, trailingTrivia);
        }

        public Token withTrailingTrivia(List<Trivia> trivia) {
            return new Token(kind, text, leadingTrivia, trivia);
        }

        public boolean is(TokenKind expectedKind, String expectedText) {
            return kind == expectedKind && text.equals(expectedText);
        }

        @Override
        public String toString() {
            return kind + "(" + text + ")";
        }
    }

    /**
     * Interior node: a syntax kind with an ordered list of children.
     * Optional parts of the grammar are simply absent from the children.
     */
    record Node(
    SyntaxKind kind,
    List<SyntaxNode> children) implements SyntaxNode {
        public Node {
            checkNotNull(kind);
            children = ImmutableList.copyOf(children);
        }

        @Override
        public @Nullable Token firstToken() {
            for (var child : children) {
                var token = child.firstToken();
                if (token != null) {
                    return token;
                }
            }
            return null;
        }

        @Override
        public @Nullable Token lastToken() {
            for (var child : Lists.reverse(children)) {
                var token = child.lastToken();
                if (token != null) {
                    return token;
                }
            }
            return null;
        }

        @Override
        public void writeTo(StringBuilder sb) {
            children.forEach(child -> child.writeTo(sb));
        }

        public boolean is(SyntaxKind expectedKind) {
            return kind == expectedKind;
        }

        /**
         * Index of the first child node of the given kind, or -1.
         */
        public int indexOf(SyntaxKind childKind) {
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) instanceof Node node && node.kind() == childKind) {
                    return i;
                }
            }
            return -1;
        }

        public @Nullable Node child(SyntaxKind childKind) {
            var index = indexOf(childKind);
            return index < 0 ? null : (Node) children.get(index);
        }

        public ImmutableList<Node> childNodes() {
            var builder = ImmutableList.<Node>builder();
            for (var child : children) {
                if (child instanceof Node node) {
                    builder.add(node);
                }
            }
            return builder.build();
        }

        public Node withChildren(List<? extends SyntaxNode> newChildren) {
            return new Node(kind, ImmutableList.copyOf(newChildren));
        }

        public Node withChild(int index, SyntaxNode child) {
            checkElementIndex(index, children.size());
            checkNotNull(child);
            if (children.get(index) == child) {
                return this;
            }
            var builder = ImmutableList.<SyntaxNode>builderWithExpectedSize(children.size());
            for (int i = 0; i < children.size(); i++) {
                builder.add(i == index ? child : children.get(i));
            }
            return new Node(kind, builder.build());
        }

        public Node withChildInserted(int index, SyntaxNode child) {
            checkPositionIndex(index, children.size());
            checkNotNull(child);
            var builder = ImmutableList.<SyntaxNode>builderWithExpectedSize(children.size() + 1);
            builder.addAll(children.subList(0, index));
            builder.add(child);
            builder.addAll(children.subList(index, children.size()));
            return new Node(kind, builder.build());
        }

        public Node withoutChild(int index) {
            checkElementIndex(index, children.size());
            var builder = ImmutableList.<SyntaxNode>builderWithExpectedSize(children.size() - 1);
            builder.addAll(children.subList(0, index));
            builder.addAll(children.subList(index + 1, children.size()));
            return new Node(kind, builder.build());
        }

        @Override
        public String toString() {
            return kind + "[" + toSource() + "]";
        }
    }
}
