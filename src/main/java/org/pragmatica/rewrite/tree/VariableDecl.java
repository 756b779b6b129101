package org.pragmatica.rewrite.tree;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Typed view over a {@link SyntaxKind#VARIABLE_DECL} node: one {@code var}/{@code let} statement with its bindings.
 */
public record VariableDecl(SyntaxNode.Node node) {
    public VariableDecl {
        checkArgument(node.is(SyntaxKind.VARIABLE_DECL), "Not a variable declaration: %s", node.kind());
    }

    /**
     * View the node as a variable declaration, or {@code null} if it is something else.
     */
    public static @Nullable VariableDecl variableDecl(SyntaxNode node) {
        return node instanceof SyntaxNode.Node candidate && candidate.is(SyntaxKind.VARIABLE_DECL)
               ? new VariableDecl(candidate)
               : null;
    }

    /**
     * The {@code var} or {@code let} keyword.
     */
    public SyntaxNode.Token introducer() {
        for (var child : node.children()) {
            if (child instanceof SyntaxNode.Token token && isIntroducer(token)) {
                return token;
            }
        }
        throw new IllegalStateException("Variable declaration without introducer: " + node);
    }

    /**
     * Modifier tokens preceding the introducer, e.g. {@code private} or {@code static}.
     */
    public ImmutableList<SyntaxNode.Token> modifiers() {
        var modifiers = ImmutableList.<SyntaxNode.Token>builder();
        for (var child : node.children()) {
            if (!(child instanceof SyntaxNode.Token token) || isIntroducer(token)) {
                break;
            }
            modifiers.add(token);
        }
        return modifiers.build();
    }

    /**
     * The binding list. A declaration always has at least one binding; anything else is a malformed tree.
     */
    public SyntaxNode.Node bindingList() {
        var list = node.child(SyntaxKind.PATTERN_BINDING_LIST);
        checkState(list != null, "Variable declaration without binding list: %s", node);
        checkState(!list.childNodes()
                        .isEmpty(), "Variable declaration without bindings: %s", node);
        return list;
    }

    public ImmutableList<PatternBinding> bindings() {
        return bindingList().childNodes()
                            .stream()
                            .map(PatternBinding::new)
                            .collect(ImmutableList.toImmutableList());
    }

    public int bindingCount() {
        return bindingList().childNodes()
                            .size();
    }

    /**
     * Same declaration (modifiers, introducer) with the binding list replaced.
     */
    public VariableDecl withBindings(List<PatternBinding> bindings) {
        checkArgument(!bindings.isEmpty(), "Variable declaration requires at least one binding");
        var nodes = bindings.stream()
                            .map(PatternBinding::node)
                            .collect(ImmutableList.toImmutableList());
        var index = node.indexOf(SyntaxKind.PATTERN_BINDING_LIST);
        return new VariableDecl(node.withChild(index, SyntaxFactory.patternBindingList(nodes)));
    }

    private static boolean isIntroducer(SyntaxNode.Token token) {
        return token.is(TokenKind.KEYWORD, "var") || token.is(TokenKind.KEYWORD, "let");
    }
}
