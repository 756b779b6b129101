package org.pragmatica.rewrite.tree;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Factory for tokens and nodes laid out the way the parser produces them.
 *
 * <p>Layouts:
 * <pre>
 * SOURCE_FILE          := CODE_BLOCK_ITEM_LIST eof
 * CODE_BLOCK           := '{' CODE_BLOCK_ITEM_LIST '}'
 * CLOSURE_EXPR         := '{' CODE_BLOCK_ITEM_LIST '}'
 * VARIABLE_DECL        := modifier* ('var' | 'let') PATTERN_BINDING_LIST
 * PATTERN_BINDING      := pattern TYPE_ANNOTATION? INITIALIZER_CLAUSE? ','?
 * TYPE_ANNOTATION      := ':' type
 * INITIALIZER_CLAUSE   := '=' expression
 * </pre>
 */
public final class SyntaxFactory {
    private SyntaxFactory() {}

    public static SyntaxNode.Token token(TokenKind kind, String text) {
        return new SyntaxNode.Token(kind, text, List.of(), List.of());
    }

    public static SyntaxNode.Token keyword(String text) {
        return token(TokenKind.KEYWORD, text);
    }

    public static SyntaxNode.Token identifier(String text) {
        return token(TokenKind.IDENTIFIER, text);
    }

    public static SyntaxNode.Token punctuation(String text) {
        return token(TokenKind.PUNCTUATION, text);
    }

    public static SyntaxNode.Token comma() {
        return punctuation(",");
    }

    public static SyntaxNode.Token integerLiteral(String text) {
        return token(TokenKind.INTEGER_LITERAL, text);
    }

    public static SyntaxNode.Token endOfFile() {
        return token(TokenKind.END_OF_FILE, "");
    }

    public static SyntaxNode.Node node(SyntaxKind kind, List<? extends SyntaxNode> children) {
        return new SyntaxNode.Node(kind, ImmutableList.copyOf(children));
    }

    public static SyntaxNode.Node node(SyntaxKind kind, SyntaxNode... children) {
        return new SyntaxNode.Node(kind, ImmutableList.copyOf(children));
    }

    public static SyntaxNode.Node sourceFile(List<? extends SyntaxNode> statements, SyntaxNode.Token endOfFile) {
        return node(SyntaxKind.SOURCE_FILE, statementList(statements), endOfFile);
    }

    public static SyntaxNode.Node codeBlock(SyntaxNode.Token leftBrace,
                                           List<? extends SyntaxNode> statements,
                                           SyntaxNode.Token rightBrace) {
        return node(SyntaxKind.CODE_BLOCK, leftBrace, statementList(statements), rightBrace);
    }

    public static SyntaxNode.Node closure(SyntaxNode.Token leftBrace,
                                         List<? extends SyntaxNode> statements,
                                         SyntaxNode.Token rightBrace) {
        return node(SyntaxKind.CLOSURE_EXPR, leftBrace, statementList(statements), rightBrace);
    }

    public static SyntaxNode.Node statementList(List<? extends SyntaxNode> statements) {
        return node(SyntaxKind.CODE_BLOCK_ITEM_LIST, statements);
    }

    public static SyntaxNode.Node variableDecl(List<SyntaxNode.Token> modifiers,
                                              SyntaxNode.Token introducer,
                                              List<SyntaxNode.Node> bindings) {
        checkArgument(!bindings.isEmpty(), "Variable declaration requires at least one binding");
        var children = ImmutableList.<SyntaxNode>builder()
                                    .addAll(modifiers)
                                    .add(introducer)
                                    .add(patternBindingList(bindings))
                                    .build();
        return node(SyntaxKind.VARIABLE_DECL, children);
    }

    public static SyntaxNode.Node variableDecl(SyntaxNode.Token introducer, List<SyntaxNode.Node> bindings) {
        return variableDecl(List.of(), introducer, bindings);
    }

    public static SyntaxNode.Node patternBindingList(List<SyntaxNode.Node> bindings) {
        for (var binding : bindings) {
            checkArgument(binding.is(SyntaxKind.PATTERN_BINDING), "Not a binding: %s", binding.kind());
        }
        return node(SyntaxKind.PATTERN_BINDING_LIST, bindings);
    }

    public static SyntaxNode.Node patternBinding(SyntaxNode.Node pattern,
                                                SyntaxNode.@Nullable Node typeAnnotation,
                                                SyntaxNode.@Nullable Node initializer,
                                                SyntaxNode.@Nullable Token trailingComma) {
        var children = ImmutableList.<SyntaxNode>builder()
                                    .add(pattern);
        if (typeAnnotation != null) {
            children.add(typeAnnotation);
        }
        if (initializer != null) {
            children.add(initializer);
        }
        if (trailingComma != null) {
            children.add(trailingComma);
        }
        return node(SyntaxKind.PATTERN_BINDING, children.build());
    }

    public static SyntaxNode.Node identifierPattern(SyntaxNode.Token name) {
        return node(SyntaxKind.IDENTIFIER_PATTERN, name);
    }

    public static SyntaxNode.Node wildcardPattern(SyntaxNode.Token underscore) {
        return node(SyntaxKind.WILDCARD_PATTERN, underscore);
    }

    /**
     * Tuple pattern; {@code elements} holds the element patterns interleaved with their comma tokens.
     */
    public static SyntaxNode.Node tuplePattern(SyntaxNode.Token leftParen,
                                              List<? extends SyntaxNode> elements,
                                              SyntaxNode.Token rightParen) {
        var children = ImmutableList.<SyntaxNode>builder()
                                    .add(leftParen)
                                    .addAll(elements)
                                    .add(rightParen)
                                    .build();
        return node(SyntaxKind.TUPLE_PATTERN, children);
    }

    public static SyntaxNode.Node typeAnnotation(SyntaxNode.Token colon, SyntaxNode.Node type) {
        return node(SyntaxKind.TYPE_ANNOTATION, colon, type);
    }

    public static SyntaxNode.Node simpleType(SyntaxNode.Token name) {
        return node(SyntaxKind.SIMPLE_TYPE, name);
    }

    public static SyntaxNode.Node initializer(SyntaxNode.Token equals, SyntaxNode.Node value) {
        return node(SyntaxKind.INITIALIZER_CLAUSE, equals, value);
    }

    public static SyntaxNode.Node identifierExpr(SyntaxNode.Token name) {
        return node(SyntaxKind.IDENTIFIER_EXPR, name);
    }

    public static SyntaxNode.Node literalExpr(SyntaxNode.Token literal) {
        return node(SyntaxKind.LITERAL_EXPR, literal);
    }

    public static SyntaxNode.Node callExpr(SyntaxNode.Node callee,
                                          SyntaxNode.Token leftParen,
                                          List<? extends SyntaxNode> arguments,
                                          SyntaxNode.Token rightParen) {
        var children = ImmutableList.<SyntaxNode>builder()
                                    .add(callee)
                                    .add(leftParen)
                                    .addAll(arguments)
                                    .add(rightParen)
                                    .build();
        return node(SyntaxKind.CALL_EXPR, children);
    }

    public static SyntaxNode.Node expressionStmt(SyntaxNode.Node expression) {
        return node(SyntaxKind.EXPRESSION_STMT, expression);
    }
}
