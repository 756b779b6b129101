package org.pragmatica.rewrite.tree;

/**
 * Kind of an interior syntax node.
 */
public enum SyntaxKind {
    SOURCE_FILE(true),
    CODE_BLOCK(true),
    CLOSURE_EXPR(true),
    CODE_BLOCK_ITEM_LIST(false),
    VARIABLE_DECL(false),
    PATTERN_BINDING_LIST(false),
    PATTERN_BINDING(false),
    IDENTIFIER_PATTERN(false),
    TUPLE_PATTERN(false),
    WILDCARD_PATTERN(false),
    TYPE_ANNOTATION(false),
    SIMPLE_TYPE(false),
    INITIALIZER_CLAUSE(false),
    EXPRESSION_STMT(false),
    IDENTIFIER_EXPR(false),
    LITERAL_EXPR(false),
    CALL_EXPR(false),
    IF_STMT(false),
    UNKNOWN(false);

    private final boolean statementContainer;

    SyntaxKind(boolean statementContainer) {
        this.statementContainer = statementContainer;
    }

    /**
     * Whether nodes of this kind own a {@link #CODE_BLOCK_ITEM_LIST} child, i.e. are rewrite sites.
     */
    public boolean isStatementContainer() {
        return statementContainer;
    }
}
