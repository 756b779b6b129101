package org.pragmatica.rewrite.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.rewrite.Trees.binding;
import static org.pragmatica.rewrite.Trees.callWithClosure;
import static org.pragmatica.rewrite.Trees.declaration;
import static org.pragmatica.rewrite.Trees.sourceFile;
import static org.pragmatica.rewrite.Trees.withLeading;

class SyntaxNodeTest {

    @Test
    void toSource_reproducesTokensAndTrivia() {
        var root = sourceFile(withLeading(declaration("var", binding("a"), binding("b", "Int")),
                                          Trivia.blockComment("/* header */"),
                                          Trivia.newlines(2)),
                              callWithClosure("run", declaration("let", binding("x"))));

        assertThat(root.toSource()).isEqualTo("/* header */\n\nvar a, b: Int\nrun({\n  let x\n})");
    }

    @Test
    void firstAndLastToken() {
        var decl = declaration("var", binding("a"), binding("b", "Int"));

        assertThat(decl.firstToken()).isNotNull();
        assertThat(decl.firstToken()
                       .text()).isEqualTo("var");
        assertThat(decl.lastToken()
                       .text()).isEqualTo("Int");
        assertThat(decl.leadingTrivia()).isEmpty();
        assertThat(decl.trailingTrivia()).isEmpty();
    }

    @Test
    void emptyNode_hasNoTokens() {
        var empty = SyntaxFactory.statementList(List.of());

        assertThat(empty.firstToken()).isNull();
        assertThat(empty.lastToken()).isNull();
        assertThat(empty.leadingTrivia()).isEmpty();
        assertThat(empty.toSource()).isEmpty();
    }

    @Test
    void withChild_sharesUntouchedChildren() {
        var decl = declaration("var", binding("a"), binding("b"));
        var introducer = decl.children()
                             .get(0);
        var list = (SyntaxNode.Node) decl.children()
                                         .get(1);
        var replacement = SyntaxFactory.patternBindingList(List.of(binding("c")));

        var updated = decl.withChild(1, replacement);

        assertThat(updated.children()
                          .get(0)).isSameAs(introducer);
        assertThat(updated.toSource()).isEqualTo("var c");
        assertThat(decl.children()
                       .get(1)).isSameAs(list);
    }

    @Test
    void withChild_sameChild_returnsReceiver() {
        var decl = declaration("var", binding("a"));

        assertThat(decl.withChild(0, decl.children()
                                         .get(0))).isSameAs(decl);
    }

    @Test
    void insertAndRemoveChildren() {
        var call = SyntaxFactory.node(SyntaxKind.UNKNOWN, SyntaxFactory.identifier("a"), SyntaxFactory.identifier("c"));

        var inserted = call.withChildInserted(1, SyntaxFactory.identifier("b"));
        var removed = inserted.withoutChild(0);

        assertThat(inserted.toSource()).isEqualTo("abc");
        assertThat(removed.toSource()).isEqualTo("bc");
        assertThat(call.toSource()).isEqualTo("ac");
    }

    @Test
    void childLookupByKind() {
        var binding = binding("a", "Int");

        assertThat(binding.indexOf(SyntaxKind.TYPE_ANNOTATION)).isEqualTo(1);
        assertThat(binding.indexOf(SyntaxKind.INITIALIZER_CLAUSE)).isEqualTo(-1);
        assertThat(binding.child(SyntaxKind.IDENTIFIER_PATTERN)).isNotNull();
        assertThat(binding.childNodes()).hasSize(2);
    }

    @Test
    void structurallyEqualTrees_areEqual() {
        assertThat(declaration("var", binding("a"), binding("b", "Int")))
            .isEqualTo(declaration("var", binding("a"), binding("b", "Int")));
        assertThat(declaration("var", binding("a"))).isNotEqualTo(declaration("let", binding("a")));
    }

    @Test
    void outOfRangeIndex_isRejected() {
        var decl = declaration("var", binding("a"));

        assertThatThrownBy(() -> decl.withChild(5, SyntaxFactory.identifier("x")))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
