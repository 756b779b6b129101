package org.pragmatica.rewrite;

import org.junit.jupiter.api.Test;
import org.pragmatica.rewrite.error.Diagnostic;
import org.pragmatica.rewrite.rule.OneBindingPerDeclarationRule;
import org.pragmatica.rewrite.tree.SyntaxKind;
import org.pragmatica.rewrite.tree.SyntaxNode;
import org.pragmatica.rewrite.tree.VariableDecl;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.rewrite.Trees.binding;
import static org.pragmatica.rewrite.Trees.bindingWithClosure;
import static org.pragmatica.rewrite.Trees.call;
import static org.pragmatica.rewrite.Trees.callWithClosure;
import static org.pragmatica.rewrite.Trees.declaration;
import static org.pragmatica.rewrite.Trees.ifStatement;
import static org.pragmatica.rewrite.Trees.sourceFile;
import static org.pragmatica.rewrite.Trees.tupleBinding;

class RewriterTest {
    private static final String RULE_ID = OneBindingPerDeclarationRule.RULE_ID;

    private final Rewriter rewriter = Rewriter.rewriter(OneBindingPerDeclarationRule.oneBindingPerDeclarationRule());

    @Test
    void format_appliesRewriteAndReportsDiagnostic() {
        var root = sourceFile(declaration("var", binding("a"), binding("b", "Int")));

        var result = rewriter.format(root);

        assertThat(result.changed()).isTrue();
        assertThat(result.tree()
                         .toSource()).isEqualTo("var a: Int\nvar b: Int");
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.count(Diagnostic.Severity.WARNING)).isEqualTo(1);
    }

    @Test
    void lint_reportsButReturnsOriginalTree() {
        var root = sourceFile(declaration("var", binding("a"), binding("b", "Int")));

        var result = rewriter.lint(root);

        assertThat(result.tree()).isSameAs(root);
        assertThat(result.changed()).isTrue();
        assertThat(result.hasDiagnostics()).isTrue();
    }

    @Test
    void lintAndFormat_reportTheSameDiagnostics() {
        var root = sourceFile(declaration("var", binding("a"), binding("b")),
                              callWithClosure("run", declaration("let", binding("x"), binding("y"))));

        var lint = rewriter.lint(root);
        var format = rewriter.format(root);

        assertThat(lint.diagnostics()).isEqualTo(format.diagnostics());
        assertThat(lint.diagnostics()).hasSize(2);
    }

    @Test
    void formattingTwice_isIdempotent() {
        var root = sourceFile(declaration("var", binding("a"), binding("b"), binding("c", "Int")),
                              callWithClosure("run", declaration("let", binding("x"), binding("y"))));

        var once = rewriter.format(root);
        var twice = rewriter.format(once.tree());

        assertThat(twice.changed()).isFalse();
        assertThat(twice.tree()).isSameAs(once.tree());
        assertThat(twice.diagnostics()).isEmpty();
    }

    @Test
    void nothingToSplit_returnsSameTreeWithoutDiagnostics() {
        var root = sourceFile(call("setup"),
                              declaration("let", tupleBinding("x", "y", "pair")),
                              declaration("var", binding("z", "Int")));

        var result = rewriter.format(root);

        assertThat(result.tree()).isSameAs(root);
        assertThat(result.changed()).isFalse();
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void nestedSplit_keepsOuterDiagnosticAnchoredInInputTree() {
        var root = sourceFile(call("setup"),
                              declaration("var",
                                          bindingWithClosure("f", declaration("var", binding("x"), binding("y", "Int"))),
                                          binding("g", "Action")));
        var outer = ((SyntaxNode.Node) root.children()
                                           .get(0)).children()
                                                   .get(1);
        var inner = VariableDecl.variableDecl(outer)
                                .bindings()
                                .get(0)
                                .initializer()
                                .child(SyntaxKind.CLOSURE_EXPR)
                                .child(SyntaxKind.CODE_BLOCK_ITEM_LIST)
                                .children()
                                .get(0);
        assertThat(root.toSource()).isEqualTo("setup()\nvar f = {\n  var x, y: Int\n}, g: Action");

        var result = rewriter.lint(root);

        assertThat(result.diagnostics()).hasSize(2);
        assertThat(result.diagnostics()
                         .get(0)
                         .anchor()).isSameAs(inner);
        assertThat(result.diagnostics()
                         .get(1)
                         .anchor()).isSameAs(outer);
        assertThat(rewriter.format(root)
                           .tree()
                           .toSource()).isEqualTo("setup()\nvar f: Action = {\n  var x: Int\n  var y: Int\n}\nvar g: Action");
    }

    @Test
    void splitInsideBlock_keepsBlockIndentation() {
        var root = sourceFile(ifStatement("ready", declaration("var", binding("a"), binding("b", "Int"))));

        var result = rewriter.format(root);

        assertThat(result.tree()
                         .toSource()).isEqualTo("if ready {\n  var a: Int\n  var b: Int\n}");
    }

    @Test
    void disabledRule_doesNotRun() {
        var config = RewriteConfig.defaultConfig()
                                  .withDisabledRule(RULE_ID);
        var disabled = Rewriter.rewriter(OneBindingPerDeclarationRule.oneBindingPerDeclarationRule(), config);
        var root = sourceFile(declaration("var", binding("a"), binding("b")));

        var result = disabled.format(root);

        assertThat(result.tree()).isSameAs(root);
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void configuredSeverity_isApplied() {
        var config = RewriteConfig.defaultConfig()
                                  .withRuleSeverity(RULE_ID, Diagnostic.Severity.ERROR);
        var strict = Rewriter.rewriter(OneBindingPerDeclarationRule.oneBindingPerDeclarationRule(), config);

        var result = strict.lint(sourceFile(declaration("var", binding("a"), binding("b"))));

        assertThat(result.count(Diagnostic.Severity.ERROR)).isEqualTo(1);
        assertThat(result.count(Diagnostic.Severity.WARNING)).isZero();
    }

    @Test
    void concurrentRuns_doNotShareDiagnostics() throws InterruptedException, ExecutionException {
        var executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<RewriteResult>> tasks = IntStream.range(0, 16)
                                                           .mapToObj(i -> (Callable<RewriteResult>) () -> rewriter.format(sampleTree(i)))
                                                           .toList();
            for (Future<RewriteResult> future : executor.invokeAll(tasks)) {
                var result = future.get();
                assertThat(result.diagnostics()).hasSize(1);
                assertThat(result.tree()
                                 .toSource()).contains("\nvar b");
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static SyntaxNode sampleTree(int index) {
        return sourceFile(call("task" + index), declaration("var", binding("a"), binding("b", "Int")));
    }
}
