package org.pragmatica.rewrite.rule;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.pragmatica.rewrite.error.Diagnostic;
import org.pragmatica.rewrite.error.DiagnosticMessage;
import org.pragmatica.rewrite.tree.PatternBinding;
import org.pragmatica.rewrite.tree.SyntaxNode;
import org.pragmatica.rewrite.tree.Trivia;
import org.pragmatica.rewrite.tree.TriviaEditor;
import org.pragmatica.rewrite.tree.VariableDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Each variable declaration, except tuple destructuring, declares exactly one variable.
 *
 * <p>Lint: a declaration with several bindings is reported.
 *
 * <p>Format: such a declaration is split into one declaration per binding, each on its own line. A type annotation
 * written once after the last binding applies to all of them and is copied to every binding that has none.
 * <pre>
 * var a, b: Int      =&gt;   var a: Int
 *                          var b: Int
 * </pre>
 */
public final class OneBindingPerDeclarationRule implements RewriteRule {
    public static final String RULE_ID = "one-binding-per-declaration";

    private static final Logger log = LoggerFactory.getLogger(OneBindingPerDeclarationRule.class);

    private OneBindingPerDeclarationRule() {}

    public static OneBindingPerDeclarationRule oneBindingPerDeclarationRule() {
        return new OneBindingPerDeclarationRule();
    }

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public Diagnostic.Severity defaultSeverity() {
        return DiagnosticMessage.SPLIT_VARIABLE_BINDING.defaultSeverity();
    }

    @Override
    public SyntaxNode.@Nullable Node rewriteStatements(SyntaxNode.Node original,
                                                       SyntaxNode.Node statements,
                                                       RuleContext context) {
        if (!hasCompoundDeclaration(statements)) {
            return null;
        }
        checkArgument(original.children()
                              .size() == statements.children()
                                                   .size(),
                      "Statement sequences differ in length");
        var children = statements.children();
        var items = ImmutableList.<SyntaxNode>builder();
        for (int i = 0; i < children.size(); i++) {
            var item = children.get(i);
            var declaration = VariableDecl.variableDecl(item);
            if (declaration == null || declaration.bindingCount() < 2) {
                items.add(item);
                continue;
            }
            context.diagnose(DiagnosticMessage.SPLIT_VARIABLE_BINDING,
                             original.children()
                                     .get(i));
            items.addAll(split(declaration));
        }
        return statements.withChildren(items.build());
    }

    private static boolean hasCompoundDeclaration(SyntaxNode.Node statements) {
        for (var item : statements.children()) {
            var declaration = VariableDecl.variableDecl(item);
            if (declaration != null && declaration.bindingCount() > 1) {
                return true;
            }
        }
        return false;
    }

    private static List<SyntaxNode.Node> split(VariableDecl declaration) {
        var bindings = declaration.bindings();
        var inherited = inheritedTypeAnnotation(bindings);
        var indentation = TriviaEditor.indentation(declaration.node()
                                                              .leadingTrivia());
        var result = ImmutableList.<SyntaxNode.Node>builderWithExpectedSize(bindings.size());

        log.trace("Splitting declaration with {} bindings", bindings.size());

        for (int i = 0; i < bindings.size(); i++) {
            var original = bindings.get(i);
            var binding = standalone(original, inherited);

            if (i == 0) {
                // Keeps the declaration's own leading trivia.
                result.add(declaration.withBindings(List.of(binding))
                                      .node());
                continue;
            }
            var detached = new PatternBinding(TriviaEditor.withLeadingTrivia(binding.node(), List.of()));
            var single = declaration.withBindings(List.of(detached))
                                    .node();
            result.add(TriviaEditor.withLeadingTrivia(single, leadingTriviaOfLaterDeclaration(original, indentation)));
        }
        return result.build();
    }

    /**
     * A fresh line carrying whatever indentation or comments preceded the binding. A binding written right after
     * its comma has none, so the new declaration lines up with the original statement instead.
     */
    private static List<Trivia> leadingTriviaOfLaterDeclaration(PatternBinding binding, List<Trivia> indentation) {
        var own = TriviaEditor.withoutNewlines(binding.node()
                                                      .leadingTrivia());
        return TriviaEditor.onFreshLine(own.isEmpty() ? indentation : own);
    }

    /**
     * The annotation written once for the whole declaration. Only the last binding can carry it, but any
     * annotated binding is accepted and the last one wins.
     */
    private static SyntaxNode.@Nullable Node inheritedTypeAnnotation(List<PatternBinding> bindings) {
        SyntaxNode.Node annotation = null;
        for (var binding : bindings) {
            var candidate = binding.typeAnnotation();
            if (candidate != null) {
                annotation = candidate;
            }
        }
        return annotation;
    }

    private static PatternBinding standalone(PatternBinding binding, SyntaxNode.@Nullable Node inherited) {
        var comma = binding.trailingComma();
        var result = binding.withoutTrailingComma();

        if (inherited != null && binding.typeAnnotation() == null) {
            result = withInheritedAnnotation(result, inherited);
        }
        if (comma != null && TriviaEditor.containsComment(comma.trailingTrivia())) {
            var trailing = TriviaEditor.concat(result.node()
                                                     .trailingTrivia(),
                                               comma.trailingTrivia());
            result = new PatternBinding(TriviaEditor.withTrailingTrivia(result.node(), TriviaEditor.trimEnd(trailing)));
        }
        return result;
    }

    /**
     * Place the annotation right after the pattern. Whatever followed the pattern (usually the space before
     * {@code =}) now follows the annotation.
     */
    private static PatternBinding withInheritedAnnotation(PatternBinding binding, SyntaxNode.Node inherited) {
        var pattern = binding.pattern();
        var spacing = pattern.trailingTrivia();
        var annotation = TriviaEditor.withTrailingTrivia(TriviaEditor.withLeadingTrivia(inherited, List.of()), spacing);
        return binding.withPattern(TriviaEditor.withTrailingTrivia(pattern, List.of()))
                      .withTypeAnnotation(annotation);
    }
}
