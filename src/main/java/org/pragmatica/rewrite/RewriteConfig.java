package org.pragmatica.rewrite;

import org.pragmatica.rewrite.error.Diagnostic;
import org.pragmatica.rewrite.rule.RewriteRule;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Rewriter configuration: per-rule severities and disabled rules.
 */
public record RewriteConfig(
    Map<String, Diagnostic.Severity> ruleSeverities,
    Set<String> disabledRules
) {
    public static final RewriteConfig DEFAULT = new RewriteConfig(Map.of(), Set.of());

    public RewriteConfig {
        ruleSeverities = Map.copyOf(ruleSeverities);
        disabledRules = Set.copyOf(disabledRules);
    }

    public static RewriteConfig defaultConfig() {
        return DEFAULT;
    }

    public boolean isRuleEnabled(String ruleId) {
        return !disabledRules.contains(ruleId);
    }

    /**
     * Configured severity for the rule, or the rule's own default.
     */
    public Diagnostic.Severity severityFor(RewriteRule rule) {
        return ruleSeverities.getOrDefault(rule.ruleId(), rule.defaultSeverity());
    }

    /**
     * Builder-style method to set rule severity.
     */
    public RewriteConfig withRuleSeverity(String ruleId, Diagnostic.Severity severity) {
        var newSeverities = new HashMap<>(ruleSeverities);
        newSeverities.put(ruleId, severity);
        return new RewriteConfig(newSeverities, disabledRules);
    }

    /**
     * Builder-style method to disable a rule.
     */
    public RewriteConfig withDisabledRule(String ruleId) {
        var newDisabled = new HashSet<>(disabledRules);
        newDisabled.add(ruleId);
        return new RewriteConfig(ruleSeverities, newDisabled);
    }
}
