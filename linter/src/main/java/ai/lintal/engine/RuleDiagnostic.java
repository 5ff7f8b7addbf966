package ai.lintal.engine;

import ai.lintal.diagnostics.Diagnostic;

/** A diagnostic tagged with the rule that produced it and that rule's registration index. */
public record RuleDiagnostic(String ruleName, int ruleIndex, Diagnostic diagnostic) {}
