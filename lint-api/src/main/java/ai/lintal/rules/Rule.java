package ai.lintal.rules;

import ai.lintal.cst.CstNode;
import ai.lintal.diagnostics.Diagnostic;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A single check. The dispatcher calls {@link #check} once for every visited node whose kind passes
 * {@link #relevantKinds()}. Rules must not mutate the tree and must keep no state between calls that could affect
 * the output of another file; a rule instance is shared by every worker analyzing files in parallel.
 *
 * <p>Each implementation also exposes a {@code MODULE_NAME} constant and a static {@code fromConfig(RuleProperties)}
 * factory, registered in the rule catalog as a {@link RuleFactory}.
 */
public interface Rule {

    /** Stable name used in reports, e.g. {@code FinalLocalVariable}. */
    String name();

    /** Node kinds this rule wants to see; an empty optional means every node. */
    default Optional<Set<String>> relevantKinds() {
        return Optional.empty();
    }

    List<Diagnostic> check(CheckContext ctx, CstNode node);
}
