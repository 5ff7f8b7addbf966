package ai.lintal.engine;

import ai.lintal.cst.CstNode;
import ai.lintal.rules.CheckContext;
import ai.lintal.rules.Rule;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Walks a tree once in pre-order and offers every node to each rule interested in its kind. The combined output is
 * ordered by start byte, then by rule registration order; diagnostics of one rule at the same start keep the order the
 * rule emitted them in.
 *
 * <p>A rule that throws on some node, or runs out of stack on a very deep one, is logged and skipped for that node
 * only, so one faulty rule cannot hide the diagnostics of the others.
 */
public final class TreeDispatcher {
    private static final Logger logger = LogManager.getLogger(TreeDispatcher.class);

    private static final Comparator<RuleDiagnostic> ORDER = Comparator.<RuleDiagnostic>comparingInt(
                    d -> d.diagnostic().range().start())
            .thenComparingInt(RuleDiagnostic::ruleIndex);

    private final List<Rule> rules;
    private final List<@Nullable Set<String>> filters;

    public TreeDispatcher(RuleSet ruleSet) {
        this.rules = ruleSet.rules();
        this.filters = new ArrayList<>(rules.size());
        for (var rule : rules) {
            filters.add(rule.relevantKinds().orElse(null));
        }
    }

    public List<RuleDiagnostic> dispatch(CheckContext ctx, CstNode root) {
        var results = new ArrayList<RuleDiagnostic>();
        if (rules.isEmpty()) {
            return results;
        }
        var stack = new ArrayDeque<CstNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            var kind = node.kind();
            for (int i = 0; i < rules.size(); i++) {
                var filter = filters.get(i);
                if (filter != null && !filter.contains(kind)) {
                    continue;
                }
                var rule = rules.get(i);
                try {
                    for (var diagnostic : rule.check(ctx, node)) {
                        results.add(new RuleDiagnostic(rule.name(), i, diagnostic));
                    }
                } catch (RuntimeException | StackOverflowError e) {
                    logger.error(
                            "Rule {} failed on {} at byte {} of {}",
                            rule.name(),
                            kind,
                            node.startByte(),
                            ctx.fileName(),
                            e);
                }
            }
            var children = node.children();
            for (int c = children.size() - 1; c >= 0; c--) {
                stack.push(children.get(c));
            }
        }
        results.sort(ORDER);
        return results;
    }
}
