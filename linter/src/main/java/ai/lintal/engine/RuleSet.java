package ai.lintal.engine;

import ai.lintal.rules.Rule;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;

/** Ordered, immutable collection of configured rules. Registration order breaks ties between diagnostics. */
public final class RuleSet implements Iterable<Rule> {
    private final ImmutableList<Rule> rules;

    private RuleSet(ImmutableList<Rule> rules) {
        this.rules = rules;
    }

    public static RuleSet of(Rule... rules) {
        return new RuleSet(ImmutableList.copyOf(rules));
    }

    public static RuleSet of(List<? extends Rule> rules) {
        return new RuleSet(ImmutableList.copyOf(rules));
    }

    public ImmutableList<Rule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public Iterator<Rule> iterator() {
        return rules.iterator();
    }
}
