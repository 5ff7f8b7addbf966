package ai.lintal.rules;

/** Builds a rule from its configuration properties. */
@FunctionalInterface
public interface RuleFactory {
    Rule create(RuleProperties properties);
}
