package ai.lintal.engine;

import ai.lintal.rules.Rule;
import ai.lintal.rules.RuleFactory;
import ai.lintal.rules.RuleProperties;
import ai.lintal.rules.coding.MultipleVariableDeclarations;
import ai.lintal.rules.coding.OneStatementPerLine;
import ai.lintal.rules.imports.UnusedImports;
import ai.lintal.rules.modifier.FinalLocalVariable;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Maps module names to rule factories and builds rule sets from configuration. */
public final class RuleCatalog {
    private static final Logger logger = LogManager.getLogger(RuleCatalog.class);

    /** One configured module: its name and its raw properties. */
    public record RuleConfig(String moduleName, Map<String, String> properties) {
        public RuleConfig(String moduleName) {
            this(moduleName, Map.of());
        }
    }

    private static final ImmutableMap<String, RuleFactory> BUILT_IN = ImmutableMap.<String, RuleFactory>builder()
            .put(FinalLocalVariable.MODULE_NAME, FinalLocalVariable::fromConfig)
            .put(MultipleVariableDeclarations.MODULE_NAME, MultipleVariableDeclarations::fromConfig)
            .put(OneStatementPerLine.MODULE_NAME, OneStatementPerLine::fromConfig)
            .put(UnusedImports.MODULE_NAME, UnusedImports::fromConfig)
            .build();

    private RuleCatalog() {}

    public static Set<String> moduleNames() {
        return BUILT_IN.keySet();
    }

    public static Optional<Rule> create(String moduleName, Map<String, String> properties) {
        var factory = BUILT_IN.get(moduleName);
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.create(RuleProperties.of(moduleName, properties)));
    }

    /** Builds a rule set in configuration order; unknown modules are logged and skipped. */
    public static RuleSet fromConfig(List<RuleConfig> configs) {
        var rules = new ArrayList<Rule>();
        for (var config : configs) {
            var rule = create(config.moduleName(), config.properties());
            if (rule.isEmpty()) {
                logger.warn("Unknown rule module '{}', skipping", config.moduleName());
                continue;
            }
            rules.add(rule.get());
        }
        return RuleSet.of(rules);
    }

    /** Every built-in rule with default properties. */
    public static RuleSet defaultRuleSet() {
        return fromConfig(BUILT_IN.keySet().stream().map(RuleConfig::new).toList());
    }
}
