package ai.lintal.rules.modifier;

import static ai.lintal.treesitter.JavaNodeTypes.*;

import ai.lintal.cst.CstNode;
import ai.lintal.diagnostics.Diagnostic;
import ai.lintal.diagnostics.FixAvailability;
import ai.lintal.diagnostics.Violation;
import ai.lintal.rules.CheckContext;
import ai.lintal.rules.Rule;
import ai.lintal.rules.RuleProperties;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reports local variables that are given a value at most once on every path and could therefore be declared
 * {@code final}.
 *
 * <p>Each executable body (method, constructor, initializer, or a lambda outside any of those) is analyzed once as a
 * whole; lambdas and class bodies nested inside it are handled by that same analysis.
 *
 * <p>Properties:
 *
 * <ul>
 *   <li>{@code validateEnhancedForLoopVariable} (default {@code false}): also check enhanced-for loop variables.
 *   <li>{@code validateUnnamedVariables} (default {@code false}): also check unnamed {@code _} variables.
 * </ul>
 */
public final class FinalLocalVariable implements Rule {
    public static final String MODULE_NAME = "FinalLocalVariable";

    private static final Set<String> ENTRY_KINDS = Set.of(
            METHOD_DECLARATION,
            CONSTRUCTOR_DECLARATION,
            COMPACT_CONSTRUCTOR_DECLARATION,
            STATIC_INITIALIZER,
            BLOCK,
            LAMBDA_EXPRESSION);

    private static final Set<String> EXECUTABLE_KINDS = Set.of(
            METHOD_DECLARATION,
            CONSTRUCTOR_DECLARATION,
            COMPACT_CONSTRUCTOR_DECLARATION,
            STATIC_INITIALIZER,
            LAMBDA_EXPRESSION);

    private final boolean validateEnhancedForLoopVariable;
    private final boolean validateUnnamedVariables;

    public FinalLocalVariable(boolean validateEnhancedForLoopVariable, boolean validateUnnamedVariables) {
        this.validateEnhancedForLoopVariable = validateEnhancedForLoopVariable;
        this.validateUnnamedVariables = validateUnnamedVariables;
    }

    public FinalLocalVariable() {
        this(false, false);
    }

    public static FinalLocalVariable fromConfig(RuleProperties properties) {
        return new FinalLocalVariable(
                properties.getBoolean("validateEnhancedForLoopVariable", false),
                properties.getBoolean("validateUnnamedVariables", false));
    }

    @Override
    public String name() {
        return MODULE_NAME;
    }

    @Override
    public Optional<Set<String>> relevantKinds() {
        return Optional.of(ENTRY_KINDS);
    }

    @Override
    public List<Diagnostic> check(CheckContext ctx, CstNode node) {
        if (!isEntryPoint(node) || isInsideExecutableBody(node)) {
            return List.of();
        }
        return new FinalityAnalyzer(ctx, validateEnhancedForLoopVariable, validateUnnamedVariables).analyze(node);
    }

    private static boolean isEntryPoint(CstNode node) {
        if (node.is(BLOCK)) {
            return isInstanceInitializer(node);
        }
        return true;
    }

    private static boolean isInstanceInitializer(CstNode block) {
        return block.parent()
                .map(p -> p.is(CLASS_BODY) || p.is(ENUM_BODY_DECLARATIONS))
                .orElse(false);
    }

    private static boolean isInsideExecutableBody(CstNode node) {
        var current = node.parent();
        while (current.isPresent()) {
            var ancestor = current.get();
            if (EXECUTABLE_KINDS.contains(ancestor.kind()) || (ancestor.is(BLOCK) && isInstanceInitializer(ancestor))) {
                return true;
            }
            current = ancestor.parent();
        }
        return false;
    }

    /** The only violation of this rule. It carries no fix. */
    public record VariableShouldBeFinal(String variableName) implements Violation {
        @Override
        public String message() {
            return "Variable '" + variableName + "' should be declared final.";
        }

        @Override
        public FixAvailability fixAvailability() {
            return FixAvailability.NONE;
        }
    }
}
