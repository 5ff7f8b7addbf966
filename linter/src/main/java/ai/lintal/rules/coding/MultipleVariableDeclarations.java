package ai.lintal.rules.coding;

import static ai.lintal.treesitter.JavaNodeTypes.*;

import ai.lintal.cst.CstNode;
import ai.lintal.diagnostics.Diagnostic;
import ai.lintal.diagnostics.Edit;
import ai.lintal.diagnostics.Fix;
import ai.lintal.diagnostics.FixAvailability;
import ai.lintal.diagnostics.Violation;
import ai.lintal.rules.CheckContext;
import ai.lintal.rules.Rule;
import ai.lintal.rules.RuleProperties;
import ai.lintal.treesitter.CstTraversalUtils;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks that each variable declaration is in its own statement and on its own line. Declarations in a {@code for}
 * initializer are exempt. At most one violation is reported per declaration statement.
 */
public final class MultipleVariableDeclarations implements Rule {
    public static final String MODULE_NAME = "MultipleVariableDeclarations";

    private static final Set<String> DECLARATION_KINDS = Set.of(LOCAL_VARIABLE_DECLARATION, FIELD_DECLARATION);

    public static MultipleVariableDeclarations fromConfig(RuleProperties properties) {
        return new MultipleVariableDeclarations();
    }

    @Override
    public String name() {
        return MODULE_NAME;
    }

    @Override
    public Optional<Set<String>> relevantKinds() {
        return Optional.of(DECLARATION_KINDS);
    }

    @Override
    public List<Diagnostic> check(CheckContext ctx, CstNode node) {
        if (node.parent().map(p -> p.is(FOR_STATEMENT)).orElse(false)) {
            return List.of();
        }
        var declarators = node.childrenOfKind(VARIABLE_DECLARATOR);
        if (declarators.size() > 1) {
            var diagnostic = new Diagnostic(new MultipleInStatement(), node.range());
            return List.of(splitFix(ctx, node, declarators)
                    .map(diagnostic::withFix)
                    .orElse(diagnostic));
        }
        var next = CstTraversalUtils.nextSibling(node);
        if (next.isPresent() && DECLARATION_KINDS.contains(next.get().kind())
                && ctx.startLine(next.get()) == ctx.endLine(node)) {
            var indentation = ctx.source().indentation(ctx.startLine(node));
            var edit = LineBreaks.breakBefore(ctx.source(), node.endByte(), next.get().startByte(), indentation);
            return List.of(new Diagnostic(new MultipleOnLine(), node.range(), Fix.of(edit)));
        }
        return List.of();
    }

    /**
     * Rewrites {@code int a = 1, b[];} as {@code int a = 1;} and {@code int b[];}, each on its own line with the
     * indentation of the original statement.
     */
    private static Optional<Fix> splitFix(CheckContext ctx, CstNode declaration, List<CstNode> declarators) {
        var source = ctx.source();
        var prefix = source.slice(declaration.startByte(), declarators.get(0).startByte()).stripTrailing();
        if (prefix.isEmpty()) {
            return Optional.empty();
        }
        var separator = LineBreaks.lineEnding(source) + source.indentation(ctx.startLine(declaration));
        var replacement = declarators.stream()
                .map(d -> prefix + " " + ctx.text(d) + ";")
                .collect(Collectors.joining(separator));
        return Optional.of(Fix.of(Edit.replacement(declaration.range(), replacement)));
    }

    public record MultipleInStatement() implements Violation {
        @Override
        public String message() {
            return "Each variable declaration must be in its own statement.";
        }

        @Override
        public FixAvailability fixAvailability() {
            return FixAvailability.ALWAYS;
        }
    }

    public record MultipleOnLine() implements Violation {
        @Override
        public String message() {
            return "Only one variable definition per line allowed.";
        }

        @Override
        public FixAvailability fixAvailability() {
            return FixAvailability.ALWAYS;
        }
    }
}
