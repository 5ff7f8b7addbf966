package ai.lintal.rules.coding;

import static ai.lintal.treesitter.JavaNodeTypes.*;

import ai.lintal.cst.CstNode;
import ai.lintal.diagnostics.Diagnostic;
import ai.lintal.diagnostics.Fix;
import ai.lintal.diagnostics.FixAvailability;
import ai.lintal.diagnostics.Violation;
import ai.lintal.rules.CheckContext;
import ai.lintal.rules.Rule;
import ai.lintal.rules.RuleProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Checks that there is only one statement per line. A statement counts when it ends with a semicolon; it is reported
 * when it starts on the line where the previous such statement of the same container ended. {@code for} headers are
 * never inspected.
 *
 * <p>Properties:
 *
 * <ul>
 *   <li>{@code treatTryResourcesAsStatement} (default {@code false}): also require each try resource on its own line.
 * </ul>
 */
public final class OneStatementPerLine implements Rule {
    public static final String MODULE_NAME = "OneStatementPerLine";

    private static final Set<String> CONTAINER_KINDS = Set.of(
            PROGRAM,
            BLOCK,
            CONSTRUCTOR_BODY,
            CLASS_BODY,
            INTERFACE_BODY,
            ENUM_BODY_DECLARATIONS,
            SWITCH_BLOCK_STATEMENT_GROUP);

    private static final Set<String> RELEVANT_KINDS = Set.of(
            PROGRAM,
            BLOCK,
            CONSTRUCTOR_BODY,
            CLASS_BODY,
            INTERFACE_BODY,
            ENUM_BODY_DECLARATIONS,
            SWITCH_BLOCK_STATEMENT_GROUP,
            RESOURCE_SPECIFICATION);

    private final boolean treatTryResourcesAsStatement;

    public OneStatementPerLine(boolean treatTryResourcesAsStatement) {
        this.treatTryResourcesAsStatement = treatTryResourcesAsStatement;
    }

    public OneStatementPerLine() {
        this(false);
    }

    public static OneStatementPerLine fromConfig(RuleProperties properties) {
        return new OneStatementPerLine(properties.getBoolean("treatTryResourcesAsStatement", false));
    }

    @Override
    public String name() {
        return MODULE_NAME;
    }

    @Override
    public Optional<Set<String>> relevantKinds() {
        return Optional.of(RELEVANT_KINDS);
    }

    @Override
    public List<Diagnostic> check(CheckContext ctx, CstNode node) {
        if (node.is(RESOURCE_SPECIFICATION)) {
            return treatTryResourcesAsStatement ? checkResources(ctx, node) : List.of();
        }
        if (!CONTAINER_KINDS.contains(node.kind())) {
            return List.of();
        }
        var diagnostics = new ArrayList<Diagnostic>();
        @Nullable CstNode previous = null;
        for (var child : node.namedChildren()) {
            if (isComment(child.kind())) {
                continue;
            }
            if (!endsWithSemicolon(child)) {
                previous = null;
                continue;
            }
            if (previous != null && ctx.startLine(child) == ctx.endLine(previous)) {
                diagnostics.add(violation(ctx, previous, previous.endByte(), child));
            }
            previous = child;
        }
        return diagnostics;
    }

    private List<Diagnostic> checkResources(CheckContext ctx, CstNode specification) {
        var diagnostics = new ArrayList<Diagnostic>();
        @Nullable CstNode previous = null;
        int separatorEnd = -1;
        for (var child : specification.children()) {
            if (child.is(";")) {
                separatorEnd = child.endByte();
            } else if (child.is(RESOURCE)) {
                if (previous != null && ctx.startLine(child) == ctx.endLine(previous)) {
                    diagnostics.add(violation(ctx, previous, Math.max(separatorEnd, previous.endByte()), child));
                }
                previous = child;
            }
        }
        return diagnostics;
    }

    private static Diagnostic violation(CheckContext ctx, CstNode previous, int separatorEnd, CstNode statement) {
        var indentation = ctx.source().indentation(ctx.startLine(previous));
        var edit = LineBreaks.breakBefore(ctx.source(), separatorEnd, statement.startByte(), indentation);
        return new Diagnostic(new MultipleStatementsOnLine(), statement.range(), Fix.of(edit));
    }

    private static boolean endsWithSemicolon(CstNode statement) {
        var children = statement.children();
        if (children.isEmpty()) {
            return false;
        }
        var last = children.get(children.size() - 1);
        if (last.is(";")) {
            return true;
        }
        // unbraced bodies end with the semicolon of the nested statement
        return last.isNamed() && !isComment(last.kind()) && endsWithSemicolon(last);
    }

    public record MultipleStatementsOnLine() implements Violation {
        @Override
        public String message() {
            return "Only one statement per line allowed.";
        }

        @Override
        public FixAvailability fixAvailability() {
            return FixAvailability.ALWAYS;
        }
    }
}
