package ai.lintal.rules.imports;

import static ai.lintal.treesitter.JavaNodeTypes.*;

import ai.lintal.cst.CstNode;
import ai.lintal.cst.TextRange;
import ai.lintal.diagnostics.Diagnostic;
import ai.lintal.diagnostics.Edit;
import ai.lintal.diagnostics.Fix;
import ai.lintal.diagnostics.FixAvailability;
import ai.lintal.diagnostics.Violation;
import ai.lintal.rules.CheckContext;
import ai.lintal.rules.Rule;
import ai.lintal.rules.RuleProperties;
import ai.lintal.source.SourceText;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reports single-type and static member imports whose simple name is never referenced. Wildcard imports are never
 * reported.
 *
 * <p>Properties:
 *
 * <ul>
 *   <li>{@code processJavadoc} (default {@code true}): names referenced from Javadoc {@code {@link}},
 *       {@code {@linkplain}}, {@code {@value}}, {@code @see}, {@code @throws} and {@code @exception} count as uses.
 * </ul>
 */
public final class UnusedImports implements Rule {
    public static final String MODULE_NAME = "UnusedImports";

    private static final Set<String> REFERENCE_KINDS = Set.of(IDENTIFIER, TYPE_IDENTIFIER);

    private final boolean processJavadoc;

    public UnusedImports(boolean processJavadoc) {
        this.processJavadoc = processJavadoc;
    }

    public UnusedImports() {
        this(true);
    }

    public static UnusedImports fromConfig(RuleProperties properties) {
        return new UnusedImports(properties.getBoolean("processJavadoc", true));
    }

    @Override
    public String name() {
        return MODULE_NAME;
    }

    @Override
    public Optional<Set<String>> relevantKinds() {
        return Optional.of(Set.of(PROGRAM));
    }

    @Override
    public List<Diagnostic> check(CheckContext ctx, CstNode node) {
        var imports = Imports.collect(node, ctx.source());
        if (imports.isEmpty()) {
            return List.of();
        }
        var referenced = collectReferencedNames(ctx.source(), node);
        var diagnostics = new ArrayList<Diagnostic>();
        for (var info : imports) {
            if (info.isWildcard() || info.simpleName() == null || referenced.contains(info.simpleName())) {
                continue;
            }
            var fix = Fix.of(Edit.deletion(deletionRange(ctx.source(), info.node())));
            diagnostics.add(new Diagnostic(new UnusedImport(info.path()), info.range(), fix));
        }
        return diagnostics;
    }

    private Set<String> collectReferencedNames(SourceText source, CstNode program) {
        var names = new HashSet<String>();
        var stack = new ArrayDeque<CstNode>();
        stack.push(program);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            var kind = node.kind();
            if (kind.equals(IMPORT_DECLARATION) || kind.equals(PACKAGE_DECLARATION)) {
                continue;
            }
            if (REFERENCE_KINDS.contains(kind)) {
                names.add(node.text(source));
            } else if (processJavadoc && kind.equals(BLOCK_COMMENT)) {
                var comment = node.text(source);
                if (JavadocReferences.isJavadoc(comment)) {
                    names.addAll(JavadocReferences.collect(comment));
                }
            }
            for (var child : node.children()) {
                stack.push(child);
            }
        }
        return names;
    }

    /** The whole line when the import is alone on it, otherwise just the declaration. */
    private static TextRange deletionRange(SourceText source, CstNode declaration) {
        int startLine = source.lineOf(declaration.startByte());
        int endLine = source.lineOf(Math.max(declaration.startByte(), declaration.endByte() - 1));
        int lineStart = source.lineStart(startLine);
        int lineEnd = source.lineEnd(endLine);
        if (source.isBlank(lineStart, declaration.startByte()) && source.isBlank(declaration.endByte(), lineEnd)) {
            return new TextRange(lineStart, source.nextLineStart(endLine));
        }
        return declaration.range();
    }

    public record UnusedImport(String importPath) implements Violation {
        @Override
        public String message() {
            return "Unused import - " + importPath + ".";
        }

        @Override
        public FixAvailability fixAvailability() {
            return FixAvailability.ALWAYS;
        }
    }
}
