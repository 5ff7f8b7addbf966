package ai.lintal.rules.imports;

import ai.lintal.cst.CstNode;
import ai.lintal.cst.TextRange;
import org.jetbrains.annotations.Nullable;

/**
 * One import declaration.
 *
 * @param path full imported path, e.g. {@code java.util.List} or {@code java.util.*}
 * @param simpleName last path segment for single-type and static member imports, null for wildcards
 */
public record ImportInfo(
        String path,
        @Nullable String simpleName,
        boolean isStatic,
        boolean isWildcard,
        CstNode node) {

    public TextRange range() {
        return node.range();
    }
}
