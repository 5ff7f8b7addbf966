package ai.lintal.rules.imports;

import static ai.lintal.treesitter.JavaNodeTypes.*;

import ai.lintal.cst.CstNode;
import ai.lintal.source.SourceText;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Reads the import and package declarations of a compilation unit. */
public final class Imports {

    private Imports() {}

    /** Import declarations directly under {@code program}, in source order. */
    public static List<ImportInfo> collect(CstNode program, SourceText source) {
        var imports = new ArrayList<ImportInfo>();
        for (var child : program.childrenOfKind(IMPORT_DECLARATION)) {
            parse(child, source).ifPresent(imports::add);
        }
        return imports;
    }

    static Optional<ImportInfo> parse(CstNode declaration, SourceText source) {
        boolean isStatic = false;
        boolean isWildcard = false;
        @Nullable String path = null;
        for (var child : declaration.children()) {
            switch (child.kind()) {
                case "static" -> isStatic = true;
                case "asterisk" -> isWildcard = true;
                case IDENTIFIER, SCOPED_IDENTIFIER -> path = child.text(source);
                default -> {}
            }
        }
        if (path == null) {
            return Optional.empty();
        }
        if (isWildcard) {
            path = path + ".*";
        }
        var simpleName = isWildcard ? null : path.substring(path.lastIndexOf('.') + 1);
        return Optional.of(new ImportInfo(path, simpleName, isStatic, isWildcard, declaration));
    }
}
