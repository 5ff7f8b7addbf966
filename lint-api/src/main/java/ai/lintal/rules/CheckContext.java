package ai.lintal.rules;

import ai.lintal.cst.CstNode;
import ai.lintal.source.SourceText;
import org.jetbrains.annotations.Nullable;

/** Per-file state handed to every rule invocation. */
public final class CheckContext {
    private final SourceText source;
    private final @Nullable String fileName;

    public CheckContext(SourceText source, @Nullable String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public CheckContext(SourceText source) {
        this(source, null);
    }

    public SourceText source() {
        return source;
    }

    /** Display name of the file being analyzed, for log messages; null for in-memory sources. */
    public @Nullable String fileName() {
        return fileName;
    }

    public String text(CstNode node) {
        return source.slice(node.range());
    }

    /** 1-indexed line where the node starts. */
    public int startLine(CstNode node) {
        return source.lineOf(node.startByte());
    }

    /** 1-indexed line of the node's last byte. */
    public int endLine(CstNode node) {
        return source.lineOf(Math.max(node.startByte(), node.endByte() - 1));
    }
}
