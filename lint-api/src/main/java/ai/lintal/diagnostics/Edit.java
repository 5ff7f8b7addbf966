package ai.lintal.diagnostics;

import ai.lintal.cst.TextRange;

/** Replacement of the bytes in {@code range} with {@code content}. */
public record Edit(TextRange range, String content) {

    public static Edit replacement(TextRange range, String content) {
        return new Edit(range, content);
    }

    public static Edit insertion(int offset, String content) {
        return new Edit(TextRange.empty(offset), content);
    }

    public static Edit deletion(TextRange range) {
        return new Edit(range, "");
    }

    public boolean isInsertion() {
        return range.isEmpty();
    }
}
