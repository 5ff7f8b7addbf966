package ai.lintal.rules.coding;

import ai.lintal.cst.TextRange;
import ai.lintal.diagnostics.Edit;
import ai.lintal.source.SourceText;

/** Edits that move the code at {@code nextStart} onto a line of its own. */
final class LineBreaks {

    private LineBreaks() {}

    /**
     * Replaces the blank gap between {@code previousEnd} and {@code nextStart} with a line break and the given
     * indentation; if something other than blanks sits in the gap, the break is inserted right before
     * {@code nextStart}.
     */
    static Edit breakBefore(SourceText source, int previousEnd, int nextStart, String indentation) {
        var lineBreak = lineEnding(source);
        if (previousEnd <= nextStart && source.isBlank(previousEnd, nextStart)) {
            return Edit.replacement(new TextRange(previousEnd, nextStart), lineBreak + indentation);
        }
        return Edit.insertion(nextStart, lineBreak + indentation);
    }

    /** Line terminator to use for new lines: CRLF if the file already uses it, otherwise LF. */
    static String lineEnding(SourceText source) {
        return source.text().contains("\r\n") ? "\r\n" : "\n";
    }
}
