package ai.lintal.engine;

import ai.lintal.diagnostics.Edit;
import ai.lintal.diagnostics.Fix;
import ai.lintal.source.SourceText;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Applies fixes to a source text in a single pass. Fixes are taken whole in order of position; a fix with any edit
 * overlapping an edit already accepted, or reaching past the end of the text, is skipped entirely.
 */
public final class FixApplier {
    private static final Logger logger = LogManager.getLogger(FixApplier.class);

    public record Result(String text, int applied, int skipped) {}

    private FixApplier() {}

    public static Result apply(SourceText source, List<Fix> fixes) {
        var ordered = new ArrayList<>(fixes);
        ordered.sort(Comparator.comparing(Fix::span));
        var accepted = new ArrayList<Edit>();
        int applied = 0;
        int skipped = 0;
        for (var fix : ordered) {
            if (conflicts(fix, accepted, source)) {
                skipped++;
                continue;
            }
            accepted.addAll(fix.edits());
            applied++;
        }
        accepted.sort(Comparator.comparing(Edit::range));
        var result = new StringBuilder(source.text().length());
        int cursor = 0;
        for (var edit : accepted) {
            result.append(source.slice(cursor, edit.range().start()));
            result.append(edit.content());
            cursor = edit.range().end();
        }
        result.append(source.slice(cursor, source.byteLength()));
        if (skipped > 0) {
            logger.debug("Applied {} fixes, skipped {} overlapping ones", applied, skipped);
        }
        return new Result(result.toString(), applied, skipped);
    }

    private static boolean conflicts(Fix fix, List<Edit> accepted, SourceText source) {
        for (var edit : fix.edits()) {
            if (edit.range().end() > source.byteLength()) {
                logger.warn(
                        "Fix edit {} reaches past the end of the source ({} bytes)",
                        edit.range(),
                        source.byteLength());
                return true;
            }
            for (var other : accepted) {
                if (edit.range().intersects(other.range())) {
                    return true;
                }
            }
        }
        return false;
    }
}
