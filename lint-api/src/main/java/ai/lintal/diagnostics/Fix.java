package ai.lintal.diagnostics;

import ai.lintal.cst.TextRange;
import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;

/** A set of edits that resolves one diagnostic when applied together. Edits are kept sorted by position. */
public record Fix(ImmutableList<Edit> edits) {

    public Fix {
        if (edits.isEmpty()) {
            throw new IllegalArgumentException("A fix needs at least one edit");
        }
        edits = ImmutableList.sortedCopyOf(Comparator.comparing(Edit::range), edits);
    }

    public static Fix of(Edit edit) {
        return new Fix(ImmutableList.of(edit));
    }

    public static Fix of(List<Edit> edits) {
        return new Fix(ImmutableList.copyOf(edits));
    }

    /** Smallest range covering every edit. */
    public TextRange span() {
        return new TextRange(edits.get(0).range().start(), edits.stream()
                .mapToInt(e -> e.range().end())
                .max()
                .orElseThrow());
    }
}
