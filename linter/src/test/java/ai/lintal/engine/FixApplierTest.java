package ai.lintal.engine;

import static org.junit.jupiter.api.Assertions.*;

import ai.lintal.cst.TextRange;
import ai.lintal.diagnostics.Edit;
import ai.lintal.diagnostics.Fix;
import ai.lintal.source.SourceText;
import java.util.List;
import org.junit.jupiter.api.Test;

public class FixApplierTest {

    @Test
    public void testIndependentFixesAreAllApplied() {
        var source = new SourceText("int a; int b;");
        var result = FixApplier.apply(
                source,
                List.of(
                        Fix.of(Edit.replacement(new TextRange(6, 7), "\n")),
                        Fix.of(Edit.insertion(0, "// header\n"))));

        assertEquals("// header\nint a;\nint b;", result.text());
        assertEquals(2, result.applied());
        assertEquals(0, result.skipped());
    }

    @Test
    public void testOverlappingFixIsSkippedWhole() {
        var source = new SourceText("abcdef");
        var first = Fix.of(Edit.replacement(new TextRange(1, 3), "X"));
        var overlapping = Fix.of(List.of(Edit.deletion(new TextRange(2, 4)), Edit.insertion(6, "!")));

        var result = FixApplier.apply(source, List.of(first, overlapping));

        assertEquals("aXdef", result.text());
        assertEquals(1, result.applied());
        assertEquals(1, result.skipped());
    }

    @Test
    public void testTwoInsertionsAtTheSameOffsetConflict() {
        var source = new SourceText("ab");
        var result = FixApplier.apply(
                source, List.of(Fix.of(Edit.insertion(1, "1")), Fix.of(Edit.insertion(1, "2"))));

        assertEquals("a1b", result.text());
        assertEquals(1, result.skipped());
    }

    @Test
    public void testAdjacentEditsDoNotConflict() {
        var source = new SourceText("abcd");
        var result = FixApplier.apply(
                source,
                List.of(
                        Fix.of(Edit.replacement(new TextRange(0, 2), "X")),
                        Fix.of(Edit.replacement(new TextRange(2, 4), "Y"))));

        assertEquals("XY", result.text());
        assertEquals(2, result.applied());
    }

    @Test
    public void testByteOffsetsWithMultibyteText() {
        // "é" takes two bytes, so "b" starts at byte 4
        var source = new SourceText("é; b;");
        var result = FixApplier.apply(source, List.of(Fix.of(Edit.replacement(new TextRange(3, 4), "\n"))));
        assertEquals("é;\nb;", result.text());
    }

    @Test
    public void testEditPastTheEndIsSkipped() {
        var source = new SourceText("abc");
        var result = FixApplier.apply(source, List.of(Fix.of(Edit.insertion(10, "x"))));
        assertEquals("abc", result.text());
        assertEquals(1, result.skipped());
    }
}
