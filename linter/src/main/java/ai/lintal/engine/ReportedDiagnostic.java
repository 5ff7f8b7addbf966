package ai.lintal.engine;

import ai.lintal.diagnostics.Fix;
import ai.lintal.source.SourceText;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A diagnostic as reported to users: 1-indexed positions and a serializable fix. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportedDiagnostic(
        String ruleName,
        String message,
        int line,
        int column,
        int endLine,
        int endColumn,
        @Nullable ReportedFix fix) {

    public record ReportedFix(List<ReportedEdit> edits) {}

    public record ReportedEdit(int startByte, int endByte, String content) {}

    static ReportedDiagnostic from(RuleDiagnostic ruleDiagnostic, SourceText source) {
        var diagnostic = ruleDiagnostic.diagnostic();
        var start = source.location(diagnostic.range().start());
        var end = source.location(diagnostic.range().end());
        return new ReportedDiagnostic(
                ruleDiagnostic.ruleName(),
                diagnostic.message(),
                start.line(),
                start.column(),
                end.line(),
                end.column(),
                diagnostic.optionalFix().map(ReportedDiagnostic::toReported).orElse(null));
    }

    private static ReportedFix toReported(Fix fix) {
        return new ReportedFix(fix.edits().stream()
                .map(e -> new ReportedEdit(e.range().start(), e.range().end(), e.content()))
                .toList());
    }
}
