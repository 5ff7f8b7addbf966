package ai.lintal.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Result of linting one file. An unanalyzable file carries an error message and no diagnostics. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileLintResult(String file, Status status, List<ReportedDiagnostic> diagnostics, @Nullable String error) {

    public enum Status {
        ANALYZED,
        UNANALYZABLE
    }

    public static FileLintResult analyzed(String file, List<ReportedDiagnostic> diagnostics) {
        return new FileLintResult(file, Status.ANALYZED, List.copyOf(diagnostics), null);
    }

    public static FileLintResult unanalyzable(String file, String error) {
        return new FileLintResult(file, Status.UNANALYZABLE, List.of(), error);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /** Diagnostics produced by one rule. */
    public List<ReportedDiagnostic> diagnosticsFor(String ruleName) {
        return diagnostics.stream().filter(d -> d.ruleName().equals(ruleName)).toList();
    }
}
