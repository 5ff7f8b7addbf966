package ai.lintal.diagnostics;

import ai.lintal.cst.TextRange;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** One reported violation at a byte range of the analyzed source, optionally with a fix. */
public record Diagnostic(Violation kind, TextRange range, @Nullable Fix fix) {

    public Diagnostic {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(range);
        if (fix != null && kind.fixAvailability() == FixAvailability.NONE) {
            throw new IllegalArgumentException("Violation " + kind.getClass().getSimpleName() + " declares no fixes");
        }
    }

    public Diagnostic(Violation kind, TextRange range) {
        this(kind, range, null);
    }

    public Diagnostic withFix(Fix fix) {
        return new Diagnostic(kind, range, fix);
    }

    public String message() {
        return kind.message();
    }

    public Optional<Fix> optionalFix() {
        return Optional.ofNullable(fix);
    }
}
