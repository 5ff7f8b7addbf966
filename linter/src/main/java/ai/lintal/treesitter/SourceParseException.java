package ai.lintal.treesitter;

import org.jetbrains.annotations.Nullable;

/** Thrown when a source file cannot be turned into a syntax tree at all. */
public class SourceParseException extends Exception {
    private final @Nullable String fileName;

    public SourceParseException(String message, @Nullable String fileName) {
        super(message);
        this.fileName = fileName;
    }

    public SourceParseException(String message, Throwable cause, @Nullable String fileName) {
        super(message, cause);
        this.fileName = fileName;
    }

    public @Nullable String getFileName() {
        return fileName;
    }

    @Override
    public String getMessage() {
        return String.format("Parsing failed for %s: %s", fileName == null ? "<memory>" : fileName, super.getMessage());
    }
}
