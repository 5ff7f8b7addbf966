package ai.lintal.diagnostics;

/**
 * The kind of a reported problem. Rules declare one small record per message they can produce; the record carries
 * whatever the message needs (a variable name, an import path).
 */
public interface Violation {

    /** Human-readable message, e.g. {@code Variable 'x' should be declared final.} */
    String message();

    FixAvailability fixAvailability();
}
