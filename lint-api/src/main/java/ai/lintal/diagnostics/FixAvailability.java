package ai.lintal.diagnostics;

/** Whether diagnostics of a given violation kind carry a fix. */
public enum FixAvailability {
    ALWAYS,
    SOMETIMES,
    NONE
}
