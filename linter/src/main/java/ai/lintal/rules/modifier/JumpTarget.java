package ai.lintal.rules.modifier;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A statement that {@code break} or {@code yield} can leave. Collects the states of those exits and, for loops, of the
 * {@code continue} statements that end an iteration early.
 */
final class JumpTarget {
    enum Kind {
        LOOP,
        SWITCH,
        LABELED
    }

    private final Kind kind;
    private final @Nullable String label;
    private final List<FlowSnapshot> exits = new ArrayList<>();
    private final List<FlowSnapshot> continues = new ArrayList<>();

    JumpTarget(Kind kind, @Nullable String label) {
        this.kind = kind;
        this.label = label;
    }

    Kind kind() {
        return kind;
    }

    @Nullable
    String label() {
        return label;
    }

    void addExit(FlowSnapshot snapshot) {
        exits.add(snapshot);
    }

    List<FlowSnapshot> exits() {
        return exits;
    }

    void addContinue(FlowSnapshot snapshot) {
        continues.add(snapshot);
    }

    List<FlowSnapshot> continues() {
        return continues;
    }
}
