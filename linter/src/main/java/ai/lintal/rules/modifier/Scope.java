package ai.lintal.rules.modifier;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Bindings introduced by one block-like construct, in declaration order. */
final class Scope {
    private final Map<String, VariableCandidate> variables = new LinkedHashMap<>();
    private final Map<String, VariableCandidate> shadowed = new LinkedHashMap<>();

    void declare(VariableCandidate candidate) {
        var previous = variables.put(candidate.name(), candidate);
        if (previous != null) {
            // unnamed variables may be declared repeatedly; keep every binding reportable
            shadowed.put(previous.name() + "@" + previous.nameRange().start(), previous);
        }
    }

    @Nullable
    VariableCandidate find(String name) {
        return variables.get(name);
    }

    /** Every binding of this scope, including ones hidden by a later redeclaration. */
    Collection<VariableCandidate> candidates() {
        if (shadowed.isEmpty()) {
            return variables.values();
        }
        var all = new LinkedHashMap<String, VariableCandidate>(shadowed);
        for (var candidate : variables.values()) {
            all.put(candidate.name() + "@" + candidate.nameRange().start(), candidate);
        }
        return all.values();
    }
}
