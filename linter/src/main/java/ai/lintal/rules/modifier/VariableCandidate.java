package ai.lintal.rules.modifier;

import ai.lintal.cst.TextRange;

/**
 * A local binding tracked while a body is analyzed. Identity matters: two candidates with the same name in different
 * scopes are different variables.
 *
 * <p>{@code state} follows the path currently being analyzed and is reset at branch merges; {@code worst} only grows
 * and is what decides the report once the scope closes.
 */
final class VariableCandidate {
    private final String name;
    private final TextRange nameRange;
    private final int loopDepth;
    private final boolean excluded;
    private final CandidateState declaredState;
    private CandidateState state;
    private CandidateState worst;

    private VariableCandidate(String name, TextRange nameRange, int loopDepth, boolean excluded, CandidateState state) {
        this.name = name;
        this.nameRange = nameRange;
        this.loopDepth = loopDepth;
        this.excluded = excluded;
        this.declaredState = state;
        this.state = state;
        this.worst = state;
    }

    static VariableCandidate tracked(String name, TextRange nameRange, int loopDepth, boolean initialized) {
        var initial = initialized ? CandidateState.SINGLE_ASSIGNED : CandidateState.UNTOUCHED;
        return new VariableCandidate(name, nameRange, loopDepth, false, initial);
    }

    /** A binding that shadows outer names but is never reported. */
    static VariableCandidate excluded(String name, TextRange nameRange, int loopDepth) {
        return new VariableCandidate(name, nameRange, loopDepth, true, CandidateState.DISQUALIFIED);
    }

    String name() {
        return name;
    }

    TextRange nameRange() {
        return nameRange;
    }

    /** State right after the declaration: one action if it has an initializer. */
    CandidateState declaredState() {
        return declaredState;
    }

    CandidateState state() {
        return state;
    }

    /**
     * Records one value-giving action. An assignment from a region that may run more than once per declaration
     * (a loop entered after the declaration, a lambda, a nested class) disqualifies outright.
     */
    void assign(int currentLoopDepth) {
        if (excluded) {
            return;
        }
        state = currentLoopDepth > loopDepth ? CandidateState.DISQUALIFIED : state.afterAssignment();
        worst = CandidateState.worse(worst, state);
    }

    void resetState(CandidateState newState) {
        if (!excluded) {
            state = newState;
        }
    }

    boolean shouldBeFinal() {
        return !excluded && worst == CandidateState.SINGLE_ASSIGNED;
    }

    @Override
    public String toString() {
        return name + "@" + nameRange + "[" + state + "/" + worst + "]";
    }
}
