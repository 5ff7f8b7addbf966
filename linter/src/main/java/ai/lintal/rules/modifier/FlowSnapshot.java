package ai.lintal.rules.modifier;

import java.util.Map;

/** Per-candidate states at one program point, plus whether that point can be reached. */
record FlowSnapshot(Map<VariableCandidate, CandidateState> states, boolean reachable) {

    /** A candidate declared after this point is taken as freshly declared. */
    CandidateState stateOf(VariableCandidate candidate) {
        return states.getOrDefault(candidate, candidate.declaredState());
    }
}
