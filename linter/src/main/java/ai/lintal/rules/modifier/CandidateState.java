package ai.lintal.rules.modifier;

/** How many times a local has been given a value along the current path, saturating at two. */
enum CandidateState {
    UNTOUCHED,
    SINGLE_ASSIGNED,
    DISQUALIFIED;

    CandidateState afterAssignment() {
        return this == UNTOUCHED ? SINGLE_ASSIGNED : DISQUALIFIED;
    }

    static CandidateState worse(CandidateState a, CandidateState b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
