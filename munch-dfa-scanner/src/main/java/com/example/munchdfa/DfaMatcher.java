package com.example.munchdfa;

/**
 * Runs a DFA over a whole input, with no tokenizing or whitespace skipping,
 * and reports where it stopped.
 */
public final class DfaMatcher {

    /** Outcome of {@link DfaMatcher#match}. */
    public static final class Verdict {
        private final boolean accepted;
        private final int state;
        private final String label;

        Verdict(boolean accepted, int state, String label) {
            this.accepted = accepted;
            this.state = state;
            this.label = label;
        }

        public boolean isAccepted() { return accepted; }

        /** Last state reached: the final state, or the one with no transition for the next character. */
        public int getState() { return state; }

        /** Accept label of the final state, or null when rejected. */
        public String getLabel() { return label; }

        @Override
        public String toString() {
            return (accepted ? "accepted" : "rejected") + " state=" + state + (label == null ? "" : " label=" + label);
        }
    }

    private final Dfa dfa;

    public DfaMatcher(Dfa dfa) {
        if (dfa == null) {
            throw new NullPointerException("dfa");
        }
        this.dfa = dfa;
    }

    public Verdict match(CharSequence input) {
        int state = dfa.getStart();
        int i = 0;
        while (i < input.length()) {
            int c = Character.codePointAt(input, i);
            int next = dfa.next(state, c);
            if (next == Dfa.NO_STATE) {
                return new Verdict(false, state, null);
            }
            state = next;
            i += Character.charCount(c);
        }
        String label = dfa.label(state);
        return new Verdict(label != null, state, label);
    }
}
