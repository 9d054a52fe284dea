package com.example.munchdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A deterministic, possibly partial, finite automaton over code points.
 *
 * <p>Each (state, symbol) pair has at most one target; a pair with no entry
 * means the automaton rejects there. Instances are immutable.
 */
public final class Dfa {

    /** Returned by {@link #next} when no transition is defined. */
    public static final int NO_STATE = -1;

    private final Map<Integer, Map<Integer, Integer>> transitions;
    private final int start;
    private final SortedMap<Integer, String> accept;
    private final int transitionCount;

    private Dfa(Map<Integer, Map<Integer, Integer>> transitions, int start, SortedMap<Integer, String> accept,
                int transitionCount) {
        this.transitions = transitions;
        this.start = start;
        this.accept = accept;
        this.transitionCount = transitionCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getStart() {
        return start;
    }

    /** Accept states and their labels, ascending by state id. */
    public SortedMap<Integer, String> getAccept() {
        return accept;
    }

    public boolean isAccepting(int state) {
        return accept.containsKey(state);
    }

    /** Label of an accept state, or null if {@code state} does not accept. */
    public String label(int state) {
        return accept.get(state);
    }

    /** Target of {@code state} on {@code symbol}, or {@link #NO_STATE}. */
    public int next(int state, int symbol) {
        Map<Integer, Integer> row = transitions.get(state);
        if (row == null) {
            return NO_STATE;
        }
        Integer target = row.get(symbol);
        return target == null ? NO_STATE : target;
    }

    public int transitionCount() {
        return transitionCount;
    }

    /**
     * Number of distinct states mentioned by the start state, the accept
     * mapping or any transition.
     */
    public int stateCount() {
        Set<Integer> states = new HashSet<>(accept.keySet());
        states.add(start);
        for (Map.Entry<Integer, Map<Integer, Integer>> row : transitions.entrySet()) {
            states.add(row.getKey());
            states.addAll(row.getValue().values());
        }
        return states.size();
    }

    /** All transitions, ordered by source state and then by symbol. */
    public List<Transition> transitions() {
        List<Transition> list = new ArrayList<>(transitionCount);
        for (Map.Entry<Integer, Map<Integer, Integer>> row : transitions.entrySet()) {
            for (Map.Entry<Integer, Integer> cell : row.getValue().entrySet()) {
                list.add(new Transition(row.getKey(), cell.getKey(), cell.getValue()));
            }
        }
        Collections.sort(list);
        return list;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dfa)) {
            return false;
        }
        Dfa other = (Dfa) o;
        return start == other.start && accept.equals(other.accept) && transitions.equals(other.transitions);
    }

    @Override
    public int hashCode() {
        return (start * 31 + accept.hashCode()) * 31 + transitions.hashCode();
    }

    @Override
    public String toString() {
        return "Dfa(start=" + start + ", transitions=" + transitions() + ", accept=" + accept + ")";
    }

    /**
     * Collects DFA transitions. Adding a second, different target for a
     * (state, symbol) pair that already has one is rejected.
     */
    public static final class Builder {

        private final Map<Integer, Map<Integer, Integer>> transitions = new HashMap<>();
        private final SortedMap<Integer, String> accept = new TreeMap<>();
        private int start;
        private int transitionCount;

        private Builder() {
        }

        public Builder start(int state) {
            checkState(state);
            this.start = state;
            return this;
        }

        public Builder transition(int from, int symbol, int to) {
            checkState(from);
            checkState(to);
            if (!Character.isValidCodePoint(symbol)) {
                throw new IllegalArgumentException("Invalid symbol: " + symbol);
            }
            Integer previous = transitions.computeIfAbsent(from, k -> new HashMap<>()).putIfAbsent(symbol, to);
            if (previous == null) {
                transitionCount++;
            } else if (previous != to) {
                throw new IllegalArgumentException("State " + from + " already moves to " + previous
                        + " on '" + new String(Character.toChars(symbol)) + "', cannot also move to " + to);
            }
            return this;
        }

        public Builder accept(int state, String label) {
            checkState(state);
            if (label == null) {
                throw new NullPointerException("label");
            }
            accept.put(state, label);
            return this;
        }

        public Dfa build() {
            Map<Integer, Map<Integer, Integer>> frozen = new HashMap<>();
            for (Map.Entry<Integer, Map<Integer, Integer>> row : transitions.entrySet()) {
                frozen.put(row.getKey(), Collections.unmodifiableMap(new HashMap<>(row.getValue())));
            }
            return new Dfa(Collections.unmodifiableMap(frozen), start,
                    Collections.unmodifiableSortedMap(new TreeMap<>(accept)), transitionCount);
        }

        private static void checkState(int state) {
            if (state < 0) {
                throw new IllegalArgumentException("Negative state id: " + state);
            }
        }
    }
}
