package com.example.munchdfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A nondeterministic finite automaton with epsilon transitions.
 *
 * <p>Transitions are held as a two-level lookup, state to (symbol to target
 * states). Symbols are code points; {@link #EPSILON} marks an epsilon edge.
 * States are plain non-negative ints and need not be contiguous: a state
 * that appears nowhere in the transition table simply has no successors.
 * Instances are immutable.
 */
public final class Nfa {

    /** Symbol value used for epsilon transitions. Never a valid code point. */
    public static final int EPSILON = -1;

    private final Map<Integer, Map<Integer, StateSet>> transitions;
    private final int start;
    private final SortedMap<Integer, String> accept;

    private Nfa(Map<Integer, Map<Integer, StateSet>> transitions, int start, SortedMap<Integer, String> accept) {
        this.transitions = transitions;
        this.start = start;
        this.accept = accept;
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

    /**
     * Direct successors of {@code state} on {@code symbol}, which may be
     * {@link #EPSILON}. Unknown pairs have no successors.
     */
    public StateSet targets(int state, int symbol) {
        Map<Integer, StateSet> row = transitions.get(state);
        if (row == null) {
            return StateSet.empty();
        }
        StateSet targets = row.get(symbol);
        return targets == null ? StateSet.empty() : targets;
    }

    /** All non-epsilon symbols used by some transition, in ascending order. */
    public SortedSet<Integer> alphabet() {
        SortedSet<Integer> alphabet = new TreeSet<>();
        for (Map<Integer, StateSet> row : transitions.values()) {
            alphabet.addAll(row.keySet());
        }
        alphabet.remove(EPSILON);
        return Collections.unmodifiableSortedSet(alphabet);
    }

    /** Number of (state, symbol, target) edges, epsilon edges included. */
    public int transitionCount() {
        int count = 0;
        for (Map<Integer, StateSet> row : transitions.values()) {
            for (StateSet targets : row.values()) {
                count += targets.size();
            }
        }
        return count;
    }

    /**
     * All edges, epsilon edges included, ordered by source state, then by
     * symbol (epsilon first), then by target.
     */
    public List<Transition> transitions() {
        List<Transition> list = new ArrayList<>();
        for (Map.Entry<Integer, Map<Integer, StateSet>> row : transitions.entrySet()) {
            for (Map.Entry<Integer, StateSet> cell : row.getValue().entrySet()) {
                for (int target : cell.getValue().toArray()) {
                    list.add(new Transition(row.getKey(), cell.getKey(), target));
                }
            }
        }
        Collections.sort(list);
        return list;
    }

    /**
     * Returns the smallest superset of {@code states} that is closed under
     * epsilon transitions. Cycles of epsilon edges are fine.
     */
    public StateSet epsilonClosure(StateSet states) {
        Set<Integer> closure = states.toSet();
        Deque<Integer> stack = new ArrayDeque<>(closure);
        while (!stack.isEmpty()) {
            int state = stack.pop();
            for (int next : targets(state, EPSILON).toArray()) {
                if (closure.add(next)) {
                    stack.push(next);
                }
            }
        }
        return StateSet.of(closure);
    }

    /**
     * Returns every state reachable from some member of {@code states} by one
     * transition on {@code symbol}. Epsilon edges are not followed.
     */
    public StateSet move(StateSet states, int symbol) {
        Set<Integer> result = new HashSet<>();
        for (int state : states.toArray()) {
            for (int next : targets(state, symbol).toArray()) {
                result.add(next);
            }
        }
        return StateSet.of(result);
    }

    /**
     * Labels of the accept states in {@code states}, in ascending state order,
     * joined with {@code ", "}. Returns null when none of them accepts.
     */
    public String joinedLabel(StateSet states) {
        StringBuilder sb = null;
        for (int state : states.toArray()) {
            String label = accept.get(state);
            if (label == null) {
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(label);
            } else {
                sb.append(", ").append(label);
            }
        }
        return sb == null ? null : sb.toString();
    }

    @Override
    public String toString() {
        return "Nfa(start=" + start + ", transitions=" + transitionCount() + ", accept=" + accept + ")";
    }

    /**
     * Collects transitions and accept labels. Targets added twice for the same
     * (state, symbol) pair are kept once.
     */
    public static final class Builder {

        private final Map<Integer, Map<Integer, Set<Integer>>> transitions = new HashMap<>();
        private final SortedMap<Integer, String> accept = new TreeMap<>();
        private int start;

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
            if (symbol != EPSILON && !Character.isValidCodePoint(symbol)) {
                throw new IllegalArgumentException("Invalid symbol: " + symbol);
            }
            transitions.computeIfAbsent(from, k -> new HashMap<>())
                    .computeIfAbsent(symbol, k -> new HashSet<>())
                    .add(to);
            return this;
        }

        public Builder epsilon(int from, int to) {
            return transition(from, EPSILON, to);
        }

        public Builder accept(int state, String label) {
            checkState(state);
            if (label == null) {
                throw new NullPointerException("label");
            }
            accept.put(state, label);
            return this;
        }

        public Nfa build() {
            Map<Integer, Map<Integer, StateSet>> frozen = new HashMap<>();
            for (Map.Entry<Integer, Map<Integer, Set<Integer>>> row : transitions.entrySet()) {
                Map<Integer, StateSet> frozenRow = new HashMap<>();
                for (Map.Entry<Integer, Set<Integer>> cell : row.getValue().entrySet()) {
                    frozenRow.put(cell.getKey(), StateSet.of(cell.getValue()));
                }
                frozen.put(row.getKey(), Collections.unmodifiableMap(frozenRow));
            }
            return new Nfa(Collections.unmodifiableMap(frozen), start,
                    Collections.unmodifiableSortedMap(new TreeMap<>(accept)));
        }

        private static void checkState(int state) {
            if (state < 0) {
                throw new IllegalArgumentException("Negative state id: " + state);
            }
        }
    }
}
