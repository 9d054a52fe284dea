package com.example.munchdfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Converts an NFA into an equivalent DFA by subset construction.
 *
 * <p>DFA states are numbered in breadth-first discovery order: 0 is the
 * epsilon closure of the NFA start state, and symbols are tried in ascending
 * code point order, so the same NFA and alphabet always give the same
 * numbering. The result is partial: an empty move set records no transition
 * rather than a dead state.
 *
 * <p>When a DFA state contains several NFA accept states its label is their
 * labels joined with {@code ", "} in ascending NFA state order, duplicates
 * included.
 */
public final class SubsetConstructor {

    private SubsetConstructor() {
    }

    /** Converts {@code nfa} over the symbols its own transitions use. */
    public static Dfa convert(Nfa nfa) {
        return convert(nfa, nfa.alphabet());
    }

    /**
     * Converts {@code nfa} over {@code alphabet}. Symbols outside the alphabet
     * are never explored, even where the NFA has transitions on them.
     */
    public static Dfa convert(Nfa nfa, Collection<Integer> alphabet) {
        SortedSet<Integer> symbols = new TreeSet<>(alphabet);
        symbols.remove(Nfa.EPSILON);

        Dfa.Builder dfa = Dfa.builder().start(0);
        Map<StateSet, Integer> stateMapping = new HashMap<>();
        List<StateSet> dfaStates = new ArrayList<>();

        // Start state is the closure of the NFA start state
        StateSet startClosure = nfa.epsilonClosure(StateSet.of(nfa.getStart()));
        register(nfa, startClosure, stateMapping, dfaStates, dfa);

        Queue<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        while (!queue.isEmpty()) {
            int current = queue.remove();
            StateSet currentSet = dfaStates.get(current);
            for (int symbol : symbols) {
                StateSet moveSet = nfa.move(currentSet, symbol);
                if (moveSet.isEmpty()) {
                    continue;
                }
                StateSet nextClosure = nfa.epsilonClosure(moveSet);
                Integer next = stateMapping.get(nextClosure);
                if (next == null) {
                    next = register(nfa, nextClosure, stateMapping, dfaStates, dfa);
                    queue.add(next);
                }
                dfa.transition(current, symbol, next);
            }
        }
        return dfa.build();
    }

    private static int register(Nfa nfa, StateSet states, Map<StateSet, Integer> stateMapping,
                                List<StateSet> dfaStates, Dfa.Builder dfa) {
        int index = dfaStates.size();
        stateMapping.put(states, index);
        dfaStates.add(states);
        String label = nfa.joinedLabel(states);
        if (label != null) {
            dfa.accept(index, label);
        }
        return index;
    }
}
