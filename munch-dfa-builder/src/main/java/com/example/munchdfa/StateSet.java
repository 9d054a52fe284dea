package com.example.munchdfa;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * An immutable set of NFA state ids kept as a sorted, duplicate-free array.
 * Two sets holding the same ids are equal no matter how they were built,
 * so instances can key the map of discovered DFA states.
 */
public final class StateSet {

    private static final StateSet EMPTY = new StateSet(new int[0]);

    private final int[] states;

    private StateSet(int[] sortedStates) {
        this.states = sortedStates;
    }

    public static StateSet empty() {
        return EMPTY;
    }

    public static StateSet of(int... states) {
        int[] copy = states.clone();
        Arrays.sort(copy);
        int size = 0;
        for (int i = 0; i < copy.length; i++) {
            if (i == 0 || copy[i] != copy[i - 1]) {
                copy[size++] = copy[i];
            }
        }
        return size == 0 ? EMPTY : new StateSet(Arrays.copyOf(copy, size));
    }

    public static StateSet of(Collection<Integer> states) {
        if (states.isEmpty()) {
            return EMPTY;
        }
        Set<Integer> sorted = new TreeSet<>(states);
        int[] array = new int[sorted.size()];
        int i = 0;
        for (int state : sorted) {
            array[i++] = state;
        }
        return new StateSet(array);
    }

    public boolean contains(int state) {
        return Arrays.binarySearch(states, state) >= 0;
    }

    public boolean isEmpty() {
        return states.length == 0;
    }

    public int size() {
        return states.length;
    }

    /** Returns the ids in ascending order. */
    public int[] toArray() {
        return states.clone();
    }

    /** Returns the ids in ascending order as a mutable set. */
    public Set<Integer> toSet() {
        Set<Integer> set = new TreeSet<>();
        for (int state : states) {
            set.add(state);
        }
        return set;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StateSet && Arrays.equals(states, ((StateSet) o).states);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(states);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < states.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(states[i]);
        }
        return sb.append('}').toString();
    }
}
