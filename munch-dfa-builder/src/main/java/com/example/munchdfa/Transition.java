package com.example.munchdfa;

/**
 * One automaton edge: {@code source --symbol--> target}. The symbol is a code
 * point, or {@link Nfa#EPSILON} for an NFA epsilon edge.
 */
public final class Transition implements Comparable<Transition> {

    private final int source;
    private final int symbol;
    private final int target;

    public Transition(int source, int symbol, int target) {
        this.source = source;
        this.symbol = symbol;
        this.target = target;
    }

    public int getSource() { return source; }

    public int getSymbol() { return symbol; }

    public int getTarget() { return target; }

    /** Orders by source state, then by symbol, then by target. */
    @Override
    public int compareTo(Transition other) {
        if (source != other.source) {
            return Integer.compare(source, other.source);
        }
        if (symbol != other.symbol) {
            return Integer.compare(symbol, other.symbol);
        }
        return Integer.compare(target, other.target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Transition)) {
            return false;
        }
        Transition t = (Transition) o;
        return source == t.source && symbol == t.symbol && target == t.target;
    }

    @Override
    public int hashCode() {
        return (source * 31 + symbol) * 31 + target;
    }

    @Override
    public String toString() {
        String on = symbol == Nfa.EPSILON ? "\u03b5" : new String(Character.toChars(symbol));
        return source + " -" + on + "-> " + target;
    }
}
