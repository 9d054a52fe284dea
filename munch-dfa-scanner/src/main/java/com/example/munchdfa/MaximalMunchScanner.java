package com.example.munchdfa;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into tokens by running a DFA from each token start and keeping
 * the longest prefix that ends in an accept state.
 *
 * <p>Whitespace between tokens is skipped and never part of a lexeme.
 * Every token consumes at least one character; reaching an accept state
 * without consuming input does not count. When no accepting prefix exists
 * the whole scan fails with a {@link LexicalException} pointing at the
 * first character of the failed token.
 *
 * <p>A scanner holds no state between calls and may be shared by threads.
 */
public final class MaximalMunchScanner {

    private final Dfa dfa;

    public MaximalMunchScanner(Dfa dfa) {
        if (dfa == null) {
            throw new NullPointerException("dfa");
        }
        this.dfa = dfa;
    }

    public List<Token> scan(CharSequence input) throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        int length = input.length();
        int i = 0;
        while (true) {
            while (i < length && Character.isWhitespace(Character.codePointAt(input, i))) {
                i += Character.charCount(Character.codePointAt(input, i));
            }
            if (i >= length) {
                return tokens;
            }

            int state = dfa.getStart();
            int lastAcceptState = Dfa.NO_STATE;
            int lastAcceptEnd = i;
            int j = i;
            while (j < length) {
                int c = Character.codePointAt(input, j);
                state = dfa.next(state, c);
                if (state == Dfa.NO_STATE) {
                    break;
                }
                j += Character.charCount(c);
                if (dfa.isAccepting(state)) {
                    lastAcceptState = state;
                    lastAcceptEnd = j;
                }
            }

            if (lastAcceptState == Dfa.NO_STATE) {
                throw error(input, i);
            }
            tokens.add(new Token(dfa.label(lastAcceptState), input.subSequence(i, lastAcceptEnd).toString()));
            i = lastAcceptEnd;
        }
    }

    private static LexicalException error(CharSequence input, int offset) {
        int line = 1;
        int column = 1;
        int k = 0;
        while (k < offset) {
            int c = Character.codePointAt(input, k);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            k += Character.charCount(c);
        }
        return new LexicalException(line, column, offset, Character.codePointAt(input, offset));
    }
}
