package com.example.munchdfa;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

/** Tests for {@link MaximalMunchScanner}. */
public class MaximalMunchScannerTest {

    /** 0 -a-> 1 -a-> 2, with 1 labelled A and 2 labelled AA. */
    private static Dfa aaDfa() {
        return Dfa.builder()
                .start(0)
                .transition(0, 'a', 1)
                .transition(1, 'a', 2)
                .accept(1, "A")
                .accept(2, "AA")
                .build();
    }

    /**
     * Lexer NFA: keyword "if", identifiers, numbers, '=' and '=='.
     * Same shape as the builder fixture, restricted to a few letters.
     */
    static Dfa lexerDfa() {
        Nfa.Builder nfa = Nfa.builder().start(0)
                .epsilon(0, 1).transition(1, 'i', 2).transition(2, 'f', 3)
                .epsilon(0, 4)
                .epsilon(0, 7).epsilon(8, 7)
                .epsilon(0, 10).transition(10, '=', 11).transition(11, '=', 12)
                .accept(3, "keyword")
                .accept(5, "identifier")
                .accept(8, "number")
                .accept(11, "assign")
                .accept(12, "equals");
        for (char c : "abfix".toCharArray()) {
            nfa.transition(4, c, 5).transition(5, c, 5);
        }
        for (char c : "012".toCharArray()) {
            nfa.transition(5, c, 5).transition(7, c, 8);
        }
        return SubsetConstructor.convert(nfa.build());
    }

    private static List<Token> scan(Dfa dfa, String input) throws LexicalException {
        return new MaximalMunchScanner(dfa).scan(input);
    }

    @Test
    public void longestMatchWins() throws Exception {
        assertThat(scan(aaDfa(), "aa"), equalTo(Collections.singletonList(new Token("AA", "aa"))));
    }

    @Test
    public void whitespaceSeparatesTokens() throws Exception {
        assertThat(scan(aaDfa(), "a  a"), equalTo(Arrays.asList(new Token("A", "a"), new Token("A", "a"))));
        assertThat(scan(aaDfa(), "\taaa\n\r\n"), equalTo(Arrays.asList(new Token("AA", "aa"), new Token("A", "a"))));
    }

    @Test
    public void emptyAndBlankInputGiveNoTokens() throws Exception {
        assertThat(scan(aaDfa(), ""), equalTo(Collections.<Token>emptyList()));
        assertThat(scan(aaDfa(), " \n\t "), equalTo(Collections.<Token>emptyList()));
    }

    @Test
    public void errorReportsLineColumnAndCharacter() {
        LexicalException e = assertThrows(LexicalException.class, () -> scan(aaDfa(), "a\naZ"));
        assertThat(e.getLine(), is(2));
        assertThat(e.getColumn(), is(2));
        assertThat(e.getCharacter(), is("Z"));
        assertThat(e.getOffset(), is(3));
        assertThat(e.getMessage(), is("Unexpected character 'Z' at line 2, column 2"));
    }

    @Test
    public void errorOnFirstCharacter() {
        LexicalException e = assertThrows(LexicalException.class, () -> scan(aaDfa(), "  b"));
        assertThat(e.getLine(), is(1));
        assertThat(e.getColumn(), is(3));
        assertThat(e.getCodePoint(), is((int) 'b'));
    }

    @Test
    public void backsUpToLastAcceptingPosition() throws Exception {
        // "ab" and "abcd" are tokens, "abc" is only a prefix
        Dfa dfa = Dfa.builder()
                .transition(0, 'a', 1).transition(1, 'b', 2)
                .transition(2, 'c', 3).transition(3, 'd', 4)
                .transition(0, 'c', 5)
                .accept(2, "AB").accept(4, "ABCD").accept(5, "C")
                .build();
        assertThat(scan(dfa, "abcab"), equalTo(Arrays.asList(
                new Token("AB", "ab"), new Token("C", "c"), new Token("AB", "ab"))));
        assertThat(scan(dfa, "abcd"), equalTo(Collections.singletonList(new Token("ABCD", "abcd"))));

        LexicalException e = assertThrows(LexicalException.class, () -> scan(dfa, "abca"));
        assertThat(e.getColumn(), is(4));
    }

    @Test
    public void acceptingStartStateNeverMatchesEmptyLexeme() throws Exception {
        Nfa nfa = Nfa.builder().start(0).accept(0, "S").build();
        Dfa dfa = SubsetConstructor.convert(nfa);
        assertThat(dfa.label(0), is("S"));
        assertThat(scan(dfa, ""), equalTo(Collections.<Token>emptyList()));

        LexicalException e = assertThrows(LexicalException.class, () -> scan(dfa, "x"));
        assertThat(e.getLine(), is(1));
        assertThat(e.getColumn(), is(1));
        assertThat(e.getCharacter(), is("x"));
    }

    @Test
    public void tokenizesWithConstructedLexer() throws Exception {
        assertThat(scan(lexerDfa(), "if x == 12\nifx=a1"), equalTo(Arrays.asList(
                new Token("keyword, identifier", "if"),
                new Token("identifier", "x"),
                new Token("equals", "=="),
                new Token("number", "12"),
                new Token("identifier", "ifx"),
                new Token("assign", "="),
                new Token("identifier", "a1"))));
    }

    @Test
    public void constructedLexerReportsErrorPosition() {
        LexicalException e = assertThrows(LexicalException.class, () -> scan(lexerDfa(), "x = 1\n  12 + 2"));
        assertThat(e.getLine(), is(2));
        assertThat(e.getColumn(), is(6));
        assertThat(e.getCharacter(), is("+"));
    }

    @Test
    public void supplementaryCodePointsCountAsOneColumn() throws Exception {
        int smile = 0x1F600;
        Dfa dfa = Dfa.builder()
                .transition(0, smile, 1)
                .transition(0, 'a', 2)
                .accept(1, "emoji").accept(2, "A")
                .build();
        String face = new String(Character.toChars(smile));
        assertThat(scan(dfa, face + " a"), equalTo(Arrays.asList(new Token("emoji", face), new Token("A", "a"))));

        LexicalException e = assertThrows(LexicalException.class, () -> scan(dfa, face + "a?"));
        assertThat(e.getColumn(), is(3));
        assertThat(e.getOffset(), is(3));
    }
}
