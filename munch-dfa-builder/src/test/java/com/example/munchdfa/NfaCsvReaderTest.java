package com.example.munchdfa;

import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

public class NfaCsvReaderTest {

    static Path resource(String name) throws URISyntaxException {
        return Paths.get(NfaCsvReaderTest.class.getResource("/" + name).toURI());
    }

    private static Nfa read(String csv) throws IOException {
        Nfa.Builder builder = Nfa.builder();
        NfaCsvReader.read(new StringReader(csv), "test.csv", builder);
        return builder.build();
    }

    @Test
    public void readsFixtureWithCommentsAndHeader() throws Exception {
        Nfa.Builder builder = Nfa.builder();
        int count = NfaCsvReader.read(resource("nfa-transitions.csv"), builder);
        Nfa nfa = builder.build();

        assertThat(count, is(25));
        assertThat(nfa.transitionCount(), is(25));
        assertThat(nfa.targets(0, Nfa.EPSILON), equalTo(StateSet.of(1, 4, 7, 10)));
        assertThat(nfa.targets(11, '='), equalTo(StateSet.of(12)));
        assertThat(nfa.alphabet().size(), is(9));
    }

    @Test
    public void emptyInputIsEpsilonAndSpaceIsASymbol() throws Exception {
        Nfa nfa = read("0,,1\n1, ,2\n");
        assertThat(nfa.targets(0, Nfa.EPSILON), equalTo(StateSet.of(1)));
        assertThat(nfa.targets(1, ' '), equalTo(StateSet.of(2)));
    }

    @Test
    public void quotedCommaIsASymbol() throws Exception {
        Nfa nfa = read("From,Input,To\n0,\",\",1\n");
        assertThat(nfa.targets(0, ','), equalTo(StateSet.of(1)));
    }

    @Test
    public void repeatedPairsAccumulateTargets() throws Exception {
        Nfa nfa = read("0,a,1\n0,a,2\n0,a,1\n");
        assertThat(nfa.targets(0, 'a'), equalTo(StateSet.of(1, 2)));
    }

    @Test
    public void emptyFileGivesNoTransitions() throws Exception {
        assertThat(read("").transitionCount(), is(0));
    }

    @Test
    public void multiCharacterInputIsRejected() {
        MalformedAutomatonException first = assertThrows(MalformedAutomatonException.class,
                () -> read("0,ab,1\n"));
        assertThat(first.getMessage(), containsString("single character"));

        MalformedAutomatonException third = assertThrows(MalformedAutomatonException.class,
                () -> read("0,a,1\n1,b,2\n2,cd,3\n"));
        assertThat(third.getLineNumber() - first.getLineNumber(), is(2L));
        assertThat(third.getMessage(), containsString("test.csv:" + third.getLineNumber() + ":"));
    }

    @Test
    public void paddedInputIsNotTrimmed() {
        MalformedAutomatonException e = assertThrows(MalformedAutomatonException.class,
                () -> read("0, a ,1\n"));
        assertThat(e.getMessage(), containsString("' a '"));
    }

    @Test
    public void nonIntegerStateIsRejected() {
        MalformedAutomatonException e = assertThrows(MalformedAutomatonException.class,
                () -> read("0,a,1\nq0,a,1\n"));
        assertThat(e.getMessage(), containsString("q0"));
    }

    @Test
    public void wrongFieldCountIsRejected() {
        assertThrows(MalformedAutomatonException.class, () -> read("0,a\n"));
        assertThrows(MalformedAutomatonException.class, () -> read("0,a,1,2\n"));
    }

    @Test
    public void negativeStateIsRejected() {
        assertThrows(MalformedAutomatonException.class, () -> read("-1,a,1\n"));
    }
}
