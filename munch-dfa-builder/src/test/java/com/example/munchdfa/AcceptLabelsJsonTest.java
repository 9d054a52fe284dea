package com.example.munchdfa;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class AcceptLabelsJsonTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void readsNfaStatesFixture() throws Exception {
        AcceptLabelsJson.NfaStates states = AcceptLabelsJson.readNfaStates(NfaCsvReaderTest.resource("nfa-states.json"));
        assertThat(states.getStart(), is(0));
        assertThat(states.getAccept().size(), is(5));
        assertThat(states.getAccept().get(5), is("identifier"));
        assertThat(states.getAccept().get(12), is("equals"));
    }

    @Test
    public void startIsFirstInitialStateOrZero() throws Exception {
        AcceptLabelsJson.NfaStates states = AcceptLabelsJson.readNfaStates(
                new StringReader("{\"initial\": [\"4\", 9], \"final\": [[\"6\", \"X\"]]}"), "states.json");
        assertThat(states.getStart(), is(4));
        assertThat(states.getAccept().get(6), is("X"));

        states = AcceptLabelsJson.readNfaStates(new StringReader("{\"final\": []}"), "states.json");
        assertThat(states.getStart(), is(0));
        assertTrue(states.getAccept().isEmpty());
    }

    @Test
    public void appliesToBuilder() throws Exception {
        AcceptLabelsJson.NfaStates states = AcceptLabelsJson.readNfaStates(
                new StringReader("{\"initial\": [2], \"final\": [[3, \"X\"]]}"), "states.json");
        Nfa nfa = states.applyTo(Nfa.builder()).build();
        assertThat(nfa.getStart(), is(2));
        assertThat(nfa.getAccept().get(3), is("X"));
    }

    @Test
    public void dfaAcceptIsWrittenAsSortedPairs() throws Exception {
        Map<Integer, String> accept = new HashMap<>();
        accept.put(10, "B");
        accept.put(2, "A, C");
        StringWriter out = new StringWriter();
        AcceptLabelsJson.writeDfaAccept(accept, out);
        assertThat(out.toString(), is("[[2,\"A, C\"],[10,\"B\"]]"));
    }

    @Test
    public void dfaAcceptFileRoundTrip() throws Exception {
        Dfa dfa = SubsetConstructor.convert(NfaTest.abbNfa());
        Path file = tmp.newFile("final-states.json").toPath();
        AcceptLabelsJson.writeDfaAccept(dfa.getAccept(), file);
        SortedMap<Integer, String> accept = AcceptLabelsJson.readDfaAccept(file);
        assertThat(accept, equalTo(dfa.getAccept()));
    }

    @Test
    public void malformedDocumentsAreRejected() {
        assertThrows(MalformedAutomatonException.class,
                () -> AcceptLabelsJson.readDfaAccept(new StringReader("[[1]]"), "a.json"));
        assertThrows(MalformedAutomatonException.class,
                () -> AcceptLabelsJson.readDfaAccept(new StringReader("[[1, 2]]"), "a.json"));
        assertThrows(MalformedAutomatonException.class,
                () -> AcceptLabelsJson.readDfaAccept(new StringReader("{\"1\": \"A\"}"), "a.json"));
        assertThrows(MalformedAutomatonException.class,
                () -> AcceptLabelsJson.readDfaAccept(new StringReader("[[-3, \"A\"]]"), "a.json"));
        assertThrows(MalformedAutomatonException.class,
                () -> AcceptLabelsJson.readDfaAccept(new StringReader("[[1, \"A\"]"), "a.json"));
        assertThrows(MalformedAutomatonException.class,
                () -> AcceptLabelsJson.readNfaStates(new StringReader("[]"), "s.json"));
        assertThrows(MalformedAutomatonException.class,
                () -> AcceptLabelsJson.readNfaStates(new StringReader("{\"initial\": 0}"), "s.json"));
    }
}
