package com.example.munchdfa;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.deser.FromXmlParser;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reads and writes finite automata in the JFLAP {@code .jff} XML format.
 *
 * <p>A {@code read} element is a single character, empty for an epsilon
 * edge, or one of the classes {@code [0-9]}, {@code [a-z]} and
 * {@code [A-Z]}, which expand to one edge per character. The start state is
 * the first state marked {@code <initial/>}, or 0 when none is. A final
 * state is labelled with its {@code <label>}, or else its {@code name}, or
 * else its id.
 */
public final class JflapFile {

    private static final Logger log = LoggerFactory.getLogger(JflapFile.class);

    private static final XmlMapper MAPPER = (XmlMapper) ((XmlMapper) new XmlMapper()
            .disable(FromXmlParser.Feature.EMPTY_ELEMENT_AS_NULL))
            .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION);

    @JacksonXmlRootElement(localName = "structure")
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"type", "automaton"})
    public static class Structure {
        private String type;
        private Automaton automaton;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public Automaton getAutomaton() { return automaton; }
        public void setAutomaton(Automaton automaton) { this.automaton = automaton; }
    }

    /** States and transitions may interleave; each element is appended as it is read. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"state", "transition"})
    public static class Automaton {
        private final List<State> states = new ArrayList<>();
        private final List<Edge> transitions = new ArrayList<>();

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "state")
        public List<State> getStates() { return states; }

        @JacksonXmlProperty(localName = "state")
        public void setState(State state) { states.add(state); }

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "transition")
        public List<Edge> getTransitions() { return transitions; }

        @JacksonXmlProperty(localName = "transition")
        public void setTransition(Edge edge) { transitions.add(edge); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"id", "name", "x", "y", "initial", "final", "label"})
    public static class State {
        @JacksonXmlProperty(isAttribute = true)
        private String id;

        @JacksonXmlProperty(isAttribute = true)
        private String name;

        private String x;
        private String y;
        private String initial;

        @JacksonXmlProperty(localName = "final")
        private String finalMarker;

        private String label;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getX() { return x; }
        public void setX(String x) { this.x = x; }

        public String getY() { return y; }
        public void setY(String y) { this.y = y; }

        // Present (usually empty) when the state is marked, null otherwise
        public String getInitial() { return initial; }
        public void setInitial(String initial) { this.initial = initial; }

        public String getFinalMarker() { return finalMarker; }
        public void setFinalMarker(String finalMarker) { this.finalMarker = finalMarker; }

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"from", "to", "read"})
    public static class Edge {
        private String from;
        private String to;
        private String read;

        public String getFrom() { return from; }
        public void setFrom(String from) { this.from = from; }

        public String getTo() { return to; }
        public void setTo(String to) { this.to = to; }

        public String getRead() { return read; }
        public void setRead(String read) { this.read = read; }
    }

    private JflapFile() {
    }

    /**
     * Sets the start state and adds every accept label and transition in
     * {@code file} to {@code nfa}. Returns the number of transitions added.
     */
    public static int read(Path file, Nfa.Builder nfa) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int count = read(reader, file.toString(), nfa);
            log.debug("Read {} NFA transitions from {}", count, file);
            return count;
        }
    }

    public static int read(Reader reader, String source, Nfa.Builder nfa) throws IOException {
        Structure structure;
        try {
            structure = MAPPER.readValue(reader, Structure.class);
        } catch (JsonProcessingException e) {
            throw new MalformedAutomatonException(source + ": " + e.getOriginalMessage(), e);
        }
        if (structure == null || structure.automaton == null) {
            throw new MalformedAutomatonException(source + ": missing <automaton> element");
        }
        if (structure.type != null && !structure.type.trim().equals("fa")) {
            throw new MalformedAutomatonException(source + ": expected a finite automaton but type is '"
                    + structure.type.trim() + "'");
        }

        boolean started = false;
        for (State state : structure.automaton.states) {
            int id = stateId(state.id, source);
            if (state.initial != null && !started) {
                nfa.start(id);
                started = true;
            }
            if (state.finalMarker != null) {
                nfa.accept(id, labelOf(state));
            }
        }
        if (!started) {
            nfa.start(0);
        }

        int count = 0;
        for (Edge edge : structure.automaton.transitions) {
            int from = stateId(edge.from, source);
            int to = stateId(edge.to, source);
            for (int symbol : symbols(edge.read, source, from)) {
                nfa.transition(from, symbol, to);
                count++;
            }
        }
        return count;
    }

    /** Writes {@code nfa} as a JFLAP finite automaton, one edge per transition. */
    public static void write(Nfa nfa, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(nfa, writer);
        }
        log.debug("Wrote {} NFA transitions to {}", nfa.transitionCount(), file);
    }

    public static void write(Nfa nfa, Writer writer) throws IOException {
        List<Transition> transitions = nfa.transitions();
        SortedSet<Integer> ids = new TreeSet<>(nfa.getAccept().keySet());
        ids.add(nfa.getStart());
        for (Transition t : transitions) {
            ids.add(t.getSource());
            ids.add(t.getTarget());
        }

        Automaton automaton = new Automaton();
        for (int id : ids) {
            State state = new State();
            state.id = Integer.toString(id);
            state.name = "q" + id;
            // JFLAP needs a position; lay the states out in a row
            state.x = Double.toString(id * 100.0);
            state.y = "100.0";
            if (id == nfa.getStart()) {
                state.initial = "";
            }
            String label = nfa.getAccept().get(id);
            if (label != null) {
                state.finalMarker = "";
                state.label = label;
            }
            automaton.setState(state);
        }
        for (Transition t : transitions) {
            Edge edge = new Edge();
            edge.from = Integer.toString(t.getSource());
            edge.to = Integer.toString(t.getTarget());
            edge.read = t.getSymbol() == Nfa.EPSILON ? "" : new String(Character.toChars(t.getSymbol()));
            automaton.setTransition(edge);
        }

        Structure structure = new Structure();
        structure.type = "fa";
        structure.automaton = automaton;
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(writer, structure);
    }

    private static String labelOf(State state) {
        if (state.label != null && !state.label.trim().isEmpty()) {
            return state.label.trim();
        }
        if (state.name != null && !state.name.trim().isEmpty()) {
            return state.name.trim();
        }
        return state.id.trim();
    }

    static List<Integer> symbols(String read, String source, int from) throws MalformedAutomatonException {
        List<Integer> symbols = new ArrayList<>();
        if (read == null || read.isEmpty()) {
            symbols.add(Nfa.EPSILON);
        } else if (read.equals("[0-9]")) {
            addRange(symbols, '0', '9');
        } else if (read.equals("[a-z]")) {
            addRange(symbols, 'a', 'z');
        } else if (read.equals("[A-Z]")) {
            addRange(symbols, 'A', 'Z');
        } else if (read.codePointCount(0, read.length()) == 1) {
            symbols.add(read.codePointAt(0));
        } else {
            throw new MalformedAutomatonException(source + ": transition from state " + from
                    + " reads '" + read + "', expected a single character or one of [0-9], [a-z], [A-Z]");
        }
        return symbols;
    }

    private static void addRange(List<Integer> symbols, char first, char last) {
        for (char c = first; c <= last; c++) {
            symbols.add((int) c);
        }
    }

    private static int stateId(String field, String source) throws MalformedAutomatonException {
        if (field == null) {
            throw new MalformedAutomatonException(source + ": state id is missing");
        }
        String value = field.trim();
        int state;
        try {
            state = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedAutomatonException(source + ": state is not an integer: '" + value + "'");
        }
        if (state < 0) {
            throw new MalformedAutomatonException(source + ": negative state id: " + state);
        }
        return state;
    }
}
