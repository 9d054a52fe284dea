package com.example.munchdfa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * JSON files describing start and accept states.
 *
 * <p>NFA state files look like
 * <pre>{"initial": [0], "final": [[3, "identifier"], [7, "number"]]}</pre>
 * and DFA accept files are just the list of {@code [state, label]} pairs.
 */
public final class AcceptLabelsJson {

    private static final Logger log = LoggerFactory.getLogger(AcceptLabelsJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Start state and accept labels of an NFA. */
    public static final class NfaStates {
        private final int start;
        private final SortedMap<Integer, String> accept;

        public NfaStates(int start, Map<Integer, String> accept) {
            this.start = start;
            this.accept = Collections.unmodifiableSortedMap(new TreeMap<>(accept));
        }

        public int getStart() { return start; }

        public SortedMap<Integer, String> getAccept() { return accept; }

        /** Sets the start state and adds every accept label to {@code nfa}. */
        public Nfa.Builder applyTo(Nfa.Builder nfa) {
            nfa.start(start);
            for (Map.Entry<Integer, String> entry : accept.entrySet()) {
                nfa.accept(entry.getKey(), entry.getValue());
            }
            return nfa;
        }
    }

    private AcceptLabelsJson() {
    }

    public static NfaStates readNfaStates(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            NfaStates states = readNfaStates(reader, file.toString());
            log.debug("Read {} NFA accept states from {}", states.getAccept().size(), file);
            return states;
        }
    }

    /**
     * The start state is the first {@code initial} entry, or 0 when the list
     * is missing or empty.
     */
    public static NfaStates readNfaStates(Reader reader, String source) throws IOException {
        JsonNode root = parse(reader, source);
        if (!root.isObject()) {
            throw new MalformedAutomatonException(source + ": expected a JSON object with 'initial' and 'final'");
        }
        int start = 0;
        JsonNode initial = root.path("initial");
        if (initial.isArray() && initial.size() > 0) {
            start = stateId(initial.get(0), source);
        } else if (!initial.isMissingNode() && !initial.isArray()) {
            throw new MalformedAutomatonException(source + ": 'initial' must be an array");
        }
        JsonNode finals = root.path("final");
        SortedMap<Integer, String> accept = finals.isMissingNode() ? new TreeMap<>() : labelPairs(finals, source);
        return new NfaStates(start, accept);
    }

    public static SortedMap<Integer, String> readDfaAccept(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            SortedMap<Integer, String> accept = readDfaAccept(reader, file.toString());
            log.debug("Read {} DFA accept states from {}", accept.size(), file);
            return accept;
        }
    }

    public static SortedMap<Integer, String> readDfaAccept(Reader reader, String source) throws IOException {
        return labelPairs(parse(reader, source), source);
    }

    /** Writes {@code [[state, label], ...]} in ascending state order. */
    public static void writeDfaAccept(Map<Integer, String> accept, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeDfaAccept(accept, writer);
        }
        log.debug("Wrote {} DFA accept states to {}", accept.size(), file);
    }

    public static void writeDfaAccept(Map<Integer, String> accept, Writer writer) throws IOException {
        ArrayNode pairs = MAPPER.createArrayNode();
        for (Map.Entry<Integer, String> entry : new TreeMap<>(accept).entrySet()) {
            pairs.addArray().add(entry.getKey()).add(entry.getValue());
        }
        MAPPER.writeValue(writer, pairs);
    }

    private static JsonNode parse(Reader reader, String source) throws IOException {
        try {
            JsonNode root = MAPPER.readTree(reader);
            if (root == null || root.isMissingNode()) {
                throw new MalformedAutomatonException(source + ": empty document");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedAutomatonException(source + ": " + e.getOriginalMessage(), e);
        }
    }

    private static SortedMap<Integer, String> labelPairs(JsonNode pairs, String source)
            throws MalformedAutomatonException {
        if (!pairs.isArray()) {
            throw new MalformedAutomatonException(source + ": expected an array of [state, label] pairs");
        }
        SortedMap<Integer, String> accept = new TreeMap<>();
        for (JsonNode pair : pairs) {
            if (!pair.isArray() || pair.size() != 2 || !pair.get(1).isTextual()) {
                throw new MalformedAutomatonException(source + ": expected [state, label] but found " + pair);
            }
            accept.put(stateId(pair.get(0), source), pair.get(1).asText());
        }
        return accept;
    }

    // JFF exports sometimes carry ids as strings
    private static int stateId(JsonNode node, String source) throws MalformedAutomatonException {
        int state;
        if (node.isInt()) {
            state = node.intValue();
        } else if (node.isTextual()) {
            try {
                state = Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedAutomatonException(source + ": state is not an integer: " + node);
            }
        } else {
            throw new MalformedAutomatonException(source + ": state is not an integer: " + node);
        }
        if (state < 0) {
            throw new MalformedAutomatonException(source + ": negative state id: " + state);
        }
        return state;
    }
}
