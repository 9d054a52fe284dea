package com.example.munchdfa;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.*;

/**
 * Serializes a DFA to a single JSON document and reads it back.
 *
 * <p>Runs of consecutive code points leading from the same state to the same
 * target are written as one inclusive range. State ids are written as they
 * are in the {@link Dfa}.
 */
public class AutomatonSerializer {

    private static final Logger log = LoggerFactory.getLogger(AutomatonSerializer.class);

    public static class TransitionEntry {
        @JsonProperty("curr_state")
        private int currState;

        @JsonProperty("range_start")
        private int rangeStart;

        @JsonProperty("range_end")
        private int rangeEnd;

        @JsonProperty("next_state")
        private int nextState;

        public TransitionEntry() {}

        public TransitionEntry(int currState, int rangeStart, int rangeEnd, int nextState) {
            this.currState = currState;
            this.rangeStart = rangeStart;
            this.rangeEnd = rangeEnd;
            this.nextState = nextState;
        }

        // Getters and setters
        public int getCurrState() { return currState; }
        public void setCurrState(int currState) { this.currState = currState; }

        public int getRangeStart() { return rangeStart; }
        public void setRangeStart(int rangeStart) { this.rangeStart = rangeStart; }

        public int getRangeEnd() { return rangeEnd; }
        public void setRangeEnd(int rangeEnd) { this.rangeEnd = rangeEnd; }

        public int getNextState() { return nextState; }
        public void setNextState(int nextState) { this.nextState = nextState; }
    }

    public static class AutomatonJson {
        @JsonProperty("_comment")
        private String comment;

        @JsonProperty("start_state")
        private int startState;

        @JsonProperty("match_states")
        private List<Integer> matchStates;

        @JsonProperty("match_labels")
        private Map<Integer, String> matchLabels;

        @JsonProperty("transition_table")
        private List<TransitionEntry> transitionTable;

        public AutomatonJson() {}

        public AutomatonJson(String comment, int startState, List<Integer> matchStates,
                             Map<Integer, String> matchLabels, List<TransitionEntry> transitionTable) {
            this.comment = comment;
            this.startState = startState;
            this.matchStates = matchStates;
            this.matchLabels = matchLabels;
            this.transitionTable = transitionTable;
        }

        // Getters and setters
        public String getComment() { return comment; }
        public void setComment(String comment) { this.comment = comment; }

        public int getStartState() { return startState; }
        public void setStartState(int startState) { this.startState = startState; }

        public List<Integer> getMatchStates() { return matchStates; }
        public void setMatchStates(List<Integer> matchStates) { this.matchStates = matchStates; }

        public Map<Integer, String> getMatchLabels() { return matchLabels; }
        public void setMatchLabels(Map<Integer, String> matchLabels) { this.matchLabels = matchLabels; }

        public List<TransitionEntry> getTransitionTable() { return transitionTable; }
        public void setTransitionTable(List<TransitionEntry> transitionTable) { this.transitionTable = transitionTable; }
    }

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Serializes a DFA to JSON and saves to file
     */
    public static void serializeToJson(Dfa dfa, String comment, File file) throws IOException {
        MAPPER.writeValue(file, toJson(dfa, comment));
        log.debug("Automaton serialized to {}", file);
    }

    public static String serializeToString(Dfa dfa, String comment) throws IOException {
        return MAPPER.writeValueAsString(toJson(dfa, comment));
    }

    /**
     * Builds the JSON model of a DFA, coalescing symbol runs into ranges
     */
    public static AutomatonJson toJson(Dfa dfa, String comment) {
        List<Integer> matchStates = new ArrayList<>(dfa.getAccept().keySet());
        Map<Integer, String> matchLabels = new TreeMap<>(dfa.getAccept());

        // Transitions come sorted by state, then symbol, so a run is contiguous
        List<TransitionEntry> transitionTable = new ArrayList<>();
        TransitionEntry open = null;
        for (Transition t : dfa.transitions()) {
            if (open != null
                    && open.currState == t.getSource()
                    && open.nextState == t.getTarget()
                    && open.rangeEnd + 1 == t.getSymbol()) {
                open.rangeEnd = t.getSymbol();
                continue;
            }
            open = new TransitionEntry(t.getSource(), t.getSymbol(), t.getSymbol(), t.getTarget());
            transitionTable.add(open);
        }

        return new AutomatonJson(comment, dfa.getStart(), matchStates, matchLabels, transitionTable);
    }

    /**
     * Reads a DFA previously written by {@link #serializeToJson}
     */
    public static Dfa read(File file) throws IOException {
        AutomatonJson json;
        try {
            json = MAPPER.readValue(file, AutomatonJson.class);
        } catch (JsonProcessingException e) {
            throw new MalformedAutomatonException(file + ": " + e.getOriginalMessage(), e);
        }
        Dfa dfa = fromJson(json, file.toString());
        log.debug("Automaton read from {} with {} transitions", file, dfa.transitionCount());
        return dfa;
    }

    public static Dfa fromJson(AutomatonJson json, String source) throws MalformedAutomatonException {
        Map<Integer, String> labels = json.matchLabels == null ? Collections.emptyMap() : json.matchLabels;
        List<Integer> matchStates = json.matchStates == null ? Collections.emptyList() : json.matchStates;
        List<TransitionEntry> table = json.transitionTable == null ? Collections.emptyList() : json.transitionTable;
        try {
            Dfa.Builder dfa = Dfa.builder().start(json.startState);
            for (Integer state : matchStates) {
                if (state == null) {
                    throw new MalformedAutomatonException(source + ": null entry in match_states");
                }
                String label = labels.get(state);
                if (label == null) {
                    throw new MalformedAutomatonException(source + ": match state " + state + " has no label");
                }
                dfa.accept(state, label);
            }
            for (TransitionEntry entry : table) {
                if (entry == null) {
                    throw new MalformedAutomatonException(source + ": null entry in transition_table");
                }
                if (entry.rangeStart > entry.rangeEnd) {
                    throw new MalformedAutomatonException(source + ": empty range " + entry.rangeStart
                            + ".." + entry.rangeEnd + " from state " + entry.currState);
                }
                for (int symbol = entry.rangeStart; symbol <= entry.rangeEnd; symbol++) {
                    dfa.transition(entry.currState, symbol, entry.nextState);
                }
            }
            return dfa.build();
        } catch (IllegalArgumentException e) {
            throw new MalformedAutomatonException(source + ": " + e.getMessage(), e);
        }
    }
}
