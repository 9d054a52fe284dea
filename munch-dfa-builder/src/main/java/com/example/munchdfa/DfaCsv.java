package com.example.munchdfa;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
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
import java.util.Map;

/**
 * Reads and writes DFA transition tables as {@code From,Input,To} CSV with a
 * header row. Each input is a single code point. Accept labels travel
 * separately, see {@link AcceptLabelsJson}.
 */
public final class DfaCsv {

    private static final Logger log = LoggerFactory.getLogger(DfaCsv.class);

    private static final CsvMapper MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = MAPPER.schemaFor(TransitionRecord.class).withHeader();

    @JsonPropertyOrder({"From", "Input", "To"})
    public static class TransitionRecord {
        @JsonProperty("From")
        private int from;

        @JsonProperty("Input")
        private String input;

        @JsonProperty("To")
        private int to;

        public TransitionRecord() {}

        public TransitionRecord(int from, String input, int to) {
            this.from = from;
            this.input = input;
            this.to = to;
        }

        // Getters and setters
        public int getFrom() { return from; }
        public void setFrom(int from) { this.from = from; }

        public String getInput() { return input; }
        public void setInput(String input) { this.input = input; }

        public int getTo() { return to; }
        public void setTo(int to) { this.to = to; }
    }

    private DfaCsv() {
    }

    /** Writes the transitions of {@code dfa}, ordered by source and then symbol. */
    public static void write(Dfa dfa, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(dfa, writer);
        }
        log.debug("Wrote {} DFA transitions to {}", dfa.transitionCount(), file);
    }

    public static void write(Dfa dfa, Writer writer) throws IOException {
        List<TransitionRecord> records = new ArrayList<>(dfa.transitionCount());
        for (Transition t : dfa.transitions()) {
            records.add(new TransitionRecord(t.getSource(), new String(Character.toChars(t.getSymbol())), t.getTarget()));
        }
        MAPPER.writer(SCHEMA).writeValue(writer, records);
    }

    /**
     * Reads a transition table and combines it with {@code start} and the
     * {@code accept} labels into a DFA.
     */
    public static Dfa read(Path file, int start, Map<Integer, String> accept) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Dfa dfa = read(reader, file.toString(), start, accept);
            log.debug("Read {} DFA transitions from {}", dfa.transitionCount(), file);
            return dfa;
        }
    }

    public static Dfa read(Reader reader, String source, int start, Map<Integer, String> accept) throws IOException {
        Dfa.Builder dfa = Dfa.builder().start(start);
        for (Map.Entry<Integer, String> entry : accept.entrySet()) {
            dfa.accept(entry.getKey(), entry.getValue());
        }
        try (MappingIterator<TransitionRecord> records = MAPPER.readerFor(TransitionRecord.class)
                .with(SCHEMA).readValues(reader)) {
            while (records.hasNextValue()) {
                TransitionRecord record = records.nextValue();
                long line = records.getParser().getTokenLocation().getLineNr();
                String input = record.getInput() == null ? "" : record.getInput();
                if (input.isEmpty()) {
                    throw new MalformedAutomatonException(source, line, "empty input field");
                }
                if (input.codePointCount(0, input.length()) != 1) {
                    throw new MalformedAutomatonException(source, line,
                            "expected a single character for input but found '" + input + "'");
                }
                try {
                    dfa.transition(record.getFrom(), input.codePointAt(0), record.getTo());
                } catch (IllegalArgumentException e) {
                    throw new MalformedAutomatonException(source, line, e.getMessage());
                }
            }
        } catch (JsonProcessingException e) {
            throw new MalformedAutomatonException(source + ": " + e.getOriginalMessage(), e);
        }
        return dfa.build();
    }
}
