package com.example.munchdfa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads NFA transitions from a {@code From,Input,To} CSV table.
 *
 * <p>Blank rows, rows whose first field starts with {@code //} and a
 * {@code From,Input,To} header row are skipped. An empty {@code Input} is an
 * epsilon transition; any other input must be exactly one code point. The
 * input field is taken verbatim so that a space can label a transition.
 */
public final class NfaCsvReader {

    private static final Logger log = LoggerFactory.getLogger(NfaCsvReader.class);

    private static final CsvMapper MAPPER = new CsvMapper()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES);

    private NfaCsvReader() {
    }

    /** Adds every transition in {@code file} to {@code nfa}. Returns the number added. */
    public static int read(Path file, Nfa.Builder nfa) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int count = read(reader, file.toString(), nfa);
            log.debug("Read {} NFA transitions from {}", count, file);
            return count;
        }
    }

    /**
     * Adds every transition read from {@code reader} to {@code nfa}.
     * {@code source} names the input in error messages.
     */
    public static int read(Reader reader, String source, Nfa.Builder nfa) throws IOException {
        int count = 0;
        try (MappingIterator<String[]> rows = MAPPER.readerFor(String[].class).readValues(reader)) {
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                long line = rows.getParser().getTokenLocation().getLineNr();
                if (isSkipped(row)) {
                    continue;
                }
                if (row.length != 3) {
                    throw new MalformedAutomatonException(source, line,
                            "expected 3 fields (From,Input,To) but found " + row.length);
                }
                int from = parseState(row[0], source, line);
                int symbol = parseSymbol(row[1], source, line);
                int to = parseState(row[2], source, line);
                nfa.transition(from, symbol, to);
                count++;
            }
        } catch (JsonProcessingException e) {
            throw new MalformedAutomatonException(source + ": " + e.getOriginalMessage(), e);
        }
        return count;
    }

    private static boolean isSkipped(String[] row) {
        if (row.length == 0 || (row.length == 1 && row[0].trim().isEmpty())) {
            return true;
        }
        String first = row[0].trim();
        return first.startsWith("//") || first.equalsIgnoreCase("From");
    }

    static int parseState(String field, String source, long line) throws MalformedAutomatonException {
        String value = field.trim();
        int state;
        try {
            state = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedAutomatonException(source, line, "state is not an integer: '" + value + "'");
        }
        if (state < 0) {
            throw new MalformedAutomatonException(source, line, "negative state id: " + state);
        }
        return state;
    }

    private static int parseSymbol(String field, String source, long line) throws MalformedAutomatonException {
        if (field.isEmpty()) {
            return Nfa.EPSILON;
        }
        if (field.codePointCount(0, field.length()) != 1) {
            throw new MalformedAutomatonException(source, line,
                    "expected a single character for input but found '" + field + "'");
        }
        return field.codePointAt(0);
    }
}
