package com.example.munchdfa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.SortedMap;

/**
 * Command line tool that loads a DFA and either tokenizes an input file with
 * it or, with {@code --check}, reports whether the whole file is accepted.
 * The DFA is either a single JSON document or the transition CSV and
 * final-states JSON pair written by the builder; in the latter case the
 * start state is 0.
 */
public class MunchScannerDemo {

    private static final Logger log = LoggerFactory.getLogger(MunchScannerDemo.class);

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean check = args.length > 0 && args[0].equals("--check");
        int first = check ? 1 : 0;
        int positional = args.length - first;
        if (positional != 2 && positional != 3) {
            err.println("❗ Please provide a DFA (JSON document, or transition CSV and final-states JSON) and an input file as arguments.");
            err.println("👉 Usage: java MunchScannerDemo [--check] <dfa.json> <input-file>");
            err.println("👉 Usage: java MunchScannerDemo [--check] <dfa-transitions.csv> <dfa-final-states.json> <input-file>");
            return 2;
        }

        File inputFile = new File(args[args.length - 1]);

        try {
            // Step 1: Load the DFA
            Dfa dfa;
            if (positional == 2) {
                dfa = AutomatonSerializer.read(new File(args[first]));
            } else {
                SortedMap<Integer, String> accept = AcceptLabelsJson.readDfaAccept(Paths.get(args[first + 1]));
                dfa = DfaCsv.read(Paths.get(args[first]), 0, accept);
            }
            log.info("DFA loaded with {} states and {} transitions", dfa.stateCount(), dfa.transitionCount());

            // Step 2: Read the input
            String input;
            try {
                input = Files.readString(inputFile.toPath(), StandardCharsets.UTF_8);
            } catch (CharacterCodingException e) {
                throw new IOException(inputFile + " is not valid UTF-8", e);
            }

            // Step 3: Check or tokenize
            if (check) {
                out.println(new DfaMatcher(dfa).match(input));
                return 0;
            }
            List<Token> tokens = new MaximalMunchScanner(dfa).scan(input);
            for (Token token : tokens) {
                out.println(token.getCategory() + "\t" + token.getLexeme());
            }
            log.info("Scanned {} tokens", tokens.size());
            return 0;
        } catch (LexicalException e) {
            err.println("Lexical error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error occurred: " + e.getMessage());
            log.debug("Loading failed", e);
            return 1;
        }
    }
}
