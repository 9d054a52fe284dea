package com.example.munchdfa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command line tool that converts an NFA, given either as a transition CSV
 * plus states JSON or as a JFLAP {@code .jff} file, into a DFA and writes the
 * DFA transition CSV, accept-label JSON and the single-file JSON document.
 */
public class NfaDfaBuilder {

    private static final Logger log = LoggerFactory.getLogger(NfaDfaBuilder.class);

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean jflap = args.length > 0 && args[0].toLowerCase(Locale.ROOT).endsWith(".jff");
        int inputs = jflap ? 1 : 2;
        if (args.length < inputs || args.length > inputs + 1) {
            err.println("❗ Please provide the NFA transition CSV and the NFA states JSON, or a JFLAP file, as arguments.");
            err.println("👉 Usage: java NfaDfaBuilder <nfa-transitions.csv> <nfa-states.json> [output-prefix]");
            err.println("👉 Usage: java NfaDfaBuilder <automaton.jff> [output-prefix]");
            return 2;
        }

        Path nfaFile = Paths.get(args[0]);

        try {
            // Step 1: Read the NFA
            Nfa.Builder builder = Nfa.builder();
            if (jflap) {
                JflapFile.read(nfaFile, builder);
            } else {
                AcceptLabelsJson.readNfaStates(Paths.get(args[1])).applyTo(builder);
                NfaCsvReader.read(nfaFile, builder);
            }
            Nfa nfa = builder.build();
            log.info("NFA read with {} transitions and {} accept states", nfa.transitionCount(), nfa.getAccept().size());

            // Step 2: Subset construction over the symbols the NFA uses
            Dfa dfa = SubsetConstructor.convert(nfa, nfa.alphabet());
            log.info("DFA built with {} states and {} transitions", dfa.stateCount(), dfa.transitionCount());

            // Step 3: Write the outputs
            String prefix = args.length > inputs ? args[inputs] : "dfa-" + sha256Hex(Files.readAllBytes(nfaFile)).substring(0, 8);
            List<Path> outputs = write(dfa, prefix, "DFA derived from " + nfaFile.getFileName());
            for (Path output : outputs) {
                out.println(output); // Output filenames so parent program can locate the output files
            }
            return 0;
        } catch (IOException e) {
            err.println("Error occurred: " + e.getMessage());
            log.debug("Conversion failed", e);
            return 1;
        }
    }

    /**
     * Writes {@code prefix-transitions.csv}, {@code prefix-final-states.json}
     * and {@code prefix.json}. Returns the paths written.
     */
    static List<Path> write(Dfa dfa, String prefix, String comment) throws IOException {
        Path transitions = Paths.get(prefix + "-transitions.csv");
        Path finalStates = Paths.get(prefix + "-final-states.json");
        Path document = Paths.get(prefix + ".json");

        DfaCsv.write(dfa, transitions);
        AcceptLabelsJson.writeDfaAccept(dfa.getAccept(), finalStates);
        AutomatonSerializer.serializeToJson(dfa, comment, document.toFile());

        List<Path> outputs = new ArrayList<>();
        outputs.add(transitions);
        outputs.add(finalStates);
        outputs.add(document);
        return outputs;
    }

    static String sha256Hex(byte[] input) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] hash = digest.digest(input);
        StringBuilder hex = new StringBuilder();
        for (byte b : hash) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }
}
