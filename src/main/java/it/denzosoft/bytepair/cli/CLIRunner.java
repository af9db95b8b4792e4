package it.denzosoft.bytepair.cli;

import it.denzosoft.bytepair.tokenizer.Tokenizer;
import it.denzosoft.bytepair.tokenizer.TokenizerException;
import it.denzosoft.bytepair.tokenizer.TokenizerFactory;
import it.denzosoft.bytepair.tokenizer.TokenizerResult;
import it.denzosoft.bytepair.tokenizer.TrainerConfig;
import it.denzosoft.bytepair.tokenizer.TrainingListener;
import it.denzosoft.bytepair.tokenizer.TrainingResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CLIRunner {

    private final CLIOptions options;
    private final BufferedReader in;
    private final PrintStream out;

    public CLIRunner(CLIOptions options) {
        this(options, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public CLIRunner(CLIOptions options, BufferedReader in, PrintStream out) {
        this.options = options;
        this.in = in;
        this.out = out;
    }

    public void run() throws IOException {
        if (options.isHelp()) {
            CLIOptions.printUsage();
            return;
        }

        if (options.getPrompt() == null && !options.isInteractive() && !options.isShowInfo()) {
            System.err.println("Error: provide --prompt, --interactive or --info");
            CLIOptions.printUsage();
            return;
        }

        TrainerConfig config = options.toTrainerConfig();
        TokenizerResult<Tokenizer> created = TokenizerFactory.tryCreate(config);
        if (!created.isOk()) {
            throw new IOException("Invalid configuration: " + created.error().getMessage());
        }
        Tokenizer tokenizer = created.value();

        Path corpusPath = Paths.get(options.getCorpusPath());
        out.println("Opening file " + corpusPath + "...");
        byte[] corpus = Files.readAllBytes(corpusPath);
        out.println("Corpus size: " + corpus.length + " bytes");
        if (corpus.length == 0) {
            throw new IOException("Corpus is empty: " + corpusPath);
        }

        boolean verbose = options.getVerbose() != null
            ? options.getVerbose()
            : options.isInteractive() && askVerbose();

        TrainingListener listener = verbose ? event -> out.println(event) : null;
        long start = System.currentTimeMillis();
        TrainingResult result = tokenizer.train(corpus, config.stopEarly(), listener);
        out.println(result + " (" + (System.currentTimeMillis() - start) + "ms)");

        for (String special : options.getSpecialTokens()) {
            boolean known = tokenizer.specialTokenId(special) >= 0;
            int id = tokenizer.registerSpecial(special);
            if (!known) {
                out.println("Added special token " + special + " with ID " + id);
            }
        }

        if (options.isShowInfo()) {
            VocabularyInfoPrinter.print(tokenizer, out);
        }

        if (options.getPrompt() != null) {
            printRoundTrip(tokenizer, options.getPrompt());
        }
        if (options.isInteractive()) {
            runInteractive(tokenizer);
        }
    }

    private boolean askVerbose() throws IOException {
        while (true) {
            out.print("Print merge information? (y/n): ");
            out.flush();
            String answer = in.readLine();
            if (answer == null) return false;
            answer = answer.trim();
            if (answer.equalsIgnoreCase("y")) return true;
            if (answer.equalsIgnoreCase("n")) return false;
            out.println("Invalid input. Please enter 'y' or 'n'");
        }
    }

    private void runInteractive(Tokenizer tokenizer) throws IOException {
        while (true) {
            out.print("\nEnter text to encode (or 'q' to quit): ");
            out.flush();
            String input = in.readLine();
            if (input == null || input.equals("q") || input.equalsIgnoreCase("quit") || input.equalsIgnoreCase("exit")) {
                out.println();
                break;
            }
            printRoundTrip(tokenizer, input);
        }
    }

    private void printRoundTrip(Tokenizer tokenizer, String text) {
        int[] encoded;
        try {
            encoded = tokenizer.encode(text);
        } catch (TokenizerException e) {
            System.err.println("Encode error: " + e.getMessage());
            return;
        }
        StringBuilder sb = new StringBuilder("Encoded: ");
        for (int id : encoded) {
            sb.append(id).append(' ');
        }
        out.println(sb.toString().trim());

        TokenizerResult<String> decoded = tokenizer.tryDecode(encoded);
        if (decoded.isOk()) {
            out.println("Decoded: " + decoded.value());
        } else {
            System.err.println("Decode error: " + decoded.error().getMessage());
        }
    }
}
