package it.denzosoft.bytepair.cli;

import it.denzosoft.bytepair.tokenizer.TrainerConfig;

import java.util.ArrayList;
import java.util.List;

public class CLIOptions {

    public static final String DEFAULT_SPECIAL_TOKEN = "<|endoftext|>";

    private String corpusPath = "data.txt";
    private int vocabSize = TrainerConfig.DEFAULT.maxVocabSize();
    private boolean stopEarly = TrainerConfig.DEFAULT.stopEarly();
    private Boolean verbose; // null = ask in interactive mode
    private final List<String> specialTokens = new ArrayList<>();
    private String prompt;
    private boolean interactive;
    private boolean showInfo;
    private boolean help;

    public static CLIOptions parse(String[] args) {
        CLIOptions opts = new CLIOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--corpus".equals(arg) || "-f".equals(arg)) {
                opts.corpusPath = args[++i];
            } else if ("--vocab-size".equals(arg) || "-v".equals(arg)) {
                opts.vocabSize = Integer.parseInt(args[++i]);
            } else if ("--stop-early".equals(arg)) {
                opts.stopEarly = true;
            } else if ("--verbose".equals(arg)) {
                opts.verbose = Boolean.TRUE;
            } else if ("--quiet".equals(arg) || "-q".equals(arg)) {
                opts.verbose = Boolean.FALSE;
            } else if ("--special".equals(arg) || "-s".equals(arg)) {
                opts.specialTokens.add(args[++i]);
            } else if ("--prompt".equals(arg) || "-p".equals(arg)) {
                opts.prompt = args[++i];
            } else if ("--interactive".equals(arg) || "-i".equals(arg)) {
                opts.interactive = true;
            } else if ("--info".equals(arg)) {
                opts.showInfo = true;
            } else if ("--help".equals(arg) || "-h".equals(arg)) {
                opts.help = true;
            } else {
                // A bare argument is the corpus path
                if (!arg.startsWith("-")) {
                    opts.corpusPath = arg;
                } else {
                    System.err.println("Unknown option: " + arg);
                }
            }
        }
        if (opts.specialTokens.isEmpty()) {
            opts.specialTokens.add(DEFAULT_SPECIAL_TOKEN);
        }
        return opts;
    }

    public TrainerConfig toTrainerConfig() {
        return TrainerConfig.builder()
            .maxVocabSize(vocabSize)
            .stopEarly(stopEarly)
            .build();
    }

    // Getters
    public String getCorpusPath() { return corpusPath; }
    public int getVocabSize() { return vocabSize; }
    public boolean isStopEarly() { return stopEarly; }
    /** @return the requested verbosity, or null if neither --verbose nor --quiet was given */
    public Boolean getVerbose() { return verbose; }
    public List<String> getSpecialTokens() { return specialTokens; }
    public String getPrompt() { return prompt; }
    public boolean isInteractive() { return interactive; }
    public boolean isShowInfo() { return showInfo; }
    public boolean isHelp() { return help; }

    public static void printUsage() {
        System.out.println("Usage: java -jar bytepair.jar [options] [corpus]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --corpus, -f <path>      Training corpus file (default: data.txt)");
        System.out.println("  --vocab-size, -v <num>   Maximum vocabulary size, > 256 (default: 1000)");
        System.out.println("  --stop-early             Stop when the most frequent pair occurs once");
        System.out.println("  --verbose                Print every merge");
        System.out.println("  --quiet, -q              Do not print merges and do not ask");
        System.out.println("  --special, -s <token>    Register a special token (repeatable,");
        System.out.println("                           default: " + DEFAULT_SPECIAL_TOKEN + ")");
        System.out.println("  --prompt, -p <text>      Encode and decode a single text");
        System.out.println("  --interactive, -i        Encode/decode lines read from stdin");
        System.out.println("  --info                   Show vocabulary summary after training");
        System.out.println("  --help, -h               Show this help");
    }
}
