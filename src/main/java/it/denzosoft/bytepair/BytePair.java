package it.denzosoft.bytepair;

import it.denzosoft.bytepair.cli.CLIOptions;
import it.denzosoft.bytepair.cli.CLIRunner;
import it.denzosoft.bytepair.tokenizer.TokenizerException;

import java.io.IOException;

/**
 * BytePair - byte-level BPE tokenizer trainer.
 *
 * Learns a merge table from a corpus file, then encodes and decodes text with it.
 *
 * Launch modes:
 *   --prompt <text>    encode/decode one text and exit
 *   --interactive      read lines from stdin until 'q'
 *   --info             print a vocabulary summary
 */
public class BytePair {

    public static final String VERSION = "1.0.0";

    public static void main(String[] args) {
        System.out.println("BytePair v" + VERSION + " - Byte-Pair Encoding Tokenizer");
        System.out.println();

        CLIOptions options = CLIOptions.parse(args);

        try {
            new CLIRunner(options).run();
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (TokenizerException e) {
            System.err.println("Tokenizer error (" + e.kind() + "): " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Unexpected error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
