package it.denzosoft.bytepair.cli;

import it.denzosoft.bytepair.tokenizer.Tokenizer;
import it.denzosoft.bytepair.tokenizer.MergeRule;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class VocabularyInfoPrinter {

    private static final int LAST_MERGES = 5;

    public static void print(Tokenizer tokenizer, PrintStream out) {
        String separator = "+" + repeat("-", 26) + "+" + repeat("-", 30) + "+";
        out.println(separator);
        out.printf("| %-24s | %-28s |%n", "Property", "Value");
        out.println(separator);
        printRow(out, "Max Vocab Size", String.valueOf(tokenizer.maxVocabSize()));
        printRow(out, "Vocab Size", String.valueOf(tokenizer.vocabSize()));
        printRow(out, "Byte Tokens", "256");
        printRow(out, "Merges", String.valueOf(tokenizer.mergeCount()));
        // every ID past the bytes is either a merge or a special token
        int specials = tokenizer.vocabSize() - 256 - tokenizer.mergeCount();
        printRow(out, "Special Tokens", String.valueOf(specials));

        List<MergeRule> merges = tokenizer.merges();
        for (int i = Math.max(0, merges.size() - LAST_MERGES); i < merges.size(); i++) {
            MergeRule rule = merges.get(i);
            String token = new String(tokenizer.tokenOf(rule.id()), StandardCharsets.UTF_8);
            printRow(out, "Merge " + rule, quote(token));
        }
        out.println(separator);
    }

    private static void printRow(PrintStream out, String property, String value) {
        out.printf("| %-24s | %-28s |%n", property, value);
    }

    private static String quote(String token) {
        String escaped = token.replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
        return escaped.length() > 26 ? "\"" + escaped.substring(0, 23) + "...\"" : "\"" + escaped + "\"";
    }

    private static String repeat(String s, int count) {
        StringBuilder sb = new StringBuilder(s.length() * count);
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
