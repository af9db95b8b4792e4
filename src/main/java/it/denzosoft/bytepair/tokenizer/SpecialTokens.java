package it.denzosoft.bytepair.tokenizer;

import java.util.*;

/**
 * Registered special token literals and the scanner that splits text around them.
 * Matching is literal (no patterns): the earliest position wins, and among literals
 * starting at that position the longest one wins.
 */
public class SpecialTokens {

    private final Map<String, Integer> literalToId = new LinkedHashMap<>();
    private final Map<Integer, String> idToLiteral = new HashMap<>();
    private Node root = new Node();

    private static final class Node {
        final Map<Character, Node> children = new HashMap<>();
        String literal; // non-null if a registered literal ends here
    }

    /** A piece of split input: either plain text or a matched special token. */
    public static final class Span {
        private final String text;
        private final int specialId;

        Span(String text, int specialId) {
            this.text = text;
            this.specialId = specialId;
        }

        public String text() { return text; }
        public boolean isSpecial() { return specialId >= 0; }
        /** @return the special token ID, or -1 for plain text */
        public int specialId() { return specialId; }

        @Override
        public String toString() {
            return isSpecial() ? "Special[" + text + "=" + specialId + "]" : "Text[" + text + "]";
        }
    }

    void add(String literal, int id) {
        if (literal == null || literal.isEmpty()) {
            throw TokenizerException.specialTokenConflict(literal, "literal must not be empty");
        }
        // a lone surrogate could match inside a surrogate pair of the input
        if (!isWellFormed(literal)) {
            throw TokenizerException.specialTokenConflict(literal, "literal contains an unpaired surrogate");
        }
        if (literalToId.containsKey(literal)) {
            throw TokenizerException.specialTokenConflict(literal, "already registered with ID " + literalToId.get(literal));
        }
        literalToId.put(literal, id);
        idToLiteral.put(id, literal);

        Node node = root;
        for (int i = 0; i < literal.length(); i++) {
            node = node.children.computeIfAbsent(literal.charAt(i), c -> new Node());
        }
        node.literal = literal;
    }

    static boolean isWellFormed(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 == text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) return false;
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }

    void clear() {
        literalToId.clear();
        idToLiteral.clear();
        root = new Node();
    }

    public boolean isEmpty() { return literalToId.isEmpty(); }
    public int size() { return literalToId.size(); }

    /** @return the ID registered for the literal, or -1 */
    public int getTokenId(String literal) {
        return literalToId.getOrDefault(literal, -1);
    }

    /** @return the literal registered under the ID, or null */
    public String getLiteral(int tokenId) {
        return idToLiteral.get(tokenId);
    }

    public boolean contains(int tokenId) {
        return idToLiteral.containsKey(tokenId);
    }

    /**
     * Splits text into alternating plain and special spans, in input order.
     * Empty plain spans are not emitted.
     */
    public List<Span> split(String text) {
        List<Span> spans = new ArrayList<>();
        if (literalToId.isEmpty()) {
            if (!text.isEmpty()) spans.add(new Span(text, -1));
            return spans;
        }

        int plainStart = 0;
        int pos = 0;
        while (pos < text.length()) {
            String match = longestMatchAt(text, pos);
            if (match == null) {
                pos++;
                continue;
            }
            if (pos > plainStart) {
                spans.add(new Span(text.substring(plainStart, pos), -1));
            }
            spans.add(new Span(match, literalToId.get(match)));
            pos += match.length();
            plainStart = pos;
        }
        if (plainStart < text.length()) {
            spans.add(new Span(text.substring(plainStart), -1));
        }
        return spans;
    }

    private String longestMatchAt(String text, int pos) {
        Node node = root;
        String longest = null;
        for (int i = pos; i < text.length(); i++) {
            node = node.children.get(text.charAt(i));
            if (node == null) break;
            if (node.literal != null) longest = node.literal;
        }
        return longest;
    }
}
