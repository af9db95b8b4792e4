package it.denzosoft.bytepair.tokenizer;

/**
 * A learned substitution: the adjacent pair (left, right) is replaced by {@code id}.
 */
public final class MergeRule {
    private final int left;
    private final int right;
    private final int id;

    public MergeRule(int left, int right, int id) {
        this.left = left;
        this.right = right;
        this.id = id;
    }

    public int left() { return left; }
    public int right() { return right; }
    public int id() { return id; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergeRule)) return false;
        MergeRule other = (MergeRule) o;
        return left == other.left && right == other.right && id == other.id;
    }

    @Override
    public int hashCode() {
        return (31 * left + right) * 31 + id;
    }

    @Override
    public String toString() {
        return "(" + left + ", " + right + ") -> " + id;
    }
}
