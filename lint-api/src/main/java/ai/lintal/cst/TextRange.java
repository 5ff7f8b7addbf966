package ai.lintal.cst;

/**
 * Half-open byte range {@code [start, end)} into the UTF-8 encoding of a source file. Tree-sitter reports node
 * positions as UTF-8 byte offsets, so every range in the engine uses the same unit.
 */
public record TextRange(int start, int end) implements Comparable<TextRange> {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range: start=" + start + ", end=" + end);
        }
    }

    public static TextRange of(int start, int end) {
        return new TextRange(start, end);
    }

    public static TextRange empty(int offset) {
        return new TextRange(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean contains(TextRange other) {
        return other.start >= start && other.end <= end;
    }

    /** True if the two ranges share at least one byte, or if an empty range sits strictly inside the other. */
    public boolean intersects(TextRange other) {
        if (isEmpty() || other.isEmpty()) {
            return (isEmpty() && other.start < start && start < other.end)
                    || (other.isEmpty() && start < other.start && other.start < end)
                    || (isEmpty() && other.isEmpty() && start == other.start);
        }
        return start < other.end && other.start < end;
    }

    @Override
    public int compareTo(TextRange other) {
        int byStart = Integer.compare(start, other.start);
        return byStart != 0 ? byStart : Integer.compare(end, other.end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
