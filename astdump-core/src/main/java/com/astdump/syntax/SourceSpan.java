package com.astdump.syntax;

/**
 * Half-open range of character offsets into a source text: {@code start} inclusive, {@code end} exclusive.
 *
 * <p>Spans are not validated on construction; {@link SourceText#slice(SourceSpan)} rejects spans that
 * do not fit the text.</p>
 */
public record SourceSpan(int start, int end) {

    private static final SourceSpan EMPTY = new SourceSpan(0, 0);

    public static SourceSpan empty() {
        return EMPTY;
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public boolean isEmpty() {
        return start == end;
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
