package com.astdump.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The source text a syntax tree was parsed from.
 *
 * <p>Lines and columns are 1-based. LF, CR and CRLF all terminate a line.</p>
 */
public final class SourceText {

    private final String name;
    private final String content;
    private final int[] lineOffsets; // Starting offset of each line

    public SourceText(String name, String content) {
        this.name = Objects.requireNonNull(name, "name");
        this.content = Objects.requireNonNull(content, "content");
        this.lineOffsets = buildLineOffsetIndex(content);
    }

    public static SourceText of(String content) {
        return new SourceText("<memory>", content);
    }

    public String name() {
        return name;
    }

    public String content() {
        return content;
    }

    public int length() {
        return content.length();
    }

    public int lineCount() {
        return lineOffsets.length;
    }

    /**
     * Returns the span covering the whole text.
     */
    public SourceSpan fullSpan() {
        return new SourceSpan(0, content.length());
    }

    /**
     * Returns the characters covered by {@code span}.
     *
     * @throws InvalidSpanException if the span is inverted or reaches outside the text
     */
    public CharSequence slice(SourceSpan span) {
        checkSpan(span);
        return content.subSequence(span.start(), span.end());
    }

    public void checkSpan(SourceSpan span) {
        if (span == null) {
            throw new InvalidSpanException(null, "No span given for " + name);
        }
        if (span.start() < 0 || span.end() > content.length() || span.start() > span.end()) {
            throw new InvalidSpanException(span,
                "Span " + span + " is outside " + name + " (length " + content.length() + ")");
        }
    }

    /**
     * Converts a line/column position into a character offset.
     *
     * @throws InvalidSpanException if the line does not exist or the column runs past the end of the text
     */
    public int offsetOf(int line, int column) {
        if (line < 1 || line > lineOffsets.length || column < 1) {
            throw new InvalidSpanException(null,
                "Position " + line + ":" + column + " is outside " + name);
        }
        int offset = lineOffsets[line - 1] + column - 1;
        if (offset > content.length()) {
            throw new InvalidSpanException(null,
                "Position " + line + ":" + column + " is past the end of " + name);
        }
        return offset;
    }

    private static int[] buildLineOffsetIndex(String content) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0);

        int length = content.length();
        for (int i = 0; i < length; i++) {
            char ch = content.charAt(i);
            if (ch == '\n') {
                offsets.add(i + 1);
            } else if (ch == '\r') {
                if (i + 1 < length && content.charAt(i + 1) == '\n') {
                    i++;
                }
                offsets.add(i + 1);
            }
        }

        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return "SourceText[" + name + ", " + content.length() + " chars]";
    }
}
