package com.astdump.token;

import com.astdump.syntax.InvalidSpanException;
import com.astdump.syntax.SourceSpan;
import com.astdump.syntax.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Cursor that lexes C-family tokens from one span of a source text and never reads outside it.
 *
 * <p>A tokenizer holds a view of the source until it is closed; use it in a try-with-resources block.
 * Whitespace, line comments and block comments are skipped. Numbers are scanned greedily over letters,
 * digits, underscores and dots (plus a sign right after an exponent marker), so {@code 0x1F},
 * {@code 10UL} and {@code 1.5e-3f} each come back as a single token with their exact spelling.</p>
 */
public final class SpanTokenizer implements AutoCloseable {

    private static final Set<String> PUNCTUATORS_4 = Set.of(">>>=");
    private static final Set<String> PUNCTUATORS_3 = Set.of("<<=", ">>=", ">>>", "...");
    private static final Set<String> PUNCTUATORS_2 = Set.of(
        "->", "::", "++", "--", "&&", "||", "==", "!=", "<=", ">=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<", ">>"
    );

    private CharSequence text;
    private final int base;
    private int pos;
    private boolean closed;

    private SpanTokenizer(CharSequence text, int base) {
        this.text = text;
        this.base = base;
    }

    /**
     * Opens a tokenizer over {@code span} of {@code source}.
     *
     * @throws InvalidSpanException if the source is missing or the span does not fit it
     */
    public static SpanTokenizer open(SourceText source, SourceSpan span) {
        if (source == null) {
            throw new InvalidSpanException(span, "No source text available for span " + span);
        }
        return new SpanTokenizer(source.slice(span), span.start());
    }

    /**
     * Returns the next token, or empty once the span is exhausted.
     */
    public Optional<Token> next() {
        if (closed) {
            throw new IllegalStateException("Tokenizer is closed");
        }
        skipTrivia();
        if (pos >= text.length()) {
            return Optional.empty();
        }

        int start = pos;
        char c = text.charAt(pos);
        TokenKind kind;
        if (Character.isJavaIdentifierStart(c)) {
            kind = TokenKind.IDENTIFIER;
            scanIdentifier();
        } else if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            kind = TokenKind.NUMBER;
            scanNumber();
        } else if (c == '"') {
            kind = TokenKind.STRING;
            scanQuoted('"');
        } else if (c == '\'') {
            kind = TokenKind.CHARACTER;
            scanQuoted('\'');
        } else {
            kind = TokenKind.PUNCTUATOR;
            scanPunctuator();
        }

        String spelling = text.subSequence(start, pos).toString();
        return Optional.of(new Token(kind, spelling, new SourceSpan(base + start, base + pos)));
    }

    /**
     * Drains the remaining tokens of the span.
     */
    public List<Token> remaining() {
        List<Token> tokens = new ArrayList<>();
        for (Optional<Token> token = next(); token.isPresent(); token = next()) {
            tokens.add(token.get());
        }
        return tokens;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        text = null;
    }

    private void skipTrivia() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peek(1) == '/') {
                while (pos < text.length() && text.charAt(pos) != '\n' && text.charAt(pos) != '\r') {
                    pos++;
                }
            } else if (c == '/' && peek(1) == '*') {
                pos += 2;
                while (pos < text.length() && !(text.charAt(pos) == '*' && peek(1) == '/')) {
                    pos++;
                }
                pos = Math.min(pos + 2, text.length());
            } else {
                return;
            }
        }
    }

    private void scanIdentifier() {
        pos++;
        while (pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos))) {
            pos++;
        }
    }

    private void scanNumber() {
        boolean hex = text.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X');
        char prev = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            boolean signAfterExponent = (c == '+' || c == '-') && isExponentMarker(prev, hex);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '.' || signAfterExponent)) {
                break;
            }
            prev = c;
            pos++;
        }
    }

    private void scanQuoted(char quote) {
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\') {
                pos = Math.min(pos + 2, text.length());
            } else if (c == quote) {
                pos++;
                return;
            } else {
                pos++;
            }
        }
    }

    private void scanPunctuator() {
        for (int width = 4; width >= 2; width--) {
            if (pos + width <= text.length()) {
                String candidate = text.subSequence(pos, pos + width).toString();
                if (punctuatorsOfWidth(width).contains(candidate)) {
                    pos += width;
                    return;
                }
            }
        }
        pos++;
    }

    private static Set<String> punctuatorsOfWidth(int width) {
        return switch (width) {
            case 4 -> PUNCTUATORS_4;
            case 3 -> PUNCTUATORS_3;
            default -> PUNCTUATORS_2;
        };
    }

    private static boolean isExponentMarker(char c, boolean hex) {
        return hex ? (c == 'p' || c == 'P') : (c == 'e' || c == 'E');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char peek(int ahead) {
        int index = pos + ahead;
        return index < text.length() ? text.charAt(index) : '\0';
    }
}
