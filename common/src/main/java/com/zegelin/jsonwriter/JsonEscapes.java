package com.zegelin.jsonwriter;

import com.google.common.escape.CharEscaperBuilder;
import com.google.common.escape.Escaper;

/**
 * The JSON string escape table shared by {@link JsonWriter} and the UTF-8 writer.
 * <p>
 * The quote and backslash characters, and all control characters in {@code 0x00-0x1F} must be escaped.
 * {@code \b \f \n \r \t} use their two-character named escapes, the rest of the control range is written as
 * <code>&#92;u00XX</code>. Everything else, including {@code /} and non-ASCII characters, is written verbatim.
 */
public final class JsonEscapes {
    /** Marks a character escaped as <code>&#92;u00XX</code> in the table returned by {@link #escapeFor(char)}. */
    public static final char UNICODE = 'u';

    public static final int NAMED_ESCAPE_LENGTH = 2;
    public static final int UNICODE_ESCAPE_LENGTH = 6;

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private static final char[] ESCAPES = new char[128];

    static {
        for (char c = 0; c < 0x20; c++) {
            ESCAPES[c] = UNICODE;
        }

        ESCAPES['"'] = '"';
        ESCAPES['\\'] = '\\';
        ESCAPES['\b'] = 'b';
        ESCAPES['\f'] = 'f';
        ESCAPES['\n'] = 'n';
        ESCAPES['\r'] = 'r';
        ESCAPES['\t'] = 't';
    }

    private static final Escaper ESCAPER;

    static {
        final CharEscaperBuilder builder = new CharEscaperBuilder();

        for (char c = 0; c < ESCAPES.length; c++) {
            final char escape = ESCAPES[c];

            if (escape == UNICODE) {
                builder.addEscape(c, new String(unicodeEscape(c)));

            } else if (escape != 0) {
                builder.addEscape(c, new String(new char[] {JsonToken.ESCAPE.character, escape}));
            }
        }

        ESCAPER = builder.toEscaper();
    }

    private JsonEscapes() {}

    /**
     * Returns 0 if {@code c} is written verbatim, {@link #UNICODE} if it requires a <code>&#92;u00XX</code> escape,
     * otherwise the character following the backslash in its named escape.
     */
    public static char escapeFor(final char c) {
        return c < ESCAPES.length ? ESCAPES[c] : 0;
    }

    /** The number of chars {@code escape} (a value returned by {@link #escapeFor(char)}) expands to. */
    public static int escapeLength(final char escape) {
        return escape == UNICODE ? UNICODE_ESCAPE_LENGTH : NAMED_ESCAPE_LENGTH;
    }

    /** The high hex digit of the <code>&#92;u00XX</code> escape of control character {@code c}. */
    public static char highHexDigit(final char c) {
        return HEX_DIGITS[(c >> 4) & 0xF];
    }

    /** The low hex digit of the <code>&#92;u00XX</code> escape of control character {@code c}. */
    public static char lowHexDigit(final char c) {
        return HEX_DIGITS[c & 0xF];
    }

    private static char[] unicodeEscape(final char c) {
        return new char[] {JsonToken.ESCAPE.character, UNICODE, '0', '0', highHexDigit(c), lowHexDigit(c)};
    }

    /**
     * An {@link Escaper} applying the same rules as the writers, without the surrounding quotes.
     * Use it to escape names once up-front for {@link JsonWriter#writeName(String)}.
     */
    public static Escaper escaper() {
        return ESCAPER;
    }
}
