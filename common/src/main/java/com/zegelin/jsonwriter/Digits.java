package com.zegelin.jsonwriter;

/**
 * Decimal digit counting and formatting for 64-bit integers.
 * <p>
 * Values passed to the {@code Unsigned} methods are interpreted as unsigned 64-bit integers.
 */
public final class Digits {
    /** {@link Long#MIN_VALUE} can't be negated, so it is written from this constant. */
    public static final char[] LONG_MIN_VALUE = Long.toString(Long.MIN_VALUE).toCharArray();

    /** The maximum digit count of an unsigned 64-bit value. */
    public static final int MAX_UNSIGNED_LONG_DIGITS = 20;

    // 10^19 doesn't fit a signed long
    private static final long UNSIGNED_TEN_POW_19 = Long.parseUnsignedLong("10000000000000000000");

    private Digits() {}

    public static int countUnsigned(final long value) {
        if (value < 0) {
            return Long.compareUnsigned(value, UNSIGNED_TEN_POW_19) < 0 ? 19 : 20;
        }

        if (value < 10_000_000_000L) {
            if (value < 100_000L) {
                if (value < 100L) {
                    return value < 10L ? 1 : 2;
                }

                if (value < 1_000L) {
                    return 3;
                }

                return value < 10_000L ? 4 : 5;
            }

            if (value < 10_000_000L) {
                return value < 1_000_000L ? 6 : 7;
            }

            if (value < 100_000_000L) {
                return 8;
            }

            return value < 1_000_000_000L ? 9 : 10;
        }

        if (value < 1_000_000_000_000_000_000L) {
            if (value < 1_000_000_000_000L) {
                return value < 100_000_000_000L ? 11 : 12;
            }

            if (value < 100_000_000_000_000L) {
                return value < 10_000_000_000_000L ? 13 : 14;
            }

            if (value < 10_000_000_000_000_000L) {
                return value < 1_000_000_000_000_000L ? 15 : 16;
            }

            return value < 100_000_000_000_000_000L ? 17 : 18;
        }

        return 19;
    }

    /**
     * Writes the decimal digits of {@code value} right to left, ending just before {@code end}.
     * The caller must have sized the region with {@link #countUnsigned(long)}.
     */
    public static void writeUnsigned(final char[] dest, final int end, long value) {
        int i = end;

        if (value < 0) {
            final long quotient = Long.divideUnsigned(value, 10);
            dest[--i] = (char) ('0' + (value - quotient * 10));
            value = quotient;
        }

        while (value >= 10) {
            final long quotient = value / 10;
            dest[--i] = (char) ('0' + (value - quotient * 10));
            value = quotient;
        }

        dest[--i] = (char) ('0' + value);
    }
}
