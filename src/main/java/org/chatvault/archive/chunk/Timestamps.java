package org.chatvault.archive.chunk;

/**
 * Conversions for API timestamps of the form {@code "<seconds>.<micros>"}.
 */
public final class Timestamps {

    private static final int MICRO_DIGITS = 6;

    private Timestamps() {
    }

    /**
     * Converts {@code "1700000000.000123"} to {@code 1700000000000123}. A missing fraction
     * counts as zero; a fraction shorter than six digits is right-padded.
     *
     * @param ts the API timestamp
     * @return the timestamp in epoch microseconds
     * @throws IllegalArgumentException if {@code ts} is empty or not numeric
     */
    public static long toMicros(String ts) {
        if (ts == null || ts.isEmpty()) {
            throw new IllegalArgumentException("invalid timestamp: empty");
        }
        int dot = ts.indexOf('.');
        String seconds = dot < 0 ? ts : ts.substring(0, dot);
        String fraction = dot < 0 ? "" : ts.substring(dot + 1);
        if (seconds.isEmpty() || fraction.length() > MICRO_DIGITS) {
            throw new IllegalArgumentException("invalid timestamp: \"" + ts + "\"");
        }
        try {
            long secs = Long.parseLong(seconds);
            StringBuilder micros = new StringBuilder(fraction);
            while (micros.length() < MICRO_DIGITS) {
                micros.append('0');
            }
            if (micros.charAt(0) == '-' || micros.charAt(0) == '+') {
                throw new IllegalArgumentException("invalid timestamp: \"" + ts + "\"");
            }
            return secs * 1_000_000L + Long.parseLong(micros.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid timestamp: \"" + ts + "\"", e);
        }
    }
}
