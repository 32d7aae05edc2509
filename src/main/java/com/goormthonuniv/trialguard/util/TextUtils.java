package com.goormthonuniv.trialguard.util;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern INTEGER = Pattern.compile("\\d+");

    private TextUtils() {}

    /** Trimmed, lower-cased form used for every attribute comparison. Null becomes "". */
    public static String normalize(String text) {
        if (text == null) return "";
        return text.strip().toLowerCase(Locale.ROOT);
    }

    /** Substring match in either direction on normalized values; equality counts. */
    public static boolean containsEither(String a, String b) {
        String x = normalize(a);
        String y = normalize(b);
        return x.contains(y) || y.contains(x);
    }

    /** True when {@code needle} occurs (case-insensitively) inside any of the haystack strings. */
    public static boolean mentionedIn(String needle, Collection<String> haystack) {
        String n = normalize(needle);
        for (String h : haystack) {
            if (normalize(h).contains(n)) return true;
        }
        return false;
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static String orUnknown(String s) {
        return isBlank(s) ? "Unknown" : s;
    }

    /**
     * "min-max" range from the first two integers found in the text ("18-65", "18 to 65 years").
     * Empty when fewer than two integers are present.
     */
    public static Optional<IntRange> parseRange(String text) {
        if (text == null) return Optional.empty();
        Matcher m = INTEGER.matcher(text);
        long[] found = new long[2];
        int n = 0;
        while (n < 2 && m.find()) {
            try {
                found[n] = Long.parseLong(m.group());
            } catch (NumberFormatException e) {
                return Optional.empty();   // absurdly long digit run
            }
            n++;
        }
        if (n < 2 || found[0] > Integer.MAX_VALUE || found[1] > Integer.MAX_VALUE) return Optional.empty();
        return Optional.of(new IntRange((int) found[0], (int) found[1]));
    }

    public record IntRange(int min, int max) {
        public boolean overlaps(IntRange other) {
            return !(max < other.min || other.max < min);
        }
    }
}
