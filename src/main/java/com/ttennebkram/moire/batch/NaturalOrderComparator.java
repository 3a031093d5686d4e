package com.ttennebkram.moire.batch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders names the way people number pages: "page2" before "page10".
 * Digit runs compare by numeric value, text runs case-insensitively.
 * Names that are equal under those rules fall back to plain String order.
 */
public class NaturalOrderComparator implements Comparator<String> {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    @Override
    public int compare(String a, String b) {
        List<String> left = split(a);
        List<String> right = split(b);

        int n = Math.min(left.size(), right.size());
        for (int i = 0; i < n; i++) {
            String l = left.get(i);
            String r = right.get(i);
            boolean lDigits = Character.isDigit(l.charAt(0));
            boolean rDigits = Character.isDigit(r.charAt(0));

            int cmp;
            if (lDigits && rDigits) {
                cmp = compareNumeric(l, r);
            } else if (lDigits != rDigits) {
                // Numbers sort before text
                cmp = lDigits ? -1 : 1;
            } else {
                cmp = l.toLowerCase(Locale.ROOT).compareTo(r.toLowerCase(Locale.ROOT));
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        if (left.size() != right.size()) {
            return Integer.compare(left.size(), right.size());
        }
        return a.compareTo(b);
    }

    /**
     * Compare two digit runs by value without overflowing on long runs.
     */
    private static int compareNumeric(String l, String r) {
        String a = stripLeadingZeros(l);
        String b = stripLeadingZeros(r);
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    /**
     * Split into alternating digit and non-digit runs.
     */
    static List<String> split(String s) {
        List<String> runs = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= s.length(); i++) {
            if (i == s.length() || Character.isDigit(s.charAt(i)) != Character.isDigit(s.charAt(i - 1))) {
                if (i > start) {
                    runs.add(s.substring(start, i));
                }
                start = i;
            }
        }
        return runs;
    }
}
