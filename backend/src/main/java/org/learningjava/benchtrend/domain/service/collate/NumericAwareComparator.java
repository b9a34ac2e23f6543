package org.learningjava.benchtrend.domain.service.collate;

import java.util.Comparator;

/**
 * Orders names alphabetically, but compares runs of digits by their numeric value,
 * so that {@code bench2} sorts before {@code bench10}.
 * Letters compare case-insensitively first; case only breaks ties.
 */
public final class NumericAwareComparator implements Comparator<String> {

    public static final NumericAwareComparator INSTANCE = new NumericAwareComparator();

    private NumericAwareComparator() { }

    @Override
    public int compare(String a, String b) {
        int i = 0, j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);

            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int endA = digitRunEnd(a, i);
                int endB = digitRunEnd(b, j);
                int cmp = compareDigitRuns(a, i, endA, b, j, endB);
                if (cmp != 0) return cmp;
                i = endA;
                j = endB;
            } else {
                int cmp = Character.compare(Character.toLowerCase(ca), Character.toLowerCase(cb));
                if (cmp != 0) return cmp;
                i++;
                j++;
            }
        }

        int remaining = Integer.compare(a.length() - i, b.length() - j);
        if (remaining != 0) return remaining;

        int ignoringCase = a.compareToIgnoreCase(b);
        return ignoringCase != 0 ? ignoringCase : a.compareTo(b);
    }

    private static int digitRunEnd(String s, int start) {
        int end = start;
        while (end < s.length() && Character.isDigit(s.charAt(end))) end++;
        return end;
    }

    private static int compareDigitRuns(String a, int startA, int endA, String b, int startB, int endB) {
        int sa = skipZeros(a, startA, endA);
        int sb = skipZeros(b, startB, endB);

        int lenCmp = Integer.compare(endA - sa, endB - sb);
        if (lenCmp != 0) return lenCmp;

        for (int k = 0; k < endA - sa; k++) {
            int cmp = Character.compare(a.charAt(sa + k), b.charAt(sb + k));
            if (cmp != 0) return cmp;
        }
        // "01" after "1"
        return Integer.compare(endA - startA, endB - startB);
    }

    private static int skipZeros(String s, int start, int end) {
        int i = start;
        while (i < end - 1 && s.charAt(i) == '0') i++;
        return i;
    }
}
