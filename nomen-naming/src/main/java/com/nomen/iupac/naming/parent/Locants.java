package com.nomen.iupac.naming.parent;

import com.nomen.iupac.rules.parent.Locant;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Locant list formatting.
 */
public final class Locants {

    private Locants() {
    }

    /**
     * Comma-separated locants: {@code 1,2,4}.
     */
    public static String join(List<Locant> locants) {
        return locants.stream().map(Locant::toString).collect(Collectors.joining(","));
    }

    /**
     * Lexicographic comparison of sorted locant lists; at the first point of
     * difference the lower locant wins. A proper prefix ranks first.
     */
    public static int compare(List<Locant> a, List<Locant> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
