package com.example.frontdesk.knowledge;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word-set Jaccard similarity.
 *
 * <p>Tokens are the (Unicode) whitespace-separated pieces of the lower-cased text; punctuation stays attached
 * ("hours?" and "hours" are different tokens).</p>
 */
public final class TokenSimilarity {

    private static final Pattern WS = Pattern.compile("(?U)\\s+");

    private TokenSimilarity() {
    }

    public static Set<String> tokens(String text) {
        if (text == null) return Set.of();
        Set<String> out = new HashSet<>();
        for (String t : WS.split(text.toLowerCase(Locale.ROOT))) {
            if (!t.isEmpty()) out.add(t);
        }
        return out.isEmpty() ? Set.of() : Collections.unmodifiableSet(out);
    }

    /** |a ∩ b| / |a ∪ b|; 0 when either side is empty. */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> small = a.size() <= b.size() ? a : b;
        Set<String> large = small == a ? b : a;
        int inter = 0;
        for (String t : small) {
            if (large.contains(t)) inter++;
        }
        int union = a.size() + b.size() - inter;
        return (double) inter / union;
    }
}
