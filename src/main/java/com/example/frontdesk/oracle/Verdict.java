package com.example.frontdesk.oracle;

import com.example.frontdesk.error.UpstreamUnavailableException;

import java.util.Locale;

/**
 * The oracle's answer to "can this be answered confidently?".
 */
public enum Verdict {
    ANSWERABLE,
    ESCALATE;

    /**
     * Parses the model's one-word reply. Only the first word counts, case and surrounding
     * punctuation are ignored: {@code "Yes."} → ANSWERABLE, {@code "\"NO\""} → ESCALATE.
     *
     * @throws UpstreamUnavailableException for anything else, including an empty reply
     */
    public static Verdict parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UpstreamUnavailableException("oracle", "empty verdict");
        }
        String first = raw.strip().split("\\s+", 2)[0];
        String token = first.replaceAll("^[^\\p{L}]+|[^\\p{L}]+$", "").toUpperCase(Locale.ROOT);
        return switch (token) {
            case "YES" -> ANSWERABLE;
            case "NO" -> ESCALATE;
            default -> throw new UpstreamUnavailableException("oracle", "unrecognized verdict token '" + abbreviate(raw) + "'");
        };
    }

    private static String abbreviate(String s) {
        String t = s.strip();
        return t.length() <= 40 ? t : t.substring(0, 40) + "...";
    }
}
