package com.example.frontdesk.domain;

import java.util.List;
import java.util.Locale;

/**
 * One conversational turn. {@code role} is {@link #USER} or {@link #ASSISTANT}.
 */
public record Turn(String role, String text) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public Turn {
        role = role == null ? USER : role.toLowerCase(Locale.ROOT);
        text = text == null ? "" : text;
    }

    public static Turn user(String text) {
        return new Turn(USER, text);
    }

    public static Turn assistant(String text) {
        return new Turn(ASSISTANT, text);
    }

    public boolean isUser() {
        return USER.equals(role);
    }

    /** "role: text", one turn per line. */
    public static String render(List<Turn> turns) {
        StringBuilder sb = new StringBuilder();
        for (Turn t : turns) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(t.role()).append(": ").append(t.text());
        }
        return sb.toString();
    }
}
