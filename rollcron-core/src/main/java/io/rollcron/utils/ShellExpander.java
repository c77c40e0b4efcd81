package io.rollcron.utils;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Expands a leading {@code ~} and {@code $VAR} / {@code ${VAR}} references.
 * Unknown variables are left untouched.
 */
public final class ShellExpander {
    private ShellExpander() {
    }

    public static String expand(String input) {
        return expand(input, System.getenv(), System.getProperty("user.home"));
    }

    public static String expand(String input, Map<String, String> env, String home) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input;
        if (home != null && (s.equals("~") || s.startsWith("~/"))) {
            s = home + s.substring(1);
        }
        return expandVariables(s, env::get);
    }

    private static String expandVariables(String s, Function<String, String> lookup) {
        StringBuilder out = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c != '$' || i + 1 >= s.length()) {
                out.append(c);
                i++;
                continue;
            }

            int start;
            int end;
            int next;
            if (s.charAt(i + 1) == '{') {
                start = i + 2;
                end = s.indexOf('}', start);
                if (end < 0) {
                    out.append(s, i, s.length());
                    break;
                }
                next = end + 1;
            } else {
                start = i + 1;
                end = start;
                while (end < s.length() && (Character.isLetterOrDigit(s.charAt(end)) || s.charAt(end) == '_')) {
                    end++;
                }
                next = end;
            }

            String name = s.substring(start, end);
            String value = name.isEmpty() ? null : lookup.apply(name);
            if (value == null) {
                out.append(s, i, next);
            } else {
                out.append(value);
            }
            i = next == i ? i + 1 : next;
        }
        return out.toString();
    }
}
