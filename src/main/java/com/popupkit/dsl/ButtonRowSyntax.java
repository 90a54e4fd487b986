package com.popupkit.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizes the surface forms of a button row: {@code [Save | Cancel]}, {@code → Next},
 * {@code Yes or No}, {@code buttons: A, B} and {@code with A or B}.
 */
final class ButtonRowSyntax {

    private static final Pattern IF_PREFIX = Pattern.compile("(?i)^if(\\s.*)?$");
    private static final Pattern OR_SEPARATOR = Pattern.compile("(?i)\\s+or\\s+");
    private static final int MAX_PHRASE_WORDS = 4;

    private ButtonRowSyntax() {
    }

    /**
     * @return the button labels, or null when the line is not a button row
     */
    static List<String> parse(String line) {
        String t = line.trim();
        if (t.startsWith("[") && t.endsWith("]") && t.length() > 2) {
            String inner = t.substring(1, t.length() - 1).trim();
            if (IF_PREFIX.matcher(inner).matches() || inner.contains("[") || inner.contains("]")) {
                return null;
            }
            return nonEmpty(split(inner, "\\|"));
        }
        if (t.startsWith("→") || t.startsWith("->")) {
            String rest = t.substring(t.startsWith("→") ? 1 : 2).trim();
            return rest.isEmpty() ? null : nonEmpty(List.of(unquote(rest)));
        }
        String lower = t.toLowerCase(Locale.ROOT);
        if (lower.startsWith("buttons:") || lower.startsWith("actions:")) {
            String rest = t.substring(t.indexOf(':') + 1).trim();
            if (rest.startsWith("[") && rest.endsWith("]")) {
                rest = rest.substring(1, rest.length() - 1);
            }
            if (rest.contains("|")) {
                return nonEmpty(split(rest, "\\|"));
            }
            if (rest.contains(",")) {
                return nonEmpty(split(rest, ","));
            }
            return nonEmpty(split(rest, OR_SEPARATOR.pattern()));
        }
        if (lower.startsWith("with ")) {
            return nonEmpty(split(t.substring(5), OR_SEPARATOR.pattern()));
        }
        return parseOrPhrase(t);
    }

    /**
     * "Yes or No", "Save or Discard or Cancel". Questions, sentences and labeled lines are not rows.
     */
    static List<String> parseOrPhrase(String t) {
        if (t.contains(":") || t.endsWith("?") || t.endsWith(".") || !OR_SEPARATOR.matcher(t).find()) {
            return null;
        }
        List<String> parts = split(t, OR_SEPARATOR.pattern());
        if (parts.size() < 2) {
            return null;
        }
        for (String part : parts) {
            if (part.isEmpty() || part.split("\\s+").length > MAX_PHRASE_WORDS) {
                return null;
            }
        }
        return parts;
    }

    private static List<String> split(String raw, String separatorRegex) {
        List<String> parts = new ArrayList<>();
        for (String part : raw.split(separatorRegex)) {
            String label = unquote(part.trim());
            if (!label.isEmpty()) {
                parts.add(label);
            }
        }
        return parts;
    }

    private static List<String> nonEmpty(List<String> labels) {
        return labels.isEmpty() ? null : labels;
    }

    static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
