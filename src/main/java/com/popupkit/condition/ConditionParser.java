package com.popupkit.condition;

import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses guard text such as {@code Advanced}, {@code not Advanced}, {@code Tags has Work},
 * {@code Theme = Dark} or {@code Volume > 50}, combined with {@code and} / {@code or}
 * ({@code and} binds tighter).
 */
public final class ConditionParser {

    private static final Pattern HAS = Pattern.compile("(?i)^(.+?)\\s+has\\s+(.+)$");
    private static final Pattern COMPARE = Pattern.compile("^(.+?)\\s*(==|!=|>=|<=|=|>|<)\\s*(.*)$");

    private ConditionParser() {
    }

    public static Condition parse(String text) {
        String trimmed = text != null ? text.trim() : "";
        if (trimmed.isEmpty()) {
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "Empty condition");
        }
        return parseOr(trimmed);
    }

    private static Condition parseOr(String text) {
        List<String> parts = splitOnKeyword(text, "or");
        if (parts.size() == 1) {
            return parseAnd(parts.get(0));
        }
        List<Condition> conditions = new ArrayList<>();
        for (String part : parts) {
            conditions.add(parseAnd(part));
        }
        return Condition.or(conditions);
    }

    private static Condition parseAnd(String text) {
        List<String> parts = splitOnKeyword(text, "and");
        if (parts.size() == 1) {
            return parseUnary(parts.get(0));
        }
        List<Condition> conditions = new ArrayList<>();
        for (String part : parts) {
            conditions.add(parseUnary(part));
        }
        return Condition.and(conditions);
    }

    private static Condition parseUnary(String raw) {
        String text = raw.trim();
        if (text.isEmpty()) {
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "Incomplete condition");
        }
        if (text.startsWith("(") && text.endsWith(")") && closesAtEnd(text)) {
            return parseOr(text.substring(1, text.length() - 1).trim());
        }
        if (text.startsWith("!") && !text.startsWith("!=")) {
            return Condition.not(parseUnary(text.substring(1)));
        }
        if (text.toLowerCase(Locale.ROOT).startsWith("not ")) {
            return Condition.not(parseUnary(text.substring(4)));
        }
        Matcher has = HAS.matcher(text);
        if (has.matches()) {
            return Condition.has(reference(has.group(1)), operand(has.group(2)));
        }
        Matcher compare = COMPARE.matcher(text);
        if (compare.matches()) {
            String value = operand(compare.group(3));
            if (value.isEmpty()) {
                throw new PopupParseException(ErrorKind.MALFORMED_INPUT,
                    "Missing value after '" + compare.group(2) + "' in condition '" + text + "'");
            }
            return Condition.compare(reference(compare.group(1)), ComparisonOperator.fromSymbol(compare.group(2)), value);
        }
        return Condition.truthy(reference(text));
    }

    private static String reference(String raw) {
        String ref = raw.trim();
        if (ref.startsWith("@")) {
            ref = ref.substring(1).trim();
        }
        ref = unquote(ref);
        if (ref.isEmpty()) {
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "Condition is missing the field it refers to");
        }
        return ref;
    }

    private static String operand(String raw) {
        return unquote(raw.trim());
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean closesAtEnd(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /**
     * Split on a whitespace-delimited keyword, ignoring occurrences inside quotes or parentheses.
     */
    static List<String> splitOnKeyword(String text, String keyword) {
        List<String> parts = new ArrayList<>();
        String lower = text.toLowerCase(Locale.ROOT);
        boolean inQuote = false;
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (!inQuote && c == '(') {
                depth++;
            } else if (!inQuote && c == ')') {
                depth--;
            } else if (!inQuote && depth == 0 && Character.isWhitespace(c)) {
                int kwStart = i + 1;
                while (kwStart < text.length() && Character.isWhitespace(text.charAt(kwStart))) {
                    kwStart++;
                }
                int kwEnd = kwStart + keyword.length();
                if (lower.startsWith(keyword, kwStart) && kwEnd < text.length()
                    && Character.isWhitespace(text.charAt(kwEnd))) {
                    parts.add(text.substring(start, i).trim());
                    start = kwEnd;
                    i = kwEnd - 1;
                }
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }
}
