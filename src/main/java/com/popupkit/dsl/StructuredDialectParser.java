package com.popupkit.dsl;

import com.popupkit.models.Element;
import com.popupkit.models.PopupDefinition;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.SourceText;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Indentation-structured dialect:
 * <pre>
 * Settings:
 *   Volume: 0-100 = 75
 *   Theme: Light | Dark
 *   [Save | Cancel]
 * </pre>
 * The first line is the title when it reads like one; a trailing colon is dropped.
 */
public class StructuredDialectParser implements DialectParser {

    public static final String NAME = "structured";

    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+");

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * The structured dialect has no envelope; it is the fallback for any text.
     */
    @Override
    public boolean matchesEnvelope(String input) {
        return false;
    }

    @Override
    public PopupDefinition parse(String input) {
        SourceText source = new SourceText(input);
        List<SourceLine> lines = SourceLine.split(source);
        int first = firstContentLine(lines);
        if (first < 0) {
            throw source.error(ErrorKind.MALFORMED_INPUT, 0, "Empty popup definition");
        }

        String title = null;
        SourceLine head = lines.get(first);
        if (HEADING.matcher(head.text).find()) {
            title = stripColon(HEADING.matcher(head.text).replaceFirst(""));
            first++;
        } else if (isTitleCandidate(head.text)) {
            title = stripColon(head.text);
            first++;
        }

        List<Element> elements = new BodyParser(source).parseBlock(lines.subList(first, lines.size()));
        return ElementFactory.finish(title, elements);
    }

    /**
     * A first line is a title unless it is a body construct: a message, button row, block opener,
     * quoted text, or a {@code Label: value} field.
     */
    static boolean isTitleCandidate(String t) {
        if (t.isEmpty() || BodyParser.isMessage(t) || BodyParser.isQuoted(t) || BodyParser.isGroupHeader(t)
            || BodyParser.isWhenBlock(t) || BodyParser.startsConditional(t)) {
            return false;
        }
        char c = t.charAt(0);
        if (c == '[' || c == '{' || c == '}' || c == '#' || c == '"' || c == '→' || t.startsWith("->")) {
            return false;
        }
        String lower = t.toLowerCase(Locale.ROOT);
        if (lower.startsWith(NaturalDialectParser.KEYWORD) || lower.startsWith(ClassicDialectParser.KEYWORD)) {
            return false;
        }
        if (ButtonRowSyntax.parse(t) != null) {
            return false;
        }
        return t.endsWith(":") || !t.contains(":");
    }

    private static String stripColon(String t) {
        String trimmed = t.trim();
        return trimmed.endsWith(":") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
    }

    static int firstContentLine(List<SourceLine> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                return i;
            }
        }
        return -1;
    }
}
