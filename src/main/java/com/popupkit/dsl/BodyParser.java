package com.popupkit.dsl;

import com.popupkit.condition.ConditionParser;
import com.popupkit.models.ButtonsElement;
import com.popupkit.models.ConditionalElement;
import com.popupkit.models.Element;
import com.popupkit.models.GroupElement;
import com.popupkit.models.OptionElement;
import com.popupkit.models.TextElement;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;
import com.popupkit.parse.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line grammar shared by the structured and natural dialects. Lines indented deeper than the
 * line before them belong to it: members of a group, the body of a {@code when} block, or the
 * reveals of a widget.
 */
final class BodyParser {

    private static final String[] MESSAGE_PREFIXES = {"> ", "! ", "? ", "• "};
    private static final Pattern GROUP_HEADER = Pattern.compile("^-{3,}\\s*(.*?)\\s*-{3,}$");
    private static final Pattern WHEN_BLOCK = Pattern.compile("(?i)^when\\s+(.+):$");

    private final SourceText source;

    BodyParser(SourceText source) {
        this.source = source;
    }

    List<Element> parseBlock(List<SourceLine> lines) {
        List<Element> elements = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            SourceLine line = lines.get(i);
            if (line.isBlank()) {
                i++;
                continue;
            }
            if (startsConditional(line.text)) {
                i = parseBraceConditional(lines, i, elements);
                continue;
            }
            int end = childrenEnd(lines, i);
            List<SourceLine> children = lines.subList(i + 1, end);
            parseLine(line, children, elements);
            i = end;
        }
        return elements;
    }

    private void parseLine(SourceLine line, List<SourceLine> children, List<Element> out) {
        String t = line.text;

        if (t.startsWith("}")) {
            throw source.error(ErrorKind.MALFORMED_INPUT, line.offset, "Unexpected '}' without a matching '[if ...] {'");
        }
        if (t.startsWith("{")) {
            throw source.error(ErrorKind.MALFORMED_INPUT, line.offset, "Unexpected '{' without a preceding '[if ...]'");
        }

        Matcher when = WHEN_BLOCK.matcher(t);
        if (when.matches()) {
            String condition = normalizeCondition(when.group(1), line.offset + t.indexOf(when.group(1)));
            out.add(new ConditionalElement(condition, parseBlock(children)));
            return;
        }

        Matcher group = GROUP_HEADER.matcher(t);
        if (group.matches()) {
            out.add(new GroupElement(group.group(1), parseBlock(children)));
            return;
        }

        int labelEnd = t.startsWith("\"") ? closingQuote(t) : -1;
        if (labelEnd > 0) {
            String after = t.substring(labelEnd + 1).trim();
            if (after.startsWith(":")
                && labeledLine(unescape(t.substring(1, labelEnd)), after.substring(1).trim(), children, out)) {
                return;
            }
        }

        if (isQuoted(t)) {
            out.add(new TextElement(unescape(t.substring(1, t.length() - 1))));
            out.addAll(parseBlock(children));
            return;
        }

        if (isMessage(t)) {
            out.add(new TextElement(t));
            out.addAll(parseBlock(children));
            return;
        }

        List<String> buttons = ButtonRowSyntax.parse(t);
        if (buttons != null) {
            out.add(new ButtonsElement(buttons));
            out.addAll(parseBlock(children));
            return;
        }

        int colon = t.indexOf(':');
        if (colon > 0 && labeledLine(t.substring(0, colon).trim(), t.substring(colon + 1).trim(), children, out)) {
            return;
        }

        out.add(new TextElement(t));
        out.addAll(parseBlock(children));
    }

    /**
     * {@code Label: value} as a widget, or a bare {@code Label:} with nested lines as a group.
     *
     * @return false when the line is plain text after all
     */
    private boolean labeledLine(String label, String value, List<SourceLine> children, List<Element> out) {
        if (value.isEmpty() && hasContent(children)) {
            out.add(new GroupElement(label, parseBlock(children)));
            return true;
        }
        Element widget = value.isEmpty() ? null : WidgetInference.infer(label, value);
        if (widget == null) {
            return false;
        }
        attachChildren(widget, parseBlock(children));
        out.add(widget);
        return true;
    }

    /**
     * Nested lines under a widget are its reveals, except that a group named after one of a
     * choice's options holds that option's children.
     */
    private static void attachChildren(Element widget, List<Element> nested) {
        List<Element> reveals = new ArrayList<>();
        for (Element child : nested) {
            if (widget instanceof OptionElement && child instanceof GroupElement && child.getId() == null
                && child.getWhen() == null && child.getReveals().isEmpty()
                && ((OptionElement) widget).indexOfOption(child.getLabel()) >= 0) {
                ((OptionElement) widget).putOptionChildren(child.getLabel(), ((GroupElement) child).getElements());
            } else {
                reveals.add(child);
            }
        }
        widget.setReveals(reveals);
    }

    // ---- [if cond] { ... } ----

    static boolean startsConditional(String t) {
        return t.regionMatches(true, 0, "[if ", 0, 4) || t.equalsIgnoreCase("[if]");
    }

    private int parseBraceConditional(List<SourceLine> lines, int start, List<Element> out) {
        SourceLine head = lines.get(start);
        int close = head.text.indexOf(']');
        if (close < 0) {
            throw source.error(ErrorKind.MALFORMED_INPUT, head.offset, "Unclosed '[if' condition");
        }
        String rawCondition = head.text.substring(3, close);
        String condition = normalizeCondition(rawCondition, head.offset + 3);

        // The opening brace follows the condition on the same line or starts the next non-blank line.
        int lineIndex = start;
        String rest = head.text.substring(close + 1);
        int restOffset = head.offset + close + 1;
        int restIndent = head.indent + close + 1;
        if (rest.trim().isEmpty()) {
            int next = start + 1;
            while (next < lines.size() && lines.get(next).isBlank()) {
                next++;
            }
            if (next >= lines.size() || !lines.get(next).text.startsWith("{")) {
                throw source.error(ErrorKind.MALFORMED_INPUT, head.offset + close + 1,
                    "Expected '{' after [if " + rawCondition.trim() + "]");
            }
            lineIndex = next;
            rest = lines.get(next).text;
            restOffset = lines.get(next).offset;
            restIndent = lines.get(next).indent;
        }
        int lead = rest.indexOf('{');
        if (lead < 0 || !rest.substring(0, lead).trim().isEmpty()) {
            throw source.error(ErrorKind.MALFORMED_INPUT, restOffset,
                "Expected '{' after [if " + rawCondition.trim() + "]");
        }
        int braceOffset = restOffset + lead;

        // Scan for the matching brace, collecting the body as slices of the original lines.
        List<SourceLine> body = new ArrayList<>();
        int depth = 1;
        boolean inQuote = false;
        String segment = rest.substring(lead + 1);
        int segmentOffset = braceOffset + 1;
        int segmentIndent = restIndent + lead + 1;
        while (true) {
            for (int c = 0; c < segment.length(); c++) {
                char ch = segment.charAt(c);
                if (ch == '"') {
                    inQuote = !inQuote;
                } else if (!inQuote && ch == '{') {
                    depth++;
                } else if (!inQuote && ch == '}') {
                    depth--;
                    if (depth == 0) {
                        addSlice(body, segment.substring(0, c), segmentIndent, segmentOffset);
                        String trailing = segment.substring(c + 1).trim();
                        if (!trailing.isEmpty()) {
                            throw source.error(ErrorKind.MALFORMED_INPUT, segmentOffset + c + 1,
                                "Unexpected content after closing '}'");
                        }
                        out.add(new ConditionalElement(condition, parseBlock(body)));
                        return lineIndex + 1;
                    }
                }
            }
            addSlice(body, segment, segmentIndent, segmentOffset);
            lineIndex++;
            if (lineIndex >= lines.size()) {
                throw source.error(ErrorKind.MALFORMED_INPUT, braceOffset,
                    "Unclosed '{' for [if " + rawCondition.trim() + "]");
            }
            SourceLine next = lines.get(lineIndex);
            segment = next.text;
            inQuote = false;
            segmentOffset = next.offset;
            segmentIndent = next.indent;
        }
    }

    private static void addSlice(List<SourceLine> body, String raw, int indent, int offset) {
        SourceLine slice = SourceLine.slice(raw, indent, offset);
        if (!slice.isBlank()) {
            body.add(slice);
        }
    }

    private String normalizeCondition(String raw, int offset) {
        try {
            return ConditionParser.parse(raw).toString();
        } catch (PopupParseException e) {
            throw source.error(ErrorKind.MALFORMED_INPUT, offset, e.getReason());
        }
    }

    // ---- line classification ----

    private static int childrenEnd(List<SourceLine> lines, int index) {
        int indent = lines.get(index).indent;
        int end = index + 1;
        int lastContent = index;
        while (end < lines.size()) {
            SourceLine next = lines.get(end);
            if (!next.isBlank()) {
                if (next.indent <= indent) {
                    break;
                }
                lastContent = end;
            }
            end++;
        }
        return lastContent + 1;
    }

    private static boolean hasContent(List<SourceLine> lines) {
        for (SourceLine line : lines) {
            if (!line.isBlank()) {
                return true;
            }
        }
        return false;
    }

    static boolean isMessage(String t) {
        for (String prefix : MESSAGE_PREFIXES) {
            if (t.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    static boolean isQuoted(String t) {
        return t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"") && !t.endsWith("\\\"");
    }

    static boolean isGroupHeader(String t) {
        return GROUP_HEADER.matcher(t).matches();
    }

    static boolean isWhenBlock(String t) {
        return WHEN_BLOCK.matcher(t).matches();
    }

    /**
     * Index of the quote closing the one at position 0, skipping escaped characters, or -1.
     */
    static int closingQuote(String t) {
        for (int i = 1; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    static String unescape(String quoted) {
        StringBuilder sb = new StringBuilder(quoted.length());
        for (int i = 0; i < quoted.length(); i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length()) {
                char n = quoted.charAt(++i);
                sb.append(n == 'n' ? '\n' : n);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    static boolean startsWithKeyword(String t, String keyword) {
        return t.toLowerCase(Locale.ROOT).startsWith(keyword);
    }
}
