package com.popupkit.dsl;

import com.popupkit.models.ButtonsElement;
import com.popupkit.models.Element;
import com.popupkit.models.PopupDefinition;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.SourceText;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Confirmation dialect: {@code confirm Delete file? with Yes or No}. Lines after the first use
 * the structured body grammar.
 */
public class NaturalDialectParser implements DialectParser {

    public static final String NAME = "natural";
    static final String KEYWORD = "confirm ";

    private static final Pattern WITH_SEPARATOR = Pattern.compile("(?i)\\s+with\\s+");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean matchesEnvelope(String input) {
        List<SourceLine> lines = SourceLine.split(new SourceText(input));
        int first = StructuredDialectParser.firstContentLine(lines);
        return first >= 0 && lines.get(first).text.toLowerCase(Locale.ROOT).startsWith(KEYWORD);
    }

    @Override
    public PopupDefinition parse(String input) {
        SourceText source = new SourceText(input);
        List<SourceLine> lines = SourceLine.split(source);
        int first = StructuredDialectParser.firstContentLine(lines);
        if (first < 0 || !lines.get(first).text.toLowerCase(Locale.ROOT).startsWith(KEYWORD)) {
            throw source.error(ErrorKind.MALFORMED_INPUT, first < 0 ? 0 : lines.get(first).offset,
                "Expected 'confirm <question>'");
        }
        SourceLine head = lines.get(first);
        String question = head.text.substring(KEYWORD.length()).trim();

        // The last " with A or B" whose tail is a button phrase; earlier ones belong to the question.
        List<String> inlineButtons = null;
        Matcher with = WITH_SEPARATOR.matcher(question);
        int split = -1;
        while (with.find()) {
            List<String> buttons = with.start() > 0 ? ButtonRowSyntax.parseOrPhrase(question.substring(with.end())) : null;
            if (buttons != null) {
                inlineButtons = buttons;
                split = with.start();
            }
        }
        if (split >= 0) {
            question = question.substring(0, split).trim();
        }
        if (question.isEmpty()) {
            throw source.error(ErrorKind.MALFORMED_INPUT, head.offset + KEYWORD.length(),
                "'confirm' needs a question");
        }
        if (!question.endsWith("?")) {
            question = question + "?";
        }

        List<Element> elements = new BodyParser(source).parseBlock(lines.subList(first + 1, lines.size()));
        if (inlineButtons != null) {
            elements.add(new ButtonsElement(inlineButtons));
        }
        return ElementFactory.finish(question, elements);
    }
}
