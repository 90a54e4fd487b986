package com.popupkit.dsl;

import com.popupkit.condition.ConditionParser;
import com.popupkit.dsl.ClassicTokenizer.Token;
import com.popupkit.dsl.ClassicTokenizer.Type;
import com.popupkit.models.ButtonsElement;
import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.ConditionalElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementKind;
import com.popupkit.models.GroupElement;
import com.popupkit.models.MultiSelectElement;
import com.popupkit.models.OptionValue;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.SliderElement;
import com.popupkit.models.TextElement;
import com.popupkit.models.TextInputElement;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;
import com.popupkit.parse.SourceText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bracketed dialect:
 * <pre>
 * popup "Settings" [
 *   slider "Volume" 0..100 default = 75
 *   choice "Theme" ["Light", "Dark"]
 *   [if Theme = Dark] { checkbox "High contrast" }
 *   buttons ["Save", "Cancel"]
 * ]
 * </pre>
 */
public class ClassicDialectParser implements DialectParser {

    public static final String NAME = "classic";
    static final String KEYWORD = "popup";

    private static final Pattern ENVELOPE = Pattern.compile("^\\s*popup\\b[ \\t]*(\"|[^\\n]*\\[)");
    private static final Pattern RANGE = Pattern.compile("^(-?\\d+(?:\\.\\d+)?)(?:\\.\\.|-)(-?\\d+(?:\\.\\d+)?)$");
    private static final Map<String, ElementKind> WIDGET_KEYWORDS = buildWidgetKeywords();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean matchesEnvelope(String input) {
        return input != null && ENVELOPE.matcher(input).find();
    }

    @Override
    public PopupDefinition parse(String input) {
        SourceText source = new SourceText(input);
        return new Parser(source, ClassicTokenizer.tokenize(source)).parsePopup();
    }

    /**
     * Element kind for a widget keyword, including aliases such as {@code toggle} or {@code dropdown}.
     */
    public static ElementKind widgetKind(String keyword) {
        return keyword != null ? WIDGET_KEYWORDS.get(keyword.toLowerCase(Locale.ROOT)) : null;
    }

    private static Map<String, ElementKind> buildWidgetKeywords() {
        Map<String, ElementKind> map = new HashMap<>();
        register(map, ElementKind.TEXT, "text", "label", "message", "markdown", "info", "note", "display");
        register(map, ElementKind.SLIDER, "slider", "range", "scale", "number");
        register(map, ElementKind.CHECKBOX, "checkbox", "check", "toggle", "switch", "bool", "boolean");
        register(map, ElementKind.TEXTBOX, "textbox", "input", "textarea", "textfield", "field", "text_input", "string");
        register(map, ElementKind.CHOICE, "choice", "radio", "options", "choose", "single");
        register(map, ElementKind.SELECT, "select", "dropdown");
        register(map, ElementKind.MULTISELECT, "multiselect", "multi", "tags", "checklist", "multiple");
        register(map, ElementKind.GROUP, "group", "section");
        register(map, ElementKind.BUTTONS, "buttons", "actions");
        return Collections.unmodifiableMap(map);
    }

    private static void register(Map<String, ElementKind> map, ElementKind kind, String... keywords) {
        for (String keyword : keywords) {
            map.put(keyword, kind);
        }
    }

    private static final class Parser {
        private final SourceText source;
        private final List<Token> tokens;
        private int pos;

        Parser(SourceText source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        PopupDefinition parsePopup() {
            Token keyword = next();
            if (!keyword.isWord(KEYWORD)) {
                throw error(keyword, "Expected 'popup' but found " + keyword.describe());
            }
            String title = expect(Type.STRING, "a quoted title after 'popup'").text;
            Token open = expect(Type.LBRACKET, "'[' to open the popup body");
            List<Element> elements = parseItems(open, Type.RBRACKET);
            expect(Type.RBRACKET, "']' to close the popup body");
            if (peek().type != Type.EOF) {
                throw error(peek(), "Unexpected " + peek().describe() + " after the popup body");
            }
            return ElementFactory.finish(title, elements);
        }

        private List<Element> parseItems(Token opener, Type closer) {
            List<Element> items = new ArrayList<>();
            while (true) {
                while (peek().type == Type.COMMA) {
                    next();
                }
                Token t = peek();
                if (t.type == closer) {
                    return items;
                }
                if (t.type == Type.EOF) {
                    throw error(opener, "Unclosed '" + opener.text + "'");
                }
                items.add(parseItem());
            }
        }

        private Element parseItem() {
            Token t = peek();
            if (t.type == Type.LBRACKET) {
                if (peekAhead(1).isWord("if")) {
                    return parseConditional();
                }
                next();
                return new ButtonsElement(parseLabelList(t));
            }
            if (t.type == Type.STRING) {
                next();
                return new TextElement(t.text);
            }
            if (t.type != Type.WORD) {
                throw error(t, "Expected a popup element but found " + t.describe());
            }
            ElementKind kind = widgetKind(t.text);
            if (kind == null) {
                throw source.error(ErrorKind.UNKNOWN_WIDGET_KIND, t.offset, "Unknown widget kind '" + t.text + "'");
            }
            next();
            switch (kind) {
                case TEXT:
                    return new TextElement(expect(Type.STRING, "quoted text after '" + t.text + "'").text);
                case SLIDER:
                    return parseSlider(t);
                case CHECKBOX:
                    return parseCheckbox(t);
                case TEXTBOX:
                    return parseTextbox(t);
                case CHOICE:
                case SELECT: {
                    String label = label(t);
                    Token open = expect(Type.LBRACKET, "'[' with the options of '" + label + "'");
                    List<OptionValue> options = toOptions(parseLabelList(open));
                    Integer defaultIndex = null;
                    if (peek().isWord("default")) {
                        next();
                        acceptEquals();
                        defaultIndex = parseDefaultOption(options);
                    }
                    return ElementFactory.identified(new ChoiceElement(kind, label, options, defaultIndex));
                }
                case MULTISELECT: {
                    String label = label(t);
                    Token open = expect(Type.LBRACKET, "'[' with the options of '" + label + "'");
                    return ElementFactory.identified(new MultiSelectElement(label, toOptions(parseLabelList(open))));
                }
                case GROUP: {
                    String label = label(t);
                    Token open = expect(Type.LBRACKET, "'[' to open group '" + label + "'");
                    List<Element> members = parseItems(open, Type.RBRACKET);
                    expect(Type.RBRACKET, "']' to close group '" + label + "'");
                    return new GroupElement(label, members);
                }
                case BUTTONS: {
                    Token open = expect(Type.LBRACKET, "'[' with the button labels");
                    return new ButtonsElement(parseLabelList(open));
                }
                default:
                    throw error(t, "'" + t.text + "' cannot be used here");
            }
        }

        private Element parseSlider(Token keyword) {
            String label = label(keyword);
            Double min = null;
            Double max = null;
            Double def = null;
            while (true) {
                Token t = peek();
                Matcher range = t.type == Type.WORD ? RANGE.matcher(t.text) : null;
                if (range != null && range.matches()) {
                    next();
                    min = Double.parseDouble(range.group(1));
                    max = Double.parseDouble(range.group(2));
                } else if (t.type == Type.WORD && isNumber(t.text) && peekAhead(1).isWord("to")) {
                    min = number(next());
                    next();
                    max = number(next());
                } else if (t.isWord("min") || t.isWord("max") || t.isWord("default")) {
                    next();
                    acceptEquals();
                    double value = number(next());
                    if (t.isWord("min")) {
                        min = value;
                    } else if (t.isWord("max")) {
                        max = value;
                    } else {
                        def = value;
                    }
                } else if (t.type == Type.EQUALS) {
                    next();
                    def = number(next());
                } else {
                    break;
                }
            }
            return ElementFactory.identified(new SliderElement(label,
                min != null ? min : 0, max != null ? max : 100, def));
        }

        private Element parseCheckbox(Token keyword) {
            String label = label(keyword);
            boolean def = false;
            Token t = peek();
            if (t.isWord("default")) {
                next();
                acceptEquals();
                def = bool(next());
            } else if (t.type == Type.WORD && WidgetInference.booleanValue(t.text) != null) {
                def = bool(next());
            }
            return ElementFactory.identified(new CheckboxElement(label, def));
        }

        private Element parseTextbox(Token keyword) {
            String label = label(keyword);
            String placeholder = null;
            Integer rows = null;
            while (true) {
                Token t = peek();
                if (t.isWord("rows")) {
                    next();
                    acceptEquals();
                    rows = (int) number(next());
                } else if (t.isWord("placeholder")) {
                    next();
                    acceptEquals();
                    placeholder = expect(Type.STRING, "a quoted placeholder").text;
                } else if (t.type == Type.AT) {
                    next();
                    Token hint = next();
                    if (hint.type != Type.STRING && hint.type != Type.WORD) {
                        throw error(hint, "Expected a hint after '@' but found " + hint.describe());
                    }
                    placeholder = hint.text;
                } else if (t.isWord("multiline")) {
                    next();
                    rows = rows != null ? rows : 3;
                } else {
                    break;
                }
            }
            return ElementFactory.identified(new TextInputElement(label, placeholder, rows));
        }

        private Element parseConditional() {
            Token open = next();
            next();
            int start = peek().offset;
            while (peek().type != Type.RBRACKET) {
                if (peek().type == Type.EOF) {
                    throw error(open, "Unclosed '[if' condition");
                }
                next();
            }
            Token close = next();
            String raw = source.getText().substring(Math.min(start, close.offset), close.offset);
            String condition;
            try {
                condition = ConditionParser.parse(raw).toString();
            } catch (PopupParseException e) {
                throw source.error(ErrorKind.MALFORMED_INPUT, start, e.getReason());
            }
            Token brace = expect(Type.LBRACE, "'{' after [if " + raw.trim() + "]");
            List<Element> body = parseItems(brace, Type.RBRACE);
            expect(Type.RBRACE, "'}' to close [if " + raw.trim() + "]");
            return new ConditionalElement(condition, body);
        }

        /**
         * Labels up to the closing bracket, separated by commas or pipes. Unquoted words
         * in a row join into one label.
         */
        private List<String> parseLabelList(Token open) {
            List<String> labels = new ArrayList<>();
            StringBuilder current = null;
            while (true) {
                Token t = next();
                switch (t.type) {
                    case RBRACKET:
                        if (current != null) {
                            labels.add(current.toString());
                        }
                        if (labels.isEmpty()) {
                            throw error(open, "Empty list");
                        }
                        return labels;
                    case COMMA:
                    case PIPE:
                        if (current != null) {
                            labels.add(current.toString());
                            current = null;
                        }
                        break;
                    case STRING:
                        if (current != null) {
                            labels.add(current.toString());
                        }
                        labels.add(t.text);
                        current = null;
                        break;
                    case WORD:
                        current = current == null ? new StringBuilder(t.text) : current.append(' ').append(t.text);
                        break;
                    case EOF:
                        throw error(open, "Unclosed '['");
                    default:
                        throw error(t, "Unexpected " + t.describe() + " in list");
                }
            }
        }

        private Integer parseDefaultOption(List<OptionValue> options) {
            Token t = next();
            if (t.type == Type.STRING || (t.type == Type.WORD && !isNumber(t.text))) {
                for (int i = 0; i < options.size(); i++) {
                    if (options.get(i).getLabel().equals(t.text)) {
                        return i;
                    }
                }
                throw error(t, "Default " + t.describe() + " is not one of the options");
            }
            return (int) number(t);
        }

        private String label(Token keyword) {
            return expect(Type.STRING, "a quoted label after '" + keyword.text + "'").text;
        }

        private void acceptEquals() {
            if (peek().type == Type.EQUALS) {
                next();
            }
        }

        private double number(Token t) {
            if (t.type != Type.WORD || !isNumber(t.text)) {
                throw error(t, "Expected a number but found " + t.describe());
            }
            return Double.parseDouble(t.text);
        }

        private boolean bool(Token t) {
            Boolean value = t.type == Type.WORD ? WidgetInference.booleanValue(t.text) : null;
            if (value == null) {
                throw error(t, "Expected true or false but found " + t.describe());
            }
            return value;
        }

        private Token expect(Type type, String what) {
            Token t = peek();
            if (t.type != type) {
                throw error(t, "Expected " + what + " but found " + t.describe());
            }
            return next();
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token peekAhead(int n) {
            return tokens.get(Math.min(pos + n, tokens.size() - 1));
        }

        private Token next() {
            Token t = tokens.get(pos);
            if (t.type != Type.EOF) {
                pos++;
            }
            return t;
        }

        private PopupParseException error(Token at, String reason) {
            return source.error(ErrorKind.MALFORMED_INPUT, at.offset, reason);
        }
    }

    private static List<OptionValue> toOptions(List<String> labels) {
        List<OptionValue> options = new ArrayList<>();
        for (String label : labels) {
            options.add(new OptionValue(label));
        }
        return options;
    }

    private static boolean isNumber(String text) {
        return text.matches("-?\\d+(?:\\.\\d+)?");
    }
}
