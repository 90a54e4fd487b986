package com.popupkit.dsl;

import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.Element;
import com.popupkit.models.MultiSelectElement;
import com.popupkit.models.OptionValue;
import com.popupkit.models.SliderElement;
import com.popupkit.models.TextInputElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers a widget from the value half of a {@code Label: value} line.
 */
public final class WidgetInference {

    private static final String NUMBER = "(-?\\d+(?:\\.\\d+)?)";
    private static final Pattern RANGE = Pattern.compile(
        "^" + NUMBER + "(?:\\s*(?:-|\\.\\.)\\s*|\\s+to\\s+)" + NUMBER + "(?:\\s*=\\s*" + NUMBER + ")?$");

    private static final Set<String> TRUE_WORDS = Set.of(
        "yes", "true", "on", "enabled", "checked", "✓", "✔", "☑", "[x]");
    private static final Set<String> FALSE_WORDS = Set.of(
        "no", "false", "off", "disabled", "unchecked", "✗", "✘", "☐", "[ ]", "[]");

    static final String EMPTY_OPTIONS = "\"\"";

    private WidgetInference() {
    }

    /**
     * @return the inferred widget with its identifier set, or null when the value is plain text
     */
    public static Element infer(String label, String value) {
        String v = value.trim();
        if (v.isEmpty()) {
            return null;
        }
        if (v.startsWith("@")) {
            String hint = v.substring(1).trim();
            return ElementFactory.identified(new TextInputElement(label, hint.isEmpty() ? null : hint, null));
        }
        Boolean flag = booleanValue(v);
        if (flag != null) {
            return ElementFactory.identified(new CheckboxElement(label, flag));
        }
        Matcher range = RANGE.matcher(v);
        if (range.matches()) {
            double min = Double.parseDouble(range.group(1));
            double max = Double.parseDouble(range.group(2));
            Double def = range.group(3) != null ? Double.parseDouble(range.group(3)) : null;
            return ElementFactory.identified(new SliderElement(label, min, max, def));
        }
        if (v.startsWith("[") && v.endsWith("]")) {
            String inner = v.substring(1, v.length() - 1).trim();
            List<OptionValue> options = splitOptions(inner, ",");
            // [""] is the written form of a multiselect without options
            if (options.isEmpty() && !EMPTY_OPTIONS.equals(inner)) {
                return null;
            }
            return ElementFactory.identified(new MultiSelectElement(label, options));
        }
        if (v.contains("|")) {
            List<OptionValue> options = splitOptions(v, "\\|");
            return options.isEmpty() ? null : ElementFactory.identified(new ChoiceElement(label, options, null));
        }
        return null;
    }

    static Boolean booleanValue(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(lower)) {
            return Boolean.TRUE;
        }
        if (FALSE_WORDS.contains(lower)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static List<OptionValue> splitOptions(String raw, String separatorRegex) {
        List<OptionValue> options = new ArrayList<>();
        for (String part : raw.split(separatorRegex)) {
            String label = ButtonRowSyntax.unquote(part.trim());
            if (!label.isEmpty()) {
                options.add(new OptionValue(label));
            }
        }
        return options;
    }
}
