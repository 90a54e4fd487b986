package com.popupkit.dsl;

import com.popupkit.models.ButtonsElement;
import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ConditionalElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementKind;
import com.popupkit.models.GroupElement;
import com.popupkit.models.OptionElement;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.SliderElement;
import com.popupkit.models.TextInputElement;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a popup tree as indentation-structured text that {@link StructuredDialectParser}
 * reads back with the same title, element kinds and labels.
 * Per-element guards outside conditional blocks, reveals of groups and text-input row counts
 * are not written.
 */
public final class DslSerializer {

    private static final String INDENT = "  ";

    private DslSerializer() {
    }

    public static String serialize(PopupDefinition definition) {
        StringBuilder sb = new StringBuilder();
        int depth = 0;
        String title = definition.getTitle();
        if (title != null) {
            String line = title + ":";
            sb.append(StructuredDialectParser.isTitleCandidate(line) && !title.isEmpty() ? line : "# " + line).append('\n');
            depth = 1;
        }
        writeElements(definition.getElements(), depth, title == null, sb);
        return sb.toString();
    }

    private static void writeElements(List<Element> elements, int depth, boolean firstLineOfInput, StringBuilder sb) {
        boolean first = firstLineOfInput;
        for (Element element : elements) {
            writeElement(element, depth, first, sb);
            first = false;
        }
    }

    private static void writeElement(Element element, int depth, boolean firstLineOfInput, StringBuilder sb) {
        String label = element.getLabel();
        switch (element.getKind()) {
            case TEXT:
                line(sb, depth, textLine(label, firstLineOfInput));
                break;
            case SLIDER: {
                SliderElement slider = (SliderElement) element;
                StringBuilder value = new StringBuilder()
                    .append(SliderElement.formatNumber(slider.getMin()))
                    .append("..")
                    .append(SliderElement.formatNumber(slider.getMax()));
                if (slider.getDefaultValue() != null) {
                    value.append(" = ").append(SliderElement.formatNumber(slider.getDefaultValue()));
                }
                line(sb, depth, widgetLabel(label) + ": " + value);
                break;
            }
            case CHECKBOX:
                line(sb, depth, widgetLabel(label) + ": " + (((CheckboxElement) element).getDefaultValue() ? "yes" : "no"));
                break;
            case TEXTBOX: {
                String placeholder = ((TextInputElement) element).getPlaceholder();
                line(sb, depth, widgetLabel(label) + ": @" + (placeholder != null ? placeholder : ""));
                break;
            }
            case CHOICE:
            case SELECT: {
                List<String> options = ((OptionElement) element).getOptionLabels();
                String joined = String.join(" | ", options);
                line(sb, depth, widgetLabel(label) + ": " + (options.size() == 1 ? joined + " |" : joined));
                break;
            }
            case MULTISELECT:
                line(sb, depth, widgetLabel(label) + ": " + multiSelectValue(((OptionElement) element).getOptionLabels()));
                break;
            case GROUP:
                line(sb, depth, "--- " + label + " ---");
                writeElements(((GroupElement) element).getElements(), depth + 1, false, sb);
                break;
            case CONDITIONAL:
                line(sb, depth, "when " + ((ConditionalElement) element).getCondition() + ":");
                break;
            case BUTTONS:
                line(sb, depth, "[" + String.join(" | ", ((ButtonsElement) element).getButtons()) + "]");
                break;
            default:
                throw new IllegalStateException("Unhandled element kind " + element.getKind());
        }

        if (element instanceof OptionElement) {
            for (Map.Entry<String, List<Element>> branch : ((OptionElement) element).getOptionChildren().entrySet()) {
                if (branch.getValue().isEmpty()) {
                    continue;
                }
                line(sb, depth + 1, widgetLabel(branch.getKey()) + ":");
                writeElements(branch.getValue(), depth + 2, false, sb);
            }
        }
        // Lines nested under a group header read back as members, so group reveals have no written form.
        if (element.getKind() != ElementKind.GROUP) {
            writeElements(element.getReveals(), depth + 1, false, sb);
        }
    }

    /**
     * Labels that would change how a {@code Label: value} line reads are written quoted.
     */
    static String widgetLabel(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        if (needsQuoting(label) || label.contains("\"") || BodyParser.isMessage(label + " ")
            || lower.startsWith("buttons") || lower.startsWith("actions")) {
            return "\"" + BodyParser.escape(label) + "\"";
        }
        return label;
    }

    /**
     * Options are quoted when the bare list would read as a checkbox word such as {@code [x]}.
     */
    static String multiSelectValue(List<String> options) {
        if (options.isEmpty()) {
            return "[" + WidgetInference.EMPTY_OPTIONS + "]";
        }
        String bare = "[" + String.join(", ", options) + "]";
        if (WidgetInference.booleanValue(bare) == null) {
            return bare;
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < options.size(); i++) {
            sb.append(i > 0 ? ", " : "").append('"').append(options.get(i)).append('"');
        }
        return sb.append(']').toString();
    }

    /**
     * Static text is written bare when it would read back as text, quoted otherwise.
     */
    private static String textLine(String content, boolean firstLineOfInput) {
        if (BodyParser.isMessage(content) && !content.contains("\n")) {
            return content;
        }
        if (firstLineOfInput || needsQuoting(content)) {
            return "\"" + BodyParser.escape(content) + "\"";
        }
        return content;
    }

    private static boolean needsQuoting(String content) {
        if (content.isEmpty() || !content.equals(content.trim()) || content.contains("\n")) {
            return true;
        }
        if (content.contains(":") || content.contains("|") || content.contains("{") || content.contains("}")) {
            return true;
        }
        char c = content.charAt(0);
        if (c == '[' || c == '"' || c == '#' || c == '-' || c == '→' || c == '/') {
            return true;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        return lower.startsWith("with ") || lower.startsWith("when ") || ButtonRowSyntax.parse(content) != null;
    }

    private static void line(StringBuilder sb, int depth, String text) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        sb.append(text).append('\n');
    }
}
