package com.popupkit.condition;

import com.popupkit.AppLogger;
import com.popupkit.json.IdGenerator;
import com.popupkit.models.Element;
import com.popupkit.models.ElementValue;
import com.popupkit.models.OptionElement;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupState;
import com.popupkit.parse.PopupParseException;
import com.popupkit.state.ElementLocator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates display guards against the current popup state.
 */
public class ConditionEvaluator {

    private final PopupDefinition definition;
    private final PopupState state;

    public ConditionEvaluator(PopupDefinition definition, PopupState state) {
        this.definition = definition;
        this.state = state;
    }

    /**
     * Evaluate guard text. A guard that cannot be parsed is treated as satisfied, so a typo
     * shows the element instead of hiding it for good.
     */
    public boolean evaluate(String guard) {
        if (guard == null || guard.isBlank()) {
            return true;
        }
        Condition condition;
        try {
            condition = ConditionParser.parse(guard);
        } catch (PopupParseException e) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.warn("Ignoring unparseable guard '" + guard + "': " + e.getReason());
            }
            return true;
        }
        return evaluate(condition);
    }

    public boolean evaluate(Condition condition) {
        switch (condition.getType()) {
            case TRUTHY: {
                Element element = resolve(condition.getReference());
                return element != null && isTruthy(state.getValue(element.getId()));
            }
            case NOT:
                return !evaluate(condition.getInner());
            case AND:
                for (Condition part : condition.getParts()) {
                    if (!evaluate(part)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (Condition part : condition.getParts()) {
                    if (evaluate(part)) {
                        return true;
                    }
                }
                return false;
            case HAS:
                return has(condition.getReference(), condition.getOperand());
            case COMPARE:
                return compare(condition);
            default:
                throw new IllegalStateException("Unhandled condition type " + condition.getType());
        }
    }

    /**
     * Implicit "is set" rule used for guards and for showing reveals: a checked box, a selected
     * choice, a non-empty multi-selection or text, a non-zero number.
     */
    public static boolean isTruthy(ElementValue value) {
        if (value == null) {
            return false;
        }
        switch (value.getType()) {
            case BOOLEAN:
                return value.asBoolean();
            case NUMBER:
                return value.asNumber() != 0;
            case TEXT:
                return !value.asText().isEmpty();
            case CHOICE:
                return value.asChoice() != null;
            case MULTI_CHOICE:
                return value.asMultiChoice().contains(Boolean.TRUE);
            default:
                return false;
        }
    }

    /**
     * Find the referenced element: by id first, then by the slug of the reference.
     */
    Element resolve(String reference) {
        Element element = ElementLocator.findById(definition, reference);
        if (element == null) {
            element = ElementLocator.findById(definition, IdGenerator.slug(reference));
        }
        return element;
    }

    private boolean has(String reference, String operand) {
        Element element = resolve(reference);
        if (element == null) {
            return false;
        }
        ElementValue value = state.getValue(element.getId());
        if (value == null) {
            return false;
        }
        switch (value.getType()) {
            case MULTI_CHOICE:
            case CHOICE:
                for (String label : selectedLabels(element, value)) {
                    if (label.equalsIgnoreCase(operand)) {
                        return true;
                    }
                }
                return false;
            case TEXT:
                return value.asText().toLowerCase(Locale.ROOT).contains(operand.toLowerCase(Locale.ROOT));
            default:
                return false;
        }
    }

    private boolean compare(Condition condition) {
        Element element = resolve(condition.getReference());
        if (element == null) {
            return false;
        }
        ElementValue value = state.getValue(element.getId());
        if (value == null) {
            return false;
        }
        ComparisonOperator operator = condition.getOperator();
        String operand = condition.getOperand();
        Double number = parseNumber(operand);

        if (number != null) {
            if (value.getType() == ElementValue.Type.NUMBER) {
                return operator.test(Double.compare(value.asNumber(), number));
            }
            if (value.getType() == ElementValue.Type.MULTI_CHOICE) {
                return operator.test(Double.compare(selectedLabels(element, value).size(), number));
            }
        }
        if (operator.isOrdering()) {
            return false;
        }
        String actual = displayText(element, value);
        boolean equal = actual != null && actual.equalsIgnoreCase(operand)
            || value.getType() == ElementValue.Type.BOOLEAN && booleanWord(operand) != null
                && booleanWord(operand) == value.asBoolean();
        return operator == ComparisonOperator.EQUALS ? equal : !equal;
    }

    private static String displayText(Element element, ElementValue value) {
        switch (value.getType()) {
            case TEXT:
                return value.asText();
            case BOOLEAN:
                return Boolean.toString(value.asBoolean());
            case NUMBER:
                return Double.toString(value.asNumber());
            case CHOICE: {
                List<String> labels = selectedLabels(element, value);
                return labels.isEmpty() ? null : labels.get(0);
            }
            default:
                return null;
        }
    }

    static List<String> selectedLabels(Element element, ElementValue value) {
        List<String> labels = new ArrayList<>();
        if (!(element instanceof OptionElement)) {
            return labels;
        }
        List<String> options = ((OptionElement) element).getOptionLabels();
        if (value.getType() == ElementValue.Type.CHOICE) {
            Integer index = value.asChoice();
            if (index != null && index >= 0 && index < options.size()) {
                labels.add(options.get(index));
            }
        } else if (value.getType() == ElementValue.Type.MULTI_CHOICE) {
            List<Boolean> flags = value.asMultiChoice();
            for (int i = 0; i < options.size() && i < flags.size(); i++) {
                if (Boolean.TRUE.equals(flags.get(i))) {
                    labels.add(options.get(i));
                }
            }
        }
        return labels;
    }

    private static Boolean booleanWord(String word) {
        switch (word.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "on":
            case "checked":
                return Boolean.TRUE;
            case "false":
            case "no":
            case "off":
            case "unchecked":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    private static Double parseNumber(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
