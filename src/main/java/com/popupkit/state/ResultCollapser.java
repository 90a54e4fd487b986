package com.popupkit.state;

import com.popupkit.AppLogger;
import com.popupkit.models.Element;
import com.popupkit.models.ElementValue;
import com.popupkit.models.OptionElement;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupResult;
import com.popupkit.models.PopupState;
import com.popupkit.models.SliderElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a final {@link PopupState} into the flat {@link PopupResult} handed back to the caller.
 */
public final class ResultCollapser {

    private ResultCollapser() {
    }

    public static PopupResult collapse(PopupState state, PopupDefinition definition) {
        return collapse(state, definition, null);
    }

    /**
     * @param onlyIds when non-null, values for identifiers outside this set are left out
     */
    public static PopupResult collapse(PopupState state, PopupDefinition definition, Set<String> onlyIds) {
        if (state == null || state.getButtonClicked() == null) {
            return PopupResult.cancelled();
        }
        AppLogger logger = AppLogger.get();
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, ElementValue> entry : state.getValues().entrySet()) {
            String id = entry.getKey();
            if (onlyIds != null && !onlyIds.contains(id)) {
                continue;
            }
            Element element = ElementLocator.findById(definition, id);
            if (element == null) {
                if (logger != null) {
                    logger.warn("Skipping state value for unknown element '" + id + "'");
                }
                continue;
            }
            Object formatted = format(element, entry.getValue());
            if (formatted != null) {
                values.put(id, formatted);
            } else if (logger != null && entry.getValue().getType() != ElementValue.Type.CHOICE) {
                logger.warn("Skipping value of '" + id + "': " + entry.getValue().getType()
                    + " does not fit a " + element.getKind().getTag());
            }
        }
        return PopupResult.completed(state.getButtonClicked(), values);
    }

    /**
     * Caller-facing form of one value, or null when it should be omitted.
     */
    static Object format(Element element, ElementValue value) {
        if (value == null) {
            return null;
        }
        switch (element.getKind()) {
            case SLIDER:
                if (value.getType() != ElementValue.Type.NUMBER) {
                    return null;
                }
                return SliderElement.formatNumber(value.asNumber()) + "/"
                    + SliderElement.formatNumber(((SliderElement) element).getMax());
            case CHECKBOX:
                return value.getType() == ElementValue.Type.BOOLEAN ? value.asBoolean() : null;
            case TEXTBOX:
                return value.getType() == ElementValue.Type.TEXT ? value.asText() : null;
            case CHOICE:
            case SELECT: {
                if (value.getType() != ElementValue.Type.CHOICE || value.asChoice() == null) {
                    return null;
                }
                List<String> labels = ((OptionElement) element).getOptionLabels();
                int index = value.asChoice();
                return index >= 0 && index < labels.size() ? labels.get(index) : null;
            }
            case MULTISELECT: {
                if (value.getType() != ElementValue.Type.MULTI_CHOICE) {
                    return null;
                }
                List<String> labels = ((OptionElement) element).getOptionLabels();
                List<Boolean> flags = value.asMultiChoice();
                List<String> selected = new ArrayList<>();
                for (int i = 0; i < labels.size() && i < flags.size(); i++) {
                    if (Boolean.TRUE.equals(flags.get(i))) {
                        selected.add(labels.get(i));
                    }
                }
                return selected;
            }
            default:
                return null;
        }
    }
}
