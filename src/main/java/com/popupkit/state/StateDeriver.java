package com.popupkit.state;

import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementValue;
import com.popupkit.models.MultiSelectElement;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupState;
import com.popupkit.models.SliderElement;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;

/**
 * Builds the initial {@link PopupState}. Every reveal list and every option branch is walked,
 * whatever is selected, so an element that becomes visible later already has a value.
 */
public final class StateDeriver {

    private StateDeriver() {
    }

    public static PopupState derive(PopupDefinition definition) {
        PopupState state = new PopupState();
        ElementLocator.forEach(definition.getElements(), element -> {
            if (!element.hasValue() || element.getId() == null) {
                return;
            }
            if (state.getValues().containsKey(element.getId())) {
                throw new PopupParseException(ErrorKind.DUPLICATE_IDENTIFIER,
                    "Duplicate identifier '" + element.getId() + "'");
            }
            state.setValue(element.getId(), initialValue(element));
        });
        return state;
    }

    /**
     * Default value of a value-bearing element, or null for elements that carry none.
     */
    public static ElementValue initialValue(Element element) {
        switch (element.getKind()) {
            case SLIDER:
                return ElementValue.number(((SliderElement) element).effectiveDefault());
            case CHECKBOX:
                return ElementValue.bool(((CheckboxElement) element).getDefaultValue());
            case TEXTBOX:
                return ElementValue.text("");
            case CHOICE:
            case SELECT: {
                ChoiceElement choice = (ChoiceElement) element;
                Integer index = choice.getDefaultIndex();
                boolean inRange = index != null && index >= 0 && index < choice.getOptions().size();
                return ElementValue.choice(inRange ? index : null);
            }
            case MULTISELECT:
                return ElementValue.emptyMultiChoice(((MultiSelectElement) element).getOptions().size());
            default:
                return null;
        }
    }
}
