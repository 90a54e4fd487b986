package com.popupkit.parse;

import com.popupkit.models.Element;
import com.popupkit.models.OptionElement;
import com.popupkit.models.PopupDefinition;
import com.popupkit.state.ElementLocator;

import java.util.HashSet;
import java.util.Set;

/**
 * Whole-tree checks that no single element can make on its own.
 */
public final class PopupValidator {

    private PopupValidator() {
    }

    public static PopupDefinition validate(PopupDefinition definition) {
        Set<String> seen = new HashSet<>();
        ElementLocator.forEach(definition.getElements(), element -> {
            checkIdentifier(element, seen);
            if (element instanceof OptionElement) {
                checkOptionChildren((OptionElement) element);
            }
        });
        return definition;
    }

    private static void checkIdentifier(Element element, Set<String> seen) {
        String id = element.getId();
        if (id != null && !seen.add(id)) {
            throw new PopupParseException(ErrorKind.DUPLICATE_IDENTIFIER,
                "Duplicate identifier '" + id + "' (" + element.getKind().getTag() + " '" + element.getLabel() + "')");
        }
    }

    private static void checkOptionChildren(OptionElement element) {
        for (String key : element.getOptionChildren().keySet()) {
            if (element.indexOfOption(key) < 0) {
                throw new PopupParseException(ErrorKind.MALFORMED_INPUT,
                    "Option children key '" + key + "' is not an option of '" + element.getLabel() + "'");
            }
        }
    }
}
