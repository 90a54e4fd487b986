package com.popupkit.dsl;

import com.popupkit.json.IdGenerator;
import com.popupkit.models.ButtonsElement;
import com.popupkit.models.Element;
import com.popupkit.models.PopupDefinition;
import com.popupkit.state.ElementLocator;

import java.util.ArrayList;
import java.util.List;

/**
 * Construction steps every textual dialect shares.
 */
final class ElementFactory {

    static final String DEFAULT_BUTTON = "OK";

    private ElementFactory() {
    }

    /**
     * Give a value-bearing element the slug of its label as identifier.
     */
    static <T extends Element> T identified(T element) {
        if (element.hasValue() && element.getId() == null) {
            element.setId(IdGenerator.slug(element.getLabel()));
        }
        return element;
    }

    /**
     * Add Force Yield to every button row, or append an {@code [OK | Force Yield]} row when the
     * popup has none at any depth.
     */
    static PopupDefinition finish(String title, List<Element> elements) {
        List<Element> body = new ArrayList<>(elements);
        boolean[] sawButtons = {false};
        ElementLocator.forEach(body, element -> {
            if (element instanceof ButtonsElement) {
                ((ButtonsElement) element).ensureForceYield();
                sawButtons[0] = true;
            }
        });
        if (!sawButtons[0]) {
            ButtonsElement row = new ButtonsElement(List.of(DEFAULT_BUTTON));
            row.ensureForceYield();
            body.add(row);
        }
        return new PopupDefinition(title, body);
    }
}
