package com.popupkit.state;

import com.popupkit.models.Element;
import com.popupkit.models.PopupDefinition;

import java.util.List;
import java.util.function.Consumer;

/**
 * Root-down search over the element tree. Nothing keeps parent pointers, so every lookup
 * starts at the top and descends through reveals, group members and option children.
 */
public final class ElementLocator {

    private ElementLocator() {
    }

    public static Element findById(PopupDefinition definition, String id) {
        return definition != null ? findById(definition.getElements(), id) : null;
    }

    /**
     * Elements of the given list are checked before anything nested below them.
     */
    public static Element findById(List<Element> elements, String id) {
        if (elements == null || id == null) {
            return null;
        }
        for (Element element : elements) {
            if (id.equals(element.getId())) {
                return element;
            }
        }
        for (Element element : elements) {
            Element found = findById(element.getReveals(), id);
            if (found != null) {
                return found;
            }
            for (List<Element> nested : element.getNestedLists()) {
                found = findById(nested, id);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /**
     * Pre-order visit of every element: the element, its nested lists (group members or option
     * children), then its reveals.
     */
    public static void forEach(List<Element> elements, Consumer<Element> visitor) {
        if (elements == null) {
            return;
        }
        for (Element element : elements) {
            visitor.accept(element);
            for (List<Element> nested : element.getNestedLists()) {
                forEach(nested, visitor);
            }
            forEach(element.getReveals(), visitor);
        }
    }
}
