package com.popupkit.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of the canonical tree.
 */
public class PopupDefinition {
    private final String title;
    private final List<Element> elements;

    public PopupDefinition(String title, List<Element> elements) {
        this.title = title;
        this.elements = elements != null ? new ArrayList<>(elements) : new ArrayList<>();
    }

    public String getTitle() { return title; }

    public List<Element> getElements() { return elements; }

    public PopupDefinition copy() {
        return new PopupDefinition(title, Element.copyAll(elements));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PopupDefinition)) return false;
        PopupDefinition that = (PopupDefinition) o;
        return Objects.equals(title, that.title) && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, elements);
    }

    @Override
    public String toString() {
        return "PopupDefinition{title='" + title + "', elements=" + elements + '}';
    }
}
