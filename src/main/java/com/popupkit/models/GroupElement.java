package com.popupkit.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Labeled container. Contributes no value of its own.
 */
public class GroupElement extends Element {
    private final List<Element> elements;

    public GroupElement(String label, List<Element> elements) {
        super(label);
        this.elements = elements != null ? new ArrayList<>(elements) : new ArrayList<>();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.GROUP;
    }

    public List<Element> getElements() { return elements; }

    @Override
    public List<List<Element>> getNestedLists() {
        return List.of(elements);
    }

    @Override
    public Element copy() {
        return copyBaseInto(new GroupElement(getLabel(), copyAll(elements)));
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && elements.equals(((GroupElement) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), elements);
    }
}
