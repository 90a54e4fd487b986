package com.popupkit.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base of the canonical element tree. Every element directly owns its child lists;
 * there are no parent pointers, all lookups are root-down.
 */
public abstract class Element {
    private final String label;
    private String id;
    private String when;
    private List<Element> reveals = new ArrayList<>();

    protected Element(String label) {
        this.label = label;
    }

    public abstract ElementKind getKind();

    /**
     * Deep copy of this element and everything below it.
     */
    public abstract Element copy();

    public String getLabel() { return label; }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getWhen() { return when; }
    public void setWhen(String when) { this.when = when; }

    public List<Element> getReveals() { return reveals; }
    public void setReveals(List<Element> reveals) {
        this.reveals = reveals != null ? new ArrayList<>(reveals) : new ArrayList<>();
    }

    public boolean hasValue() {
        return getKind().isValueBearing();
    }

    /**
     * Child lists owned by this element other than {@link #getReveals()}:
     * group members, or option children for choice-bearing variants.
     */
    public List<List<Element>> getNestedLists() {
        return List.of();
    }

    protected <T extends Element> T copyBaseInto(T target) {
        target.setId(id);
        target.setWhen(when);
        target.setReveals(copyAll(reveals));
        return target;
    }

    public static List<Element> copyAll(List<Element> elements) {
        List<Element> copies = new ArrayList<>();
        if (elements != null) {
            for (Element element : elements) {
                copies.add(element.copy());
            }
        }
        return copies;
    }

    protected boolean baseEquals(Element other) {
        return getKind() == other.getKind()
            && Objects.equals(label, other.label)
            && Objects.equals(id, other.id)
            && Objects.equals(when, other.when)
            && Objects.equals(reveals, other.reveals);
    }

    protected int baseHash() {
        return Objects.hash(getKind(), label, id, when, reveals);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return baseEquals((Element) o);
    }

    @Override
    public int hashCode() {
        return baseHash();
    }

    @Override
    public String toString() {
        return getKind().getTag() + "{label='" + getLabel() + "', id='" + id + "'}";
    }
}
