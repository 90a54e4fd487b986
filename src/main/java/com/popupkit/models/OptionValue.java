package com.popupkit.models;

import java.util.Objects;

/**
 * One entry of a choice-bearing element: a bare label, or a label with a description.
 */
public class OptionValue {
    private final String label;
    private final String description;

    public OptionValue(String label) {
        this(label, null);
    }

    public OptionValue(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() { return label; }

    public String getDescription() { return description; }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionValue)) return false;
        OptionValue that = (OptionValue) o;
        return Objects.equals(label, that.label) && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, description);
    }

    @Override
    public String toString() {
        return hasDescription() ? label + " (" + description + ")" : label;
    }
}
