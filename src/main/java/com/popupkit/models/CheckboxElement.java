package com.popupkit.models;

import java.util.Objects;

/**
 * Boolean toggle. Reveals are shown while the box is checked.
 */
public class CheckboxElement extends Element {
    private final boolean defaultValue;

    public CheckboxElement(String label, boolean defaultValue) {
        super(label);
        this.defaultValue = defaultValue;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.CHECKBOX;
    }

    public boolean getDefaultValue() { return defaultValue; }

    @Override
    public Element copy() {
        return copyBaseInto(new CheckboxElement(getLabel(), defaultValue));
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && defaultValue == ((CheckboxElement) o).defaultValue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), defaultValue);
    }
}
