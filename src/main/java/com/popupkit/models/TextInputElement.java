package com.popupkit.models;

import java.util.Objects;

/**
 * Free text entry; multi-line when more than one row is requested.
 */
public class TextInputElement extends Element {
    private final String placeholder;
    private final Integer rows;

    public TextInputElement(String label, String placeholder, Integer rows) {
        super(label);
        this.placeholder = placeholder;
        this.rows = rows;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.TEXTBOX;
    }

    public String getPlaceholder() { return placeholder; }

    public Integer getRows() { return rows; }

    public boolean isMultiline() {
        return rows != null && rows > 1;
    }

    @Override
    public Element copy() {
        return copyBaseInto(new TextInputElement(getLabel(), placeholder, rows));
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        TextInputElement that = (TextInputElement) o;
        return Objects.equals(placeholder, that.placeholder) && Objects.equals(rows, that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), placeholder, rows);
    }
}
