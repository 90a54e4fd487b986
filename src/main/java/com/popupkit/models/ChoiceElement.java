package com.popupkit.models;

import java.util.List;
import java.util.Objects;

/**
 * Single-selection element. Authors may write it as {@code choice} or {@code select};
 * both collapse to the label of the selected option.
 */
public class ChoiceElement extends OptionElement {
    private final ElementKind kind;
    private final Integer defaultIndex;

    public ChoiceElement(String label, List<OptionValue> options, Integer defaultIndex) {
        this(ElementKind.CHOICE, label, options, defaultIndex);
    }

    public ChoiceElement(ElementKind kind, String label, List<OptionValue> options, Integer defaultIndex) {
        super(label, options);
        if (kind != ElementKind.CHOICE && kind != ElementKind.SELECT) {
            throw new IllegalArgumentException("Not a single-choice kind: " + kind);
        }
        this.kind = kind;
        this.defaultIndex = defaultIndex;
    }

    @Override
    public ElementKind getKind() {
        return kind;
    }

    public Integer getDefaultIndex() { return defaultIndex; }

    @Override
    public Element copy() {
        return copyOptionsInto(new ChoiceElement(kind, getLabel(), getOptions(), defaultIndex));
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equals(defaultIndex, ((ChoiceElement) o).defaultIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), defaultIndex);
    }
}
