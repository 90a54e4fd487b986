package com.popupkit.models;

import java.util.List;

public class MultiSelectElement extends OptionElement {

    public MultiSelectElement(String label, List<OptionValue> options) {
        super(label, options);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.MULTISELECT;
    }

    @Override
    public Element copy() {
        return copyOptionsInto(new MultiSelectElement(getLabel(), getOptions()));
    }
}
