package com.popupkit.models;

import java.util.List;

/**
 * Guard block from the textual dialects. The condition is both the label and the
 * display guard; the guarded elements are the reveal list.
 */
public class ConditionalElement extends Element {

    public ConditionalElement(String condition, List<Element> body) {
        super(condition);
        setWhen(condition);
        setReveals(body);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.CONDITIONAL;
    }

    public String getCondition() {
        return getLabel();
    }

    @Override
    public Element copy() {
        return copyBaseInto(new ConditionalElement(getLabel(), getReveals()));
    }
}
