package com.popupkit.models;

/**
 * Static text. The label is the displayed content.
 */
public class TextElement extends Element {

    public TextElement(String content) {
        super(content);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.TEXT;
    }

    public String getContent() {
        return getLabel();
    }

    @Override
    public Element copy() {
        return copyBaseInto(new TextElement(getLabel()));
    }
}
