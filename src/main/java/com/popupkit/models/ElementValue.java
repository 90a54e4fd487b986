package com.popupkit.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Current value of one value-bearing element. Instances are immutable; the renderer
 * replaces entries in {@link PopupState} rather than editing them.
 */
public final class ElementValue {

    public enum Type {
        NUMBER,
        BOOLEAN,
        TEXT,
        CHOICE,
        MULTI_CHOICE
    }

    private final Type type;
    private final double number;
    private final boolean bool;
    private final String text;
    private final Integer choice;
    private final List<Boolean> selections;

    private ElementValue(Type type, double number, boolean bool, String text, Integer choice, List<Boolean> selections) {
        this.type = type;
        this.number = number;
        this.bool = bool;
        this.text = text;
        this.choice = choice;
        this.selections = selections;
    }

    public static ElementValue number(double value) {
        return new ElementValue(Type.NUMBER, value, false, null, null, null);
    }

    public static ElementValue bool(boolean value) {
        return new ElementValue(Type.BOOLEAN, 0, value, null, null, null);
    }

    public static ElementValue text(String value) {
        return new ElementValue(Type.TEXT, 0, false, value != null ? value : "", null, null);
    }

    /**
     * @param index selected option index, or null for no selection
     */
    public static ElementValue choice(Integer index) {
        return new ElementValue(Type.CHOICE, 0, false, null, index, null);
    }

    public static ElementValue multiChoice(List<Boolean> selections) {
        List<Boolean> copy = new ArrayList<>(selections != null ? selections : List.of());
        return new ElementValue(Type.MULTI_CHOICE, 0, false, null, null, Collections.unmodifiableList(copy));
    }

    /**
     * Nothing selected, one flag per option.
     */
    public static ElementValue emptyMultiChoice(int optionCount) {
        return multiChoice(Collections.nCopies(optionCount, Boolean.FALSE));
    }

    public Type getType() {
        return type;
    }

    public double asNumber() {
        require(Type.NUMBER);
        return number;
    }

    public boolean asBoolean() {
        require(Type.BOOLEAN);
        return bool;
    }

    public String asText() {
        require(Type.TEXT);
        return text;
    }

    public Integer asChoice() {
        require(Type.CHOICE);
        return choice;
    }

    public List<Boolean> asMultiChoice() {
        require(Type.MULTI_CHOICE);
        return selections;
    }

    /**
     * Copy of a multi-choice value with one flag changed.
     */
    public ElementValue withSelection(int index, boolean selected) {
        require(Type.MULTI_CHOICE);
        List<Boolean> copy = new ArrayList<>(selections);
        copy.set(index, selected);
        return multiChoice(copy);
    }

    private void require(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Value is " + type + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementValue)) return false;
        ElementValue that = (ElementValue) o;
        return type == that.type
            && Double.compare(number, that.number) == 0
            && bool == that.bool
            && Objects.equals(text, that.text)
            && Objects.equals(choice, that.choice)
            && Objects.equals(selections, that.selections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, bool, text, choice, selections);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return "Number(" + number + ")";
            case BOOLEAN:
                return "Boolean(" + bool + ")";
            case TEXT:
                return "Text(" + text + ")";
            case CHOICE:
                return "Choice(" + choice + ")";
            default:
                return "MultiChoice(" + selections + ")";
        }
    }
}
