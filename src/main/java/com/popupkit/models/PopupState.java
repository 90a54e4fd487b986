package com.popupkit.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Editable state of one popup: one value per identifier, plus the clicked action.
 * An unset {@code buttonClicked} means the interaction was cancelled.
 */
public class PopupState {
    private final Map<String, ElementValue> values;
    private String buttonClicked;

    public PopupState() {
        this(new LinkedHashMap<>(), null);
    }

    public PopupState(Map<String, ElementValue> values, String buttonClicked) {
        this.values = values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>();
        this.buttonClicked = buttonClicked;
    }

    public Map<String, ElementValue> getValues() { return values; }

    public ElementValue getValue(String id) {
        return id != null ? values.get(id) : null;
    }

    public void setValue(String id, ElementValue value) {
        values.put(id, value);
    }

    public String getButtonClicked() { return buttonClicked; }
    public void setButtonClicked(String buttonClicked) { this.buttonClicked = buttonClicked; }

    public boolean isCancelled() {
        return buttonClicked == null;
    }

    @Override
    public String toString() {
        return "PopupState{values=" + values + ", buttonClicked='" + buttonClicked + "'}";
    }
}
