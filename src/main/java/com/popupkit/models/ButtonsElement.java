package com.popupkit.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A row of action buttons. The clicked label ends up in {@link PopupState#getButtonClicked()}.
 */
public class ButtonsElement extends Element {
    public static final String FORCE_YIELD = "Force Yield";

    private final List<String> buttons;

    public ButtonsElement(List<String> buttons) {
        super(null);
        this.buttons = buttons != null ? new ArrayList<>(buttons) : new ArrayList<>();
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.BUTTONS;
    }

    @Override
    public String getLabel() {
        return String.join(" | ", buttons);
    }

    public List<String> getButtons() { return buttons; }

    /**
     * Append the reserved Force Yield action unless the row already has it.
     */
    public void ensureForceYield() {
        if (!buttons.contains(FORCE_YIELD)) {
            buttons.add(FORCE_YIELD);
        }
    }

    @Override
    public Element copy() {
        return copyBaseInto(new ButtonsElement(buttons));
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && buttons.equals(((ButtonsElement) o).buttons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), buttons);
    }
}
