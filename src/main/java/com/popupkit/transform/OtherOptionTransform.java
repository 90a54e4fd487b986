package com.popupkit.transform;

import com.popupkit.json.IdGenerator;
import com.popupkit.models.Element;
import com.popupkit.models.OptionElement;
import com.popupkit.models.OptionValue;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.TextInputElement;

import java.util.List;
import java.util.Locale;

/**
 * Gives every single- and multi-select element an "Other (please specify)" option backed by a
 * free-text field. Applying it twice gives the same tree as applying it once.
 */
public final class OtherOptionTransform {

    public static final String OTHER_LABEL = "Other (please specify)";

    private OtherOptionTransform() {
    }

    /**
     * Returns a transformed copy; the input is left untouched.
     */
    public static PopupDefinition apply(PopupDefinition definition) {
        PopupDefinition copy = definition.copy();
        applyToList(copy.getElements());
        return copy;
    }

    private static void applyToList(List<Element> elements) {
        for (Element element : elements) {
            if (element instanceof OptionElement) {
                injectOther((OptionElement) element);
            }
            applyToList(element.getReveals());
            for (List<Element> nested : element.getNestedLists()) {
                applyToList(nested);
            }
        }
    }

    private static void injectOther(OptionElement element) {
        for (OptionValue option : element.getOptions()) {
            if (isOther(option.getLabel())) {
                return;
            }
        }
        element.getOptions().add(new OptionValue(OTHER_LABEL));
        TextInputElement input = new TextInputElement(OTHER_LABEL, null, null);
        input.setId(IdGenerator.otherTextId(element.getId() != null ? element.getId() : IdGenerator.slug(element.getLabel())));
        element.putOptionChildren(OTHER_LABEL, List.of(input));
    }

    /**
     * "Other", "other", "Other (please specify)" and "Other (anything)" all count.
     */
    static boolean isOther(String label) {
        if (label == null) {
            return false;
        }
        String trimmed = label.trim();
        if (trimmed.equalsIgnoreCase("other") || trimmed.equalsIgnoreCase(OTHER_LABEL)) {
            return true;
        }
        String bare = trimmed.replaceAll("\\s*\\([^)]*\\)\\s*$", "").trim();
        return bare.toLowerCase(Locale.ROOT).equals("other");
    }
}
