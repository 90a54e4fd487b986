package com.popupkit.json;

import java.util.Locale;

/**
 * Derives element identifiers from human labels.
 */
public final class IdGenerator {

    static final String FALLBACK_ID = "field";

    private IdGenerator() {
    }

    /**
     * Lowercase the label, collapse each run of characters outside [a-z0-9] into one underscore,
     * and trim underscores from both ends. "Dark Mode?" becomes "dark_mode".
     */
    public static String slug(String label) {
        if (label == null) {
            return FALLBACK_ID;
        }
        String lower = label.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean pendingSeparator = false;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                if (pendingSeparator && sb.length() > 0) {
                    sb.append('_');
                }
                pendingSeparator = false;
                sb.append(c);
            } else {
                pendingSeparator = true;
            }
        }
        return sb.length() > 0 ? sb.toString() : FALLBACK_ID;
    }

    /**
     * Identifier of the free-text field attached to an element's "Other" option.
     */
    public static String otherTextId(String elementId) {
        return elementId + "_other_text";
    }
}
