package com.popupkit.models;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Closed set of element variants. The tag is the discriminator key used in canonical JSON
 * ({@code {"slider": "Volume", ...}}); aliases are accepted on input only.
 */
public enum ElementKind {
    TEXT("text", false, "markdown"),
    SLIDER("slider", true),
    CHECKBOX("checkbox", true, "check"),
    TEXTBOX("textbox", true, "input"),
    CHOICE("choice", true),
    SELECT("select", true),
    MULTISELECT("multiselect", true, "multi"),
    GROUP("group", false),
    CONDITIONAL("conditional", false),
    BUTTONS("buttons", false);

    private final String tag;
    private final boolean valueBearing;
    private final List<String> aliases;

    ElementKind(String tag, boolean valueBearing, String... aliases) {
        this.tag = tag;
        this.valueBearing = valueBearing;
        this.aliases = Collections.unmodifiableList(Arrays.asList(aliases));
    }

    public String getTag() {
        return tag;
    }

    public boolean isValueBearing() {
        return valueBearing;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public boolean hasOptions() {
        return this == CHOICE || this == SELECT || this == MULTISELECT;
    }

    /**
     * Resolve a JSON key to a kind, or null if the key names no element variant.
     */
    public static ElementKind fromTag(String key) {
        if (key == null) {
            return null;
        }
        for (ElementKind kind : values()) {
            if (kind.tag.equals(key) || kind.aliases.contains(key)) {
                return kind;
            }
        }
        return null;
    }
}
