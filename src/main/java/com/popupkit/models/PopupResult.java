package com.popupkit.models;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal outcome of a popup. Serializes as {@code {"button": .., "values": {..}}}
 * when completed and {@code {"cancelled": true}} otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class PopupResult {
    private static final PopupResult CANCELLED = new PopupResult(null, null);

    private final String button;
    private final Map<String, Object> values;

    private PopupResult(String button, Map<String, Object> values) {
        this.button = button;
        this.values = values;
    }

    public static PopupResult completed(String button, Map<String, Object> values) {
        if (button == null) {
            throw new IllegalArgumentException("A completed result needs the clicked button");
        }
        Map<String, Object> copy = new LinkedHashMap<>(values != null ? values : Map.of());
        return new PopupResult(button, Collections.unmodifiableMap(copy));
    }

    public static PopupResult cancelled() {
        return CANCELLED;
    }

    @JsonCreator
    static PopupResult fromJson(@JsonProperty("button") String button,
                                @JsonProperty("values") Map<String, Object> values,
                                @JsonProperty("cancelled") Boolean cancelled) {
        if (Boolean.TRUE.equals(cancelled) || button == null) {
            return CANCELLED;
        }
        return completed(button, values);
    }

    @JsonProperty("button")
    public String getButton() {
        return button;
    }

    @JsonProperty("values")
    public Map<String, Object> getValues() {
        return values;
    }

    @JsonProperty("cancelled")
    Boolean getCancelledFlag() {
        return isCancelled() ? Boolean.TRUE : null;
    }

    public boolean isCancelled() {
        return button == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PopupResult)) return false;
        PopupResult that = (PopupResult) o;
        return Objects.equals(button, that.button) && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(button, values);
    }

    @Override
    public String toString() {
        return isCancelled() ? "PopupResult{cancelled}" : "PopupResult{button='" + button + "', values=" + values + '}';
    }
}
