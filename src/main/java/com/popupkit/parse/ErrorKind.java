package com.popupkit.parse;

/**
 * Failure categories surfaced by the parsing pipeline. Codes are stable strings for API clients.
 */
public enum ErrorKind {
    MALFORMED_INPUT("popup_malformed_input"),
    MISSING_REQUIRED_FIELD("popup_missing_required_field"),
    UNKNOWN_WIDGET_KIND("popup_unknown_widget_kind"),
    DUPLICATE_IDENTIFIER("popup_duplicate_identifier"),
    AMBIGUOUS_FORMAT("popup_ambiguous_format"),
    ELEMENT_NOT_FOUND("popup_element_not_found");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
