package com.popupkit.parse;

import com.popupkit.models.PopupDefinition;

/**
 * Exception-free view of a parse: either a definition or an error code with detail.
 */
public class PopupParseResult {
    private final PopupDefinition definition;
    private final String dialect;
    private final String errorCode;
    private final String errorDetail;
    private final int line;
    private final int column;

    private PopupParseResult(PopupDefinition definition, String dialect, String errorCode, String errorDetail, int line, int column) {
        this.definition = definition;
        this.dialect = dialect;
        this.errorCode = errorCode;
        this.errorDetail = errorDetail;
        this.line = line;
        this.column = column;
    }

    public static PopupParseResult ok(PopupDefinition definition, String dialect) {
        return new PopupParseResult(definition, dialect, null, null, 0, 0);
    }

    public static PopupParseResult error(PopupParseException e) {
        return new PopupParseResult(null, null, e.getKind().getCode(), e.getMessage(), e.getLine(), e.getColumn());
    }

    public boolean isSuccess() {
        return definition != null;
    }

    public PopupDefinition getDefinition() {
        return definition;
    }

    /**
     * Name of the input format that produced the definition.
     */
    public String getDialect() {
        return dialect;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
