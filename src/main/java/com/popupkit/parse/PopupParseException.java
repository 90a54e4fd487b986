package com.popupkit.parse;

/**
 * Typed failure from parsing, normalization, validation or transform.
 * Position fields are 1-based; a line of 0 means the failure is not tied to a position.
 */
public class PopupParseException extends RuntimeException {
    private final ErrorKind kind;
    private final String reason;
    private final int line;
    private final int column;
    private final int offset;

    public PopupParseException(ErrorKind kind, String reason) {
        super(reason);
        this.kind = kind;
        this.reason = reason;
        this.line = 0;
        this.column = 0;
        this.offset = -1;
    }

    public PopupParseException(ErrorKind kind, String reason, int line, int column, int offset, String lineText) {
        super(formatMessage(reason, line, column, lineText));
        this.kind = kind;
        this.reason = reason;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Character offset the parser had reached, or -1. Used to prefer the dialect that got furthest.
     */
    public int getOffset() {
        return offset;
    }

    public boolean hasPosition() {
        return line > 0;
    }

    private static String formatMessage(String reason, int line, int column, String lineText) {
        StringBuilder sb = new StringBuilder();
        sb.append("Parse error at line ").append(line).append(", column ").append(column).append(": ").append(reason);
        if (lineText != null) {
            sb.append("\n  ").append(lineText);
            sb.append("\n  ").append(" ".repeat(Math.max(0, column - 1))).append('^');
        }
        return sb.toString();
    }
}
