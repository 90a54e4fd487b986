package com.popupkit.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw input plus a line index, so parsers can anchor errors to line and column.
 */
public class SourceText {
    private final String text;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = text != null ? text : "";
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < this.text.length(); i++) {
            if (this.text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = new int[starts.size()];
        for (int i = 0; i < starts.size(); i++) {
            lineStarts[i] = starts.get(i);
        }
    }

    public String getText() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Offset of the first character of a 1-based line.
     */
    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Raw text of a 1-based line, without the line terminator.
     */
    public String lineText(int line) {
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        if (end > start && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(start, Math.max(start, end));
    }

    public int lineOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= clamped) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    public int columnOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        return clamped - lineStarts[lineOf(clamped) - 1] + 1;
    }

    public PopupParseException error(ErrorKind kind, int offset, String reason) {
        int line = lineOf(offset);
        return new PopupParseException(kind, reason, line, columnOf(offset), offset, lineText(line));
    }
}
