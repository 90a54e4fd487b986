package com.popupkit.dsl;

import com.popupkit.parse.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * One logical line of a textual popup: trimmed content, its indentation, and the source offset
 * of the first content character.
 */
final class SourceLine {
    final String text;
    final int indent;
    final int offset;

    SourceLine(String text, int indent, int offset) {
        this.text = text;
        this.indent = indent;
        this.offset = offset;
    }

    boolean isBlank() {
        return text.isEmpty() || text.startsWith("//");
    }

    /**
     * A line made from a slice of a physical line, such as the text after an opening brace.
     */
    static SourceLine slice(String raw, int indent, int rawOffset) {
        int lead = 0;
        while (lead < raw.length() && Character.isWhitespace(raw.charAt(lead))) {
            lead++;
        }
        return new SourceLine(raw.trim(), indent + lead, rawOffset + lead);
    }

    static List<SourceLine> split(SourceText source) {
        List<SourceLine> lines = new ArrayList<>();
        for (int n = 1; n <= source.lineCount(); n++) {
            String raw = source.lineText(n);
            int indent = 0;
            int lead = 0;
            while (lead < raw.length() && (raw.charAt(lead) == ' ' || raw.charAt(lead) == '\t')) {
                indent += raw.charAt(lead) == '\t' ? 4 : 1;
                lead++;
            }
            lines.add(new SourceLine(raw.trim(), indent, source.lineStart(n) + lead));
        }
        return lines;
    }

    @Override
    public String toString() {
        return indent + ":" + text;
    }
}
