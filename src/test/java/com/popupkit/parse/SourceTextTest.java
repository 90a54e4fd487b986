package com.popupkit.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextTest {

    @Test
    void mapsOffsetsToLinesAndColumns() {
        SourceText source = new SourceText("ab\r\ncd\nef");
        assertEquals(3, source.lineCount());
        assertEquals("ab", source.lineText(1));
        assertEquals(2, source.lineOf(5));
        assertEquals(2, source.columnOf(5));
        assertEquals(3, source.lineOf(100));
    }

    @Test
    void errorMessageShowsCaret() {
        SourceText source = new SourceText("first\nsecond line");
        PopupParseException e = source.error(ErrorKind.MALFORMED_INPUT, 13, "bad token");
        assertEquals(2, e.getLine());
        assertEquals(8, e.getColumn());
        assertEquals("Parse error at line 2, column 8: bad token\n  second line\n         ^", e.getMessage());
    }
}
