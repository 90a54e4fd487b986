package com.popupkit.dsl;

import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits bracketed-dialect text into words, quoted strings and punctuation.
 */
final class ClassicTokenizer {

    enum Type {
        WORD,
        STRING,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        COMMA,
        PIPE,
        EQUALS,
        AT,
        EOF
    }

    static final class Token {
        final Type type;
        final String text;
        final int offset;
        final int end;

        Token(Type type, String text, int offset, int end) {
            this.type = type;
            this.text = text;
            this.offset = offset;
            this.end = end;
        }

        boolean isWord(String word) {
            return type == Type.WORD && text.equalsIgnoreCase(word);
        }

        String describe() {
            switch (type) {
                case EOF:
                    return "end of input";
                case STRING:
                    return "\"" + text + "\"";
                default:
                    return "'" + text + "'";
            }
        }
    }

    private ClassicTokenizer() {
    }

    static List<Token> tokenize(SourceText source) {
        String text = source.getText();
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            Type punct = punctuation(c);
            if (punct != null) {
                tokens.add(new Token(punct, String.valueOf(c), i, i + 1));
                i++;
                continue;
            }
            if (c == '"') {
                int start = i;
                StringBuilder sb = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < text.length()) {
                    char ch = text.charAt(i);
                    if (ch == '\\' && i + 1 < text.length()) {
                        char next = text.charAt(i + 1);
                        sb.append(next == 'n' ? '\n' : next);
                        i += 2;
                    } else if (ch == '"') {
                        closed = true;
                        i++;
                        break;
                    } else {
                        sb.append(ch);
                        i++;
                    }
                }
                if (!closed) {
                    throw source.error(ErrorKind.MALFORMED_INPUT, start, "Unterminated string");
                }
                tokens.add(new Token(Type.STRING, sb.toString(), start, i));
                continue;
            }
            int start = i;
            while (i < text.length()) {
                char ch = text.charAt(i);
                if (Character.isWhitespace(ch) || ch == '"' || punctuation(ch) != null) {
                    break;
                }
                i++;
            }
            tokens.add(new Token(Type.WORD, text.substring(start, i), start, i));
        }
        tokens.add(new Token(Type.EOF, "", text.length(), text.length()));
        return tokens;
    }

    private static Type punctuation(char c) {
        switch (c) {
            case '[':
                return Type.LBRACKET;
            case ']':
                return Type.RBRACKET;
            case '{':
                return Type.LBRACE;
            case '}':
                return Type.RBRACE;
            case ',':
                return Type.COMMA;
            case '|':
                return Type.PIPE;
            case '=':
                return Type.EQUALS;
            case '@':
                return Type.AT;
            default:
                return null;
        }
    }
}
