package com.lumen.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads top-level forms from source text one at a time.
 *
 * Line and column start where the caller says the code starts, so error positions
 * match the file the code came from.
 */
public class FormReader {

    /** Returned by {@link #read()} when the source is exhausted. */
    public static final Object EOF = new Object() {
        @Override public String toString() { return "#<eof>"; }
    };

    private static final Symbol QUOTE = Symbol.of(null, "quote");

    private final String source;
    private int current = 0;
    private int line;
    private int column;

    public FormReader(String source) {
        this(source, 1, 1);
    }

    public FormReader(String source, int line, int column) {
        this.source = (source == null) ? "" : source;
        this.line = Math.max(1, line);
        this.column = Math.max(1, column);
    }

    public int line() { return line; }
    public int column() { return column; }

    /** Next complete form, or {@link #EOF}. */
    public Object read() {
        skipWhitespace();
        if (isAtEnd()) return EOF;
        return readForm();
    }

    /** All remaining forms. */
    public List<Object> readAll() {
        List<Object> out = new ArrayList<>();
        for (Object f = read(); f != EOF; f = read()) out.add(f);
        return out;
    }

    private Object readForm() {
        skipWhitespace();
        if (isAtEnd()) throw error("EOF while reading");
        char c = advance();
        switch (c) {
            case '(': return Collections.unmodifiableList(readDelimited(')'));
            case '[': return new Vec(readDelimited(']'));
            case ')':
            case ']':
                throw error("Unmatched delimiter: " + c);
            case '\'': {
                List<Object> quoted = new ArrayList<>(2);
                quoted.add(QUOTE);
                quoted.add(readForm());
                return Collections.unmodifiableList(quoted);
            }
            case '"': return string();
            case ':': return new Keyword(token());
            default:
                current--;
                column--;
                return atom(token());
        }
    }

    private List<Object> readDelimited(char close) {
        List<Object> items = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) throw error("EOF while reading, expected '" + close + "'");
            if (peek() == close) {
                advance();
                return items;
            }
            items.add(readForm());
        }
    }

    private String string() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\\') {
                if (isAtEnd()) break;
                char e = advance();
                switch (e) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case '"': sb.append('"'); break;
                    case '\\': sb.append('\\'); break;
                    default: throw error("Unsupported escape character: \\" + e);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("EOF while reading string");
        advance();
        return sb.toString();
    }

    private String token() {
        int start = current;
        while (!isAtEnd() && !isDelimiter(peek())) advance();
        if (start == current) throw error("Empty token");
        return source.substring(start, current);
    }

    private Object atom(String text) {
        switch (text) {
            case "nil": return null;
            case "true": return Boolean.TRUE;
            case "false": return Boolean.FALSE;
            default: break;
        }
        char first = text.charAt(0);
        boolean numeric = isDigit(first)
                || ((first == '-' || first == '+') && text.length() > 1 && isDigit(text.charAt(1)));
        if (numeric) {
            try {
                if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
                    return Double.parseDouble(text);
                }
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw error("Invalid number: " + text);
            }
        }
        return Symbol.parse(text);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ';') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (Character.isWhitespace(c) || c == ',') {
                advance();
            } else {
                return;
            }
        }
    }

    private boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == ',' || c == '(' || c == ')'
                || c == '[' || c == ']' || c == '"' || c == ';';
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() { return source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private ReaderException error(String msg) {
        return new ReaderException(msg, line, column);
    }
}
