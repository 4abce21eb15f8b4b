package dumb.kleis;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/** Reads s-expressions; {@code ;} starts a comment that runs to the end of the line. */
public class SexpParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private SexpParser(Reader reader) {
        this.reader = reader;
    }

    public static List<Sexp> parse(String text) throws ParseException {
        try (var reader = new StringReader(text)) {
            var parser = new SexpParser(reader);
            var items = new ArrayList<Sexp>();
            parser.skipWhitespaceAndComments();
            while (parser.peek() != -1) {
                items.add(parser.parseSexp());
                parser.skipWhitespaceAndComments();
            }
            return items;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) contextBuffer.deleteCharAt(0);
            if (currentChar != -1) contextBuffer.append((char) currentChar);
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, ParseException {
        var actual = consumeChar();
        if (actual != expected)
            throw createParseException("Expected '" + expected + "'", actual == -1 ? "EOF" : "'" + (char) actual + "'");
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == ';') {
                while (peek() != '\n' && peek() != -1) consumeChar();
            } else {
                return;
            }
        }
    }

    private Sexp parseSexp() throws IOException, ParseException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected EOF while reading expression");
        return switch (c) {
            case '(' -> parseList();
            case ')' -> throw createParseException("Unbalanced ')'");
            case '"' -> parseString();
            default -> parseSymbol();
        };
    }

    private Sexp.Lst parseList() throws IOException, ParseException {
        var start = line;
        consumeChar('(');
        var items = new ArrayList<Sexp>();
        skipWhitespaceAndComments();
        while (peek() != ')') {
            if (peek() == -1) throw createParseException("Unexpected EOF inside list opened at line " + start);
            items.add(parseSexp());
            skipWhitespaceAndComments();
        }
        consumeChar(')');
        return new Sexp.Lst(items, start);
    }

    private Sexp.Atom parseString() throws IOException, ParseException {
        var start = line;
        consumeChar('"');
        var sb = new StringBuilder();
        while (peek() != '"') {
            if (peek() == -1) throw createParseException("Unexpected EOF inside string literal");
            if (peek() == '\\') {
                consumeChar('\\');
                var escaped = consumeChar();
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> throw createParseException("Invalid escape sequence '\\" + (char) escaped + "'");
                }
            } else {
                sb.append((char) consumeChar());
            }
        }
        consumeChar('"');
        return new Sexp.Atom(sb.toString(), true, start);
    }

    private Sexp.Atom parseSymbol() throws IOException, ParseException {
        var start = line;
        var sb = new StringBuilder();
        while (peek() != -1 && !Character.isWhitespace(peek()) && peek() != '(' && peek() != ')' && peek() != '"' && peek() != ';')
            sb.append((char) consumeChar());
        if (sb.isEmpty()) throw createParseException("Empty symbol");
        return new Sexp.Atom(sb.toString(), false, start);
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        @Override
        public String getMessage() {
            var location = line != -1 ? " at line " + line + (col != -1 ? ", col " + col : "") : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
