package info.isaksson.erland.sttoplcopenxml.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for the subset of IEC 61131-3 Structured Text used by function block sources.
 *
 * <p>Line comments, {@code (* *)} comments and C-style block comments are skipped; block comments
 * may nest. Unterminated comments, strings and pragmas run to the end of the text instead of failing.
 * The returned list always ends with a single {@link StTokenKind#EOF} token positioned at the end
 * of the text.</p>
 */
public final class StLexer {

    private static final Set<String> TWO_CHAR_SYMBOLS = Set.of(":=", "..", "=>", "<=", ">=", "<>", "**");

    private final String src;
    private final List<StToken> out = new ArrayList<>();
    private int pos;
    private int line = 1;

    private StLexer(String src) {
        this.src = src;
    }

    public static List<StToken> tokenize(String text) {
        StLexer lexer = new StLexer(text == null ? "" : text);
        lexer.run();
        return lexer.out;
    }

    private void run() {
        while (pos < src.length()) {
            char c = src.charAt(pos);

            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peek(1) == '/') {
                skipLineComment();
            } else if (c == '(' && peek(1) == '*') {
                skipBlockComment("(*", "*)");
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment("/*", "*/");
            } else if (c == '{') {
                readPragma();
            } else if (c == '\'' || c == '"') {
                readString(c);
            } else if (isIdentStart(c)) {
                readIdentifier();
            } else if (Character.isDigit(c)) {
                readNumber();
            } else {
                readSymbol();
            }
        }
        out.add(new StToken(StTokenKind.EOF, "", src.length(), src.length(), line));
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private void skipLineComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void skipBlockComment(String open, String close) {
        int depth = 0;
        while (pos < src.length()) {
            if (src.startsWith(open, pos)) {
                depth++;
                pos += open.length();
            } else if (src.startsWith(close, pos)) {
                depth--;
                pos += close.length();
                if (depth == 0) return;
            } else {
                if (src.charAt(pos) == '\n') line++;
                pos++;
            }
        }
    }

    private void readPragma() {
        int start = pos;
        int startLine = line;
        while (pos < src.length() && src.charAt(pos) != '}') {
            if (src.charAt(pos) == '\n') line++;
            pos++;
        }
        if (pos < src.length()) pos++;
        emit(StTokenKind.PRAGMA, start, startLine);
    }

    /** String literal; {@code $} escapes the following character. */
    private void readString(char quote) {
        int start = pos;
        int startLine = line;
        pos++;
        while (pos < src.length()) {
            char ch = src.charAt(pos);
            if (ch == '$' && pos + 1 < src.length()) {
                pos += 2;
                continue;
            }
            if (ch == '\n') line++;
            pos++;
            if (ch == quote) break;
        }
        emit(StTokenKind.STRING, start, startLine);
    }

    private void readIdentifier() {
        int start = pos;
        while (pos < src.length() && isIdentPart(src.charAt(pos))) {
            pos++;
        }
        if (pos < src.length() && src.charAt(pos) == '#') {
            // T#5s, INT#-3, TOD#12:00:00, DT#2024-01-01-10:00:00
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '-' || src.charAt(pos) == '+')) pos++;
            while (pos < src.length() && isTypedLiteralPart(src.charAt(pos))) {
                if (src.charAt(pos) == '.' && peek(1) == '.') break;
                pos++;
            }
            emit(StTokenKind.TYPED_LITERAL, start, line);
            return;
        }
        emit(StTokenKind.IDENT, start, line);
    }

    private void readNumber() {
        int start = pos;
        readDigits();
        if (pos < src.length() && src.charAt(pos) == '#') {
            // based literal: 16#FF, 2#1010_0101
            pos++;
            while (pos < src.length() && isIdentPart(src.charAt(pos))) {
                pos++;
            }
            emit(StTokenKind.TYPED_LITERAL, start, line);
            return;
        }
        // A '.' only starts a fraction when a digit follows; "1..10" stays NUMBER SYMBOL NUMBER.
        if (pos < src.length() && src.charAt(pos) == '.' && Character.isDigit(peek(1))) {
            pos++;
            readDigits();
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) pos++;
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                readDigits();
            } else {
                pos = save;
            }
        }
        emit(StTokenKind.NUMBER, start, line);
    }

    private void readDigits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void readSymbol() {
        int start = pos;
        if (pos + 2 <= src.length() && TWO_CHAR_SYMBOLS.contains(src.substring(pos, pos + 2))) {
            pos += 2;
        } else {
            pos++;
        }
        emit(StTokenKind.SYMBOL, start, line);
    }

    private void emit(StTokenKind kind, int start, int tokenLine) {
        out.add(new StToken(kind, src.substring(start, pos), start, pos, tokenLine));
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isTypedLiteralPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == ':' || c == '-';
    }
}
