package info.isaksson.erland.sttoplcopenxml.extract;

import java.util.Locale;

/**
 * A token with its position in the source text.
 *
 * <p>Offsets are half-open ({@code [start, end)}) and refer to the original text, so callers can
 * slice raw source (including comments and formatting) between any two tokens.</p>
 */
public final class StToken {
    public final StTokenKind kind;
    public final String text;
    public final int start;
    public final int end;
    /** 1-based line of {@link #start}. */
    public final int line;

    private final String upper;

    public StToken(StTokenKind kind, String text, int start, int end, int line) {
        this.kind = kind;
        this.text = text == null ? "" : text;
        this.start = start;
        this.end = end;
        this.line = line;
        this.upper = this.text.toUpperCase(Locale.ROOT);
    }

    /** Keyword match; Structured Text keywords are case-insensitive. */
    public boolean isKeyword(String keyword) {
        return kind == StTokenKind.IDENT && upper.equals(keyword);
    }

    public boolean isSymbol(String symbol) {
        return kind == StTokenKind.SYMBOL && text.equals(symbol);
    }

    public String upper() {
        return upper;
    }

    @Override public String toString() {
        return kind + "(" + text + ")@" + line;
    }
}
