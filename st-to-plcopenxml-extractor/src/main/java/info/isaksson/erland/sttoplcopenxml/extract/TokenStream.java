package info.isaksson.erland.sttoplcopenxml.extract;

import java.util.List;

/**
 * Indexed view over the token list of one source text.
 *
 * <p>Out-of-range indexes resolve to the trailing EOF token, so parsers can look ahead freely.</p>
 */
final class TokenStream {

    final String text;
    private final List<StToken> tokens;

    TokenStream(String text) {
        this.text = text == null ? "" : text;
        this.tokens = StLexer.tokenize(this.text);
    }

    StToken get(int i) {
        if (i < 0) return tokens.get(0);
        if (i >= tokens.size()) return tokens.get(tokens.size() - 1);
        return tokens.get(i);
    }

    /** Index of the EOF token. */
    int eof() {
        return tokens.size() - 1;
    }

    boolean isKeyword(int i, String keyword) {
        return i >= 0 && i < eof() && get(i).isKeyword(keyword);
    }

    boolean isSymbol(int i, String symbol) {
        return i >= 0 && i < eof() && get(i).isSymbol(symbol);
    }

    boolean isKind(int i, StTokenKind kind) {
        return i >= 0 && i <= eof() && get(i).kind == kind;
    }

    /** First index in {@code [from, to)} holding {@code keyword}, or -1. */
    int indexOfKeyword(int from, int to, String keyword) {
        for (int i = Math.max(0, from); i < to && i < eof(); i++) {
            if (get(i).isKeyword(keyword)) return i;
        }
        return -1;
    }

    /** Last index in {@code [from, to)} holding {@code keyword}, or -1. */
    int lastIndexOfKeyword(int from, int to, String keyword) {
        for (int i = Math.min(to, eof()) - 1; i >= from && i >= 0; i--) {
            if (get(i).isKeyword(keyword)) return i;
        }
        return -1;
    }

    /** Raw source between two character offsets. */
    String slice(int fromOffset, int toOffset) {
        int a = Math.max(0, Math.min(fromOffset, text.length()));
        int b = Math.max(a, Math.min(toOffset, text.length()));
        return text.substring(a, b);
    }

    /** Raw source covered by tokens {@code [from, to)}; empty when the range is empty. */
    String sliceTokens(int from, int to) {
        if (to <= from) return "";
        return slice(get(from).start, get(to - 1).end);
    }

    /** True when token {@code i} starts on a later line than token {@code i - 1}. */
    boolean startsLine(int i) {
        return i > 0 && get(i).line > get(i - 1).line;
    }
}
