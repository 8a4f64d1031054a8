package info.isaksson.erland.sttoplcopenxml.xml;

/**
 * Escaping for hand-written XML.
 *
 * <p>Element content escapes only {@code &}, {@code <} and {@code >} so Structured Text bodies
 * stay readable; quotes are left alone there. Attribute values escape quotes as well.</p>
 *
 * <p>Characters outside the XML 1.0 {@code Char} production (most C0 controls, lone surrogates,
 * U+FFFE and U+FFFF) cannot be represented at all, not even as character references, and are
 * dropped.</p>
 */
public final class XmlText {

    private XmlText() {}

    public static String escapeText(String s) {
        if (s == null) return "";
        StringBuilder out = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&': out.append("&amp;"); break;
                case '<': out.append("&lt;"); break;
                case '>': out.append("&gt;"); break;
                default: appendIfAllowed(out, s, i);
            }
        }
        return out.toString();
    }

    public static String escapeAttr(String s) {
        if (s == null) return "";
        StringBuilder out = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&': out.append("&amp;"); break;
                case '<': out.append("&lt;"); break;
                case '>': out.append("&gt;"); break;
                case '"': out.append("&quot;"); break;
                case '\'': out.append("&apos;"); break;
                // keep line breaks inside attributes through attribute-value normalization
                case '\n': out.append("&#10;"); break;
                case '\r': out.append("&#13;"); break;
                case '\t': out.append("&#9;"); break;
                default: appendIfAllowed(out, s, i);
            }
        }
        return out.toString();
    }

    /** XML 1.0 {@code Char} check for a single non-surrogate UTF-16 unit. */
    static boolean isXmlChar(char c) {
        if (c < 0x20) return c == '\t' || c == '\n' || c == '\r';
        return c != 0xFFFE && c != 0xFFFF;
    }

    private static void appendIfAllowed(StringBuilder out, String s, int i) {
        char c = s.charAt(i);
        if (Character.isHighSurrogate(c)) {
            if (i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) out.append(c);
            return;
        }
        if (Character.isLowSurrogate(c)) {
            if (i > 0 && Character.isHighSurrogate(s.charAt(i - 1))) out.append(c);
            return;
        }
        if (isXmlChar(c)) out.append(c);
    }
}
