package info.isaksson.erland.sttoplcopenxml.xml;

/**
 * Indenting XML text builder.
 *
 * <p>Attributes are passed as name/value pairs. Text content is written inline without
 * re-indentation, so multi-line bodies keep their original layout.</p>
 */
final class XmlOut {

    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder(8192);
    private int depth;

    XmlOut declaration() {
        sb.append("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n");
        return this;
    }

    XmlOut open(String name, String... attrs) {
        indent();
        sb.append('<').append(name);
        attributes(attrs);
        sb.append(">\n");
        depth++;
        return this;
    }

    XmlOut close(String name) {
        depth--;
        indent();
        sb.append("</").append(name).append(">\n");
        return this;
    }

    XmlOut empty(String name, String... attrs) {
        indent();
        sb.append('<').append(name);
        attributes(attrs);
        sb.append(" />\n");
        return this;
    }

    /** Element with escaped text content; an empty element when the text is empty. */
    XmlOut text(String name, String text, String... attrs) {
        if (text == null || text.isEmpty()) {
            return empty(name, attrs);
        }
        indent();
        sb.append('<').append(name);
        attributes(attrs);
        sb.append('>').append(XmlText.escapeText(text)).append("</").append(name).append(">\n");
        return this;
    }

    private void attributes(String[] attrs) {
        if (attrs.length % 2 != 0) {
            throw new IllegalArgumentException("attributes must be name/value pairs");
        }
        for (int i = 0; i < attrs.length; i += 2) {
            sb.append(' ').append(attrs[i]).append("=\"").append(XmlText.escapeAttr(attrs[i + 1])).append('"');
        }
    }

    private void indent() {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
