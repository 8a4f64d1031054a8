package info.isaksson.erland.sttoplcopenxml.xml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class XmlTextTest {

    @Test
    void textEscapesOnlyMarkupCharacters() {
        assertEquals("a &lt; b &amp;&amp; c &gt; 'd' \"e\"", XmlText.escapeText("a < b && c > 'd' \"e\""));
        assertEquals("", XmlText.escapeText(null));
    }

    @Test
    void attributesAlsoEscapeQuotesAndLineBreaks() {
        assertEquals("&apos;x&apos; &quot;y&quot; &lt;&amp;&gt;&#10;", XmlText.escapeAttr("'x' \"y\" <&>\n"));
    }

    @Test
    void charactersXmlCannotCarryAreDropped() {
        assertEquals("a;b;", XmlText.escapeText("a;\fb;\u0000"));
        assertEquals("x&#9;y", XmlText.escapeAttr("x\t\u0001y\uFFFF"));
        assertEquals("\t\r\n", XmlText.escapeText("\t\r\n"));
    }

    @Test
    void surrogatePairsSurviveButLoneHalvesDoNot() {
        String emoji = "\uD83D\uDE00";
        assertEquals("[" + emoji + "]", XmlText.escapeText("[" + emoji + "]"));
        assertEquals("[]", XmlText.escapeText("[\uD83D]"));
        assertEquals("[]", XmlText.escapeAttr("[\uDE00]"));
    }
}
