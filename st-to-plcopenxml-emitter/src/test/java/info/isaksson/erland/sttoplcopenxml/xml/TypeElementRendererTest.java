package info.isaksson.erland.sttoplcopenxml.xml;

import info.isaksson.erland.sttoplcopenxml.model.StArrayDimension;
import info.isaksson.erland.sttoplcopenxml.model.StTypeRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeElementRendererTest {

    private static String render(StTypeRef t) {
        XmlOut out = new XmlOut();
        TypeElementRenderer.render(out, t);
        return out.toString();
    }

    @Test
    void namedTypes() {
        assertEquals("<INT />\n", render(StTypeRef.named("int")));
        assertEquals("<TOD />\n", render(StTypeRef.named("TIME_OF_DAY")));
        assertEquals("<derived name=\"ST_Sample\" />\n", render(StTypeRef.named("ST_Sample")));
        assertEquals("<string />\n", render(StTypeRef.named("STRING")));
        assertEquals("<wstring length=\"80\" />\n", render(StTypeRef.string("WSTRING(80)", "WSTRING", "80")));
    }

    @Test
    void arrayWithBoundedAndRawDimensions() {
        StTypeRef t = StTypeRef.array("ARRAY [1..10, *] OF REAL",
                List.of(StArrayDimension.bounded("1", "10"), StArrayDimension.unbounded("*")),
                StTypeRef.named("REAL"));

        String expected = "<array>\n" +
                "  <dimension lower=\"1\" upper=\"10\" />\n" +
                "  <dimension>*</dimension>\n" +
                "  <baseType>\n" +
                "    <REAL />\n" +
                "  </baseType>\n" +
                "</array>\n";
        assertEquals(expected, render(t));
    }

    @Test
    void pointerAndReferenceUsePointerElement() {
        String expected = "<pointer>\n" +
                "  <baseType>\n" +
                "    <derived name=\"FB_Axis\" />\n" +
                "  </baseType>\n" +
                "</pointer>\n";
        assertEquals(expected, render(StTypeRef.pointer("POINTER TO FB_Axis", StTypeRef.named("FB_Axis"))));
        assertEquals(expected, render(StTypeRef.reference("REFERENCE TO FB_Axis", StTypeRef.named("FB_Axis"))));
    }
}
