package info.isaksson.erland.sttoplcopenxml.extract;

import info.isaksson.erland.sttoplcopenxml.model.ObjectIdAllocator;
import info.isaksson.erland.sttoplcopenxml.model.StFunctionBlock;
import info.isaksson.erland.sttoplcopenxml.model.StProperty;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StExtractorPropertyTest {

    private final StExtractor extractor = new StExtractor();

    @Test
    void propertyWithAttributeGetterAndSetter() {
        String src = String.join("\n",
                "FUNCTION_BLOCK Motor",
                "VAR",
                "  _speed : REAL;",
                "END_VAR",
                "PROPERTY PUBLIC Speed : REAL",
                "{attribute 'monitoring' := 'call'}",
                "PROPERTY GET",
                "VAR",
                "  tmp : REAL;",
                "END_VAR",
                "Speed := _speed;",
                "END_PROPERTY",
                "PROPERTY SET",
                "_speed := Speed;",
                "END_PROPERTY",
                "END_FUNCTION_BLOCK");
        StFunctionBlock fb = extractor.extract(src);

        assertEquals(1, fb.properties.size());
        StProperty p = fb.properties.get(0);
        assertEquals("Speed", p.name);
        assertEquals("REAL", p.type.name);
        assertNotNull(p.attribute);
        assertEquals("monitoring", p.attribute.key);
        assertEquals("call", p.attribute.value);
        assertEquals(1, p.getter.locals.size());
        assertEquals("tmp", p.getter.locals.get(0).name);
        assertEquals("Speed := _speed;", p.getter.body);
        assertNotNull(p.setter);
        assertEquals("_speed := Speed;", p.setter.body);
        assertEquals("", fb.body);
    }

    @Test
    void explicitBeginInGetterAndMembersInSourceOrder() {
        String src = String.join("\n",
                "FUNCTION_BLOCK Logger",
                "METHOD PUBLIC Reset",
                "BEGIN",
                "  count := 0;",
                "END_METHOD",
                "PROPERTY PUBLIC Count : INT",
                "PROPERTY GET",
                "BEGIN",
                "  Count := count;",
                "END_PROPERTY",
                "METHOD PUBLIC Log",
                "VAR_INPUT",
                "  msg : STRING;",
                "END_VAR",
                "BEGIN",
                "  count := count + 1;",
                "END_METHOD",
                "END_FUNCTION_BLOCK");
        StFunctionBlock fb = extractor.extract(src);

        assertEquals(2, fb.methods.size());
        assertEquals("Reset", fb.methods.get(0).name);
        assertEquals("Log", fb.methods.get(1).name);
        assertEquals("msg", fb.methods.get(1).inputs.get(0).name);
        assertEquals(1, fb.properties.size());
        StProperty p = fb.properties.get(0);
        assertNull(p.attribute);
        assertEquals("Count := count;", p.getter.body);
        assertNull(p.setter);
    }

    @Test
    void propertyWithoutGetHasEmptyGetter() {
        StFunctionBlock fb = extractor.extract("FUNCTION_BLOCK F\nPROPERTY Ready : BOOL\nEND_FUNCTION_BLOCK\n");
        StProperty p = fb.properties.get(0);
        assertEquals("Ready", p.name);
        assertTrue(p.getter.isEmpty());
        assertNull(p.setter);
    }

    @Test
    void secondAttributeAndSecondGetterAreReportedAndIgnored() {
        String src = String.join("\n",
                "FUNCTION_BLOCK F",
                "PROPERTY Value : DINT",
                "{attribute 'first' := 'one'}",
                "{attribute \"second\" := \"two\"}",
                "PROPERTY GET",
                "Value := 1;",
                "END_PROPERTY",
                "PROPERTY GET",
                "Value := 2;",
                "END_PROPERTY",
                "END_FUNCTION_BLOCK");
        StExtractor.Result res = extractor.extractWithWarnings(src, ObjectIdAllocator.seeded(3));
        StProperty p = res.functionBlock.properties.get(0);

        assertEquals("first", p.attribute.key);
        assertEquals("Value := 1;", p.getter.body);
        assertTrue(res.warnings.stream().anyMatch(w -> w.code.equals(ExtractionWarning.DUPLICATE_ATTRIBUTE)));
        assertTrue(res.warnings.stream().anyMatch(w -> w.code.equals(ExtractionWarning.DUPLICATE_ACCESSOR)));
    }
}
