package info.isaksson.erland.sttoplcopenxml.core;

import info.isaksson.erland.sttoplcopenxml.extract.ExtractionWarning;
import info.isaksson.erland.sttoplcopenxml.model.StFunctionBlock;
import info.isaksson.erland.sttoplcopenxml.model.StModelJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class StToPlcOpenXmlServiceTest {

    private static final String LOGGER = """
            FUNCTION_BLOCK Logger
            VAR CONSTANT
              cArrSize : INT := 100;
            END_VAR
            VAR
              count : INT := 0;
            END_VAR
            METHOD PUBLIC Reset
            BEGIN
              count := 0;
            END_METHOD
            END_FUNCTION_BLOCK
            """;

    @TempDir
    Path tmp;

    private final StToPlcOpenXmlService service = new StToPlcOpenXmlService();

    private static StToPlcOpenXmlOptions reproducible() {
        StToPlcOpenXmlOptions o = new StToPlcOpenXmlOptions();
        o.author = "tester";
        o.timestamp = LocalDateTime.of(2024, 5, 1, 8, 30, 0);
        o.seed = 99L;
        return o;
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) n++;
        return n;
    }

    @Test
    void convertsLoggerFile() throws Exception {
        Path in = tmp.resolve("Logger.st");
        Files.writeString(in, LOGGER, StandardCharsets.UTF_8);
        Path out = tmp.resolve("out/Logger.xml");

        Path written = service.convert(in, out, reproducible());

        assertEquals(out, written);
        String xml = Files.readString(out, StandardCharsets.UTF_8);
        assertEquals(1, count(xml, "<data name=\"http://www.3s-software.com/plcopenxml/method\""));
        assertEquals(1, count(xml, "<Method name=\"Reset\""));
        assertEquals(1, count(xml, "<Object Name=\"Reset\""));
        assertTrue(xml.contains("<xhtml xmlns=\"http://www.w3.org/1999/xhtml\">count := 0;</xhtml>"));
        assertTrue(xml.contains("<simpleValue value=\"100\" />"));
        assertTrue(xml.contains("creationDateTime=\"2024-05-01T08:30:00.0000000\""));
    }

    @Test
    void missingInputFailsWithoutCreatingOutput() {
        Path out = tmp.resolve("never.xml");
        assertThrows(NoSuchFileException.class, () -> service.convert(tmp.resolve("missing.st"), out, reproducible()));
        assertFalse(Files.exists(out));
    }

    @Test
    void seededConversionsAreByteIdentical() {
        StToPlcOpenXmlResult a = service.convertText(LOGGER, reproducible());
        StToPlcOpenXmlResult b = service.convertText(LOGGER, reproducible());

        assertArrayEquals(a.xmlBytes, b.xmlBytes);
        assertEquals(a.xmlString, new String(a.xmlBytes, StandardCharsets.UTF_8));
        assertEquals("Logger", a.functionBlock.name);
        assertTrue(a.warnings.isEmpty());
    }

    @Test
    void jsonSnapshotReproducesTheSameDocument() throws Exception {
        StToPlcOpenXmlResult fromText = service.convertText(LOGGER, reproducible());

        StFunctionBlock restored = StModelJson.readFromString(StModelJson.toJsonString(fromText.functionBlock));
        StToPlcOpenXmlResult fromModel = service.convertModel(restored, reproducible());

        assertEquals(fromText.xmlString, fromModel.xmlString);
        assertTrue(fromModel.warnings.isEmpty());
    }

    @Test
    void headerOptionsReachTheDocument() {
        StToPlcOpenXmlOptions o = reproducible();
        o.companyName = "ACME";
        o.productName = "CODESYS";
        o.productVersion = "3.5.19.0";

        String xml = service.convertText(LOGGER, o).xmlString;

        assertTrue(xml.contains("companyName=\"ACME\""));
        assertTrue(xml.contains("productName=\"CODESYS\""));
        assertTrue(xml.contains("productVersion=\"3.5.19.0\""));
        assertTrue(xml.contains("author=\"tester\""));
    }

    @Test
    void recoveriesAreReportedAsWarnings() {
        StToPlcOpenXmlResult res = service.convertText("VAR\n  x : INT;\nEND_VAR\n", null);

        assertEquals(StFunctionBlock.DEFAULT_NAME, res.functionBlock.name);
        assertEquals(ExtractionWarning.NO_FUNCTION_BLOCK, res.warnings.get(0).code);
        assertTrue(res.xmlString.contains("<pou name=\"FB\" pouType=\"functionBlock\">"));
    }

    @Test
    void rejectsNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> service.convertText(null, null));
        assertThrows(IllegalArgumentException.class, () -> service.convertModel(null, null));
        assertThrows(IllegalArgumentException.class, () -> service.convert(null, tmp.resolve("x.xml"), null));
    }
}
