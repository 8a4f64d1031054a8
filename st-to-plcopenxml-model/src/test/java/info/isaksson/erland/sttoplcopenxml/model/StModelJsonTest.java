package info.isaksson.erland.sttoplcopenxml.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StModelJsonTest {

    private static StFunctionBlock sample() {
        Map<String, StVariable> consts = new LinkedHashMap<>();
        consts.put("cArrSize", new StVariable("cArrSize", StTypeRef.named("INT"), "100"));
        Map<String, StVariable> vars = new LinkedHashMap<>();
        // Deliberately not alphabetical: source order must survive.
        vars.put("values", new StVariable("values", StTypeRef.array("ARRAY [1..cArrSize] OF REAL",
                List.of(StArrayDimension.bounded("1", "cArrSize")), StTypeRef.named("REAL"))));
        vars.put("count", new StVariable("count", StTypeRef.named("INT"), "0"));

        StMethod reset = new StMethod("11111111-1111-4111-8111-111111111111", "Reset", null,
                List.of(), List.of(), List.of(), List.of(), "count := 0;");
        StProperty p = new StProperty("22222222-2222-4222-8222-222222222222", "Count", StTypeRef.named("INT"),
                new StAttribute("monitoring", "call"),
                new StAccessor(List.of(), "Count := count;"), null);

        return new StFunctionBlock("Logger", consts, vars, List.of(), List.of(), List.of(),
                List.of(reset), List.of(p), "");
    }

    @Test
    void writesStableJsonAndReadsItBack() throws Exception {
        StFunctionBlock fb = sample();
        String a = StModelJson.toJsonString(fb);
        String b = StModelJson.toJsonString(sample());
        assertEquals(a, b);
        assertTrue(a.endsWith("}\n"));
        assertTrue(a.indexOf("\"values\"") < a.indexOf("\"count\""), "map order must follow the model");

        Path tmp = Files.createTempDirectory("st2plc-json").resolve("nested/model.json");
        StModelJson.write(fb, tmp);
        StFunctionBlock back = StModelJson.read(tmp);
        assertEquals(fb, back);
        assertEquals(List.of("values", "count"), List.copyOf(back.variables.keySet()));
    }

    @Test
    void rejectsNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> StModelJson.readFromString(null));
        assertThrows(IllegalArgumentException.class, () -> StModelJson.toJsonString(null));
    }
}
