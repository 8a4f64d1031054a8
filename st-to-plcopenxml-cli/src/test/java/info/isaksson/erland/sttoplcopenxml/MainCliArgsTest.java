package info.isaksson.erland.sttoplcopenxml;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class MainCliArgsTest {

    @Test
    void positionalsAndOptions() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "in.st", "out.xml",
                "--author", "Jane",
                "--company", "ACME",
                "--product-name", "Tool",
                "--product-version", "1.2",
                "--timestamp", "2024-05-01T08:30:00",
                "--seed", "42",
                "--write-model", "model.json"
        });

        assertEquals("in.st", a.input);
        assertEquals("out.xml", a.output);
        assertEquals("Jane", a.author);
        assertEquals("ACME", a.company);
        assertEquals("Tool", a.productName);
        assertEquals("1.2", a.productVersion);
        assertEquals(LocalDateTime.of(2024, 5, 1, 8, 30), a.timestamp);
        assertEquals(42L, a.seed);
        assertEquals("model.json", a.writeModel);
        assertFalse(a.fromModel);
        assertFalse(a.help);
    }

    @Test
    void optionsMayPrecedePositionals() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {"--from-model", "model.json", "out.xml"});
        assertTrue(a.fromModel);
        assertEquals("model.json", a.input);
        assertEquals("out.xml", a.output);
    }

    @Test
    void helpFlags() {
        assertTrue(Main.CliArgs.parse(new String[] {"-h"}).help);
        assertTrue(Main.CliArgs.parse(new String[] {"--help"}).help);
    }

    @Test
    void rejectsBadInput() {
        IllegalArgumentException extra = assertThrows(IllegalArgumentException.class,
                () -> Main.CliArgs.parse(new String[] {"a.st", "b.xml", "c"}));
        assertTrue(extra.getMessage().contains("Unexpected extra argument"));

        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a.st", "--author"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--seed", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--timestamp", "yesterday"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--author", "--seed"}));
    }

    @Test
    void helpNamesTheShadedJar() {
        PrintStream original = System.out;
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));
        try {
            Main.CliArgs.printHelp();
        } finally {
            System.setOut(original);
        }
        String help = buf.toString(StandardCharsets.UTF_8);

        assertTrue(help.contains("java -jar st-to-plcopenxml-cli/target/st-to-plcopenxml.jar samples/logger/Logger.st"));
        assertTrue(help.contains("--from-model"));
    }
}
