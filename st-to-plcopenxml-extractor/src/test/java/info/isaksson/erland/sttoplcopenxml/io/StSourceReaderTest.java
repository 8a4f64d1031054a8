package info.isaksson.erland.sttoplcopenxml.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class StSourceReaderTest {

    @TempDir
    Path tmp;

    @Test
    void readsUtf8AndDropsByteOrderMark() throws Exception {
        Path f = tmp.resolve("Fb.st");
        Files.writeString(f, "\uFEFFFUNCTION_BLOCK Fb // Gr\u00f6\u00dfe\n", StandardCharsets.UTF_8);

        assertEquals("FUNCTION_BLOCK Fb // Gr\u00f6\u00dfe\n", StSourceReader.read(f));
    }

    @Test
    void missingFileOrDirectoryIsNoSuchFile() {
        assertThrows(NoSuchFileException.class, () -> StSourceReader.read(tmp.resolve("missing.st")));
        assertThrows(NoSuchFileException.class, () -> StSourceReader.read(tmp));
    }
}
